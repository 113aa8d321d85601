package me.golemcore.estate.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.domain.model.ReplyChannel;
import me.golemcore.estate.port.inbound.ChannelPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Routes replies to the channel a turn came from.
 */
@Service
@Slf4j
public class ReplySender {

    private final Map<String, ChannelPort> channels;

    public ReplySender(List<ChannelPort> channelPorts) {
        this.channels = channelPorts.stream()
                .collect(Collectors.toMap(ChannelPort::getChannelType, Function.identity(), (a, b) -> a));
    }

    public CompletableFuture<Void> send(ReplyChannel replyChannel, String text, boolean endOfTurn) {
        if (replyChannel == null || text == null || text.isBlank()) {
            log.debug("[Reply] nothing to send (channel={})", replyChannel);
            return CompletableFuture.completedFuture(null);
        }
        ChannelPort channel = channels.get(replyChannel.channelType());
        if (channel == null) {
            log.warn("[Reply] no channel registered for type {}", replyChannel.channelType());
            return CompletableFuture.completedFuture(null);
        }
        return channel.sendMessage(replyChannel.chatId(), text, endOfTurn)
                .whenComplete((ignored, failure) -> {
                    if (failure != null) {
                        log.error("[Reply] failed to deliver to {}:{}: {}", replyChannel.channelType(),
                                replyChannel.chatId(), failure.getMessage());
                    }
                });
    }
}
