package me.golemcore.estate.adapter.inbound.web;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.domain.model.InboundMessageEvent;
import me.golemcore.estate.domain.model.Message;
import me.golemcore.estate.domain.model.ReplyChannel;
import me.golemcore.estate.infrastructure.event.SpringEventBus;
import me.golemcore.estate.port.inbound.ChannelPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Web ChannelPort adapter backed by per-chat reply outboxes. Inbound messages
 * are published on the bus; replies are queued until the client drains them.
 * Each outbox keeps the latest {@value #MAX_QUEUED_REPLIES} replies, and
 * outboxes left undrained past the session TTL are released by the session
 * sweep.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebChannelAdapter implements ChannelPort {

    public static final String CHANNEL_TYPE = "web";
    static final int MAX_QUEUED_REPLIES = 100;

    private final SpringEventBus eventBus;
    private final Clock clock;

    private final Map<String, Deque<ChatReply>> outboxes = new ConcurrentHashMap<>();
    private volatile boolean running = false;

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        running = true;
        log.info("[WebChannel] Started");
    }

    @Override
    public void stop() {
        running = false;
        outboxes.clear();
        log.info("[WebChannel] Stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content, boolean endOfTurn) {
        if (chatId == null || chatId.isBlank()) {
            log.debug("[WebChannel] Skip send without chatId");
            return CompletableFuture.completedFuture(null);
        }
        if (!running) {
            log.debug("[WebChannel] Channel stopped, reply to {} dropped", chatId);
            return CompletableFuture.completedFuture(null);
        }
        ChatReply reply = new ChatReply(content, endOfTurn, clock.instant());
        outboxes.compute(chatId, (id, queue) -> {
            Deque<ChatReply> outbox = queue != null ? queue : new ArrayDeque<>();
            outbox.addLast(reply);
            while (outbox.size() > MAX_QUEUED_REPLIES) {
                outbox.removeFirst();
            }
            return outbox;
        });
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Accepts a user message and starts a turn for it.
     *
     * @return the session key of the chat
     */
    public String handleIncomingMessage(String chatId, String text) {
        if (!running) {
            throw new IllegalStateException("Web channel is not running");
        }
        Message message = Message.builder()
                .id(UUID.randomUUID().toString())
                .role("user")
                .content(text)
                .channelType(CHANNEL_TYPE)
                .chatId(chatId)
                .senderId(chatId)
                .timestamp(clock.instant())
                .build();
        eventBus.publish(new InboundMessageEvent(message));
        return new ReplyChannel(CHANNEL_TYPE, chatId).sessionKey();
    }

    /**
     * Removes and returns all queued replies for the chat, oldest first.
     */
    public List<ChatReply> drainReplies(String chatId) {
        AtomicReference<List<ChatReply>> drained = new AtomicReference<>(List.of());
        outboxes.computeIfPresent(chatId, (id, queue) -> {
            drained.set(new ArrayList<>(queue));
            return null;
        });
        return drained.get();
    }

    @Override
    public int evictIdleSince(Instant cutoff) {
        AtomicInteger evicted = new AtomicInteger();
        for (String chatId : outboxes.keySet()) {
            outboxes.computeIfPresent(chatId, (id, queue) -> {
                ChatReply newest = queue.peekLast();
                if (newest == null || newest.timestamp().isBefore(cutoff)) {
                    evicted.incrementAndGet();
                    return null;
                }
                return queue;
            });
        }
        if (evicted.get() > 0) {
            log.info("[WebChannel] Released {} undrained outboxes (idle since before {})", evicted.get(), cutoff);
        }
        return evicted.get();
    }

    int outboxCount() {
        return outboxes.size();
    }

    public record ChatReply(String text, boolean endOfTurn, Instant timestamp) {
    }
}
