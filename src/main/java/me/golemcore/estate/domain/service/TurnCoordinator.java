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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.domain.model.FanOutTag;
import me.golemcore.estate.domain.model.InboundMessageEvent;
import me.golemcore.estate.domain.model.Message;
import me.golemcore.estate.domain.model.ReplyChannel;
import me.golemcore.estate.domain.model.Stage;
import me.golemcore.estate.domain.model.TurnOutcome;
import me.golemcore.estate.domain.model.message.ScopingRequest;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.infrastructure.i18n.MessageService;
import me.golemcore.estate.port.outbound.SearchSessionPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Entry point of a turn. Each inbound user message starts a new turn on the
 * session of its channel, acknowledges it with a status line and asks the
 * scoping worker to classify it.
 *
 * <p>
 * A message arriving while the previous turn is still in flight supersedes
 * it: the turn number is bumped, so responses of the older turn are dropped as
 * stale when they arrive.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnCoordinator {

    private final SearchSessionPort sessionPort;
    private final TurnOutcomeExecutor outcomeExecutor;
    private final MessageService messageService;
    private final EstateProperties properties;
    private final Clock clock;

    @EventListener
    public void onInboundMessage(InboundMessageEvent event) {
        accept(event.message());
    }

    /**
     * Starts a turn for the message.
     *
     * @return the session key, or {@code null} if the message was ignored
     */
    public String accept(Message message) {
        if (message == null || !message.hasContent()) {
            log.debug("[Turn] ignoring empty message");
            return null;
        }
        ReplyChannel channel = message.replyChannel();
        String key = channel.sessionKey();
        Instant now = clock.instant();

        TurnOutcome outcome = sessionPort.update(key, session -> {
            if (session.getPhase().isInFlight()) {
                log.info("[Turn] {} superseding in-flight turn {} ({})", key, session.getTurn(),
                        session.getPhase());
            }
            session.startTurn(channel, now);
            session.setStageDeadline(now.plusSeconds(properties.getTurn().getStageTimeoutSeconds()));
            FanOutTag tag = FanOutTag.single(key, session.getTurn(), Stage.SCOPING);
            log.info("[Turn] {} started turn {}", key, session.getTurn());
            return TurnOutcome.builder()
                    .replyChannel(channel)
                    .statusMessage(messageService.getMessage("turn.processing"))
                    .dispatches(List.of(new ScopingRequest(tag, message.getContent())))
                    .build();
        });
        outcomeExecutor.execute(outcome);
        return key;
    }
}
