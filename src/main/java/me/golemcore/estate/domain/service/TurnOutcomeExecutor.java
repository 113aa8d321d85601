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
import me.golemcore.estate.domain.model.TurnOutcome;
import me.golemcore.estate.infrastructure.event.SpringEventBus;
import org.springframework.stereotype.Component;

/**
 * Applies a {@link TurnOutcome} once the session lock is released: status line
 * first, then worker dispatches, then the final reply or assembly.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TurnOutcomeExecutor {

    private final SpringEventBus eventBus;
    private final ReplySender replySender;
    private final ResponseAssembler responseAssembler;

    public void execute(TurnOutcome outcome) {
        if (outcome == null || outcome.isEmpty()) {
            return;
        }
        if (outcome.statusMessage() != null) {
            replySender.send(outcome.replyChannel(), outcome.statusMessage(), false);
        }
        eventBus.publishAll(outcome.dispatches());
        if (outcome.finalReply() != null) {
            replySender.send(outcome.replyChannel(), outcome.finalReply(), true);
        }
        if (outcome.assembly() != null) {
            responseAssembler.deliver(outcome.assembly());
        }
    }
}
