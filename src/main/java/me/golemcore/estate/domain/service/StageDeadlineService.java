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
import me.golemcore.estate.domain.model.SearchSession;
import me.golemcore.estate.domain.model.TurnOutcome;
import me.golemcore.estate.domain.model.TurnPhase;
import me.golemcore.estate.infrastructure.i18n.MessageService;
import me.golemcore.estate.port.outbound.SearchSessionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Finalizes turns whose current stage missed its deadline. A turn that already
 * holds a search result is assembled from whatever arrived; earlier stages end
 * with a timeout reply.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StageDeadlineService {

    private final SearchSessionPort sessionPort;
    private final TurnOutcomeExecutor outcomeExecutor;
    private final MessageService messageService;
    private final Clock clock;

    /**
     * @return number of turns finalized by this sweep
     */
    public int expireOverdue() {
        Instant now = clock.instant();
        int expired = 0;
        for (String key : sessionPort.listKeys()) {
            TurnOutcome outcome = sessionPort.updateExisting(key, session -> expire(session, now))
                    .orElse(TurnOutcome.none());
            if (!outcome.isEmpty()) {
                expired++;
                outcomeExecutor.execute(outcome);
            }
        }
        return expired;
    }

    private TurnOutcome expire(SearchSession session, Instant now) {
        if (!session.getPhase().isInFlight() || session.isFinalized() || session.getStageDeadline() == null
                || now.isBefore(session.getStageDeadline())) {
            return TurnOutcome.none();
        }
        session.setFinalized(true);
        if (session.getSearchResult() != null) {
            log.warn("[Deadline] {} turn {} finalized with partial data in {} (geocode {}/{}, poi {}/{})",
                    session.getKey(), session.getTurn(), session.getPhase(), session.getArrivedGeocodeCount(),
                    session.getExpectedGeocodeCount(), session.getArrivedPoiCount(),
                    session.getExpectedPoiCount());
            session.setPhase(TurnPhase.ASSEMBLED);
            return TurnOutcome.builder()
                    .replyChannel(session.getReplyChannel())
                    .assembly(session.snapshot(true))
                    .build();
        }
        log.warn("[Deadline] {} turn {} timed out in {}", session.getKey(), session.getTurn(), session.getPhase());
        session.setPhase(TurnPhase.ABORTED);
        return TurnOutcome.builder()
                .replyChannel(session.getReplyChannel())
                .finalReply(messageService.getMessage("turn.timeout"))
                .build();
    }
}
