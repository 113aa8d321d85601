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
import me.golemcore.estate.domain.model.ReplyChannel;
import me.golemcore.estate.domain.model.ScopingResult;
import me.golemcore.estate.domain.model.SearchSession;
import me.golemcore.estate.domain.model.Stage;
import me.golemcore.estate.domain.model.TurnOutcome;
import me.golemcore.estate.domain.model.TurnPhase;
import me.golemcore.estate.domain.model.message.CommunityRequest;
import me.golemcore.estate.domain.model.message.QuestionRequest;
import me.golemcore.estate.domain.model.message.ScopingResponse;
import me.golemcore.estate.domain.model.message.SearchRequest;
import me.golemcore.estate.domain.model.message.WorkerMessage;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.infrastructure.i18n.MessageService;
import me.golemcore.estate.port.outbound.SearchSessionPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Routes a scoping classification to exactly one branch:
 * <ol>
 * <li>general question - forwarded to the Q&amp;A worker</li>
 * <li>complete requirements - listing search, plus community analysis when a
 * location name was inferred</li>
 * <li>anything else - the scoping agent's message is relayed to the user</li>
 * </ol>
 * An unparseable classification ends the turn with a fallback prompt.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntentRouter {

    private final SearchSessionPort sessionPort;
    private final ClassificationParser classificationParser;
    private final TurnOutcomeExecutor outcomeExecutor;
    private final MessageService messageService;
    private final EstateProperties properties;
    private final Clock clock;

    @EventListener
    public void onScopingResponse(ScopingResponse response) {
        Optional<ScopingResult> parsed = response.isError()
                ? Optional.empty()
                : classificationParser.parse(response.payload());
        Instant now = clock.instant();
        TurnOutcome outcome = sessionPort.update(response.tag().sessionKey(),
                session -> route(session, response, parsed, now));
        outcomeExecutor.execute(outcome);
    }

    private TurnOutcome route(SearchSession session, ScopingResponse response, Optional<ScopingResult> parsed,
            Instant now) {
        FanOutTag tag = response.tag();
        if (!session.isCurrentTurn(tag) || session.getPhase() != TurnPhase.AWAITING_SCOPE
                || !session.markArrived(tag)) {
            log.debug("[Router] dropping stale or duplicate classification {}", tag);
            return TurnOutcome.none();
        }
        ReplyChannel channel = session.getReplyChannel();

        if (response.isError()) {
            log.warn("[Router] scoping failed for {}: {}", tag, response.error());
            session.setPhase(TurnPhase.ABORTED);
            session.setFinalized(true);
            return finalReply(channel, messageService.getMessage("turn.unavailable",
                    messageService.getMessage("worker.scoping")));
        }
        if (parsed.isEmpty()) {
            log.warn("[Router] unparseable classification for {}", tag);
            session.setPhase(TurnPhase.AWAITING_USER);
            return finalReply(channel, messageService.getMessage("turn.fallback"));
        }

        ScopingResult result = parsed.get();
        if (result.hasQuestion()) {
            log.info("[Router] {} general question", tag);
            session.setPhase(TurnPhase.ANSWERING_GENERAL);
            armDeadline(session, now);
            FanOutTag questionTag = FanOutTag.single(session.getKey(), session.getTurn(), Stage.QUESTION);
            return TurnOutcome.builder()
                    .replyChannel(channel)
                    .statusMessage(messageService.getMessage("turn.answering"))
                    .dispatches(List.of(new QuestionRequest(questionTag, result.questionText())))
                    .build();
        }
        if (result.isSearchReady()) {
            return startSearch(session, result, channel, now);
        }

        session.setPhase(TurnPhase.AWAITING_USER);
        String relay = result.agentMessage() != null
                ? result.agentMessage()
                : messageService.getMessage("turn.fallback");
        log.info("[Router] {} requirements incomplete, relaying scoping message", tag);
        return finalReply(channel, relay);
    }

    private TurnOutcome startSearch(SearchSession session, ScopingResult result, ReplyChannel channel,
            Instant now) {
        session.setRequirements(result.requirements());
        session.setPhase(TurnPhase.AWAITING_SEARCH);
        armDeadline(session, now);

        List<WorkerMessage> dispatches = new ArrayList<>();
        dispatches.add(new SearchRequest(FanOutTag.single(session.getKey(), session.getTurn(), Stage.SEARCH),
                result.requirements()));
        if (result.hasCommunityName()) {
            session.setCommunityRequested(true);
            dispatches.add(new CommunityRequest(
                    FanOutTag.single(session.getKey(), session.getTurn(), Stage.COMMUNITY),
                    result.communityName().trim()));
        }
        log.info("[Router] {} turn {} search ready (location={}, community={})", session.getKey(),
                session.getTurn(), result.requirements().getLocation(), result.communityName());
        return TurnOutcome.builder()
                .replyChannel(channel)
                .statusMessage(messageService.getMessage("turn.searching"))
                .dispatches(dispatches)
                .build();
    }

    private void armDeadline(SearchSession session, Instant now) {
        session.setStageDeadline(now.plusSeconds(properties.getTurn().getStageTimeoutSeconds()));
    }

    private TurnOutcome finalReply(ReplyChannel channel, String text) {
        return TurnOutcome.builder().replyChannel(channel).finalReply(text).build();
    }
}
