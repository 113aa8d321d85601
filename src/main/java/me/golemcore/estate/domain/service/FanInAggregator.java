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
import me.golemcore.estate.domain.model.GeocodedLocation;
import me.golemcore.estate.domain.model.ReplyChannel;
import me.golemcore.estate.domain.model.SearchResult;
import me.golemcore.estate.domain.model.SearchSession;
import me.golemcore.estate.domain.model.TurnOutcome;
import me.golemcore.estate.domain.model.TurnPhase;
import me.golemcore.estate.domain.model.message.CommunityResponse;
import me.golemcore.estate.domain.model.message.GeocodeRequest;
import me.golemcore.estate.domain.model.message.GeocodeResponse;
import me.golemcore.estate.domain.model.message.PoiResponse;
import me.golemcore.estate.domain.model.message.QuestionResponse;
import me.golemcore.estate.domain.model.message.SearchResponse;
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

/**
 * Collects worker responses into the session of their tag and decides when a
 * turn is complete.
 *
 * <p>
 * Every handler runs as one atomic session update: duplicate check, merge,
 * counter increment, cascade decision and completion check happen together, so
 * concurrent arrivals for the same session cannot lose an increment and
 * exactly one of them observes completion. Responses tagged with an older turn
 * are dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FanInAggregator {

    private final SearchSessionPort sessionPort;
    private final FanOutDispatcher dispatcher;
    private final TurnOutcomeExecutor outcomeExecutor;
    private final MessageService messageService;
    private final EstateProperties properties;
    private final Clock clock;

    // ==================== SEARCH ====================

    @EventListener
    public void onSearchResponse(SearchResponse response) {
        Instant now = clock.instant();
        TurnOutcome outcome = sessionPort.update(response.tag().sessionKey(),
                session -> acceptSearch(session, response, now));
        outcomeExecutor.execute(outcome);
    }

    private TurnOutcome acceptSearch(SearchSession session, SearchResponse response, Instant now) {
        FanOutTag tag = response.tag();
        if (!session.isCurrentTurn(tag) || session.getPhase() != TurnPhase.AWAITING_SEARCH
                || !session.markArrived(tag)) {
            log.debug("[FanIn] dropping stale or duplicate search response {}", tag);
            return TurnOutcome.none();
        }
        if (response.isError()) {
            log.warn("[FanIn] search failed for {}: {}", tag, response.error());
            session.setPhase(TurnPhase.ABORTED);
            session.setFinalized(true);
            return TurnOutcome.builder()
                    .replyChannel(session.getReplyChannel())
                    .finalReply(messageService.getMessage("turn.unavailable",
                            messageService.getMessage("worker.search")))
                    .build();
        }

        SearchResult result = response.result() != null ? response.result() : SearchResult.builder().build();
        session.setSearchResult(result);
        List<GeocodeRequest> requests = dispatcher.planGeocodes(session);

        TurnOutcome.TurnOutcomeBuilder outcome = TurnOutcome.builder()
                .dispatches(new ArrayList<>(requests));
        if (!requests.isEmpty()) {
            session.setPhase(TurnPhase.AWAITING_GEOCODE);
            armDeadline(session, now);
            int found = Math.max(result.getTotalFound(), result.getListings().size());
            outcome.statusMessage(messageService.getMessage("turn.gathering", found));
        }
        return completeOrContinue(session, outcome);
    }

    // ==================== GEOCODE ====================

    @EventListener
    public void onGeocodeResponse(GeocodeResponse response) {
        Instant now = clock.instant();
        TurnOutcome outcome = sessionPort.update(response.tag().sessionKey(),
                session -> acceptGeocode(session, response, now));
        outcomeExecutor.execute(outcome);
    }

    private TurnOutcome acceptGeocode(SearchSession session, GeocodeResponse response, Instant now) {
        FanOutTag tag = response.tag();
        if (!session.isCurrentTurn(tag) || !dispatcher.isGeocodeDispatched(session, tag.index())
                || !session.markArrived(tag)) {
            log.debug("[FanIn] dropping stale, unknown or duplicate geocode response {}", tag);
            return TurnOutcome.none();
        }
        if (session.isFinalized()) {
            log.debug("[FanIn] geocode {} arrived after the turn was finalized", tag);
            return TurnOutcome.none();
        }
        session.setArrivedGeocodeCount(session.getArrivedGeocodeCount() + 1);

        List<WorkerMessage> dispatches = new ArrayList<>();
        if (response.isError() || response.latitude() == null || response.longitude() == null) {
            log.warn("[FanIn] geocode failed for {}: {}", tag, response.error());
        } else {
            GeocodedLocation location = new GeocodedLocation(tag.index(), response.latitude(),
                    response.longitude(), response.resolvedAddress());
            session.getGeocoded().put(tag.index(), location);
            dispatcher.planPoi(session, tag, location).ifPresent(dispatches::add);
        }
        log.info("[FanIn] {} geocoding progress: {}/{}", session.getKey(), session.getArrivedGeocodeCount(),
                session.getExpectedGeocodeCount());

        if (!dispatches.isEmpty()) {
            armDeadline(session, now);
        }
        if (TurnCompletion.isGeocodeStageComplete(session)
                && session.getArrivedPoiCount() < session.getExpectedPoiCount()) {
            session.setPhase(TurnPhase.AWAITING_POI);
        }
        return completeOrContinue(session, TurnOutcome.builder().dispatches(dispatches));
    }

    // ==================== POI ====================

    @EventListener
    public void onPoiResponse(PoiResponse response) {
        TurnOutcome outcome = sessionPort.update(response.tag().sessionKey(),
                session -> acceptPoi(session, response));
        outcomeExecutor.execute(outcome);
    }

    private TurnOutcome acceptPoi(SearchSession session, PoiResponse response) {
        FanOutTag tag = response.tag();
        if (!session.isCurrentTurn(tag) || !dispatcher.isPoiDispatched(session, tag.index())
                || !session.markArrived(tag)) {
            log.debug("[FanIn] dropping stale, unknown or duplicate POI response {}", tag);
            return TurnOutcome.none();
        }
        if (session.isFinalized()) {
            log.debug("[FanIn] POI {} arrived after the turn was finalized", tag);
            return TurnOutcome.none();
        }
        session.setArrivedPoiCount(session.getArrivedPoiCount() + 1);
        if (response.isError()) {
            log.warn("[FanIn] POI search failed for {}: {}", tag, response.error());
        } else {
            session.getPointsOfInterest().put(tag.index(), new ArrayList<>(response.points()));
        }
        log.info("[FanIn] {} POI progress: {}/{}", session.getKey(), session.getArrivedPoiCount(),
                session.getExpectedPoiCount());
        return completeOrContinue(session, TurnOutcome.builder());
    }

    // ==================== COMMUNITY ====================

    @EventListener
    public void onCommunityResponse(CommunityResponse response) {
        TurnOutcome outcome = sessionPort.update(response.tag().sessionKey(),
                session -> acceptCommunity(session, response));
        outcomeExecutor.execute(outcome);
    }

    private TurnOutcome acceptCommunity(SearchSession session, CommunityResponse response) {
        FanOutTag tag = response.tag();
        if (!session.isCurrentTurn(tag) || !session.isCommunityRequested() || !session.markArrived(tag)) {
            log.debug("[FanIn] dropping stale or duplicate community response {}", tag);
            return TurnOutcome.none();
        }
        session.setCommunityArrived(true);
        if (session.isFinalized()) {
            log.info("[FanIn] community analysis for {} arrived after assembly, omitted", tag);
            return TurnOutcome.none();
        }
        if (response.isError()) {
            log.warn("[FanIn] community analysis failed for {}: {}", tag, response.error());
        } else {
            session.setCommunityAnalysis(response.analysis());
        }
        return completeOrContinue(session, TurnOutcome.builder());
    }

    // ==================== QUESTION ====================

    @EventListener
    public void onQuestionResponse(QuestionResponse response) {
        TurnOutcome outcome = sessionPort.update(response.tag().sessionKey(),
                session -> acceptAnswer(session, response));
        outcomeExecutor.execute(outcome);
    }

    private TurnOutcome acceptAnswer(SearchSession session, QuestionResponse response) {
        FanOutTag tag = response.tag();
        if (!session.isCurrentTurn(tag) || session.getPhase() != TurnPhase.ANSWERING_GENERAL
                || !session.markArrived(tag)) {
            log.debug("[FanIn] dropping stale or duplicate answer {}", tag);
            return TurnOutcome.none();
        }
        ReplyChannel channel = session.getReplyChannel();
        session.setFinalized(true);
        if (response.isError() || response.answer() == null || response.answer().isBlank()) {
            log.warn("[FanIn] question answering failed for {}: {}", tag, response.error());
            session.setPhase(TurnPhase.ABORTED);
            return TurnOutcome.builder()
                    .replyChannel(channel)
                    .finalReply(messageService.getMessage("turn.unavailable",
                            messageService.getMessage("worker.question")))
                    .build();
        }
        session.setPhase(TurnPhase.ASSEMBLED);
        return TurnOutcome.builder().replyChannel(channel).finalReply(response.answer()).build();
    }

    // ==================== COMPLETION ====================

    private TurnOutcome completeOrContinue(SearchSession session, TurnOutcome.TurnOutcomeBuilder outcome) {
        outcome.replyChannel(session.getReplyChannel());
        if (!session.isFinalized()
                && TurnCompletion.isTurnComplete(session, properties.getTurn().isWaitForCommunity())) {
            session.setFinalized(true);
            session.setPhase(TurnPhase.ASSEMBLED);
            log.info("[FanIn] {} turn {} complete (geocode {}/{}, poi {}/{})", session.getKey(),
                    session.getTurn(), session.getArrivedGeocodeCount(), session.getExpectedGeocodeCount(),
                    session.getArrivedPoiCount(), session.getExpectedPoiCount());
            outcome.assembly(session.snapshot(false));
        }
        return outcome.build();
    }

    private void armDeadline(SearchSession session, Instant now) {
        session.setStageDeadline(now.plusSeconds(properties.getTurn().getStageTimeoutSeconds()));
    }
}
