package me.golemcore.estate.adapter.inbound.web.controller;

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
import me.golemcore.estate.adapter.inbound.web.dto.SessionProgressDto;
import me.golemcore.estate.domain.model.SearchSession;
import me.golemcore.estate.port.outbound.SearchSessionPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Read-only progress view of search sessions.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionsController {

    private final SearchSessionPort sessionPort;

    @GetMapping("/{key}")
    public Mono<ResponseEntity<SessionProgressDto>> getSession(@PathVariable String key) {
        SessionProgressDto progress = sessionPort.updateExisting(key, this::toProgress)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + key));
        return Mono.just(ResponseEntity.ok(progress));
    }

    private SessionProgressDto toProgress(SearchSession session) {
        return SessionProgressDto.builder()
                .key(session.getKey())
                .turn(session.getTurn())
                .phase(session.getPhase().name())
                .finalized(session.isFinalized())
                .listingCount(session.getSearchResult() != null && session.getSearchResult().getListings() != null
                        ? session.getSearchResult().getListings().size()
                        : 0)
                .expectedGeocodeCount(session.getExpectedGeocodeCount())
                .arrivedGeocodeCount(session.getArrivedGeocodeCount())
                .expectedPoiCount(session.getExpectedPoiCount())
                .arrivedPoiCount(session.getArrivedPoiCount())
                .communityRequested(session.isCommunityRequested())
                .communityArrived(session.isCommunityArrived())
                .turnStartedAt(format(session.getTurnStartedAt()))
                .stageDeadline(format(session.getStageDeadline()))
                .lastActivityAt(format(session.getLastActivityAt()))
                .build();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
