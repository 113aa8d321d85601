package me.golemcore.estate.domain.model;

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

import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Frozen view of a finalized turn, handed to the response assembler outside of
 * the session lock.
 *
 * @param partial
 *            {@code true} when the turn was finalized by a stage deadline
 *            before every sub-response arrived
 */
@Builder
public record TurnSnapshot(String sessionKey, long turn, ReplyChannel replyChannel, SearchResult searchResult,
        Map<Integer, GeocodedLocation> geocoded, Map<Integer, List<PointOfInterest>> pointsOfInterest,
        CommunityAnalysis communityAnalysis, boolean partial) {

    public Optional<GeocodedLocation> geocodedAt(int index) {
        return geocoded != null ? Optional.ofNullable(geocoded.get(index)) : Optional.empty();
    }

    public List<PointOfInterest> pointsOfInterestAt(int index) {
        if (pointsOfInterest == null) {
            return List.of();
        }
        return pointsOfInterest.getOrDefault(index, List.of());
    }
}
