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
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Mutable aggregation record of one conversation. Holds the reply channel and
 * everything collected for the current turn, plus the expected/arrived counters
 * used for completion detection.
 *
 * <p>
 * Instances are only mutated inside
 * {@link me.golemcore.estate.port.outbound.SearchSessionPort#update} for their
 * key, which serialises concurrent arrivals of the same session.
 */
@Data
@Builder
public class SearchSession {

    private String key;
    private ReplyChannel replyChannel;
    private long turn;

    @Builder.Default
    private TurnPhase phase = TurnPhase.IDLE;

    private SearchRequirements requirements;
    private SearchResult searchResult;

    @Builder.Default
    private Map<Integer, GeocodedLocation> geocoded = new TreeMap<>();

    @Builder.Default
    private Map<Integer, List<PointOfInterest>> pointsOfInterest = new TreeMap<>();

    private CommunityAnalysis communityAnalysis;

    private boolean geocodeDispatched;
    private int expectedGeocodeCount;
    private int arrivedGeocodeCount;
    private int expectedPoiCount;
    private int arrivedPoiCount;

    private boolean communityRequested;
    private boolean communityArrived;

    @Builder.Default
    private Set<FanOutTag> arrivedTags = new HashSet<>();

    private boolean finalized;

    private Instant createdAt;
    private Instant turnStartedAt;
    private Instant stageDeadline;
    private Instant lastActivityAt;

    /**
     * Starts a new turn: overwrites the reply channel, bumps the turn number and
     * clears all per-turn state. Responses tagged with an older turn become
     * stale.
     */
    public void startTurn(ReplyChannel channel, Instant now) {
        this.replyChannel = channel;
        this.turn++;
        this.phase = TurnPhase.AWAITING_SCOPE;
        this.requirements = null;
        this.searchResult = null;
        this.geocoded = new TreeMap<>();
        this.pointsOfInterest = new TreeMap<>();
        this.communityAnalysis = null;
        this.geocodeDispatched = false;
        this.expectedGeocodeCount = 0;
        this.arrivedGeocodeCount = 0;
        this.expectedPoiCount = 0;
        this.arrivedPoiCount = 0;
        this.communityRequested = false;
        this.communityArrived = false;
        this.arrivedTags = new HashSet<>();
        this.finalized = false;
        this.turnStartedAt = now;
        this.stageDeadline = null;
    }

    public boolean isCurrentTurn(FanOutTag tag) {
        return tag != null && tag.turn() == turn && turn > 0;
    }

    /**
     * Records the arrival of a tagged response.
     *
     * @return {@code false} when the tag was already counted (re-delivery)
     */
    public boolean markArrived(FanOutTag tag) {
        return arrivedTags.add(tag);
    }

    /**
     * Immutable copy of the data the response assembler needs.
     */
    public TurnSnapshot snapshot(boolean partial) {
        Map<Integer, List<PointOfInterest>> poiCopy = new LinkedHashMap<>();
        pointsOfInterest.forEach((index, points) -> poiCopy.put(index, List.copyOf(points)));
        return TurnSnapshot.builder()
                .sessionKey(key)
                .turn(turn)
                .replyChannel(replyChannel)
                .searchResult(searchResult)
                .geocoded(Map.copyOf(geocoded))
                .pointsOfInterest(Map.copyOf(poiCopy))
                .communityAnalysis(communityAnalysis)
                .partial(partial)
                .build();
    }

    public List<FanOutTag> arrivedTagsOf(Stage stage) {
        List<FanOutTag> tags = new ArrayList<>();
        for (FanOutTag tag : arrivedTags) {
            if (tag.stage() == stage) {
                tags.add(tag);
            }
        }
        return tags;
    }
}
