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
import me.golemcore.estate.domain.model.Listing;
import me.golemcore.estate.domain.model.SearchResult;
import me.golemcore.estate.domain.model.SearchSession;
import me.golemcore.estate.domain.model.Stage;
import me.golemcore.estate.domain.model.message.GeocodeRequest;
import me.golemcore.estate.domain.model.message.PoiRequest;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Plans the per-listing fan-out stages. Must be called from inside a session
 * update: the expected counters are written in the same atomic step that
 * decides the dispatches, so no response can be counted against a target that
 * does not include it yet.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FanOutDispatcher {

    private final EstateProperties properties;

    /**
     * Builds one geocode request per listing of the capped batch that has a
     * usable address, and fixes the expected geocode count.
     *
     * @throws IllegalStateException
     *             if the geocode stage of this turn was already dispatched
     */
    public List<GeocodeRequest> planGeocodes(SearchSession session) {
        if (session.isGeocodeDispatched()) {
            throw new IllegalStateException("Geocode stage already dispatched for " + session.getKey()
                    + " turn " + session.getTurn());
        }
        List<Listing> batch = batchOf(session.getSearchResult());
        List<GeocodeRequest> requests = new ArrayList<>();
        for (int index = 0; index < batch.size(); index++) {
            Listing listing = batch.get(index);
            if (listing == null || !listing.hasUsableAddress()) {
                log.debug("[FanOut] listing {} has no address, not geocoded", index);
                continue;
            }
            FanOutTag tag = FanOutTag.indexed(session.getKey(), session.getTurn(), Stage.GEOCODE, index);
            requests.add(new GeocodeRequest(tag, listing.getAddress().trim()));
        }
        session.setExpectedGeocodeCount(requests.size());
        session.setGeocodeDispatched(true);
        log.info("[FanOut] {} turn {}: {} listings, {} geocode requests", session.getKey(), session.getTurn(),
                batch.size(), requests.size());
        return requests;
    }

    /**
     * Cascades a successful geocode into a POI search for the same index and
     * raises the expected POI count in the same step.
     */
    public Optional<PoiRequest> planPoi(SearchSession session, FanOutTag geocodeTag, GeocodedLocation location) {
        if (!properties.getTurn().isPoiEnabled()) {
            return Optional.empty();
        }
        session.setExpectedPoiCount(session.getExpectedPoiCount() + 1);
        return Optional.of(new PoiRequest(geocodeTag.withStage(Stage.POI), location.latitude(),
                location.longitude()));
    }

    /**
     * The listing batch the fan-out works on: the first {@code fanOutCap}
     * listings of the search result.
     */
    public List<Listing> batchOf(SearchResult result) {
        if (result == null || result.isEmpty()) {
            return List.of();
        }
        List<Listing> listings = result.getListings();
        int cap = Math.max(0, properties.getTurn().getFanOutCap());
        return listings.subList(0, Math.min(cap, listings.size()));
    }

    /**
     * Whether a geocode request was dispatched for {@code index} in this turn.
     */
    public boolean isGeocodeDispatched(SearchSession session, int index) {
        if (!session.isGeocodeDispatched()) {
            return false;
        }
        List<Listing> batch = batchOf(session.getSearchResult());
        return index < batch.size() && batch.get(index) != null && batch.get(index).hasUsableAddress();
    }

    /**
     * Whether a POI request was cascaded for {@code index} in this turn.
     */
    public boolean isPoiDispatched(SearchSession session, int index) {
        return properties.getTurn().isPoiEnabled() && session.getGeocoded().containsKey(index);
    }
}
