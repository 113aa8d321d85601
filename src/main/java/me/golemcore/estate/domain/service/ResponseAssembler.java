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
import me.golemcore.estate.domain.model.EnrichedListing;
import me.golemcore.estate.domain.model.GeocodedLocation;
import me.golemcore.estate.domain.model.Listing;
import me.golemcore.estate.domain.model.TurnSnapshot;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Merges the listing batch of a finalized turn with coordinates, images and
 * nearby places by index, renders it and sends it as the final reply.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseAssembler {

    private final FanOutDispatcher dispatcher;
    private final ResultMessageRenderer renderer;
    private final ReplySender replySender;

    /**
     * One entry per listing of the capped batch, in batch order. Data recorded
     * for an index outside the batch is never included.
     */
    public List<EnrichedListing> merge(TurnSnapshot snapshot) {
        List<Listing> batch = dispatcher.batchOf(snapshot.searchResult());
        List<EnrichedListing> merged = new ArrayList<>(batch.size());
        for (int index = 0; index < batch.size(); index++) {
            Listing listing = batch.get(index);
            if (listing == null) {
                continue;
            }
            Optional<GeocodedLocation> location = snapshot.geocodedAt(index);
            merged.add(EnrichedListing.builder()
                    .index(index)
                    .listing(listing)
                    .latitude(location.map(GeocodedLocation::latitude).orElse(null))
                    .longitude(location.map(GeocodedLocation::longitude).orElse(null))
                    .resolvedAddress(location.map(GeocodedLocation::resolvedAddress).orElse(null))
                    .imageUrl(snapshot.searchResult().imageFor(index).orElse(null))
                    .pointsOfInterest(new ArrayList<>(snapshot.pointsOfInterestAt(index)))
                    .build());
        }
        return merged;
    }

    public String assemble(TurnSnapshot snapshot) {
        return renderer.render(snapshot, merge(snapshot));
    }

    public void deliver(TurnSnapshot snapshot) {
        String text = assemble(snapshot);
        replySender.send(snapshot.replyChannel(), text, true);
        log.info("[Assembler] sent final reply for {} turn {}{}", snapshot.sessionKey(), snapshot.turn(),
                snapshot.partial() ? " (partial)" : "");
    }
}
