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
import me.golemcore.estate.domain.model.EnrichedListing;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a Mapbox Static Images URL with one numbered marker per geocoded
 * listing. Markers are labelled with the listing number and cycle through a
 * fixed palette; {@code auto} fits the viewport to all markers.
 */
@Component
@RequiredArgsConstructor
public class StaticMapUrlBuilder {

    private static final List<String> MARKER_COLORS = List.of("e74c3c", "3498db", "2ecc71", "f39c12", "9b59b6");
    private static final String VIEWPORT = "auto/1000x600@2x";

    private final EstateProperties properties;

    public Optional<String> build(List<EnrichedListing> listings) {
        EstateProperties.MapboxProperties mapbox = properties.getMapbox();
        if (mapbox.getAccessToken() == null || mapbox.getAccessToken().isBlank()) {
            return Optional.empty();
        }
        List<String> markers = new ArrayList<>();
        for (EnrichedListing listing : listings) {
            if (!listing.hasCoordinates()) {
                continue;
            }
            int index = listing.getIndex();
            String color = MARKER_COLORS.get(index % MARKER_COLORS.size());
            markers.add("pin-s-" + (index + 1) + "+" + color + "(" + listing.getLongitude() + ","
                    + listing.getLatitude() + ")");
        }
        if (markers.isEmpty()) {
            return Optional.empty();
        }
        String baseUrl = stripTrailingSlash(mapbox.getBaseUrl());
        return Optional.of(baseUrl + "/styles/v1/" + mapbox.getStaticMapStyle() + "/static/"
                + String.join(",", markers) + "/" + VIEWPORT + "?access_token=" + mapbox.getAccessToken());
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
