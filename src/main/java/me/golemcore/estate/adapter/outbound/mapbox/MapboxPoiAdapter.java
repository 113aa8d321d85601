package me.golemcore.estate.adapter.outbound.mapbox;

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

import com.fasterxml.jackson.databind.JsonNode;
import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.domain.model.PointOfInterest;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.port.outbound.PointOfInterestPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Finds places near a coordinate with the Mapbox Search Box category endpoint,
 * querying each configured category. A failing category is skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MapboxPoiAdapter implements PointOfInterestPort {

    private final MapboxApi mapboxApi;
    private final EstateProperties properties;

    @Override
    public CompletableFuture<List<PointOfInterest>> findNearby(double latitude, double longitude) {
        EstateProperties.MapboxProperties mapbox = properties.getMapbox();
        if (mapbox.getAccessToken() == null || mapbox.getAccessToken().isBlank()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Mapbox token not configured"));
        }
        return CompletableFuture.supplyAsync(() -> {
            List<PointOfInterest> points = new ArrayList<>();
            for (String category : mapbox.getPoiCategories()) {
                try {
                    JsonNode response = mapboxApi.categorySearch(category, longitude, latitude,
                            mapbox.getPoiLimitPerCategory(), mapbox.getAccessToken());
                    collect(response, category, points);
                } catch (FeignException e) {
                    log.warn("[POI] Mapbox error (status {}) for category {}", e.status(), category);
                }
            }
            log.debug("[POI] {} places near {},{}", points.size(), latitude, longitude);
            return points;
        });
    }

    private void collect(JsonNode response, String category, List<PointOfInterest> points) {
        if (response == null) {
            return;
        }
        for (JsonNode feature : response.path("features")) {
            JsonNode coordinates = feature.path("geometry").path("coordinates");
            if (!coordinates.isArray() || coordinates.size() < 2) {
                continue;
            }
            JsonNode props = feature.path("properties");
            JsonNode distance = props.path("distance");
            String address = props.hasNonNull("full_address")
                    ? props.get("full_address").asText()
                    : props.path("place_formatted").asText("");
            points.add(PointOfInterest.builder()
                    .name(props.path("name").asText("Unknown"))
                    .category(category)
                    .longitude(coordinates.get(0).asDouble())
                    .latitude(coordinates.get(1).asDouble())
                    .address(address)
                    .distanceMeters(distance.isNumber() ? distance.asDouble() : null)
                    .build());
        }
    }
}
