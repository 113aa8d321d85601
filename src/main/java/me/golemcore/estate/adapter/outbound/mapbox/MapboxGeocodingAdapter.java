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
import me.golemcore.estate.domain.model.GeocodeResult;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.port.outbound.GeocodingPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Resolves listing addresses with Mapbox forward geocoding. Only the top
 * feature is used. Lookup failures are reported as failed
 * {@link GeocodeResult}s, not as exceptions.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MapboxGeocodingAdapter implements GeocodingPort {

    private final MapboxApi mapboxApi;
    private final EstateProperties properties;

    @Override
    public CompletableFuture<GeocodeResult> geocode(String address) {
        EstateProperties.MapboxProperties mapbox = properties.getMapbox();
        if (mapbox.getAccessToken() == null || mapbox.getAccessToken().isBlank()) {
            return CompletableFuture.completedFuture(GeocodeResult.failure("Mapbox token not configured"));
        }
        if (address == null || address.isBlank()) {
            return CompletableFuture.completedFuture(GeocodeResult.failure("Address is blank"));
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                JsonNode response = mapboxApi.forwardGeocode(address, mapbox.getCountry(),
                        mapbox.getAccessToken());
                return toResult(response, address);
            } catch (FeignException e) {
                log.warn("[Geocode] Mapbox error (status {}) for '{}'", e.status(), address);
                return GeocodeResult.failure("Mapbox geocoding failed: HTTP " + e.status());
            }
        });
    }

    private GeocodeResult toResult(JsonNode response, String address) {
        JsonNode feature = response != null ? response.path("features").path(0) : null;
        JsonNode coordinates = feature != null ? feature.path("geometry").path("coordinates") : null;
        if (coordinates == null || !coordinates.isArray() || coordinates.size() < 2) {
            log.debug("[Geocode] no coordinates for '{}'", address);
            return GeocodeResult.failure("No coordinates found for address");
        }
        double longitude = coordinates.get(0).asDouble();
        double latitude = coordinates.get(1).asDouble();
        String resolved = feature.path("properties").path("full_address").asText(address);
        return GeocodeResult.success(latitude, longitude, resolved);
    }
}
