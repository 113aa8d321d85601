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
import feign.Headers;
import feign.Param;
import feign.RequestLine;

/**
 * Declarative Mapbox client: forward geocoding (v6) and Search Box category
 * search. Coordinates are passed in Mapbox order, longitude first.
 */
@Headers("Accept: application/json")
public interface MapboxApi {

    @RequestLine("GET /search/geocode/v6/forward?q={query}&limit=1&country={country}&access_token={token}")
    JsonNode forwardGeocode(@Param("query") String query, @Param("country") String country,
            @Param("token") String token);

    @RequestLine("GET /search/searchbox/v1/category/{category}?proximity={longitude},{latitude}"
            + "&limit={limit}&access_token={token}")
    JsonNode categorySearch(@Param("category") String category, @Param("longitude") double longitude,
            @Param("latitude") double latitude, @Param("limit") int limit, @Param("token") String token);
}
