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

/**
 * Outcome of geocoding a single address. Either coordinates or an error.
 */
public record GeocodeResult(Double latitude, Double longitude, String resolvedAddress, String error) {

    public static GeocodeResult success(double latitude, double longitude, String resolvedAddress) {
        return new GeocodeResult(latitude, longitude, resolvedAddress, null);
    }

    public static GeocodeResult failure(String error) {
        return new GeocodeResult(null, null, null, error != null ? error : "unknown error");
    }

    public boolean isSuccess() {
        return error == null && latitude != null && longitude != null;
    }
}
