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

import java.util.ArrayList;
import java.util.List;

/**
 * One listing of the final answer, merged with everything the fan-out stages
 * produced for its index.
 */
@Data
@Builder
public class EnrichedListing {

    private int index;
    private Listing listing;
    private Double latitude;
    private Double longitude;
    private String resolvedAddress;
    private String imageUrl;

    @Builder.Default
    private List<PointOfInterest> pointsOfInterest = new ArrayList<>();

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
