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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ranked listing batch and human-readable summary produced by the search
 * worker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult {

    @Builder.Default
    private List<Listing> listings = new ArrayList<>();

    private String summary;
    private int totalFound;

    @Builder.Default
    private List<ListingImage> images = new ArrayList<>();

    public Optional<String> imageFor(int index) {
        if (images == null) {
            return Optional.empty();
        }
        return images.stream()
                .filter(image -> image.index() == index)
                .map(ListingImage::imageUrl)
                .filter(url -> url != null && !url.isBlank())
                .findFirst();
    }

    public boolean isEmpty() {
        return listings == null || listings.isEmpty();
    }
}
