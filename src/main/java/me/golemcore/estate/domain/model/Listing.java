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

/**
 * Raw listing record returned by the listing search worker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Listing {

    private String title;
    private String address;
    private String link;
    private String description;
    private String price;
    private String beds;
    private String baths;
    private String sqft;

    /**
     * Whether the listing carries an address that can be geocoded.
     */
    public boolean hasUsableAddress() {
        return address != null && !address.isBlank();
    }
}
