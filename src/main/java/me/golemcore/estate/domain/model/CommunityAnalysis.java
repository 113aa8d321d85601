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

/**
 * Safety, schools and housing assessment for a named location. Scores are on a
 * 0-10 scale.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommunityAnalysis {

    private String location;
    private Double overallScore;
    private String overallExplanation;
    private Double safetyScore;
    private Double schoolScore;
    private String schoolExplanation;
    private Double housingPricePerSqft;
    private Double avgHouseSizeSqft;

    @Builder.Default
    private List<NewsStory> positiveStories = new ArrayList<>();

    @Builder.Default
    private List<NewsStory> negativeStories = new ArrayList<>();
}
