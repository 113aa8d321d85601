package me.golemcore.estate;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class of the property search coordinator.
 *
 * <p>
 * A user message opens a turn. The coordinator classifies it, fans the turn
 * out to the listing search, geocoding, point-of-interest and community
 * workers over the event bus, merges what comes back and replies once per
 * turn.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → WebChannelAdapter, ChatController
 * Domain Layer       → TurnCoordinator, IntentRouter, FanInAggregator, ResponseAssembler
 * Workers            → Scoping, ListingSearch, Geocoding, PointOfInterest, CommunityAnalysis, Question
 * Infrastructure     → LLM/Mapbox/Tavily/SERP adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code estate.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EstateApplication {

    public static void main(String[] args) {
        SpringApplication.run(EstateApplication.class, args);
    }

}
