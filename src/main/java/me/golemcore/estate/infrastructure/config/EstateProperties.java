package me.golemcore.estate.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code estate.*} prefix:
 * <ul>
 * <li>{@link TurnProperties} - fan-out cap, POI cascade, stage deadlines</li>
 * <li>{@link SessionProperties} - session expiry</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link LlmProperties} - OpenAI-compatible LLM endpoint</li>
 * <li>{@link MapboxProperties}, {@link TavilyProperties},
 * {@link SerpProperties} - worker backends</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "estate")
@Data
public class EstateProperties {

    private TurnProperties turn = new TurnProperties();
    private SessionProperties session = new SessionProperties();
    private HttpProperties http = new HttpProperties();
    private LlmProperties llm = new LlmProperties();
    private MapboxProperties mapbox = new MapboxProperties();
    private TavilyProperties tavily = new TavilyProperties();
    private SerpProperties serp = new SerpProperties();

    @Data
    public static class TurnProperties {
        private int fanOutCap = 5;
        private boolean poiEnabled = true;
        private int poiDisplayLimit = 5;
        private boolean waitForCommunity = false;
        private int stageTimeoutSeconds = 120;
    }

    @Data
    public static class SessionProperties {
        private int ttlMinutes = 360;
        private int sweepIntervalSeconds = 5;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class LlmProperties {
        private String baseUrl = "https://api.asi1.ai/v1";
        private String apiKey;
        private String model = "asi1-mini";
        private double temperature = 0.3;
        private int maxTokens = 800;
        private long timeoutMs = 60000;
    }

    // ==================== WORKER BACKENDS ====================

    @Data
    public static class MapboxProperties {
        private String baseUrl = "https://api.mapbox.com";
        private String accessToken;
        private String country = "US";
        private int poiLimitPerCategory = 2;
        private List<String> poiCategories = new ArrayList<>(List.of(
                "school", "hospital", "grocery", "restaurant", "park", "transit_station", "cafe", "gym"));
        private String staticMapStyle = "mapbox/streets-v12";
    }

    @Data
    public static class TavilyProperties {
        private String url = "https://api.tavily.com";
        private String apiKey;
        private String searchDepth = "advanced";
        private int timeoutSeconds = 30;
    }

    @Data
    public static class SerpProperties {
        private String url = "https://api.brightdata.com/request";
        private String apiKey;
        private String zone = "serp_api1";
        private String scrapeZone = "web_unlocker1";
        private int imageScrapeCount = 3;
        private int timeoutSeconds = 60;
    }
}
