package me.golemcore.estate.adapter.outbound.websearch;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.port.outbound.WebSearchPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Tavily web search adapter over the Tavily REST API.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code estate.tavily.url} - API base URL
 * <li>{@code estate.tavily.api-key} - API key (required)
 * <li>{@code estate.tavily.search-depth} - basic / advanced
 * <li>{@code estate.tavily.timeout-seconds} - HTTP timeout
 * </ul>
 */
@Component
@Slf4j
public class TavilyWebSearchAdapter implements WebSearchPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final EstateProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public TavilyWebSearchAdapter(EstateProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        int timeoutSeconds = properties.getTavily().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getTavily().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<List<Hit>> search(String query, int maxResults) {
        if (!isAvailable()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Tavily API key not configured"));
        }
        return CompletableFuture.supplyAsync(() -> {
            EstateProperties.TavilyProperties tavily = properties.getTavily();
            try {
                String body = objectMapper.writeValueAsString(new SearchBody(tavily.getApiKey(), query,
                        tavily.getSearchDepth(), maxResults));
                Request request = new Request.Builder()
                        .url(tavily.getUrl() + "/search")
                        .post(RequestBody.create(body, JSON))
                        .build();

                try (Response response = httpClient.newCall(request).execute()) {
                    ResponseBody responseBody = response.body();
                    if (!response.isSuccessful() || responseBody == null) {
                        log.warn("[Tavily] search failed: HTTP {}", response.code());
                        throw new IllegalStateException("Tavily search failed: HTTP " + response.code());
                    }
                    List<Hit> hits = parseHits(responseBody.string(), maxResults);
                    log.debug("[Tavily] '{}' returned {} results", query, hits.size());
                    return hits;
                }
            } catch (IOException e) {
                log.warn("[Tavily] search error: {}", e.getMessage());
                throw new UncheckedIOException(e);
            }
        });
    }

    private List<Hit> parseHits(String json, int maxResults) throws IOException {
        JsonNode results = objectMapper.readTree(json).path("results");
        List<Hit> hits = new ArrayList<>();
        for (JsonNode node : results) {
            if (hits.size() >= maxResults) {
                break;
            }
            hits.add(new Hit(node.path("title").asText(""), node.path("url").asText(""),
                    node.path("content").asText(""), node.path("score").asDouble(0)));
        }
        return hits;
    }

    record SearchBody(@JsonProperty("api_key") String apiKey, String query,
            @JsonProperty("search_depth") String searchDepth, @JsonProperty("max_results") int maxResults) {
    }
}
