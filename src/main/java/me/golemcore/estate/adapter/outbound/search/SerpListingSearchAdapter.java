package me.golemcore.estate.adapter.outbound.search;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.domain.model.Listing;
import me.golemcore.estate.domain.model.ListingImage;
import me.golemcore.estate.domain.model.SearchRequirements;
import me.golemcore.estate.domain.model.SearchResult;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.port.outbound.ListingSearchPort;
import me.golemcore.estate.port.outbound.LlmPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Listing search over the Bright Data SERP API.
 *
 * <p>
 * Flow:
 * <ol>
 * <li>Search criteria are rendered as a Google query and sent through the SERP
 * zone; organic results become listings (address from the page title)
 * <li>The first results hosted on Redfin or Zillow are scraped as markdown
 * through the unlocker zone for a listing photo
 * <li>An LLM writes a short conversational summary; without an LLM a counted
 * fallback sentence is used
 * </ol>
 */
@Component
@Slf4j
public class SerpListingSearchAdapter implements ListingSearchPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String GOOGLE_SEARCH_URL = "https://www.google.com/search?brd_json=1&q=";
    private static final int SUMMARY_CONTEXT_RESULTS = 8;
    private static final List<String> SUMMARY_WORDS = List.of("found", "results", "listings", "properties");

    private static final String SUMMARY_SYSTEM_PROMPT = "You are a friendly real estate research assistant. "
            + "Based on search results, provide a natural, conversational summary of available properties. "
            + "Mention 2-3 specific listings with addresses and key details. "
            + "Keep it warm and helpful, 3-4 sentences max.";

    private final EstateProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final LlmPort llmPort;

    public SerpListingSearchAdapter(EstateProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper, LlmPort llmPort) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.llmPort = llmPort;

        int timeoutSeconds = properties.getSerp().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public CompletableFuture<SearchResult> search(SearchRequirements requirements) {
        String apiKey = properties.getSerp().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalStateException("SERP API key not configured"));
        }
        return CompletableFuture.supplyAsync(() -> {
            String query = ListingTextParser.toQuery(requirements);
            log.info("[Search] query: {}", query);
            try {
                String searchUrl = GOOGLE_SEARCH_URL + URLEncoder.encode(query, StandardCharsets.UTF_8);
                String raw = post(new RequestPayload(properties.getSerp().getZone(), searchUrl, "raw", null));
                List<Listing> listings = parseListings(raw);
                log.info("[Search] {} organic results", listings.size());

                List<ListingImage> images = scrapeImages(listings);
                String summary = summarize(listings, query);
                return SearchResult.builder()
                        .listings(listings)
                        .images(images)
                        .summary(summary)
                        .totalFound(listings.size())
                        .build();
            } catch (IOException e) {
                log.warn("[Search] SERP request failed: {}", e.getMessage());
                throw new UncheckedIOException(e);
            }
        });
    }

    private List<Listing> parseListings(String raw) throws IOException {
        JsonNode organic = objectMapper.readTree(raw).path("organic");
        List<Listing> listings = new ArrayList<>();
        for (JsonNode node : organic) {
            String title = node.path("title").asText("");
            String description = node.path("description").asText("");
            String text = title + " " + description;
            listings.add(Listing.builder()
                    .title(title)
                    .link(node.path("link").asText(null))
                    .description(description)
                    .address(ListingTextParser.addressFromTitle(title))
                    .price(ListingTextParser.price(text))
                    .beds(ListingTextParser.beds(text))
                    .baths(ListingTextParser.baths(text))
                    .sqft(ListingTextParser.sqft(text))
                    .build());
        }
        return listings;
    }

    private List<ListingImage> scrapeImages(List<Listing> listings) {
        List<ListingImage> images = new ArrayList<>();
        int limit = Math.min(properties.getSerp().getImageScrapeCount(), listings.size());
        for (int index = 0; index < limit; index++) {
            String link = listings.get(index).getLink();
            if (!ListingTextParser.isListingSite(link)) {
                log.debug("[Search] result {} is not a listing site, no image", index + 1);
                continue;
            }
            try {
                String markdown = post(new RequestPayload(properties.getSerp().getScrapeZone(), link, "raw",
                        "markdown"));
                String imageUrl = ListingTextParser.firstPropertyImage(markdown);
                if (imageUrl != null) {
                    images.add(new ListingImage(index, imageUrl));
                }
            } catch (IOException e) {
                log.warn("[Search] failed to scrape result {}: {}", index + 1, e.getMessage());
            }
        }
        return images;
    }

    private String summarize(List<Listing> listings, String query) {
        String fallback = "Found " + listings.size() + " property listings.";
        if (listings.isEmpty() || !llmPort.isAvailable()) {
            return fallback;
        }
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < Math.min(SUMMARY_CONTEXT_RESULTS, listings.size()); i++) {
            Listing listing = listings.get(i);
            context.append(i + 1).append(". ").append(listing.getTitle()).append('\n');
            if (listing.getDescription() != null && !listing.getDescription().isBlank()) {
                context.append("   ").append(listing.getDescription()).append('\n');
            }
            context.append("   Link: ").append(listing.getLink()).append("\n\n");
        }
        LlmPort.Prompt prompt = LlmPort.Prompt.builder()
                .systemPrompt(SUMMARY_SYSTEM_PROMPT)
                .userPrompt("User query: " + query + "\n\nSearch results:\n" + context
                        + "Summarize what properties are available.")
                .build();
        try {
            String summary = llmPort.complete(prompt).join();
            if (summary == null || summary.isBlank()) {
                return fallback;
            }
            String lower = summary.toLowerCase(Locale.ROOT);
            if (SUMMARY_WORDS.stream().noneMatch(lower::contains)) {
                return fallback + " " + summary.trim();
            }
            return summary.trim();
        } catch (RuntimeException e) {
            log.warn("[Search] summary generation failed: {}", e.getMessage());
            return fallback;
        }
    }

    private String post(RequestPayload payload) throws IOException {
        String body = objectMapper.writeValueAsString(payload);
        Request request = new Request.Builder()
                .url(properties.getSerp().getUrl())
                .header("Authorization", "Bearer " + properties.getSerp().getApiKey())
                .post(RequestBody.create(body, JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                throw new IOException("SERP API error: HTTP " + response.code());
            }
            return responseBody.string();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record RequestPayload(String zone, String url, String format,
            @JsonProperty("data_format") String dataFormat) {
    }
}
