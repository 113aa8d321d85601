package me.golemcore.estate.adapter.outbound.community;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.domain.model.CommunityAnalysis;
import me.golemcore.estate.domain.model.NewsStory;
import me.golemcore.estate.domain.service.ClassificationParser;
import me.golemcore.estate.port.outbound.CommunityAnalysisPort;
import me.golemcore.estate.port.outbound.LlmPort;
import me.golemcore.estate.port.outbound.WebSearchPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Community analysis from web research and an LLM: news, school and housing
 * articles are collected through the {@link WebSearchPort} and scored by the
 * LLM into a JSON assessment. The overall score is the mean of the safety and
 * school scores.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmCommunityAnalysisAdapter implements CommunityAnalysisPort {

    private static final int NEWS_RESULTS = 20;
    private static final int TOPIC_RESULTS = 15;
    private static final int SNIPPET_LENGTH = 300;
    private static final int MAX_TOKENS = 2048;

    private static final String SYSTEM_PROMPT = """
            You are a community news analyst. You will be given real news articles about a location, \
            and you need to analyze them.
            You MUST respond with ONLY valid JSON in the following format (no additional text):
            {
              "location": "location name",
              "overall": {"score": 7.9, "explanation": "Brief explanation of overall rating"},
              "safety": {
                "score": 7.5,
                "positive_stories": [{"title": "...", "summary": "...", "url": "..."}],
                "negative_stories": [{"title": "...", "summary": "...", "url": "..."}]
              },
              "schools": {"score": 8.2, "explanation": "Brief explanation of school rating"},
              "housing_avg": {"housing_price_per_square_foot": 739, "average_house_size_square_foot": 1921}
            }
            Rules:
            - All scores are numbers from 0-10 with precision to tenths.
            - The overall score is the average of the safety and schools scores.
            - Choose the 2 most relevant positive and 2 most relevant negative safety stories, with real URLs.
            - Prefer recent articles specifically about the location.
            - If housing data is missing from the articles, give reasonable estimates for the area.
            """;

    private final WebSearchPort webSearchPort;
    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;

    @Override
    public CompletableFuture<CommunityAnalysis> analyze(String locationName) {
        if (!llmPort.isAvailable()) {
            return CompletableFuture.failedFuture(new IllegalStateException("LLM not configured"));
        }
        CompletableFuture<List<WebSearchPort.Hit>> news = research(
                locationName + " local news community safety crime development", NEWS_RESULTS);
        CompletableFuture<List<WebSearchPort.Hit>> schools = research(
                locationName + " schools ratings rankings education quality greatschools niche", TOPIC_RESULTS);
        CompletableFuture<List<WebSearchPort.Hit>> housing = research(
                locationName + " housing prices per square foot average home size zillow redfin realtor",
                TOPIC_RESULTS);

        return CompletableFuture.allOf(news, schools, housing)
                .thenCompose(ignored -> {
                    String userPrompt = "Analyze community news and safety for: " + locationName + "\n\n"
                            + formatArticles("recent news articles about this location", news.join(),
                                    "No recent news articles found. Provide a general analysis.")
                            + formatArticles("articles about schools and education in this location",
                                    schools.join(), "No school-related articles found. Provide a general rating.")
                            + formatArticles("articles about housing and real estate in this location",
                                    housing.join(), "No housing-related articles found. Provide estimates.");
                    return llmPort.complete(LlmPort.Prompt.builder()
                            .systemPrompt(SYSTEM_PROMPT)
                            .userPrompt(userPrompt)
                            .maxTokens(MAX_TOKENS)
                            .build());
                })
                .thenApply(raw -> parse(raw, locationName));
    }

    private CompletableFuture<List<WebSearchPort.Hit>> research(String query, int maxResults) {
        if (!webSearchPort.isAvailable()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return webSearchPort.search(query, maxResults)
                .exceptionally(e -> {
                    log.warn("[Community] web search failed for '{}': {}", query, e.getMessage());
                    return List.of();
                });
    }

    private String formatArticles(String heading, List<WebSearchPort.Hit> hits, String emptyText) {
        if (hits.isEmpty()) {
            return emptyText + "\n\n";
        }
        StringBuilder sb = new StringBuilder("Here are ").append(heading).append(":\n\n");
        int number = 1;
        for (WebSearchPort.Hit hit : hits) {
            String content = hit.content() != null ? hit.content() : "";
            if (content.length() > SNIPPET_LENGTH) {
                content = content.substring(0, SNIPPET_LENGTH) + "...";
            }
            sb.append(number++).append(". ").append(hit.title()).append('\n')
                    .append("   Content: ").append(content).append('\n')
                    .append("   URL: ").append(hit.url()).append("\n\n");
        }
        return sb.toString();
    }

    CommunityAnalysis parse(String raw, String locationName) {
        String json = ClassificationParser.extractJsonObject(raw);
        if (json == null) {
            throw new IllegalStateException("Community analysis returned no JSON");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Community analysis returned invalid JSON: " + e.getOriginalMessage(),
                    e);
        }
        JsonNode safety = root.path("safety");
        JsonNode schools = root.path("schools");
        JsonNode housing = root.path("housing_avg");
        Double safetyScore = number(safety.path("score"));
        Double schoolScore = number(schools.path("score"));
        Double overallScore = safetyScore != null && schoolScore != null
                ? Math.round((safetyScore + schoolScore) / 2 * 10) / 10.0
                : number(root.path("overall").path("score"));

        return CommunityAnalysis.builder()
                .location(root.path("location").asText(locationName))
                .overallScore(overallScore)
                .overallExplanation(textOrNull(root.path("overall").path("explanation")))
                .safetyScore(safetyScore)
                .schoolScore(schoolScore)
                .schoolExplanation(textOrNull(schools.path("explanation")))
                .housingPricePerSqft(number(housing.path("housing_price_per_square_foot")))
                .avgHouseSizeSqft(number(housing.path("average_house_size_square_foot")))
                .positiveStories(stories(safety.path("positive_stories")))
                .negativeStories(stories(safety.path("negative_stories")))
                .build();
    }

    private List<NewsStory> stories(JsonNode array) {
        List<NewsStory> stories = new ArrayList<>();
        for (JsonNode node : array) {
            if (node.isTextual()) {
                stories.add(new NewsStory(node.asText(), null, null));
            } else if (node.isObject()) {
                stories.add(new NewsStory(textOrNull(node.path("title")), textOrNull(node.path("summary")),
                        textOrNull(node.path("url"))));
            }
        }
        return stories;
    }

    private static Double number(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().replace(",", "").replace("$", "").trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
