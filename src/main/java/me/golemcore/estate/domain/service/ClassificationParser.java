package me.golemcore.estate.domain.service;

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
import me.golemcore.estate.domain.model.ScopingResult;
import me.golemcore.estate.domain.model.SearchRequirements;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Parses the JSON classification produced by the scoping worker. LLM output
 * may be wrapped in markdown code fences or surrounded by prose; the first
 * JSON object found is used.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClassificationParser {

    private final ObjectMapper objectMapper;

    public Optional<ScopingResult> parse(String payload) {
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }
        String json = extractJsonObject(payload);
        if (json == null) {
            log.debug("[Router] no JSON object in classification payload");
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(toResult(node));
        } catch (JsonProcessingException e) {
            log.debug("[Router] failed to parse classification: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private ScopingResult toResult(JsonNode node) {
        JsonNode requirementsNode = node.path("requirements");
        SearchRequirements requirements = requirementsNode.isObject() ? toRequirements(requirementsNode) : null;
        return ScopingResult.builder()
                .complete(node.path("is_complete").asBoolean(false))
                .generalQuestion(node.path("is_general_question").asBoolean(false))
                .questionText(text(node, "general_question"))
                .requirements(requirements)
                .communityName(firstText(node, "community_name", "implied_location"))
                .agentMessage(text(node, "agent_message"))
                .build();
    }

    private SearchRequirements toRequirements(JsonNode node) {
        return SearchRequirements.builder()
                .budgetMin(longValue(node.path("budget_min")))
                .budgetMax(longValue(node.path("budget_max")))
                .bedrooms(node.path("bedrooms").isNumber() ? node.path("bedrooms").asInt() : null)
                .bathrooms(node.path("bathrooms").isNumber() ? node.path("bathrooms").asDouble() : null)
                .location(text(node, "location"))
                .additionalInfo(text(node, "additional_info"))
                .build();
    }

    private Long longValue(JsonNode node) {
        return node.isNumber() ? node.asLong() : null;
    }

    private String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * The first JSON object in {@code payload}, ignoring markdown fences and
     * surrounding prose, or {@code null}.
     */
    public static String extractJsonObject(String payload) {
        if (payload == null) {
            return null;
        }
        String trimmed = payload.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closingFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closingFence > firstNewline) {
                trimmed = trimmed.substring(firstNewline + 1, closingFence).trim();
            }
        }
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return trimmed.substring(start, end + 1);
    }
}
