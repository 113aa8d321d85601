package me.golemcore.estate.adapter.outbound.scoping;

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
import me.golemcore.estate.domain.service.ClassificationParser;
import me.golemcore.estate.port.outbound.LlmPort;
import me.golemcore.estate.port.outbound.ScopingPort;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Classifies user messages with an LLM, keeping a bounded conversation history
 * per session so follow-up messages ("make it 3 bedrooms") are understood in
 * context. Returns the raw LLM output; parsing happens in the router.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmScopingAdapter implements ScopingPort {

    static final int MAX_HISTORY_ENTRIES = 20;
    static final int MAX_CONVERSATIONS = 1000;
    private static final double TEMPERATURE = 0.3;

    private static final String SYSTEM_PROMPT = """
            You are a friendly real estate agent helping users find their dream home in the San Francisco Bay Area.
            Your job is to gather the following information from the user through natural conversation:
            1. Budget (minimum and maximum price range)
            2. Number of bedrooms
            3. Number of bathrooms
            4. Specific location within Bay Area (cities like San Francisco, Oakland, San Jose, etc.)

            Rules:
            - Be conversational and friendly
            - Ask follow-up questions ONLY if you still need information
            - Once you have ALL required information, mark as complete and only confirm, never ask questions
            - A follow-up question about earlier results is NOT complete
            - Only mark as complete when starting a NEW property search

            Response formats (JSON only):
            1. General question (neighborhoods, schools, crime, amenities):
            {"agent_message": "I'll look that up for you.", "is_complete": false, \
            "is_general_question": true, "general_question": "<the user's question>"}
            2. All requirements gathered:
            {"agent_message": "<confirmation>", "is_complete": true, "is_general_question": false, \
            "community_name": "<city or neighborhood to analyse, or null>", \
            "requirements": {"budget_min": <number or null>, "budget_max": <number>, "bedrooms": <number>, \
            "bathrooms": <number>, "location": "<city/area>", "additional_info": "<preferences or null>"}}
            3. More information needed:
            {"agent_message": "<your question or response>", "is_complete": false, "is_general_question": false}""";

    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;

    private final Map<String, Deque<HistoryEntry>> conversations = new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Deque<HistoryEntry>> eldest) {
            return size() > MAX_CONVERSATIONS;
        }
    };

    @Override
    public CompletableFuture<String> classify(String sessionKey, String userMessage) {
        if (!llmPort.isAvailable()) {
            return CompletableFuture.failedFuture(new IllegalStateException("LLM not configured"));
        }
        List<HistoryEntry> history = append(sessionKey, new HistoryEntry("User", userMessage));
        LlmPort.Prompt prompt = LlmPort.Prompt.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .userPrompt(buildPrompt(history))
                .temperature(TEMPERATURE)
                .build();
        return llmPort.complete(prompt)
                .thenApply(raw -> {
                    String agentMessage = agentMessageOf(raw);
                    if (agentMessage != null) {
                        append(sessionKey, new HistoryEntry("Agent", agentMessage));
                    }
                    return raw;
                });
    }

    List<HistoryEntry> history(String sessionKey) {
        synchronized (conversations) {
            Deque<HistoryEntry> entries = conversations.get(sessionKey);
            return entries != null ? new ArrayList<>(entries) : List.of();
        }
    }

    private List<HistoryEntry> append(String sessionKey, HistoryEntry entry) {
        synchronized (conversations) {
            Deque<HistoryEntry> entries = conversations.computeIfAbsent(sessionKey, key -> new ArrayDeque<>());
            entries.addLast(entry);
            while (entries.size() > MAX_HISTORY_ENTRIES) {
                entries.removeFirst();
            }
            return new ArrayList<>(entries);
        }
    }

    private String buildPrompt(List<HistoryEntry> history) {
        StringBuilder conversation = new StringBuilder();
        for (HistoryEntry entry : history) {
            conversation.append(entry.speaker()).append(": ").append(entry.text()).append('\n');
        }
        return "Based on the following conversation, determine the user's intent:\n\n"
                + "Conversation:\n" + conversation + "\n"
                + "Determine if this is:\n"
                + "1. A GENERAL QUESTION (neighborhoods, schools, crime, amenities, local info) "
                + "-> \"is_general_question\": true\n"
                + "2. A PROPERTY SEARCH REQUEST with budget, bedrooms, bathrooms and location "
                + "-> \"is_complete\": true\n"
                + "3. An INCOMPLETE property search or follow-up -> both false\n\n"
                + "Respond with a JSON object as specified in your instructions.";
    }

    private String agentMessageOf(String raw) {
        String json = ClassificationParser.extractJsonObject(raw);
        if (json == null) {
            return null;
        }
        try {
            JsonNode message = objectMapper.readTree(json).path("agent_message");
            return message.isTextual() ? message.asText() : null;
        } catch (JsonProcessingException e) {
            log.debug("[Scoping] classification is not valid JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    record HistoryEntry(String speaker, String text) {
    }
}
