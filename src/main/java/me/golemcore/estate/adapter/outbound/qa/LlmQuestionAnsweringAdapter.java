package me.golemcore.estate.adapter.outbound.qa;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.port.outbound.LlmPort;
import me.golemcore.estate.port.outbound.QuestionAnsweringPort;
import me.golemcore.estate.port.outbound.WebSearchPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Answers general questions about areas, schools and amenities: the question
 * is researched on the web and the top results are given to the LLM as
 * context.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmQuestionAnsweringAdapter implements QuestionAnsweringPort {

    private static final String REGION_SUFFIX = " Bay Area";
    private static final int SEARCH_RESULTS = 10;
    private static final int CONTEXT_RESULTS = 5;
    private static final int CONTENT_LENGTH = 800;

    private static final String SYSTEM_PROMPT = """
            You are a knowledgeable Bay Area real estate assistant who answers general questions about \
            neighborhoods, areas, schools, amenities, and local information.
            Your job is to provide helpful, accurate information based on search results.
            Rules:
            - Answer questions conversationally and naturally
            - Use the search results to provide accurate information
            - If search results don't contain the answer, say so honestly
            - Focus on information relevant to someone looking for a home
            - Be concise but informative""";

    private final WebSearchPort webSearchPort;
    private final LlmPort llmPort;

    @Override
    public CompletableFuture<String> answer(String question) {
        if (!webSearchPort.isAvailable() || !llmPort.isAvailable()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Question answering not configured"));
        }
        log.info("[QA] researching: {}", question);
        return webSearchPort.search(question + REGION_SUFFIX, SEARCH_RESULTS)
                .thenCompose(hits -> llmPort.complete(LlmPort.Prompt.builder()
                        .systemPrompt(SYSTEM_PROMPT)
                        .userPrompt(buildContext(question, hits)
                                + "\nBased on the search results above, answer the user's question: \""
                                + question + "\"\n\nProvide a clear, helpful answer. If the search results "
                                + "don't contain enough information to answer the question, say so honestly.")
                        .build()));
    }

    private String buildContext(String question, List<WebSearchPort.Hit> hits) {
        StringBuilder sb = new StringBuilder("User Question: ").append(question).append("\n\nSearch Results:\n\n");
        int number = 1;
        for (WebSearchPort.Hit hit : hits.subList(0, Math.min(CONTEXT_RESULTS, hits.size()))) {
            String content = hit.content() != null ? hit.content() : "N/A";
            if (content.length() > CONTENT_LENGTH) {
                content = content.substring(0, CONTENT_LENGTH) + "...";
            }
            sb.append("Result ").append(number++).append(":\n")
                    .append("Title: ").append(hit.title()).append('\n')
                    .append("URL: ").append(hit.url()).append('\n')
                    .append("Content: ").append(content).append("\n\n");
        }
        return sb.toString();
    }
}
