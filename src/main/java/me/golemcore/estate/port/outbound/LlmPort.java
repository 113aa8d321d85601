package me.golemcore.estate.port.outbound;

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

import lombok.Builder;

import java.util.concurrent.CompletableFuture;

/**
 * Port for chat-completion LLM providers. Used by the workers that need
 * language understanding (scoping, summaries, Q&A, community scoring).
 */
public interface LlmPort {

    /**
     * Executes a single-shot completion and returns the text of the answer.
     */
    CompletableFuture<String> complete(Prompt prompt);

    /**
     * Whether the provider is configured and can serve requests.
     */
    boolean isAvailable();

    @Builder
    record Prompt(String systemPrompt, String userPrompt, Double temperature, Integer maxTokens) {
    }
}
