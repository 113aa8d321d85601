package me.golemcore.estate.adapter.outbound.llm;

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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM adapter for any OpenAI-compatible chat completions endpoint, built on
 * langchain4j.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Single-shot completions with an optional system prompt
 * <li>Per-prompt temperature and max token overrides
 * <li>Automatic retry with exponential backoff for rate limits
 * </ul>
 *
 * <p>
 * Used by the scoping, community analysis and question answering adapters.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    /**
     * Max retry attempts for rate limit / transient errors (exponential backoff).
     */
    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");

    private final EstateProperties properties;

    private ChatModel defaultModel;

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<String> complete(Prompt prompt) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new IllegalStateException("LLM API key not configured");
            }
            ChatModel model = modelFor(prompt);
            List<ChatMessage> messages = toMessages(prompt);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    ChatResponse response = model.chat(messages);
                    String text = response.aiMessage() != null ? response.aiMessage().text() : null;
                    return text != null ? text : "";
                } catch (Exception e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long exponentialBackoffMs = (long) (INITIAL_BACKOFF_MS
                                * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        long resetSeconds = extractResetSeconds(e);
                        long backoffMs = resetSeconds > 0
                                ? Math.max(resetSeconds * 1000 + 1000, exponentialBackoffMs)
                                : exponentialBackoffMs;
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms", attempt + 1,
                                MAX_RETRIES, backoffMs);
                        sleepBeforeRetry(backoffMs);
                    } else {
                        log.error("[LLM] completion failed: {}", e.getMessage());
                        throw new IllegalStateException("LLM completion failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM completion failed: max retries exhausted");
        });
    }

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM completion interrupted during retry backoff", ie);
        }
    }

    private synchronized ChatModel modelFor(Prompt prompt) {
        boolean customized = prompt.temperature() != null || prompt.maxTokens() != null;
        if (customized) {
            return createModel(prompt.temperature(), prompt.maxTokens());
        }
        if (defaultModel == null) {
            defaultModel = createModel(null, null);
        }
        return defaultModel;
    }

    protected ChatModel createModel(Double temperature, Integer maxTokens) {
        EstateProperties.LlmProperties llm = properties.getLlm();
        return OpenAiChatModel.builder()
                .baseUrl(llm.getBaseUrl())
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .temperature(temperature != null ? temperature : llm.getTemperature())
                .maxTokens(maxTokens != null ? maxTokens : llm.getMaxTokens())
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(Duration.ofMillis(llm.getTimeoutMs()))
                .build();
    }

    private List<ChatMessage> toMessages(Prompt prompt) {
        List<ChatMessage> messages = new ArrayList<>();
        if (prompt.systemPrompt() != null && !prompt.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(prompt.systemPrompt()));
        }
        messages.add(UserMessage.from(prompt.userPrompt() != null ? prompt.userPrompt() : ""));
        return messages;
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && msg.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return Long.parseLong(matcher.group(1));
                }
            }
            current = current.getCause();
        }
        return -1;
    }
}
