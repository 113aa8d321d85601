package me.golemcore.estate.adapter.outbound.scoping;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.estate.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmScopingAdapterTest {

    private LlmPort llmPort;
    private LlmScopingAdapter adapter;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        adapter = new LlmScopingAdapter(llmPort, new ObjectMapper());
    }

    @Test
    void shouldReturnRawClassificationAndRememberAgentMessage() {
        String raw = "{\"agent_message\": \"What is your budget?\", \"is_complete\": false}";
        when(llmPort.complete(any())).thenReturn(CompletableFuture.completedFuture(raw));

        String result = adapter.classify("web:1", "I want a house in Oakland").join();

        assertEquals(raw, result);
        List<LlmScopingAdapter.HistoryEntry> history = adapter.history("web:1");
        assertEquals(2, history.size());
        assertEquals(new LlmScopingAdapter.HistoryEntry("User", "I want a house in Oakland"), history.get(0));
        assertEquals(new LlmScopingAdapter.HistoryEntry("Agent", "What is your budget?"), history.get(1));
    }

    @Test
    void shouldSendConversationHistoryInPrompt() {
        when(llmPort.complete(any()))
                .thenReturn(CompletableFuture.completedFuture("{\"agent_message\": \"How many bedrooms?\"}"))
                .thenReturn(CompletableFuture.completedFuture("{\"agent_message\": \"Great!\"}"));

        adapter.classify("web:1", "Oakland please").join();
        adapter.classify("web:1", "Under 1.2M").join();

        ArgumentCaptor<LlmPort.Prompt> prompts = ArgumentCaptor.forClass(LlmPort.Prompt.class);
        verify(llmPort, times(2)).complete(prompts.capture());
        LlmPort.Prompt second = prompts.getAllValues().get(1);
        assertTrue(second.userPrompt().contains("User: Oakland please\nAgent: How many bedrooms?\nUser: Under 1.2M"));
        assertEquals(0.3, second.temperature());
    }

    @Test
    void shouldKeepHistoriesPerSession() {
        when(llmPort.complete(any())).thenReturn(CompletableFuture.completedFuture("not json"));

        adapter.classify("web:a", "hello").join();
        adapter.classify("web:b", "hi there").join();

        assertEquals(1, adapter.history("web:a").size());
        assertEquals("hi there", adapter.history("web:b").get(0).text());
    }

    @Test
    void shouldBoundHistoryLength() {
        when(llmPort.complete(any())).thenReturn(CompletableFuture.completedFuture("{\"agent_message\": \"ok\"}"));

        for (int i = 0; i < 15; i++) {
            adapter.classify("web:1", "message " + i).join();
        }

        List<LlmScopingAdapter.HistoryEntry> history = adapter.history("web:1");
        assertEquals(LlmScopingAdapter.MAX_HISTORY_ENTRIES, history.size());
        assertEquals("Agent", history.get(history.size() - 1).speaker());
        assertEquals("message 14", history.get(history.size() - 2).text());
    }

    @Test
    void shouldFailWhenLlmUnavailable() {
        when(llmPort.isAvailable()).thenReturn(false);

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.classify("web:1", "hi").join());
        assertEquals("LLM not configured", ex.getCause().getMessage());
        assertTrue(adapter.history("web:1").isEmpty());
    }
}
