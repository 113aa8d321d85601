package me.golemcore.estate.adapter.outbound.qa;

import me.golemcore.estate.port.outbound.LlmPort;
import me.golemcore.estate.port.outbound.WebSearchPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmQuestionAnsweringAdapterTest {

    private WebSearchPort webSearchPort;
    private LlmPort llmPort;
    private LlmQuestionAnsweringAdapter adapter;

    @BeforeEach
    void setUp() {
        webSearchPort = mock(WebSearchPort.class);
        llmPort = mock(LlmPort.class);
        when(webSearchPort.isAvailable()).thenReturn(true);
        when(llmPort.isAvailable()).thenReturn(true);
        adapter = new LlmQuestionAnsweringAdapter(webSearchPort, llmPort);
    }

    @Test
    void shouldAnswerFromTopSearchResults() {
        List<WebSearchPort.Hit> hits = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            hits.add(new WebSearchPort.Hit("Result " + i, "https://r.test/" + i, "x".repeat(900), 1.0 / i));
        }
        when(webSearchPort.search("What is the crime rate in the Castro? Bay Area", 10))
                .thenReturn(CompletableFuture.completedFuture(hits));
        when(llmPort.complete(any())).thenReturn(CompletableFuture.completedFuture("The Castro is fairly safe."));

        String answer = adapter.answer("What is the crime rate in the Castro?").join();

        assertEquals("The Castro is fairly safe.", answer);
        ArgumentCaptor<LlmPort.Prompt> prompt = ArgumentCaptor.forClass(LlmPort.Prompt.class);
        verify(llmPort).complete(prompt.capture());
        String userPrompt = prompt.getValue().userPrompt();
        assertTrue(userPrompt.contains("Result 5"));
        assertFalse(userPrompt.contains("Result 6"));
        assertTrue(userPrompt.contains("x".repeat(800) + "..."));
        assertFalse(userPrompt.contains("x".repeat(801)));
    }

    @Test
    void shouldPropagateSearchFailure() {
        when(webSearchPort.search(any(), anyInt()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("Tavily down")));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.answer("Schools in Palo Alto?").join());
        assertEquals("Tavily down", ex.getCause().getMessage());
    }

    @Test
    void shouldFailWhenNotConfigured() {
        when(webSearchPort.isAvailable()).thenReturn(false);

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.answer("Parks near Berkeley?").join());
        assertEquals("Question answering not configured", ex.getCause().getMessage());
    }
}
