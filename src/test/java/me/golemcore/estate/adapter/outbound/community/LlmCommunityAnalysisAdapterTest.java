package me.golemcore.estate.adapter.outbound.community;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.estate.domain.model.CommunityAnalysis;
import me.golemcore.estate.port.outbound.LlmPort;
import me.golemcore.estate.port.outbound.WebSearchPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmCommunityAnalysisAdapterTest {

    private static final String ANALYSIS_JSON = """
            {
              "location": "Rockridge, Oakland",
              "overall": {"score": 9.9, "explanation": "Walkable and family friendly"},
              "safety": {
                "score": 7.6,
                "positive_stories": [{"title": "Crime down", "summary": "Burglaries fell", "url": "https://n.test/1"}],
                "negative_stories": ["Car break-ins on College Ave"]
              },
              "schools": {"score": 8.2, "explanation": "Strong elementary schools"},
              "housing_avg": {"housing_price_per_square_foot": "$739", "average_house_size_square_foot": 1921}
            }
            """;

    private WebSearchPort webSearchPort;
    private LlmPort llmPort;
    private LlmCommunityAnalysisAdapter adapter;

    @BeforeEach
    void setUp() {
        webSearchPort = mock(WebSearchPort.class);
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        when(webSearchPort.isAvailable()).thenReturn(true);
        adapter = new LlmCommunityAnalysisAdapter(webSearchPort, llmPort, new ObjectMapper());
    }

    @Test
    void shouldResearchThreeTopicsAndScore() {
        when(webSearchPort.search(anyString(), anyInt())).thenReturn(CompletableFuture.completedFuture(List.of(
                new WebSearchPort.Hit("Rockridge news", "https://n.test/1", "Crime fell 10%", 0.8))));
        when(llmPort.complete(any())).thenReturn(CompletableFuture.completedFuture(ANALYSIS_JSON));

        CommunityAnalysis analysis = adapter.analyze("Rockridge").join();

        verify(webSearchPort).search(contains("local news"), eq(20));
        verify(webSearchPort).search(contains("schools"), eq(15));
        verify(webSearchPort).search(contains("housing prices"), eq(15));
        assertEquals("Rockridge, Oakland", analysis.getLocation());
        assertEquals(7.9, analysis.getOverallScore());
        assertEquals(7.6, analysis.getSafetyScore());
        assertEquals(8.2, analysis.getSchoolScore());
        assertEquals(739.0, analysis.getHousingPricePerSqft());
        assertEquals(1921.0, analysis.getAvgHouseSizeSqft());
        assertEquals("Crime down", analysis.getPositiveStories().get(0).title());
        assertEquals("Car break-ins on College Ave", analysis.getNegativeStories().get(0).title());
        assertNull(analysis.getNegativeStories().get(0).url());

        ArgumentCaptor<LlmPort.Prompt> prompt = ArgumentCaptor.forClass(LlmPort.Prompt.class);
        verify(llmPort).complete(prompt.capture());
        assertEquals(2048, prompt.getValue().maxTokens());
        assertTrue(prompt.getValue().userPrompt().contains("Analyze community news and safety for: Rockridge"));
        assertTrue(prompt.getValue().userPrompt().contains("Crime fell 10%"));
    }

    @Test
    void shouldContinueWhenWebSearchFails() {
        when(webSearchPort.search(anyString(), anyInt()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("quota")));
        when(llmPort.complete(any())).thenReturn(CompletableFuture.completedFuture(ANALYSIS_JSON));

        CommunityAnalysis analysis = adapter.analyze("Rockridge").join();

        assertEquals(7.9, analysis.getOverallScore());
        ArgumentCaptor<LlmPort.Prompt> prompt = ArgumentCaptor.forClass(LlmPort.Prompt.class);
        verify(llmPort).complete(prompt.capture());
        assertTrue(prompt.getValue().userPrompt().contains("No recent news articles found"));
    }

    @Test
    void shouldUseLlmOverallWhenSubScoreMissing() {
        CommunityAnalysis analysis = adapter.parse("""
                ```json
                {"overall": {"score": 6.4}, "safety": {"score": 6.0}}
                ```
                """, "Fremont");

        assertEquals("Fremont", analysis.getLocation());
        assertEquals(6.4, analysis.getOverallScore());
        assertNull(analysis.getSchoolScore());
        assertTrue(analysis.getPositiveStories().isEmpty());
    }

    @Test
    void shouldRejectNonJsonAnswer() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> adapter.parse("I could not find anything.", "Fremont"));
        assertTrue(ex.getMessage().contains("no JSON"));
    }

    @Test
    void shouldFailWhenLlmUnavailable() {
        when(llmPort.isAvailable()).thenReturn(false);

        CompletionException ex = assertThrows(CompletionException.class, () -> adapter.analyze("Oakland").join());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        verify(webSearchPort, never()).search(anyString(), anyInt());
    }
}
