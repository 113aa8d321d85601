package me.golemcore.estate.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.estate.domain.model.FanOutTag;
import me.golemcore.estate.domain.model.ReplyChannel;
import me.golemcore.estate.domain.model.SearchSession;
import me.golemcore.estate.domain.model.Stage;
import me.golemcore.estate.domain.model.TurnOutcome;
import me.golemcore.estate.domain.model.TurnPhase;
import me.golemcore.estate.domain.model.message.CommunityRequest;
import me.golemcore.estate.domain.model.message.QuestionRequest;
import me.golemcore.estate.domain.model.message.ScopingResponse;
import me.golemcore.estate.domain.model.message.SearchRequest;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.infrastructure.i18n.MessageService;
import me.golemcore.estate.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class IntentRouterTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");
    private static final String KEY = "web:chat-1";

    private MutableClock clock;
    private SearchSessionService sessionService;
    private TurnOutcomeExecutor outcomeExecutor;
    private IntentRouter router;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        sessionService = new SearchSessionService(clock);
        outcomeExecutor = mock(TurnOutcomeExecutor.class);
        router = new IntentRouter(sessionService, new ClassificationParser(new ObjectMapper()), outcomeExecutor,
                new MessageService(), new EstateProperties(), clock);
        sessionService.update(KEY, session -> {
            session.startTurn(new ReplyChannel("web", "chat-1"), START);
            return null;
        });
    }

    @Test
    void shouldStartSearchAndCommunityAnalysis() {
        clock.advance(Duration.ofSeconds(4));

        router.onScopingResponse(response("""
                {"agent_message": "Great, searching!", "is_complete": true, "is_general_question": false,
                 "community_name": "Oakland",
                 "requirements": {"budget_max": 1200000, "bedrooms": 3, "bathrooms": 2, "location": "Oakland"}}
                """));

        SearchSession session = sessionService.getOrCreate(KEY);
        assertEquals(TurnPhase.AWAITING_SEARCH, session.getPhase());
        assertEquals("Oakland", session.getRequirements().getLocation());
        assertTrue(session.isCommunityRequested());
        assertEquals(START.plusSeconds(124), session.getStageDeadline());

        TurnOutcome outcome = lastOutcome();
        assertEquals("🏠 Searching for properties...", outcome.statusMessage());
        assertNull(outcome.finalReply());
        assertEquals(2, outcome.dispatches().size());
        SearchRequest search = (SearchRequest) outcome.dispatches().get(0);
        assertEquals(FanOutTag.single(KEY, 1, Stage.SEARCH), search.tag());
        assertEquals(3, search.requirements().getBedrooms());
        CommunityRequest community = (CommunityRequest) outcome.dispatches().get(1);
        assertEquals(Stage.COMMUNITY, community.tag().stage());
        assertEquals("Oakland", community.locationName());
    }

    @Test
    void shouldSearchWithoutCommunityWhenNoNameGiven() {
        router.onScopingResponse(response(
                "{\"is_complete\": true, \"requirements\": {\"bedrooms\": 2, \"location\": \"San Jose\"}}"));

        TurnOutcome outcome = lastOutcome();
        assertEquals(1, outcome.dispatches().size());
        assertInstanceOf(SearchRequest.class, outcome.dispatches().get(0));
        assertFalse(sessionService.getOrCreate(KEY).isCommunityRequested());
    }

    @Test
    void shouldRouteGeneralQuestion() {
        router.onScopingResponse(response("""
                {"agent_message": "I'll look that up for you.", "is_general_question": true,
                 "general_question": "Tell me about schools in San Francisco"}
                """));

        assertEquals(TurnPhase.ANSWERING_GENERAL, sessionService.getOrCreate(KEY).getPhase());
        TurnOutcome outcome = lastOutcome();
        assertEquals("💬 Answering your question...", outcome.statusMessage());
        QuestionRequest question = (QuestionRequest) outcome.dispatches().get(0);
        assertEquals(Stage.QUESTION, question.tag().stage());
        assertEquals("Tell me about schools in San Francisco", question.question());
    }

    @Test
    void shouldRelayFollowUpQuestionWhenRequirementsIncomplete() {
        router.onScopingResponse(response(
                "{\"agent_message\": \"What's your budget?\", \"is_complete\": false, \"is_general_question\": false}"));

        assertEquals(TurnPhase.AWAITING_USER, sessionService.getOrCreate(KEY).getPhase());
        TurnOutcome outcome = lastOutcome();
        assertEquals("What's your budget?", outcome.finalReply());
        assertTrue(outcome.dispatches().isEmpty());
    }

    @Test
    void shouldReplyWithFallbackForUnparseableClassification() {
        router.onScopingResponse(response("Sorry, I can't help with that."));

        assertEquals(TurnPhase.AWAITING_USER, sessionService.getOrCreate(KEY).getPhase());
        assertTrue(lastOutcome().finalReply().startsWith("Sorry, I didn't quite get that."));
    }

    @Test
    void shouldAbortWhenScopingWorkerFails() {
        router.onScopingResponse(new ScopingResponse(FanOutTag.single(KEY, 1, Stage.SCOPING), null, "LLM down"));

        SearchSession session = sessionService.getOrCreate(KEY);
        assertEquals(TurnPhase.ABORTED, session.getPhase());
        assertTrue(session.isFinalized());
        assertEquals("I'm having trouble reaching the conversation service right now. Please try again in a moment.",
                lastOutcome().finalReply());
    }

    @Test
    void shouldIgnoreStaleAndDuplicateClassifications() {
        String payload = "{\"agent_message\": \"Which city?\"}";
        router.onScopingResponse(new ScopingResponse(FanOutTag.single(KEY, 0, Stage.SCOPING), payload, null));
        router.onScopingResponse(response(payload));
        router.onScopingResponse(response(payload));

        List<TurnOutcome> outcomes = outcomes(3);
        assertTrue(outcomes.get(0).isEmpty());
        assertEquals("Which city?", outcomes.get(1).finalReply());
        assertTrue(outcomes.get(2).isEmpty());
    }

    @Test
    void shouldIgnoreResponseForUnknownSession() {
        router.onScopingResponse(new ScopingResponse(FanOutTag.single("web:ghost", 3, Stage.SCOPING),
                "{\"agent_message\": \"hi\"}", null));

        assertTrue(lastOutcome().isEmpty());
        assertEquals(TurnPhase.IDLE, sessionService.getOrCreate("web:ghost").getPhase());
    }

    private ScopingResponse response(String payload) {
        return new ScopingResponse(FanOutTag.single(KEY, 1, Stage.SCOPING), payload, null);
    }

    private TurnOutcome lastOutcome() {
        ArgumentCaptor<TurnOutcome> captor = ArgumentCaptor.forClass(TurnOutcome.class);
        verify(outcomeExecutor, atLeastOnce()).execute(captor.capture());
        return captor.getValue();
    }

    private List<TurnOutcome> outcomes(int count) {
        ArgumentCaptor<TurnOutcome> captor = ArgumentCaptor.forClass(TurnOutcome.class);
        verify(outcomeExecutor, times(count)).execute(captor.capture());
        return captor.getAllValues();
    }
}
