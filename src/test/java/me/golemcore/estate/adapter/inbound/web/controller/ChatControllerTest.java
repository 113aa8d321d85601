package me.golemcore.estate.adapter.inbound.web.controller;

import me.golemcore.estate.adapter.inbound.web.WebChannelAdapter;
import me.golemcore.estate.adapter.inbound.web.dto.ChatMessageRequest;
import me.golemcore.estate.adapter.inbound.web.dto.ChatReplyDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatControllerTest {

    private WebChannelAdapter webChannel;
    private ChatController controller;

    @BeforeEach
    void setUp() {
        webChannel = mock(WebChannelAdapter.class);
        controller = new ChatController(webChannel);
    }

    @Test
    void shouldAcceptMessage() {
        when(webChannel.handleIncomingMessage("chat-1", "3 bed in Oakland")).thenReturn("web:chat-1");

        StepVerifier.create(controller.postMessage(new ChatMessageRequest(" chat-1 ", " 3 bed in Oakland ")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
                    assertNotNull(response.getBody());
                    assertEquals("chat-1", response.getBody().getChatId());
                    assertEquals("web:chat-1", response.getBody().getSessionKey());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectInvalidMessages() {
        assertThrows(IllegalArgumentException.class,
                () -> controller.postMessage(new ChatMessageRequest(null, "hello")));
        assertThrows(IllegalArgumentException.class,
                () -> controller.postMessage(new ChatMessageRequest("chat-1", " ")));
        assertThrows(IllegalArgumentException.class,
                () -> controller.postMessage(new ChatMessageRequest("chat-1", "x".repeat(4001))));

        verify(webChannel, never()).handleIncomingMessage(anyString(), anyString());
    }

    @Test
    void shouldReturnDrainedReplies() {
        Instant timestamp = Instant.parse("2026-03-01T10:00:00Z");
        when(webChannel.drainReplies("chat-1")).thenReturn(List.of(
                new WebChannelAdapter.ChatReply("Processing...", false, timestamp),
                new WebChannelAdapter.ChatReply("# Results", true, timestamp)));

        StepVerifier.create(controller.getReplies("chat-1"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    List<ChatReplyDto> body = response.getBody();
                    assertNotNull(body);
                    assertEquals(2, body.size());
                    assertEquals("2026-03-01T10:00:00Z", body.get(0).getTimestamp());
                    assertTrue(body.get(1).isEndOfTurn());
                })
                .verifyComplete();
    }
}
