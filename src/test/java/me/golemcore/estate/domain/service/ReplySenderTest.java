package me.golemcore.estate.domain.service;

import me.golemcore.estate.domain.model.ReplyChannel;
import me.golemcore.estate.port.inbound.ChannelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReplySenderTest {

    private ChannelPort webChannel;
    private ReplySender replySender;

    @BeforeEach
    void setUp() {
        webChannel = mock(ChannelPort.class);
        when(webChannel.getChannelType()).thenReturn("web");
        when(webChannel.sendMessage(anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        replySender = new ReplySender(List.of(webChannel));
    }

    @Test
    void shouldRouteByChannelType() {
        replySender.send(new ReplyChannel("web", "42"), "Hello", true).join();

        verify(webChannel).sendMessage("42", "Hello", true);
    }

    @Test
    void shouldSkipBlankTextAndUnknownChannels() {
        replySender.send(new ReplyChannel("web", "42"), " ", false).join();
        replySender.send(new ReplyChannel("telegram", "42"), "Hello", false).join();
        replySender.send(null, "Hello", false).join();

        verify(webChannel, never()).sendMessage(anyString(), anyString(), anyBoolean());
    }

    @Test
    void shouldExposeDeliveryFailure() {
        when(webChannel.sendMessage("42", "Hello", true))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("closed")));

        CompletableFuture<Void> result = assertDoesNotThrow(
                () -> replySender.send(new ReplyChannel("web", "42"), "Hello", true));
        assertTrue(result.isCompletedExceptionally());
    }
}
