package me.golemcore.estate.scheduler;

import me.golemcore.estate.domain.service.StageDeadlineService;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.port.inbound.ChannelPort;
import me.golemcore.estate.port.outbound.SearchSessionPort;
import me.golemcore.estate.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionSweepSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private StageDeadlineService deadlineService;
    private SearchSessionPort sessionPort;
    private ChannelPort channel;
    private EstateProperties properties;
    private SessionSweepScheduler scheduler;

    @BeforeEach
    void setUp() {
        deadlineService = mock(StageDeadlineService.class);
        sessionPort = mock(SearchSessionPort.class);
        channel = mock(ChannelPort.class);
        properties = new EstateProperties();
        properties.getSession().setTtlMinutes(30);
        properties.getSession().setSweepIntervalSeconds(1);
        scheduler = new SessionSweepScheduler(deadlineService, sessionPort, List.of(channel), properties,
                new MutableClock(NOW));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void shouldExpireDeadlinesThenEvictIdleSessionsAndChatState() {
        when(deadlineService.expireOverdue()).thenReturn(2);

        scheduler.sweep();

        Instant cutoff = NOW.minus(Duration.ofMinutes(30));
        verify(deadlineService).expireOverdue();
        verify(sessionPort).evictIdleSince(cutoff);
        verify(channel).evictIdleSince(cutoff);
    }

    @Test
    void shouldContainSweepFailures() {
        when(deadlineService.expireOverdue()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> scheduler.sweep());
        verify(sessionPort, never()).evictIdleSince(any());
        verify(channel, never()).evictIdleSince(any());
    }

    @Test
    void shouldRunSweepPeriodicallyOnceStarted() {
        scheduler.init();

        verify(deadlineService, timeout(3000).atLeastOnce()).expireOverdue();
    }
}
