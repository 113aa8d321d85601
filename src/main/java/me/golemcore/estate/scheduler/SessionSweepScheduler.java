package me.golemcore.estate.scheduler;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.domain.service.StageDeadlineService;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.port.inbound.ChannelPort;
import me.golemcore.estate.port.outbound.SearchSessionPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic session maintenance: finalizes turns past their stage deadline,
 * then evicts sessions idle for longer than the configured TTL together with
 * the channel state of their chats.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionSweepScheduler {

    private final StageDeadlineService stageDeadlineService;
    private final SearchSessionPort sessionPort;
    private final List<ChannelPort> channelPorts;
    private final EstateProperties properties;
    private final Clock clock;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "session-sweep");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    public void init() {
        long interval = Math.max(1, properties.getSession().getSweepIntervalSeconds());
        scheduler.scheduleWithFixedDelay(this::sweep, interval, interval, TimeUnit.SECONDS);
        log.info("[Sweep] started (interval: {}s, stage timeout: {}s, session ttl: {}min)", interval,
                properties.getTurn().getStageTimeoutSeconds(), properties.getSession().getTtlMinutes());
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One maintenance pass. Failures are logged so the next pass still runs.
     */
    public void sweep() {
        try {
            int expired = stageDeadlineService.expireOverdue();
            if (expired > 0) {
                log.info("[Sweep] finalized {} overdue turns", expired);
            }
            Instant cutoff = clock.instant().minus(Duration.ofMinutes(properties.getSession().getTtlMinutes()));
            sessionPort.evictIdleSince(cutoff);
            for (ChannelPort channel : channelPorts) {
                channel.evictIdleSince(cutoff);
            }
        } catch (RuntimeException e) {
            log.error("[Sweep] session sweep failed: {}", e.getMessage(), e);
        }
    }
}
