package me.golemcore.estate.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.domain.model.SearchSession;
import me.golemcore.estate.port.outbound.SearchSessionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * In-memory session store. Sessions live in a {@link ConcurrentHashMap} and
 * every update runs inside {@code compute} for its key, so an
 * increment-and-compare on one session never races with another arrival for
 * the same session while different sessions never contend.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SearchSessionService implements SearchSessionPort {

    private final Clock clock;

    private final Map<String, SearchSession> sessions = new ConcurrentHashMap<>();

    @Override
    public SearchSession getOrCreate(String key) {
        return sessions.computeIfAbsent(key, this::newSession);
    }

    @Override
    public <T> T update(String key, Function<SearchSession, T> mutation) {
        AtomicReference<T> result = new AtomicReference<>();
        sessions.compute(key, (id, existing) -> {
            SearchSession session = existing != null ? existing : newSession(id);
            result.set(mutation.apply(session));
            session.setLastActivityAt(clock.instant());
            return session;
        });
        return result.get();
    }

    @Override
    public <T> Optional<T> updateExisting(String key, Function<SearchSession, T> mutation) {
        AtomicReference<T> result = new AtomicReference<>();
        sessions.computeIfPresent(key, (id, session) -> {
            result.set(mutation.apply(session));
            return session;
        });
        return Optional.ofNullable(result.get());
    }

    @Override
    public List<String> listKeys() {
        return List.copyOf(sessions.keySet());
    }

    @Override
    public int evictIdleSince(Instant cutoff) {
        AtomicInteger evicted = new AtomicInteger();
        for (String key : sessions.keySet()) {
            sessions.computeIfPresent(key, (id, session) -> {
                if (isEvictable(session, cutoff)) {
                    evicted.incrementAndGet();
                    log.debug("Evicted idle session: {}", id);
                    return null;
                }
                return session;
            });
        }
        if (evicted.get() > 0) {
            log.info("Evicted {} idle sessions (idle since before {})", evicted.get(), cutoff);
        }
        return evicted.get();
    }

    private boolean isEvictable(SearchSession session, Instant cutoff) {
        Instant lastActivity = session.getLastActivityAt() != null
                ? session.getLastActivityAt()
                : session.getCreatedAt();
        return !session.getPhase().isInFlight() && lastActivity != null && lastActivity.isBefore(cutoff);
    }

    private SearchSession newSession(String key) {
        Instant now = clock.instant();
        log.info("Created new session: {}", key);
        return SearchSession.builder()
                .key(key)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
    }
}
