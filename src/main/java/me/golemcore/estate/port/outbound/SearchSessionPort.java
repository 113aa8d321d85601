package me.golemcore.estate.port.outbound;

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

import me.golemcore.estate.domain.model.SearchSession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Port for the session store, the only shared mutable state of the
 * coordinator. Sessions are created lazily on first reference.
 */
public interface SearchSessionPort {

    SearchSession getOrCreate(String key);

    /**
     * Applies {@code mutation} to the session for {@code key} atomically with
     * respect to every other update of the same key. The session is created if
     * absent. The mutation must not publish events or call back into the store.
     */
    <T> T update(String key, Function<SearchSession, T> mutation);

    /**
     * Like {@link #update} but only for a session that already exists. Used by
     * sweeps and read-only views that must not resurrect evicted sessions.
     */
    <T> Optional<T> updateExisting(String key, Function<SearchSession, T> mutation);

    List<String> listKeys();

    /**
     * Removes sessions idle since before {@code cutoff} that have no turn in
     * flight.
     *
     * @return number of evicted sessions
     */
    int evictIdleSince(Instant cutoff);
}
