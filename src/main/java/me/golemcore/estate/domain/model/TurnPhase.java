package me.golemcore.estate.domain.model;

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

/**
 * Progress of the current turn of a {@link SearchSession}.
 *
 * <pre>
 * AWAITING_SCOPE -> ANSWERING_GENERAL | AWAITING_SEARCH | AWAITING_USER
 * AWAITING_SEARCH -> AWAITING_GEOCODE -> AWAITING_POI -> ASSEMBLED
 * </pre>
 *
 * {@code AWAITING_GEOCODE} and {@code AWAITING_POI} may have zero width and be
 * skipped. {@code ABORTED} ends a turn with an explanatory reply instead of an
 * assembled answer.
 */
public enum TurnPhase {
    IDLE,
    AWAITING_SCOPE,
    ANSWERING_GENERAL,
    AWAITING_USER,
    AWAITING_SEARCH,
    AWAITING_GEOCODE,
    AWAITING_POI,
    ASSEMBLED,
    ABORTED;

    /**
     * Whether the turn still waits for at least one worker response.
     */
    public boolean isInFlight() {
        return this == AWAITING_SCOPE || this == ANSWERING_GENERAL || this == AWAITING_SEARCH
                || this == AWAITING_GEOCODE || this == AWAITING_POI;
    }
}
