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

import java.util.Objects;

/**
 * Correlates a worker response with the session, turn, stage and batch index
 * of the request that produced it. Carried through every bus message instead
 * of being encoded into the session id.
 *
 * @param sessionKey
 *            key of the owning {@link SearchSession}
 * @param turn
 *            turn number the request was dispatched for
 * @param stage
 *            stage that dispatched the request
 * @param index
 *            listing index for fan-out stages, {@code 0} for single-shot stages
 */
public record FanOutTag(String sessionKey, long turn, Stage stage, int index) {

    public FanOutTag {
        Objects.requireNonNull(sessionKey, "sessionKey");
        Objects.requireNonNull(stage, "stage");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0: " + index);
        }
    }

    public static FanOutTag single(String sessionKey, long turn, Stage stage) {
        return new FanOutTag(sessionKey, turn, stage, 0);
    }

    public static FanOutTag indexed(String sessionKey, long turn, Stage stage, int index) {
        return new FanOutTag(sessionKey, turn, stage, index);
    }

    /**
     * Same session, turn and index under another stage. Used when a geocode
     * success cascades into a POI request for the same listing.
     */
    public FanOutTag withStage(Stage nextStage) {
        return new FanOutTag(sessionKey, turn, nextStage, index);
    }

    @Override
    public String toString() {
        return sessionKey + "#" + turn + "/" + stage + "[" + index + "]";
    }
}
