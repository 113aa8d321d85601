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

import lombok.Builder;
import me.golemcore.estate.domain.model.message.WorkerMessage;

import java.util.List;

/**
 * Side effects decided while a session was locked, executed after the lock is
 * released. Keeps bus publishing and channel I/O out of the atomic update.
 *
 * @param replyChannel
 *            where {@code statusMessage} and {@code finalReply} go
 * @param statusMessage
 *            intermediate progress line, not final for the turn
 * @param dispatches
 *            worker requests to publish
 * @param finalReply
 *            direct final reply (answer, relay, explanation)
 * @param assembly
 *            snapshot to assemble into the final reply
 */
@Builder
public record TurnOutcome(ReplyChannel replyChannel, String statusMessage, List<WorkerMessage> dispatches,
        String finalReply, TurnSnapshot assembly) {

    private static final TurnOutcome NONE = new TurnOutcome(null, null, List.of(), null, null);

    public static TurnOutcome none() {
        return NONE;
    }

    public List<WorkerMessage> dispatches() {
        return dispatches != null ? dispatches : List.of();
    }

    public boolean isEmpty() {
        return statusMessage == null && dispatches().isEmpty() && finalReply == null && assembly == null;
    }
}
