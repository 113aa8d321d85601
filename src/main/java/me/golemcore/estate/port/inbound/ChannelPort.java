package me.golemcore.estate.port.inbound;

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

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Bidirectional port for user-facing channels. Incoming messages are published
 * as {@link me.golemcore.estate.domain.model.InboundMessageEvent}; replies go
 * out through {@link #sendMessage}.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "web").
     */
    String getChannelType();

    void start();

    void stop();

    boolean isRunning();

    /**
     * Sends a text message. {@code endOfTurn} marks the single final reply of a
     * turn.
     */
    CompletableFuture<Void> sendMessage(String chatId, String content, boolean endOfTurn);

    /**
     * Releases per-chat state of chats with no activity since {@code cutoff}.
     *
     * @return number of chats released
     */
    int evictIdleSince(Instant cutoff);
}
