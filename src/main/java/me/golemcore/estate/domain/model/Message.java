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
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * A chat message received from, or sent to, a user channel.
 */
@Data
@Builder
public class Message {

    private String id;
    private String role; // user, assistant
    private String content;
    private String channelType;
    private String chatId;
    private String senderId;

    private Map<String, Object> metadata;
    private Instant timestamp;

    public boolean isUserMessage() {
        return "user".equals(role);
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }

    public ReplyChannel replyChannel() {
        return new ReplyChannel(channelType, chatId);
    }
}
