package me.golemcore.estate.adapter.inbound.web.controller;

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
import me.golemcore.estate.adapter.inbound.web.WebChannelAdapter;
import me.golemcore.estate.adapter.inbound.web.dto.ChatAcceptedResponse;
import me.golemcore.estate.adapter.inbound.web.dto.ChatMessageRequest;
import me.golemcore.estate.adapter.inbound.web.dto.ChatReplyDto;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Chat endpoints of the web channel: submit a user message, poll for replies.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private static final int MAX_TEXT_LENGTH = 4000;

    private final WebChannelAdapter webChannel;

    @PostMapping("/messages")
    public Mono<ResponseEntity<ChatAcceptedResponse>> postMessage(@RequestBody ChatMessageRequest request) {
        if (request == null || request.getChatId() == null || request.getChatId().isBlank()) {
            throw new IllegalArgumentException("chatId is required");
        }
        if (request.getText() == null || request.getText().isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        if (request.getText().length() > MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException("text exceeds " + MAX_TEXT_LENGTH + " characters");
        }
        String chatId = request.getChatId().trim();
        String sessionKey = webChannel.handleIncomingMessage(chatId, request.getText().trim());
        log.debug("[API] accepted message for {}", sessionKey);
        ChatAcceptedResponse body = ChatAcceptedResponse.builder()
                .chatId(chatId)
                .sessionKey(sessionKey)
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(body));
    }

    @GetMapping("/{chatId}/replies")
    public Mono<ResponseEntity<List<ChatReplyDto>>> getReplies(@PathVariable String chatId) {
        List<ChatReplyDto> replies = webChannel.drainReplies(chatId).stream()
                .map(reply -> ChatReplyDto.builder()
                        .text(reply.text())
                        .endOfTurn(reply.endOfTurn())
                        .timestamp(reply.timestamp() != null ? reply.timestamp().toString() : null)
                        .build())
                .toList();
        return Mono.just(ResponseEntity.ok(replies));
    }
}
