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

/**
 * Classification of a user message produced by the scoping worker.
 *
 * @param complete
 *            all search requirements are known and a search can start
 * @param generalQuestion
 *            the user asked a general question rather than for a search
 * @param questionText
 *            the question to forward to the Q&A worker
 * @param requirements
 *            completed search criteria, present when {@code complete}
 * @param communityName
 *            location inferred for community analysis, may be {@code null}
 * @param agentMessage
 *            text to relay while requirements are still being gathered
 */
@Builder
public record ScopingResult(boolean complete, boolean generalQuestion, String questionText,
        SearchRequirements requirements, String communityName, String agentMessage) {

    public boolean hasQuestion() {
        return generalQuestion && questionText != null && !questionText.isBlank();
    }

    public boolean isSearchReady() {
        return complete && requirements != null;
    }

    public boolean hasCommunityName() {
        return communityName != null && !communityName.isBlank();
    }
}
