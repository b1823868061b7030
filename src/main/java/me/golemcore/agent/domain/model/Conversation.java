package me.golemcore.agent.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger view of a conversation, decoded from its {@code conv:{id}} hash.
 *
 * <p>
 * At most one conversation per caller token is open inside the idle window.
 * Closing is terminal except for an explicit reopen. A ghost conversation is
 * never summarized or indexed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Conversation {

    private String id;
    private ConversationStatus status;
    private Instant startedAt;
    private Instant lastTouchedAt;
    private Instant closedAt;
    private String closeReason;
    private Instant lastRequestAt;

    @Builder.Default
    private List<String> modelSet = new ArrayList<>();
    @Builder.Default
    private List<String> tokenSet = new ArrayList<>();
    @Builder.Default
    private List<String> placeTags = new ArrayList<>();

    private String summary;
    private List<String> tags;
    private List<String> keywords;
    private SummaryResult.Flags flags;

    private String userId;
    private boolean ghost;

    private long messageCount;
    private long userAssistantCount;
    private long toolCallCount;
    private long errorCount;
    private long requestCount;
    private Long maxTurnLatencyMs;

    private String indexingStatus;
    private String indexingError;

    public boolean isOpen() {
        return status == ConversationStatus.OPEN;
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }
}
