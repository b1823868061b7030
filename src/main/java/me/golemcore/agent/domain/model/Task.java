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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A background job for one tool invocation, with counters and named content
 * sections populated as it runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    private String id;
    private String name;
    private TaskStatus status;
    private String toolName;
    private String userId;
    private String conversationId;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Long runtimeMs;
    private String errorMessage;
    private long messageCount;
    private long toolCallCount;
    private long tokensIn;
    private long tokensOut;
    private boolean archived;
    private Instant archivedAt;
    private Map<String, String> sections;
}
