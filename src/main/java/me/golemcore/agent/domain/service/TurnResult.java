package me.golemcore.agent.domain.service;

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

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.TurnStatus;

import java.util.List;

/**
 * Outcome of a finished turn. {@code errorType} is the classified failure
 * kind and is null for successful turns.
 */
public record TurnResult(String conversationId, String requestId, String turnId, TurnStatus status,
        List<Message> assistantMessages, String errorType, long latencyMs) {

    public boolean isOk() {
        return status == TurnStatus.OK;
    }
}
