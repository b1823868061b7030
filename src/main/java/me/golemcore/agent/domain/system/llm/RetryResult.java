package me.golemcore.agent.domain.system.llm;

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

import me.golemcore.agent.domain.model.AgentEvent;
import me.golemcore.agent.domain.model.Message;

import java.util.List;

/**
 * Outcome of {@link RetryingModelCaller#callWithRetry}: the accepted (or last,
 * still invalid) model result, the diagnostics recorded on the way and the
 * classified kind of every call that failed before it.
 */
public record RetryResult(ModelCallResult result, List<AgentEvent.ErrorEvent> errorEvents, int attempts,
        List<LlmCallException.Kind> failedAttempts) {

    public RetryResult {
        errorEvents = List.copyOf(errorEvents);
        failedAttempts = failedAttempts != null ? List.copyOf(failedAttempts) : List.of();
    }

    public RetryResult(ModelCallResult result, List<AgentEvent.ErrorEvent> errorEvents, int attempts) {
        this(result, errorEvents, attempts, List.of());
    }

    public Message message() {
        return result.getMessage();
    }
}
