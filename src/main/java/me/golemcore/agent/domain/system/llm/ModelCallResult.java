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

import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Normalized outcome of one model call.
 */
@Data
@Builder
public class ModelCallResult {

    private String text;
    private List<Message.ToolCall> toolCalls;
    private LlmUsage usage;
    private String model;
    private long latencyMs;

    /**
     * Assistant message ready to be appended to the working context.
     */
    private Message message;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    /**
     * No text and no tool calls.
     */
    public boolean isEmpty() {
        return !hasText() && !hasToolCalls();
    }
}
