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

import java.util.List;
import java.util.Map;

/**
 * A single message in the working context of a turn. The role is a closed
 * {@link MessageRole}; tool calls carry one canonical shape
 * ({@link ToolCall}) produced once by the model caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    private String id;
    private MessageRole role;
    private String content;
    private String name;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private Map<String, Object> metadata;

    public static Message system(String content) {
        return Message.builder().role(MessageRole.SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(MessageRole.USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(MessageRole.ASSISTANT).content(content).build();
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role(MessageRole.ASSISTANT)
                .content(content)
                .toolCalls(toolCalls)
                .build();
    }

    public static Message tool(String toolCallId, String toolName, String content) {
        return Message.builder()
                .role(MessageRole.TOOL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .content(content)
                .build();
    }

    public boolean isSystemMessage() {
        return role == MessageRole.SYSTEM;
    }

    public boolean isAssistantMessage() {
        return role == MessageRole.ASSISTANT;
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * A tool call requested by the LLM, with arguments kept as the raw JSON
     * string the provider returned.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private String arguments;
    }
}
