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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted, append-only unit of conversation content.
 *
 * <p>
 * {@code content} is either a {@link String} or a structured {@link Map}
 * (tool calls, trace payloads). The JSON round trip keeps that distinction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageRecord {

    private String id;
    private MessageRole role;
    private String name;
    private Object content;
    private List<Message.ToolCall> toolCalls;
    private String toolCallId;
    private Integer tokensIn;
    private Integer tokensOut;
    private Map<String, Object> metadata;
    private Instant createdAt;

    @JsonIgnore
    public boolean isStructured() {
        return content instanceof Map;
    }

    @JsonIgnore
    public String getTraceType() {
        if (metadata == null) {
            return null;
        }
        Object traceType = metadata.get("traceType");
        return traceType instanceof String ? (String) traceType : null;
    }

    /**
     * Orchestrator and trace failures count toward the conversation error
     * counter.
     */
    @JsonIgnore
    public boolean isErrorRecord() {
        String traceType = getTraceType();
        if ("error".equals(traceType) || "orchestrator.error".equals(traceType)) {
            return true;
        }
        return name != null && (name.endsWith(".error") || "orchestrator.error".equals(name));
    }

    /**
     * Converts a working-context message into a record ready to append.
     */
    public static MessageRecord from(Message message, String id, Instant createdAt) {
        return MessageRecord.builder()
                .id(id)
                .role(message.getRole())
                .name(message.getName() != null ? message.getName() : message.getToolName())
                .content(message.getContent() != null ? message.getContent() : "")
                .toolCalls(message.hasToolCalls() ? List.copyOf(message.getToolCalls()) : null)
                .toolCallId(message.getToolCallId())
                .metadata(message.getMetadata())
                .createdAt(createdAt)
                .build();
    }

    /**
     * Rebuilds a working-context message. Structured content has no text form
     * and is skipped by callers via {@link #isStructured()}.
     */
    public Message toMessage() {
        return Message.builder()
                .id(id)
                .role(role)
                .name(name)
                .content(content instanceof String ? (String) content : null)
                .toolCalls(toolCalls)
                .toolCallId(toolCallId)
                .toolName(role == MessageRole.TOOL ? name : null)
                .metadata(metadata)
                .build();
    }
}
