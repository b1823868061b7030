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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Streaming unit produced by a turn. Each variant reports its wire tag through
 * {@link #type()}; the tags are part of the client contract and must not
 * change.
 */
public sealed interface AgentEvent {

    String LLM_CALL = "llm_call";
    String LLM_CALL_COMPLETE = "llm_call_complete";
    String TOOL_CALL = "tool_call";
    String TOOL_CALL_COMPLETE = "tool_call_complete";
    String DELTA = "delta";
    String RECOLLECTION = "recollection";
    String ERROR = "error";

    @JsonProperty("type")
    String type();

    /**
     * Model invocation is about to start.
     */
    record LlmCallEvent(String model, List<Message> context, List<String> tools) implements AgentEvent {
        public LlmCallEvent {
            context = List.copyOf(context);
            tools = tools != null ? List.copyOf(tools) : List.of();
        }

        @Override
        public String type() {
            return LLM_CALL;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record LlmCallCompleteEvent(String model, List<Message> context, Message result, LlmUsage usage,
            Long latencyMs) implements AgentEvent {
        public LlmCallCompleteEvent {
            context = List.copyOf(context);
        }

        @Override
        public String type() {
            return LLM_CALL_COMPLETE;
        }
    }

    record ToolCallEvent(ToolCallPayload toolCall) implements AgentEvent {
        @Override
        public String type() {
            return TOOL_CALL;
        }
    }

    record ToolCallCompleteEvent(ToolCallPayload toolCall, String result) implements AgentEvent {
        @Override
        public String type() {
            return TOOL_CALL_COMPLETE;
        }
    }

    /**
     * Incremental assistant text. The final delta of a message carries a
     * non-null {@code finishReason}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record DeltaEvent(String messageId, String delta, String finishReason) implements AgentEvent {
        @Override
        public String type() {
            return DELTA;
        }

        public boolean isFinal() {
            return finishReason != null;
        }
    }

    record RecollectionEvent(String recollectionId, String sourceConversationId, int chunkIndex,
            String content, double score, int messageStartIndex, int messageEndIndex) implements AgentEvent {
        @Override
        public String type() {
            return RECOLLECTION;
        }
    }

    /**
     * {@code recovered} marks a diagnostic from an attempt that was retried; it
     * is trace-only and never serialized.
     */
    record ErrorEvent(String error, @JsonIgnore boolean recovered) implements AgentEvent {

        public ErrorEvent(String error) {
            this(error, false);
        }

        public static ErrorEvent retryNote(String error) {
            return new ErrorEvent(error, true);
        }

        @Override
        public String type() {
            return ERROR;
        }
    }

    /**
     * Wire shape {@code {id, function: {name, arguments}}}.
     */
    record ToolCallPayload(String id, FunctionPayload function) {

        public static ToolCallPayload of(Message.ToolCall call) {
            return new ToolCallPayload(call.getId(), new FunctionPayload(call.getName(), call.getArguments()));
        }
    }

    record FunctionPayload(String name, String arguments) {
    }
}
