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

import me.golemcore.agent.domain.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Brings provider tool calls into the single {@code {id, name, arguments}}
 * shape used by the rest of the turn engine.
 *
 * <p>
 * Arguments that are not valid JSON are kept verbatim so the retry wrapper can
 * reject them with a correction note.
 */
public final class ToolCallNormalizer {

    static final String DEFAULT_TOOL_NAME = "tool_call";
    private static final String EMPTY_ARGUMENTS = "{}";

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public ToolCallNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public List<Message.ToolCall> normalize(List<Message.ToolCall> toolCalls) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return List.of();
        }
        List<Message.ToolCall> normalized = new ArrayList<>(toolCalls.size());
        for (int index = 0; index < toolCalls.size(); index++) {
            Message.ToolCall call = toolCalls.get(index);
            if (call == null) {
                continue;
            }
            String name = isBlank(call.getName()) ? DEFAULT_TOOL_NAME : call.getName().trim();
            String id = isBlank(call.getId()) ? name + "_" + index : call.getId();
            normalized.add(Message.ToolCall.builder()
                    .id(id)
                    .name(name)
                    .arguments(normalizeArguments(call.getArguments()))
                    .build());
        }
        return normalized;
    }

    /**
     * Parses arguments strictly (no trailing tokens).
     *
     * @throws JsonProcessingException
     *             when the text is not a single JSON value
     */
    public JsonNode parseArguments(String arguments) throws JsonProcessingException {
        return strictReader.readTree(arguments);
    }

    String normalizeArguments(String arguments) {
        if (isBlank(arguments)) {
            return EMPTY_ARGUMENTS;
        }
        JsonNode node;
        try {
            node = parseArguments(arguments);
        } catch (JsonProcessingException e) {
            return arguments;
        }
        if (node == null || node.isMissingNode()) {
            return EMPTY_ARGUMENTS;
        }
        if (node.isObject()) {
            return arguments;
        }
        ObjectNode wrapper = objectMapper.createObjectNode();
        wrapper.set("value", node);
        return wrapper.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
