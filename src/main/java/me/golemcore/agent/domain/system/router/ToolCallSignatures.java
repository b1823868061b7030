package me.golemcore.agent.domain.system.router;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonical forms of tool calls, used to deduplicate a round and to detect a
 * model repeating itself across rounds.
 */
@Slf4j
public class ToolCallSignatures {

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectWriter sortedWriter;

    public ToolCallSignatures(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.sortedWriter = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * Name plus argument JSON with keys sorted at every depth. Unparseable
     * arguments are used verbatim.
     */
    public String canonical(Message.ToolCall call) {
        String arguments = call.getArguments() != null ? call.getArguments() : "{}";
        try {
            Object parsed = objectMapper.readValue(arguments, Object.class);
            return call.getName() + ":" + sortedWriter.writeValueAsString(parsed);
        } catch (JsonProcessingException e) {
            return call.getName() + ":" + arguments;
        }
    }

    /**
     * Signature of a whole round, independent of call order.
     */
    public String roundSignature(List<Message.ToolCall> calls) {
        List<String> parts = new ArrayList<>();
        for (Message.ToolCall call : calls) {
            parts.add(canonical(call));
        }
        Collections.sort(parts);
        return String.join("|", parts);
    }

    /**
     * Drops calls that repeat an earlier call of the round, keeping the first.
     */
    public List<Message.ToolCall> deduplicate(List<Message.ToolCall> calls) {
        Set<String> seen = new LinkedHashSet<>();
        List<Message.ToolCall> unique = new ArrayList<>();
        for (Message.ToolCall call : calls) {
            if (seen.add(canonical(call))) {
                unique.add(call);
            } else {
                log.debug("[Router] Dropping duplicate call {} ({})", call.getId(), call.getName());
            }
        }
        return unique;
    }

    /**
     * True when {@code lat} or {@code lon} is present but non-finite or out of
     * range.
     */
    public boolean hasInvalidCoordinates(Message.ToolCall call) {
        Map<String, Object> arguments = parseArguments(call.getArguments());
        return outOfRange(arguments.get("lat"), 90) || outOfRange(arguments.get("lon"), 180);
    }

    /**
     * Parses arguments into a map; anything that is not a JSON object yields an
     * empty map.
     */
    public Map<String, Object> parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(arguments, ARGUMENTS);
            return parsed != null ? parsed : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            log.debug("[Router] Arguments are not a JSON object: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    private static boolean outOfRange(Object value, double limit) {
        if (value == null) {
            return false;
        }
        double number;
        if (value instanceof Number numeric) {
            number = numeric.doubleValue();
        } else {
            try {
                number = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return true;
            }
        }
        return !Double.isFinite(number) || number < -limit || number > limit;
    }
}
