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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Conversions between ledger hash fields (flat strings) and typed values.
 *
 * <p>
 * Reads are lenient: a malformed field decodes to {@code null}. Writes are
 * strict: a value that cannot be serialized raises
 * {@link IllegalStateException}.
 */
@Slf4j
final class LedgerCodec {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    LedgerCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    <T> T fromJson(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("[Ledger] Skipping unreadable {} record: {}", type.getSimpleName(), e.getOriginalMessage());
            return null;
        }
    }

    <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("[Ledger] Skipping unreadable field: {}", e.getOriginalMessage());
            return null;
        }
    }

    List<String> stringList(String json) {
        List<String> values = fromJson(json, STRING_LIST);
        return values != null ? values : new ArrayList<>();
    }

    /**
     * Union of the JSON array stored in {@code existing} and {@code additions},
     * keeping first-seen order and skipping blanks.
     */
    String mergeStringList(String existing, String... additions) {
        Set<String> merged = new LinkedHashSet<>(stringList(existing));
        for (String value : additions) {
            if (value != null && !value.isBlank()) {
                merged.add(value);
            }
        }
        return toJson(new ArrayList<>(merged));
    }

    static Instant instant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("[Ledger] Ignoring malformed timestamp: {}", value);
            return null;
        }
    }

    static Long longValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return (long) Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("[Ledger] Ignoring malformed number: {}", value);
            return null;
        }
    }

    static long longValue(String value, long fallback) {
        Long parsed = longValue(value);
        return parsed != null ? parsed : fallback;
    }

    static Integer intValue(String value) {
        Long parsed = longValue(value);
        return parsed != null ? parsed.intValue() : null;
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    static void putIfPresent(Map<String, String> fields, String key, Object value) {
        if (value != null) {
            fields.put(key, value.toString());
        }
    }

    static void putIfNotNull(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
