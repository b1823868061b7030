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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of conversation roles. The wire value is the lowercase name.
 */
public enum MessageRole {

    SYSTEM, USER, ASSISTANT, TOOL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a persisted or provider role. Unknown values map to {@link #USER},
     * matching how loosely-typed provider messages are treated.
     */
    @JsonCreator
    public static MessageRole fromValue(String value) {
        if (value == null) {
            return USER;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
        case "system" -> SYSTEM;
        case "assistant", "ai" -> ASSISTANT;
        case "tool" -> TOOL;
        default -> USER;
        };
    }
}
