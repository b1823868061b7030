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

import java.time.Instant;
import java.util.Map;

/**
 * Entry of a task's execution log. Lifecycle types drive status transitions;
 * any other type is only logged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskEvent(String type, Instant timestamp, Map<String, Object> data) {

    public static final String TASK_STARTED = "task_started";
    public static final String MESSAGE_RECORDED = "message_recorded";
    public static final String TOOL_CALL_START = "tool_call_start";
    public static final String TOOL_CALL_COMPLETE = "tool_call_complete";
    public static final String SECTION_UPDATED = "section_updated";
    public static final String TASK_COMPLETED = "task_completed";
    public static final String TASK_CANCELLED = "task_cancelled";
    public static final String ERROR = "error";

    public TaskEvent {
        data = data != null ? data : Map.of();
    }

    public static TaskEvent of(String type, Instant timestamp) {
        return new TaskEvent(type, timestamp, Map.of());
    }
}
