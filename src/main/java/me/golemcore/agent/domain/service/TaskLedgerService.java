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

import me.golemcore.agent.domain.model.Task;
import me.golemcore.agent.domain.model.TaskEvent;
import me.golemcore.agent.domain.model.TaskListQuery;
import me.golemcore.agent.domain.model.TaskListResponse;
import me.golemcore.agent.domain.model.TaskMetadata;
import me.golemcore.agent.domain.model.TaskRecallResult;
import me.golemcore.agent.domain.model.TaskStatus;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.KeyValueStorePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger of background tasks: status lifecycle, counters, content sections
 * and an append-only event log.
 *
 * <p>
 * A task id sits in exactly one of {@code tasks:active},
 * {@code tasks:completed} or {@code tasks:archived}; the per-user indices
 * mirror that with {@code userId:taskId} members. Every move between indices
 * happens in a single transaction.
 */
@Service
@Slf4j
public class TaskLedgerService {

    private static final String ACTIVE = "active";
    private static final String COMPLETED = "completed";
    private static final String ARCHIVED = "archived";

    private static final String STATUS = "status";
    private static final String STARTED_AT = "startedAt";
    private static final String COMPLETED_AT = "completedAt";
    private static final String SECTIONS = "sections";
    private static final String USER_ID = "userId";
    private static final String DEFAULT_ERROR = "Unknown error";
    private static final int DEFAULT_EVENT_PAGE = 50;

    private static final TypeReference<Map<String, String>> SECTION_MAP = new TypeReference<>() {
    };

    private final KeyValueStorePort store;
    private final Clock clock;
    private final LedgerCodec codec;
    private final String namespace;
    private final String metricsNamespace;

    public TaskLedgerService(KeyValueStorePort store, ObjectMapper objectMapper, Clock clock,
            AgentProperties properties) {
        this.store = store;
        this.clock = clock;
        this.codec = new LedgerCodec(objectMapper);
        this.namespace = properties.getTasks().getNamespace();
        this.metricsNamespace = properties.getTasks().getMetricsNamespace();
    }

    // ==================== Lifecycle ====================

    /**
     * Registers a queued task.
     *
     * @throws IllegalStateException
     *             if a task with this id already exists
     */
    public Task createTask(String taskId, TaskMetadata metadata) {
        String id = taskId != null && !taskId.isBlank() ? taskId : LedgerIds.newId("task");
        if (store.exists(taskKey(id))) {
            throw new IllegalStateException("Task already exists: " + id);
        }
        Instant now = clock.instant();
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put(STATUS, TaskStatus.QUEUED.value());
        fields.put("createdAt", now.toString());
        LedgerCodec.putIfPresent(fields, "name", metadata.name());
        LedgerCodec.putIfPresent(fields, "toolName", metadata.toolName());
        LedgerCodec.putIfPresent(fields, USER_ID, metadata.userId());
        LedgerCodec.putIfPresent(fields, "conversationId", metadata.conversationId());
        fields.put("messageCount", "0");
        fields.put("toolCallCount", "0");
        fields.put("tokensIn", "0");
        fields.put("tokensOut", "0");
        fields.put("archived", "false");
        fields.put(SECTIONS, codec.toJson(metadata.sections() != null ? metadata.sections() : Map.of()));

        store.transaction(tx -> {
            tx.hset(taskKey(id), fields)
                    .zadd(key("tasks:" + ACTIVE), now.toEpochMilli(), id)
                    .hincrBy(metricsKey("tasks"), "created", 1);
            if (metadata.userId() != null) {
                tx.zadd(userIndexKey(ACTIVE), now.toEpochMilli(), userMember(metadata.userId(), id));
            }
        });
        log.info("[Tasks] Created task {} (tool={}, user={})", id, metadata.toolName(), metadata.userId());
        return getTask(id);
    }

    public Task getTask(String taskId) {
        Map<String, String> hash = store.hgetAll(taskKey(taskId));
        if (hash.isEmpty()) {
            return null;
        }
        return toTask(taskId, hash);
    }

    /**
     * Appends an event to the task log and applies its side effects.
     *
     * @return false when the task does not exist
     */
    public boolean recordEvent(String taskId, TaskEvent event) {
        Map<String, String> hash = store.hgetAll(taskKey(taskId));
        if (hash.isEmpty()) {
            log.warn("[Tasks] Event {} for unknown task {}", event.type(), taskId);
            return false;
        }
        TaskEvent stamped = event.timestamp() != null ? event
                : new TaskEvent(event.type(), clock.instant(), event.data());
        Instant at = stamped.timestamp();
        Map<String, Object> data = stamped.data();
        TaskStatus current = parseStatus(hash.get(STATUS));
        boolean terminal = current != null && current.isTerminal();

        Map<String, String> fields = new LinkedHashMap<>();
        String sectionName = stringValue(data.get("section"));
        if (sectionName != null) {
            Map<String, String> sections = readSections(hash.get(SECTIONS));
            sections.put(sectionName, stringValue(data.get("content")) != null
                    ? stringValue(data.get("content"))
                    : "");
            fields.put(SECTIONS, codec.toJson(sections));
        }

        String type = stamped.type();
        String moveToCompleted = null;
        if (TaskEvent.TASK_STARTED.equals(type) && !terminal) {
            fields.put(STATUS, TaskStatus.RUNNING.value());
            fields.put(STARTED_AT, at.toString());
        } else if (TaskEvent.TASK_COMPLETED.equals(type) && !terminal) {
            fields.put(STATUS, TaskStatus.COMPLETED.value());
            fields.put(COMPLETED_AT, at.toString());
            Instant startedAt = LedgerCodec.instant(hash.get(STARTED_AT));
            Instant from = startedAt != null ? startedAt : LedgerCodec.instant(hash.get("createdAt"));
            if (from != null) {
                fields.put("runtimeMs", Long.toString(Math.max(0, at.toEpochMilli() - from.toEpochMilli())));
            }
            moveToCompleted = "completed";
        } else if (TaskEvent.ERROR.equals(type) && !terminal) {
            String message = stringValue(data.get("error"));
            if (message == null) {
                message = stringValue(data.get("message"));
            }
            fields.put(STATUS, TaskStatus.ERRORED.value());
            fields.put("errorMessage", message != null ? message : DEFAULT_ERROR);
            fields.put(COMPLETED_AT, at.toString());
            moveToCompleted = "errored";
        } else if ((TaskEvent.TASK_STARTED.equals(type) || TaskEvent.TASK_COMPLETED.equals(type)
                || TaskEvent.ERROR.equals(type)) && terminal) {
            log.debug("[Tasks] Ignoring {} for terminal task {}", type, taskId);
        }

        String payload = codec.toJson(stamped);
        String userId = hash.get(USER_ID);
        String metric = moveToCompleted;
        store.transaction(tx -> {
            tx.rpush(eventsKey(taskId), payload);
            if (!fields.isEmpty()) {
                tx.hset(taskKey(taskId), fields);
            }
            if (TaskEvent.MESSAGE_RECORDED.equals(type)) {
                tx.hincrBy(taskKey(taskId), "messageCount", 1);
            }
            if (TaskEvent.TOOL_CALL_START.equals(type)) {
                tx.hincrBy(taskKey(taskId), "toolCallCount", 1);
            }
            Long tokensIn = longValue(data.get("tokensIn"));
            if (tokensIn != null) {
                tx.hincrBy(taskKey(taskId), "tokensIn", tokensIn);
            }
            Long tokensOut = longValue(data.get("tokensOut"));
            if (tokensOut != null) {
                tx.hincrBy(taskKey(taskId), "tokensOut", tokensOut);
            }
            if (metric != null) {
                moveIndex(tx, taskId, userId, ACTIVE, COMPLETED, at.toEpochMilli());
                tx.hincrBy(metricsKey("tasks"), metric, 1);
            }
        });

        if (TaskEvent.TASK_CANCELLED.equals(type)) {
            cancelTask(taskId);
        }
        if (metric != null) {
            log.info("[Tasks] Task {} {}", taskId, metric);
        }
        return true;
    }

    public List<TaskEvent> getTaskEvents(String taskId, Integer limit) {
        long start = limit != null && limit > 0 ? -limit : 0;
        return readEvents(store.lrange(eventsKey(taskId), start, -1));
    }

    /**
     * Cancels a task that has not reached a terminal status.
     */
    public boolean cancelTask(String taskId) {
        Map<String, String> hash = store.hgetAll(taskKey(taskId));
        if (hash.isEmpty()) {
            return false;
        }
        TaskStatus status = parseStatus(hash.get(STATUS));
        if (status != null && status.isTerminal()) {
            log.debug("[Tasks] Cancel ignored, task {} is already {}", taskId, status.value());
            return false;
        }
        Instant now = clock.instant();
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(STATUS, TaskStatus.CANCELLED.value());
        fields.put(COMPLETED_AT, now.toString());
        String userId = hash.get(USER_ID);
        store.transaction(tx -> {
            tx.hset(taskKey(taskId), fields);
            moveIndex(tx, taskId, userId, ACTIVE, COMPLETED, now.toEpochMilli());
            tx.hincrBy(metricsKey("tasks"), "cancelled", 1);
        });
        log.info("[Tasks] Task {} cancelled", taskId);
        return true;
    }

    /**
     * Archives a terminal task.
     */
    public boolean archiveTask(String taskId) {
        Map<String, String> hash = store.hgetAll(taskKey(taskId));
        if (hash.isEmpty() || Boolean.parseBoolean(hash.get("archived"))) {
            return false;
        }
        TaskStatus status = parseStatus(hash.get(STATUS));
        if (status == null || !status.isTerminal()) {
            log.debug("[Tasks] Archive refused, task {} is not finished", taskId);
            return false;
        }
        Instant now = clock.instant();
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("archived", "true");
        fields.put("archivedAt", now.toString());
        String userId = hash.get(USER_ID);
        store.transaction(tx -> {
            tx.hset(taskKey(taskId), fields);
            moveIndex(tx, taskId, userId, COMPLETED, ARCHIVED, now.toEpochMilli());
        });
        log.info("[Tasks] Task {} archived", taskId);
        return true;
    }

    /**
     * Removes a finished or archived task with its event log.
     */
    public boolean deleteTask(String taskId) {
        Map<String, String> hash = store.hgetAll(taskKey(taskId));
        if (hash.isEmpty()) {
            return false;
        }
        TaskStatus status = parseStatus(hash.get(STATUS));
        boolean archived = Boolean.parseBoolean(hash.get("archived"));
        if (!archived && (status == null || !status.isTerminal())) {
            log.debug("[Tasks] Delete refused, task {} is still {}", taskId, hash.get(STATUS));
            return false;
        }
        String userId = hash.get(USER_ID);
        store.transaction(tx -> {
            tx.delete(taskKey(taskId)).delete(eventsKey(taskId));
            for (String index : List.of(ACTIVE, COMPLETED, ARCHIVED)) {
                tx.zrem(key("tasks:" + index), taskId);
                if (userId != null) {
                    tx.zrem(userIndexKey(index), userMember(userId, taskId));
                }
            }
        });
        log.info("[Tasks] Task {} deleted", taskId);
        return true;
    }

    // ==================== Queries ====================

    /**
     * Lists tasks most recent first across the active and completed indices,
     * plus archived ones when requested.
     */
    public TaskListResponse listTasks(TaskListQuery query) {
        List<String> indices = new ArrayList<>(List.of(ACTIVE, COMPLETED));
        if (query.includeArchived()) {
            indices.add(ARCHIVED);
        }
        List<KeyValueStorePort.ScoredMember> entries = new ArrayList<>();
        for (String index : indices) {
            if (query.userId() == null) {
                entries.addAll(store.zrevrange(key("tasks:" + index), 0, -1));
                continue;
            }
            String prefix = query.userId() + ":";
            for (KeyValueStorePort.ScoredMember member : store.zrevrange(userIndexKey(index), 0, -1)) {
                if (member.member().startsWith(prefix)) {
                    entries.add(new KeyValueStorePort.ScoredMember(
                            member.member().substring(prefix.length()), member.score()));
                }
            }
        }
        entries.sort((a, b) -> Double.compare(b.score(), a.score()));

        int total = entries.size();
        int offset = query.effectiveOffset();
        int end = Math.min(total, offset + query.effectiveLimit());
        List<Task> tasks = new ArrayList<>();
        for (int i = offset; i < end; i++) {
            Task task = getTask(entries.get(i).member());
            if (task != null) {
                tasks.add(task);
            }
        }
        return new TaskListResponse(tasks, total, end < total);
    }

    /**
     * Snapshot of a task with its sections and a page of its event log.
     *
     * @param section
     *            return only this section when not null
     */
    public TaskRecallResult recallTask(String taskId, Integer offset, Integer count, String section) {
        Task task = getTask(taskId);
        if (task == null) {
            return null;
        }
        Map<String, TaskRecallResult.Section> sections = new LinkedHashMap<>();
        task.getSections().forEach((name, content) -> {
            if (section == null || section.equals(name)) {
                sections.put(name, new TaskRecallResult.Section(name, content));
            }
        });
        long start = offset != null && offset > 0 ? offset : 0;
        long size = count != null && count > 0 ? count : DEFAULT_EVENT_PAGE;
        List<TaskEvent> events = readEvents(store.lrange(eventsKey(taskId), start, start + size - 1));
        return new TaskRecallResult(task, sections, events);
    }

    // ==================== Internals ====================

    private void moveIndex(KeyValueStorePort.Transaction tx, String taskId, String userId, String from, String to,
            long score) {
        tx.zrem(key("tasks:" + from), taskId).zadd(key("tasks:" + to), score, taskId);
        if (userId != null) {
            String member = userMember(userId, taskId);
            tx.zrem(userIndexKey(from), member).zadd(userIndexKey(to), score, member);
        }
    }

    private List<TaskEvent> readEvents(List<String> raw) {
        List<TaskEvent> events = new ArrayList<>(raw.size());
        for (String json : raw) {
            TaskEvent event = codec.fromJson(json, TaskEvent.class);
            if (event != null) {
                events.add(event);
            }
        }
        return events;
    }

    private Map<String, String> readSections(String json) {
        Map<String, String> sections = codec.fromJson(json, SECTION_MAP);
        return sections != null ? new LinkedHashMap<>(sections) : new LinkedHashMap<>();
    }

    private Task toTask(String taskId, Map<String, String> hash) {
        return Task.builder()
                .id(taskId)
                .name(hash.get("name"))
                .status(parseStatus(hash.get(STATUS)))
                .toolName(hash.get("toolName"))
                .userId(hash.get(USER_ID))
                .conversationId(hash.get("conversationId"))
                .createdAt(LedgerCodec.instant(hash.get("createdAt")))
                .startedAt(LedgerCodec.instant(hash.get(STARTED_AT)))
                .completedAt(LedgerCodec.instant(hash.get(COMPLETED_AT)))
                .runtimeMs(LedgerCodec.longValue(hash.get("runtimeMs")))
                .errorMessage(hash.get("errorMessage"))
                .messageCount(LedgerCodec.longValue(hash.get("messageCount"), 0))
                .toolCallCount(LedgerCodec.longValue(hash.get("toolCallCount"), 0))
                .tokensIn(LedgerCodec.longValue(hash.get("tokensIn"), 0))
                .tokensOut(LedgerCodec.longValue(hash.get("tokensOut"), 0))
                .archived(Boolean.parseBoolean(hash.get("archived")))
                .archivedAt(LedgerCodec.instant(hash.get("archivedAt")))
                .sections(readSections(hash.get(SECTIONS)))
                .build();
    }

    private static TaskStatus parseStatus(String value) {
        try {
            return TaskStatus.fromValue(value);
        } catch (IllegalArgumentException e) {
            log.warn("[Tasks] Unknown task status: {}", value);
            return null;
        }
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }

    private static Long longValue(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return value instanceof String text ? LedgerCodec.longValue(text) : null;
    }

    private String key(String suffix) {
        return namespace + ":" + suffix;
    }

    private String metricsKey(String suffix) {
        return metricsNamespace + ":" + suffix;
    }

    private String taskKey(String taskId) {
        return key("task:" + taskId);
    }

    private String eventsKey(String taskId) {
        return taskKey(taskId) + ":events";
    }

    private String userIndexKey(String index) {
        return key("tasks:user:" + index);
    }

    private static String userMember(String userId, String taskId) {
        return userId + ":" + taskId;
    }
}
