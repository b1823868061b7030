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

import me.golemcore.agent.domain.model.AgentEvent;
import me.golemcore.agent.domain.model.Conversation;
import me.golemcore.agent.domain.model.ConversationCounts;
import me.golemcore.agent.domain.model.ConversationStatus;
import me.golemcore.agent.domain.model.LedgerStatus;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessageRecord;
import me.golemcore.agent.domain.model.MessageRole;
import me.golemcore.agent.domain.model.ModelCallOutcome;
import me.golemcore.agent.domain.model.RecallQuery;
import me.golemcore.agent.domain.model.RecallResult;
import me.golemcore.agent.domain.model.RequestRecord;
import me.golemcore.agent.domain.model.StartRequestOptions;
import me.golemcore.agent.domain.model.StartRequestResult;
import me.golemcore.agent.domain.model.SummaryResult;
import me.golemcore.agent.domain.model.ToolCallOutcome;
import me.golemcore.agent.domain.model.TurnOutcome;
import me.golemcore.agent.domain.model.TurnRecord;
import me.golemcore.agent.domain.model.TurnStatus;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.KeyValueStorePort;
import me.golemcore.agent.port.outbound.SummarizerPort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Durable record of conversations, requests, turns, messages and per-tool /
 * per-model metrics, kept in a namespaced {@link KeyValueStorePort}.
 *
 * <p>
 * Key layout under the namespace:
 * <ul>
 * <li>{@code conv:{id}} conversation hash, {@code conv:{id}:msgs} message
 * list, {@code conv:{id}:requests} and {@code conv:{id}:turns} indices</li>
 * <li>{@code req:{id}} and {@code turn:{id}} hashes</li>
 * <li>{@code convs:active}, {@code convs:closed} and {@code token:{t}:convs}
 * sorted sets scored by epoch millis</li>
 * </ul>
 * Metrics live under a separate namespace.
 *
 * <p>
 * Multi-key updates go through {@link KeyValueStorePort#transaction}. Token
 * lookup followed by creation is not atomic: two concurrent first requests for
 * the same token may open two conversations.
 */
@Service
@Slf4j
public class ConversationLedgerService {

    static final String STATUS = "status";
    static final String STARTED_AT = "startedAt";
    static final String LAST_TOUCHED_AT = "lastTouchedAt";
    static final String LAST_REQUEST_AT = "lastRequestAt";
    static final String CLOSED_AT = "closedAt";
    static final String CLOSE_REASON = "closeReason";
    static final String MODEL_SET = "modelSet";
    static final String TOKEN_SET = "tokenSet";
    static final String PLACE_TAGS = "placeTags";
    static final String SUMMARY = "summary";
    static final String TAGS = "tags";
    static final String KEYWORDS = "keywords";
    static final String FLAGS = "flags";
    static final String USER_ID = "userId";
    static final String GHOST = "ghost";
    static final String MESSAGE_COUNT = "messageCount";
    static final String USER_ASSISTANT_COUNT = "userAssistantCount";
    static final String TOOL_CALL_COUNT = "toolCallCount";
    static final String ERROR_COUNT = "errorCount";
    static final String REQUEST_COUNT = "requestCount";
    static final String MAX_TURN_LATENCY_MS = "maxTurnLatencyMs";
    static final String INDEXING_STATUS = "indexingStatus";
    static final String INDEXING_ERROR = "indexingError";

    private static final String ERROR_TYPE = "errorType";
    private static final String LATENCY_MS = "latencyMs";
    private static final String TOKENS_IN = "tokensIn";
    private static final String TOKENS_OUT = "tokensOut";
    private static final String COUNT = "count";

    private static final String DEFAULT_CLOSE_REASON = "idle";
    private static final String DEFAULT_RATE_LIMIT_REASON = "rate_limit";
    private static final int DEFAULT_LIST_LIMIT = 50;
    private static final int DEFAULT_RECALL_LIMIT = 10;
    private static final int TRACE_CONTEXT_LIMIT = 12;
    private static final String LLM_CALL_TRACE_PREFIX = "llm_call";

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };

    private final KeyValueStorePort store;
    private final SummarizerPort summarizer;
    private final Clock clock;
    private final LedgerCodec codec;
    private final String namespace;
    private final String metricsNamespace;
    private final long idleMs;
    private final int summaryMessageLimit;

    public ConversationLedgerService(KeyValueStorePort store, SummarizerPort summarizer, ObjectMapper objectMapper,
            Clock clock, AgentProperties properties) {
        this.store = store;
        this.summarizer = summarizer;
        this.clock = clock;
        this.codec = new LedgerCodec(objectMapper);
        AgentProperties.LedgerProperties ledger = properties.getLedger();
        this.namespace = ledger.getNamespace();
        this.metricsNamespace = ledger.getMetricsNamespace();
        this.idleMs = ledger.getIdleMs();
        this.summaryMessageLimit = ledger.getSummaryMessageLimit();
    }

    // ==================== Requests ====================

    /**
     * Resolves the conversation for a new request and records the request.
     *
     * <p>
     * An explicit {@code conversationId} is reused (and reopened when closed).
     * Otherwise the most recent open conversation of the token touched within
     * the idle window is reused, else a new one is created.
     */
    public StartRequestResult startRequest(String token, String model, StartRequestOptions options) {
        StartRequestOptions opts = options != null ? options : StartRequestOptions.none();
        Instant now = clock.instant();
        long nowMs = now.toEpochMilli();

        String conversationId;
        Map<String, String> existing;
        if (opts.conversationId() != null && !opts.conversationId().isBlank()) {
            conversationId = opts.conversationId();
            existing = store.hgetAll(convKey(conversationId));
        } else {
            conversationId = findRecentOpenConversation(token, nowMs);
            existing = conversationId != null ? store.hgetAll(convKey(conversationId)) : Map.of();
        }
        boolean isNew = existing.isEmpty();
        if (conversationId == null) {
            conversationId = LedgerIds.newId("conv");
        }
        boolean reopening = !isNew && ConversationStatus.CLOSED.value().equals(existing.get(STATUS));

        Map<String, String> convFields = new LinkedHashMap<>();
        convFields.put(LAST_TOUCHED_AT, now.toString());
        convFields.put(LAST_REQUEST_AT, now.toString());
        convFields.put(TOKEN_SET, codec.mergeStringList(existing.get(TOKEN_SET), token));
        convFields.put(MODEL_SET, codec.mergeStringList(existing.get(MODEL_SET), model));
        convFields.put(PLACE_TAGS, codec.mergeStringList(existing.get(PLACE_TAGS), opts.place()));
        if (isNew) {
            convFields.put("id", conversationId);
            convFields.put(STATUS, ConversationStatus.OPEN.value());
            convFields.put(STARTED_AT, now.toString());
            convFields.put(GHOST, Boolean.toString(opts.ghost()));
            convFields.put(MESSAGE_COUNT, "0");
            convFields.put(USER_ASSISTANT_COUNT, "0");
            convFields.put(TOOL_CALL_COUNT, "0");
            convFields.put(ERROR_COUNT, "0");
            convFields.put(REQUEST_COUNT, "0");
        } else if (reopening) {
            convFields.put(STATUS, ConversationStatus.OPEN.value());
        }
        if (opts.userId() != null && existing.get(USER_ID) == null) {
            convFields.put(USER_ID, opts.userId());
        }

        String requestId = LedgerIds.newId("req");
        Map<String, String> reqFields = new LinkedHashMap<>();
        reqFields.put("id", requestId);
        reqFields.put("conversationId", conversationId);
        LedgerCodec.putIfPresent(reqFields, "token", token);
        LedgerCodec.putIfPresent(reqFields, "modelUsed", model);
        LedgerCodec.putIfPresent(reqFields, "initialPlace", opts.place());
        LedgerCodec.putIfPresent(reqFields, USER_ID, opts.userId());
        reqFields.put(STARTED_AT, now.toString());
        if (opts.clientMeta() != null && !opts.clientMeta().isEmpty()) {
            reqFields.put("clientMeta", codec.toJson(opts.clientMeta()));
        }

        String convId = conversationId;
        store.transaction(tx -> {
            tx.hset(convKey(convId), convFields);
            if (reopening) {
                tx.hdel(convKey(convId), CLOSED_AT, CLOSE_REASON);
                tx.zrem(key("convs:closed"), convId);
            }
            tx.hincrBy(convKey(convId), REQUEST_COUNT, 1);
            tx.hset(key("req:" + requestId), reqFields);
            tx.zadd(key("convs:active"), nowMs, convId);
            if (token != null) {
                tx.zadd(tokenConvsKey(token), nowMs, convId);
            }
            tx.zadd(convKey(convId) + ":requests", nowMs, requestId);
            tx.hincrBy(metricsKey("requests"), COUNT, 1);
        });

        if (isNew) {
            log.info("[Ledger] Created conversation {} for request {}", convId, requestId);
        } else if (reopening) {
            log.info("[Ledger] Reopened conversation {} for request {}", convId, requestId);
        } else {
            log.debug("[Ledger] Reusing conversation {} for request {}", convId, requestId);
        }
        return new StartRequestResult(requestId, convId, isNew);
    }

    public void completeRequest(String requestId, long latencyMs) {
        String reqKey = key("req:" + requestId);
        if (!store.exists(reqKey)) {
            log.warn("[Ledger] Cannot complete unknown request {}", requestId);
            return;
        }
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("completedAt", clock.instant().toString());
        fields.put(LATENCY_MS, Long.toString(latencyMs));
        store.hset(reqKey, fields);
    }

    public RequestRecord getRequest(String requestId) {
        Map<String, String> hash = store.hgetAll(key("req:" + requestId));
        if (hash.isEmpty()) {
            return null;
        }
        return RequestRecord.builder()
                .id(requestId)
                .conversationId(hash.get("conversationId"))
                .token(hash.get("token"))
                .modelUsed(hash.get("modelUsed"))
                .initialPlace(hash.get("initialPlace"))
                .userId(hash.get(USER_ID))
                .clientMeta(codec.fromJson(hash.get("clientMeta"), OBJECT_MAP))
                .startedAt(LedgerCodec.instant(hash.get(STARTED_AT)))
                .completedAt(LedgerCodec.instant(hash.get("completedAt")))
                .latencyMs(LedgerCodec.longValue(hash.get(LATENCY_MS)))
                .build();
    }

    private String findRecentOpenConversation(String token, long nowMs) {
        if (token == null) {
            return null;
        }
        List<String> recent = store.zrevrangeByScore(tokenConvsKey(token), nowMs, (double) nowMs - idleMs, 0, 1);
        if (recent.isEmpty()) {
            return null;
        }
        String candidate = recent.get(0);
        String status = store.hget(convKey(candidate), STATUS);
        return ConversationStatus.OPEN.value().equals(status) ? candidate : null;
    }

    // ==================== Turns ====================

    public String startTurn(String requestId, String conversationId, String token, String model, Integer tokensIn) {
        String turnId = LedgerIds.newId("turn");
        Instant now = clock.instant();
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("id", turnId);
        fields.put("requestId", requestId);
        fields.put("conversationId", conversationId);
        LedgerCodec.putIfPresent(fields, "token", token);
        LedgerCodec.putIfPresent(fields, "model", model);
        fields.put(STARTED_AT, now.toString());
        LedgerCodec.putIfPresent(fields, TOKENS_IN, tokensIn);

        store.transaction(tx -> tx
                .hset(turnKey(turnId), fields)
                .zadd(convKey(conversationId) + ":turns", now.toEpochMilli(), turnId)
                .hincrBy(metricsKey("turns"), COUNT, 1));
        log.debug("[Ledger] Started turn {} (request={}, conversation={})", turnId, requestId, conversationId);
        return turnId;
    }

    public void endTurn(String turnId, TurnOutcome outcome) {
        Map<String, String> turn = store.hgetAll(turnKey(turnId));
        if (turn.isEmpty()) {
            log.warn("[Ledger] Cannot end unknown turn {}", turnId);
            return;
        }
        TurnStatus status = outcome.status() != null ? outcome.status() : TurnStatus.OK;
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(STATUS, status.value());
        fields.put("endedAt", clock.instant().toString());
        LedgerCodec.putIfPresent(fields, TOKENS_IN, outcome.tokensIn());
        LedgerCodec.putIfPresent(fields, TOKENS_OUT, outcome.tokensOut());
        LedgerCodec.putIfPresent(fields, LATENCY_MS, outcome.latencyMs());
        LedgerCodec.putIfPresent(fields, ERROR_TYPE, outcome.errorType());

        store.transaction(tx -> {
            tx.hset(turnKey(turnId), fields);
            if (status == TurnStatus.ERROR) {
                tx.hincrBy(metricsKey("turns"), "error", 1);
            }
        });

        String conversationId = turn.get("conversationId");
        if (outcome.latencyMs() != null && conversationId != null) {
            raiseMaxTurnLatency(conversationId, outcome.latencyMs());
        }
        log.info("[Ledger] Turn {} ended: status={}, latency={}ms", turnId, status.value(), outcome.latencyMs());
    }

    public TurnRecord getTurn(String turnId) {
        Map<String, String> hash = store.hgetAll(turnKey(turnId));
        if (hash.isEmpty()) {
            return null;
        }
        return TurnRecord.builder()
                .id(turnId)
                .requestId(hash.get("requestId"))
                .conversationId(hash.get("conversationId"))
                .token(hash.get("token"))
                .model(hash.get("model"))
                .startedAt(LedgerCodec.instant(hash.get(STARTED_AT)))
                .endedAt(LedgerCodec.instant(hash.get("endedAt")))
                .status(TurnStatus.fromValue(hash.get(STATUS)))
                .tokensIn(LedgerCodec.intValue(hash.get(TOKENS_IN)))
                .tokensOut(LedgerCodec.intValue(hash.get(TOKENS_OUT)))
                .latencyMs(LedgerCodec.longValue(hash.get(LATENCY_MS)))
                .errorType(hash.get(ERROR_TYPE))
                .build();
    }

    // Read-then-write; a concurrent turn may lose a smaller maximum.
    private void raiseMaxTurnLatency(String conversationId, long latencyMs) {
        Long current = LedgerCodec.longValue(store.hget(convKey(conversationId), MAX_TURN_LATENCY_MS));
        if (current == null || latencyMs > current) {
            store.hset(convKey(conversationId), Map.of(MAX_TURN_LATENCY_MS, Long.toString(latencyMs)));
        }
    }

    // ==================== Messages ====================

    /**
     * Appends working-context messages, assigning ids and timestamps.
     *
     * @return the persisted records in append order
     */
    public List<MessageRecord> appendMessages(String conversationId, List<Message> messages) {
        Instant now = clock.instant();
        List<MessageRecord> records = new ArrayList<>(messages.size());
        for (Message message : messages) {
            String id = message.getId() != null ? message.getId() : LedgerIds.newId("msg");
            records.add(MessageRecord.from(message, id, now));
        }
        appendRecords(conversationId, records);
        return records;
    }

    /**
     * Appends prepared records and updates the conversation counters in one
     * transaction.
     */
    public void appendRecords(String conversationId, List<MessageRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        String[] payloads = new String[records.size()];
        long userAssistant = 0;
        long toolCalls = 0;
        long errors = 0;
        for (int i = 0; i < records.size(); i++) {
            MessageRecord record = records.get(i);
            if (record.getId() == null) {
                record.setId(LedgerIds.newId("msg"));
            }
            if (record.getCreatedAt() == null) {
                record.setCreatedAt(now);
            }
            payloads[i] = codec.toJson(record);
            if (record.getRole() == MessageRole.USER || record.getRole() == MessageRole.ASSISTANT) {
                userAssistant++;
            }
            if (record.getToolCalls() != null) {
                toolCalls += record.getToolCalls().size();
            }
            if (record.getRole() == MessageRole.TOOL) {
                toolCalls++;
            }
            if (record.isErrorRecord()) {
                errors++;
            }
        }

        boolean open = ConversationStatus.OPEN.value().equals(store.hget(convKey(conversationId), STATUS));
        long userAssistantDelta = userAssistant;
        long toolCallDelta = toolCalls;
        long errorDelta = errors;
        store.transaction(tx -> {
            String convKey = convKey(conversationId);
            tx.rpush(convKey + ":msgs", payloads)
                    .hincrBy(convKey, MESSAGE_COUNT, payloads.length)
                    .hincrBy(convKey, USER_ASSISTANT_COUNT, userAssistantDelta)
                    .hincrBy(convKey, TOOL_CALL_COUNT, toolCallDelta)
                    .hincrBy(convKey, ERROR_COUNT, errorDelta)
                    .hset(convKey, Map.of(LAST_TOUCHED_AT, now.toString()));
            if (open) {
                tx.zadd(key("convs:active"), now.toEpochMilli(), conversationId);
            }
        });
        log.debug("[Ledger] Appended {} messages to {}", payloads.length, conversationId);
    }

    /**
     * Reads messages in append order.
     *
     * @param limit
     *            keep only the last {@code limit} records, all when null or
     *            non-positive
     * @param role
     *            keep only this role, all when null
     * @param since
     *            keep only records created at or after this instant
     */
    public List<MessageRecord> getMessages(String conversationId, Integer limit, MessageRole role, Instant since) {
        long start = limit != null && limit > 0 ? -limit : 0;
        List<String> raw = store.lrange(convKey(conversationId) + ":msgs", start, -1);
        List<MessageRecord> result = new ArrayList<>(raw.size());
        for (String json : raw) {
            MessageRecord record = codec.fromJson(json, MessageRecord.class);
            if (record == null) {
                continue;
            }
            if (role != null && record.getRole() != role) {
                continue;
            }
            if (since != null && record.getCreatedAt() != null && record.getCreatedAt().isBefore(since)) {
                continue;
            }
            result.add(record);
        }
        return result;
    }

    // ==================== Trace records ====================

    public MessageRecord recordLlmCallStart(TraceContext trace, AgentEvent.LlmCallEvent event) {
        Map<String, Object> content = traceContent(AgentEvent.LLM_CALL);
        LedgerCodec.putIfNotNull(content, "model", event.model());
        List<Message> context = event.context();
        int from = Math.max(0, context.size() - TRACE_CONTEXT_LIMIT);
        content.put("context", new ArrayList<>(context.subList(from, context.size())));
        content.put("tools", event.tools());
        return appendTrace(trace, AgentEvent.LLM_CALL, content);
    }

    public MessageRecord recordLlmCallComplete(TraceContext trace, AgentEvent.LlmCallCompleteEvent event) {
        Map<String, Object> content = traceContent(AgentEvent.LLM_CALL_COMPLETE);
        LedgerCodec.putIfNotNull(content, "model", event.model());
        LedgerCodec.putIfNotNull(content, "result", event.result());
        LedgerCodec.putIfNotNull(content, "usage", event.usage());
        LedgerCodec.putIfNotNull(content, LATENCY_MS, event.latencyMs());
        return appendTrace(trace, AgentEvent.LLM_CALL_COMPLETE, content);
    }

    public MessageRecord recordToolCallStart(TraceContext trace, AgentEvent.ToolCallEvent event) {
        Map<String, Object> content = traceContent(AgentEvent.TOOL_CALL);
        content.put("toolCall", event.toolCall());
        return appendTrace(trace, AgentEvent.TOOL_CALL, content);
    }

    public MessageRecord recordToolCallComplete(TraceContext trace, AgentEvent.ToolCallCompleteEvent event) {
        Map<String, Object> content = traceContent(AgentEvent.TOOL_CALL_COMPLETE);
        content.put("toolCall", event.toolCall());
        LedgerCodec.putIfNotNull(content, "result", event.result());
        return appendTrace(trace, AgentEvent.TOOL_CALL_COMPLETE, content);
    }

    private Map<String, Object> traceContent(String type) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("type", type);
        content.put("at", clock.instant().toString());
        return content;
    }

    private MessageRecord appendTrace(TraceContext trace, String tag, Map<String, Object> content) {
        String messageId = trace.messageId() != null ? trace.messageId() : LedgerIds.newId("msg");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("traceType", tag);
        metadata.put("messageId", messageId);
        LedgerCodec.putIfNotNull(metadata, "requestId", trace.requestId());
        LedgerCodec.putIfNotNull(metadata, "turnId", trace.turnId());
        MessageRecord record = MessageRecord.builder()
                .id(LedgerIds.newId("msg"))
                .role(MessageRole.SYSTEM)
                .name(tag)
                .content(content)
                .metadata(metadata)
                .createdAt(clock.instant())
                .build();
        appendRecords(trace.conversationId(), List.of(record));
        return record;
    }

    /**
     * Identifies where a trace record belongs. {@code messageId} groups the
     * records of one model call; a fresh id is used when null.
     */
    public record TraceContext(String conversationId, String requestId, String turnId, String messageId) {

        public TraceContext withMessageId(String id) {
            return new TraceContext(conversationId, requestId, turnId, id);
        }
    }

    // ==================== Metrics ====================

    public void recordToolResult(String turnId, String toolName, ToolCallOutcome outcome) {
        String toolKey = metricsKey("tool:" + toolName);
        double latency = outcome.latencyMs();
        store.transaction(tx -> {
            tx.hincrBy(toolKey, outcome.ok() ? "ok" : "fail", 1)
                    .hincrByFloat(toolKey, "sum_ms", latency)
                    .hincrByFloat(toolKey, "sum_sqr_ms", latency * latency)
                    .hincrBy(toolKey, COUNT, 1);
            if (!outcome.ok() && outcome.errorType() != null) {
                tx.hincrBy(toolKey, "error:" + outcome.errorType(), 1);
                if (turnId != null) {
                    tx.hset(turnKey(turnId), Map.of(ERROR_TYPE, outcome.errorType()));
                }
            }
        });
    }

    public void recordOpenRouterResult(String turnId, String model, ModelCallOutcome outcome) {
        String modelKey = metricsKey("model:" + model + ":openrouter");
        String latencyKey = metricsKey("model:" + model + ":latency");
        String tokensKey = metricsKey("model:" + model + ":tokens");
        store.transaction(tx -> {
            tx.hincrBy(modelKey, outcome.ok() ? "ok" : "fail", 1);
            if (!outcome.ok() && outcome.errorType() != null) {
                tx.hincrBy(modelKey, "error:" + outcome.errorType(), 1);
            }
            if (outcome.latencyMs() != null) {
                double latency = outcome.latencyMs();
                tx.hincrByFloat(latencyKey, "sum_ms", latency)
                        .hincrByFloat(latencyKey, "sum_sqr_ms", latency * latency)
                        .hincrBy(latencyKey, COUNT, 1);
            }
            if (outcome.tokensIn() != null) {
                tx.hincrBy(tokensKey, "in", outcome.tokensIn());
            }
            if (outcome.tokensOut() != null) {
                tx.hincrBy(tokensKey, "out", outcome.tokensOut());
            }
            if (turnId != null) {
                if (outcome.tokensIn() != null) {
                    tx.hincrBy(turnKey(turnId), TOKENS_IN, outcome.tokensIn());
                }
                if (outcome.tokensOut() != null) {
                    tx.hincrBy(turnKey(turnId), TOKENS_OUT, outcome.tokensOut());
                }
                if (!outcome.ok() && outcome.errorType() != null) {
                    tx.hset(turnKey(turnId), Map.of(ERROR_TYPE, outcome.errorType()));
                }
            }
        });
    }

    public void recordRateLimit(String token, String model, String reason) {
        String errorKey = "error:" + (reason != null && !reason.isBlank() ? reason : DEFAULT_RATE_LIMIT_REASON);
        store.transaction(tx -> {
            if (token != null) {
                tx.hincrBy(metricsKey("token:" + token + ":ratelimit"), "denied", 1);
            }
            if (model != null) {
                String modelKey = metricsKey("model:" + model + ":openrouter");
                tx.hincrBy(modelKey, "fail", 1).hincrBy(modelKey, errorKey, 1);
            }
        });
        log.warn("[Ledger] Rate limit recorded (model={}, reason={})", model, errorKey);
    }

    /**
     * Reads a metrics hash such as {@code tool:weather} or
     * {@code model:gpt-4o:latency}.
     */
    public Map<String, String> getMetrics(String suffix) {
        return store.hgetAll(metricsKey(suffix));
    }

    // ==================== Lifecycle ====================

    /**
     * Closes an open conversation and summarizes it unless it is a ghost.
     *
     * @return true when this call closed the conversation
     */
    public boolean closeConversation(String conversationId, String reason) {
        Map<String, String> hash = store.hgetAll(convKey(conversationId));
        if (hash.isEmpty()) {
            log.debug("[Ledger] Close skipped, conversation {} not found", conversationId);
            return false;
        }
        if (ConversationStatus.CLOSED.value().equals(hash.get(STATUS))) {
            return false;
        }
        String closeReason = reason != null && !reason.isBlank() ? reason : DEFAULT_CLOSE_REASON;
        boolean ghost = Boolean.parseBoolean(hash.get(GHOST));
        Instant now = clock.instant();
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(STATUS, ConversationStatus.CLOSED.value());
        fields.put(CLOSED_AT, now.toString());
        fields.put(CLOSE_REASON, closeReason);
        fields.put(LAST_TOUCHED_AT, now.toString());
        if (!ghost && summarizer != null) {
            // Overwritten by the summary outcome; stays when the summary write itself fails.
            fields.put(INDEXING_STATUS, "pending");
        }
        store.transaction(tx -> tx
                .hset(convKey(conversationId), fields)
                .zrem(key("convs:active"), conversationId)
                .zadd(key("convs:closed"), now.toEpochMilli(), conversationId));
        log.info("[Ledger] Closed conversation {} (reason={})", conversationId, closeReason);

        if (ghost) {
            log.info("[Ledger] Skipping summary for ghost conversation {}", conversationId);
            return true;
        }
        summarizeClosed(conversationId, closeReason, hash);
        return true;
    }

    private void summarizeClosed(String conversationId, String closeReason, Map<String, String> hash) {
        if (summarizer == null) {
            log.debug("[Ledger] No summarizer configured, conversation {} left unindexed", conversationId);
            return;
        }
        List<MessageRecord> messages = new ArrayList<>();
        for (MessageRecord record : getMessages(conversationId, null, null, null)) {
            String traceType = record.getTraceType();
            if (traceType == null || !traceType.startsWith(LLM_CALL_TRACE_PREFIX)) {
                messages.add(record);
            }
        }
        if (messages.size() > summaryMessageLimit) {
            messages = new ArrayList<>(messages.subList(messages.size() - summaryMessageLimit, messages.size()));
        }

        SummaryResult result;
        try {
            result = summarizer.summarize(conversationId, messages);
        } catch (RuntimeException e) {
            log.warn("[Ledger] Summarizer threw for {}: {}", conversationId, e.getMessage());
            result = SummaryResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        if (result == null) {
            result = SummaryResult.failed("empty summary result");
        }

        String convKey = convKey(conversationId);
        if (result.isFailed()) {
            String error = result.getSummaryError() != null ? result.getSummaryError() : "unknown";
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put(CLOSE_REASON, closeReason + "; summary_error:" + error);
            fields.put(INDEXING_STATUS, "failed");
            fields.put(INDEXING_ERROR, error);
            if (result.getFlags() != null) {
                fields.put(FLAGS, codec.toJson(result.getFlags()));
            }
            store.hset(convKey, fields);
            log.warn("[Ledger] Summary failed for conversation {}: {}", conversationId, error);
            return;
        }

        List<String> places = result.getPlaces() != null ? result.getPlaces() : List.of();
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(SUMMARY, result.getSummary() != null ? result.getSummary() : "");
        fields.put(TAGS, codec.toJson(nullToEmpty(result.getTags())));
        fields.put(KEYWORDS, codec.toJson(nullToEmpty(result.getKeywords())));
        fields.put(PLACE_TAGS, codec.mergeStringList(hash.get(PLACE_TAGS), places.toArray(new String[0])));
        fields.put(FLAGS, codec.toJson(result.getFlags() != null ? result.getFlags() : new SummaryResult.Flags()));
        fields.put(INDEXING_STATUS, "indexed");
        store.transaction(tx -> tx.hset(convKey, fields).hdel(convKey, INDEXING_ERROR));
        log.info("[Ledger] Indexed conversation {} ({} messages summarized)", conversationId, messages.size());
    }

    /**
     * Closes every active conversation last touched at or before
     * {@code nowMs - idleMs}. A failure on one id is logged and leaves it in
     * the active index for the next scan.
     *
     * @return number of conversations closed by this call
     */
    public int closeIfIdle(long nowMs) {
        List<String> idle = store.zrangeByScore(key("convs:active"), Double.NEGATIVE_INFINITY, (double) nowMs - idleMs);
        int closed = 0;
        for (String conversationId : idle) {
            try {
                if (closeConversation(conversationId, DEFAULT_CLOSE_REASON)) {
                    closed++;
                } else {
                    store.zrem(key("convs:active"), conversationId);
                }
            } catch (RuntimeException e) {
                log.warn("[Ledger] Failed to close idle conversation {}: {}", conversationId, e.getMessage());
            }
        }
        if (closed > 0) {
            log.info("[Ledger] Closed {} idle conversations", closed);
        }
        return closed;
    }

    public Conversation reopenConversation(String conversationId, String token) {
        Map<String, String> hash = store.hgetAll(convKey(conversationId));
        if (hash.isEmpty()) {
            return null;
        }
        Instant now = clock.instant();
        long nowMs = now.toEpochMilli();
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(STATUS, ConversationStatus.OPEN.value());
        fields.put(LAST_TOUCHED_AT, now.toString());
        fields.put(TOKEN_SET, codec.mergeStringList(hash.get(TOKEN_SET), token));
        store.transaction(tx -> {
            tx.hset(convKey(conversationId), fields)
                    .hdel(convKey(conversationId), CLOSED_AT, CLOSE_REASON)
                    .zrem(key("convs:closed"), conversationId)
                    .zadd(key("convs:active"), nowMs, conversationId);
            if (token != null) {
                tx.zadd(tokenConvsKey(token), nowMs, conversationId);
            }
        });
        log.info("[Ledger] Reopened conversation {}", conversationId);
        return getConversation(conversationId);
    }

    public boolean updateConversationFlags(String conversationId, SummaryResult.Flags flags) {
        if (!store.exists(convKey(conversationId))) {
            return false;
        }
        store.hset(convKey(conversationId), Map.of(FLAGS, codec.toJson(flags)));
        return true;
    }

    /**
     * Marks a conversation as ghost (never summarized) or not. A closed ghost
     * conversation cannot be un-ghosted since it was never indexed.
     */
    public boolean setGhost(String conversationId, boolean ghost) {
        Map<String, String> hash = store.hgetAll(convKey(conversationId));
        if (hash.isEmpty()) {
            return false;
        }
        boolean closed = ConversationStatus.CLOSED.value().equals(hash.get(STATUS));
        if (!ghost && closed && Boolean.parseBoolean(hash.get(GHOST))) {
            log.warn("[Ledger] Refusing to un-ghost closed conversation {}", conversationId);
            return false;
        }
        store.hset(convKey(conversationId), Map.of(GHOST, Boolean.toString(ghost)));
        return true;
    }

    public boolean deleteConversation(String conversationId) {
        String convKey = convKey(conversationId);
        Map<String, String> hash = store.hgetAll(convKey);
        if (hash.isEmpty() && !store.exists(convKey + ":msgs")) {
            return false;
        }
        List<String> tokens = codec.stringList(hash.get(TOKEN_SET));
        List<String> requestIds = store.zrangeByScore(convKey + ":requests",
                Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
        List<String> turnIds = store.zrangeByScore(convKey + ":turns",
                Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
        store.transaction(tx -> {
            tx.delete(convKey)
                    .delete(convKey + ":msgs")
                    .delete(convKey + ":requests")
                    .delete(convKey + ":turns")
                    .zrem(key("convs:active"), conversationId)
                    .zrem(key("convs:closed"), conversationId);
            for (String token : tokens) {
                tx.zrem(tokenConvsKey(token), conversationId);
            }
            for (String requestId : requestIds) {
                tx.delete(key("req:" + requestId));
            }
            for (String turnId : turnIds) {
                tx.delete(turnKey(turnId));
            }
        });
        log.info("[Ledger] Deleted conversation {} ({} requests, {} turns)", conversationId,
                requestIds.size(), turnIds.size());
        return true;
    }

    // ==================== Queries ====================

    public Conversation getConversation(String conversationId) {
        Map<String, String> hash = store.hgetAll(convKey(conversationId));
        if (hash.isEmpty()) {
            return null;
        }
        return toConversation(conversationId, hash);
    }

    /**
     * Finds past conversations by id, or by token / closed index filtered by
     * time window, place and keywords. Results are most recent first.
     */
    public List<RecallResult> recallConversation(RecallQuery query) {
        if (query.conversationId() != null && !query.conversationId().isBlank()) {
            Conversation conversation = getConversation(query.conversationId());
            if (conversation == null) {
                return List.of();
            }
            return List.of(new RecallResult(conversation, recallMessages(query, conversation.getId())));
        }

        String index = query.token() != null ? tokenConvsKey(query.token()) : key("convs:closed");
        double max = query.until() != null ? query.until().toEpochMilli() : Double.POSITIVE_INFINITY;
        double min = query.since() != null ? query.since().toEpochMilli() : Double.NEGATIVE_INFINITY;
        int limit = query.limit() != null && query.limit() > 0 ? query.limit() : DEFAULT_RECALL_LIMIT;

        List<RecallResult> results = new ArrayList<>();
        for (String conversationId : store.zrevrangeByScore(index, max, min, 0, -1)) {
            if (results.size() >= limit) {
                break;
            }
            Conversation conversation = getConversation(conversationId);
            if (conversation == null || !matchesPlace(conversation, query.place())
                    || !matchesKeywords(conversation, query.keywords())) {
                continue;
            }
            results.add(new RecallResult(conversation, recallMessages(query, conversationId)));
        }
        log.debug("[Ledger] Recall returned {} conversations", results.size());
        return results;
    }

    private List<MessageRecord> recallMessages(RecallQuery query, String conversationId) {
        if (!query.includeMessages()) {
            return null;
        }
        return getMessages(conversationId, query.messageLimit(), null, null);
    }

    private static boolean matchesPlace(Conversation conversation, String place) {
        if (place == null || place.isBlank() || conversation.getPlaceTags().isEmpty()) {
            return true;
        }
        return conversation.getPlaceTags().stream().anyMatch(tag -> tag.equalsIgnoreCase(place));
    }

    private static boolean matchesKeywords(Conversation conversation, List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return true;
        }
        StringBuilder haystack = new StringBuilder();
        if (conversation.getSummary() != null) {
            haystack.append(conversation.getSummary()).append(' ');
        }
        nullToEmpty(conversation.getTags()).forEach(tag -> haystack.append(tag).append(' '));
        nullToEmpty(conversation.getKeywords()).forEach(keyword -> haystack.append(keyword).append(' '));
        String text = haystack.toString().toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank() && text.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Lists conversations most recently touched first. Index entries whose
     * hash has disappeared are removed on the way.
     */
    public List<Conversation> listConversations(int limit, boolean includeOpen, boolean includeClosed) {
        int effectiveLimit = limit > 0 ? limit : DEFAULT_LIST_LIMIT;
        List<KeyValueStorePort.ScoredMember> entries = new ArrayList<>();
        if (includeOpen) {
            entries.addAll(store.zrevrange(key("convs:active"), 0, -1));
        }
        if (includeClosed) {
            entries.addAll(store.zrevrange(key("convs:closed"), 0, -1));
        }
        entries.sort((a, b) -> Double.compare(b.score(), a.score()));

        Set<String> seen = new LinkedHashSet<>();
        List<Conversation> result = new ArrayList<>();
        for (KeyValueStorePort.ScoredMember entry : entries) {
            if (result.size() >= effectiveLimit) {
                break;
            }
            if (!seen.add(entry.member())) {
                continue;
            }
            Conversation conversation = getConversation(entry.member());
            if (conversation == null) {
                log.debug("[Ledger] Removing stale index entry {}", entry.member());
                store.transaction(tx -> tx
                        .zrem(key("convs:active"), entry.member())
                        .zrem(key("convs:closed"), entry.member()));
                continue;
            }
            boolean open = conversation.isOpen();
            if ((open && includeOpen) || (!open && includeClosed)) {
                result.add(conversation);
            }
        }
        return result;
    }

    public ConversationCounts countConversations() {
        long active = store.zcard(key("convs:active"));
        long closed = store.zcard(key("convs:closed"));
        return new ConversationCounts(active, closed, active + closed);
    }

    public LedgerStatus getStatus() {
        Map<String, String> requests = store.hgetAll(metricsKey("requests"));
        Map<String, String> turns = store.hgetAll(metricsKey("turns"));

        Set<String> activeTokens = new LinkedHashSet<>();
        List<KeyValueStorePort.ScoredMember> active = store.zrevrange(key("convs:active"), 0, -1);
        for (KeyValueStorePort.ScoredMember entry : active) {
            activeTokens.addAll(codec.stringList(store.hget(convKey(entry.member()), TOKEN_SET)));
        }
        Instant lastActivity = active.isEmpty() ? null : Instant.ofEpochMilli((long) active.get(0).score());

        return LedgerStatus.builder()
                .namespace(namespace)
                .metricsNamespace(metricsNamespace)
                .idleMs(idleMs)
                .summarizerEnabled(summarizer != null)
                .activeConversations(active.size())
                .closedConversations(store.zcard(key("convs:closed")))
                .totalRequests(LedgerCodec.longValue(requests.get(COUNT), 0))
                .totalTurns(LedgerCodec.longValue(turns.get(COUNT), 0))
                .errorTurns(LedgerCodec.longValue(turns.get("error"), 0))
                .tokensActive(activeTokens.size())
                .lastActivityAt(lastActivity)
                .build();
    }

    private Conversation toConversation(String conversationId, Map<String, String> hash) {
        return Conversation.builder()
                .id(conversationId)
                .status(ConversationStatus.fromValue(hash.get(STATUS)))
                .startedAt(LedgerCodec.instant(hash.get(STARTED_AT)))
                .lastTouchedAt(LedgerCodec.instant(hash.get(LAST_TOUCHED_AT)))
                .closedAt(LedgerCodec.instant(hash.get(CLOSED_AT)))
                .closeReason(hash.get(CLOSE_REASON))
                .lastRequestAt(LedgerCodec.instant(hash.get(LAST_REQUEST_AT)))
                .modelSet(codec.stringList(hash.get(MODEL_SET)))
                .tokenSet(codec.stringList(hash.get(TOKEN_SET)))
                .placeTags(codec.stringList(hash.get(PLACE_TAGS)))
                .summary(hash.get(SUMMARY))
                .tags(hash.containsKey(TAGS) ? codec.stringList(hash.get(TAGS)) : null)
                .keywords(hash.containsKey(KEYWORDS) ? codec.stringList(hash.get(KEYWORDS)) : null)
                .flags(codec.fromJson(hash.get(FLAGS), SummaryResult.Flags.class))
                .userId(hash.get(USER_ID))
                .ghost(Boolean.parseBoolean(hash.get(GHOST)))
                .messageCount(LedgerCodec.longValue(hash.get(MESSAGE_COUNT), 0))
                .userAssistantCount(LedgerCodec.longValue(hash.get(USER_ASSISTANT_COUNT), 0))
                .toolCallCount(LedgerCodec.longValue(hash.get(TOOL_CALL_COUNT), 0))
                .errorCount(LedgerCodec.longValue(hash.get(ERROR_COUNT), 0))
                .requestCount(LedgerCodec.longValue(hash.get(REQUEST_COUNT), 0))
                .maxTurnLatencyMs(LedgerCodec.longValue(hash.get(MAX_TURN_LATENCY_MS)))
                .indexingStatus(hash.get(INDEXING_STATUS))
                .indexingError(hash.get(INDEXING_ERROR))
                .build();
    }

    private static List<String> nullToEmpty(List<String> values) {
        return values != null ? values : Collections.emptyList();
    }

    // ==================== Keys ====================

    private String key(String suffix) {
        return namespace + ":" + suffix;
    }

    private String metricsKey(String suffix) {
        return metricsNamespace + ":" + suffix;
    }

    private String convKey(String conversationId) {
        return key("conv:" + conversationId);
    }

    private String turnKey(String turnId) {
        return key("turn:" + turnId);
    }

    private String tokenConvsKey(String token) {
        return key("token:" + token + ":convs");
    }
}
