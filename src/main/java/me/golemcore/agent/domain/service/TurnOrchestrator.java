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
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessageRecord;
import me.golemcore.agent.domain.model.MessageRole;
import me.golemcore.agent.domain.model.StartRequestOptions;
import me.golemcore.agent.domain.model.StartRequestResult;
import me.golemcore.agent.domain.model.TurnOutcome;
import me.golemcore.agent.domain.model.TurnStatus;
import me.golemcore.agent.domain.system.llm.CancellationSignal;
import me.golemcore.agent.domain.system.llm.LlmCallException;
import me.golemcore.agent.domain.system.llm.LlmErrorClassifier;
import me.golemcore.agent.domain.system.llm.RetryingModelCaller;
import me.golemcore.agent.domain.system.router.RouterHarness;
import me.golemcore.agent.domain.system.router.RouterRequest;
import me.golemcore.agent.domain.system.stream.DelegateSequencer;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.RecollectionPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of a turn: binds it to a conversation, runs recollection and the
 * router in sequence, mirrors every event into the conversation ledger and
 * closes the turn with its outcome.
 *
 * <p>
 * Deltas, errors and recollections are always streamed to the caller; model
 * and tool events, and the diagnostics of retried model calls, only when the
 * input asks for a trace. The orchestrator keeps no state between turns.
 */
@Service
@Slf4j
public class TurnOrchestrator {

    private static final int HISTORY_LIMIT = 20;
    private static final String ERROR_MESSAGE_NAME = "orchestrator.error";
    private static final String RETRY_TRACE_TYPE = "retry";

    private final ConversationLedgerService ledger;
    private final RouterHarness routerHarness;
    private final ObjectProvider<RecollectionPort> recollectionPort;
    private final AgentProperties properties;

    public TurnOrchestrator(ConversationLedgerService ledger, RouterHarness routerHarness,
            ObjectProvider<RecollectionPort> recollectionPort, AgentProperties properties) {
        this.ledger = ledger;
        this.routerHarness = routerHarness;
        this.recollectionPort = recollectionPort;
        this.properties = properties;
    }

    public TurnHandle run(TurnInput input, CancellationSignal signal) {
        long startedAt = System.currentTimeMillis();
        String model = input.model() != null ? input.model() : properties.getLlm().getRouterModel();
        StartRequestResult request = ledger.startRequest(input.token(), model, StartRequestOptions.builder()
                .conversationId(input.conversationId())
                .place(input.place())
                .userId(input.userId())
                .ghost(input.ghost())
                .clientMeta(input.clientMeta())
                .build());
        String conversationId = request.conversationId();
        String turnId = ledger.startTurn(request.requestId(), conversationId, input.token(), model, null);

        List<Message> history = loadHistory(conversationId);
        if (!input.messages().isEmpty()) {
            ledger.appendMessages(conversationId, input.messages());
        }
        List<Message> routerMessages = new ArrayList<>(history);
        routerMessages.addAll(input.messages());

        DelegateSequencer<AgentEvent> sequencer = new DelegateSequencer<>();
        RecollectionPort recollection = recollectionPort.getIfAvailable();
        if (recollection != null) {
            sequencer.chain(recollection.recall(conversationId, input.messages())
                    .cast(AgentEvent.class)
                    .onErrorResume(error -> {
                        log.warn("[Orchestrator] Recollection failed for {}: {}", conversationId, error.getMessage());
                        return Flux.empty();
                    }));
        }
        sequencer.chain(routerHarness.run(RouterRequest.builder()
                .conversationId(conversationId)
                .requestId(request.requestId())
                .turnId(turnId)
                .token(input.token())
                .messages(routerMessages)
                .signal(signal)
                .build()));
        sequencer.done();

        TurnRun run = new TurnRun(input, model, request, turnId, startedAt);
        Flux<AgentEvent> events = sequencer.sequence()
                .doOnNext(run::mirror)
                .concatWith(Flux.defer(() -> {
                    run.complete();
                    return Flux.empty();
                }))
                .onErrorResume(error -> Flux.just(run.fail(error)))
                .filter(event -> input.trace() || isAlwaysEmitted(event))
                .doOnCancel(() -> {
                    signal.cancel();
                    run.fail(new LlmCallException(LlmCallException.Kind.ABORTED, "Subscriber cancelled"));
                });

        log.info("[Orchestrator] Turn {} started (conversation={}, new={})", turnId, conversationId,
                request.isNewConversation());
        return new TurnHandle(conversationId, request.requestId(), turnId, events, run.result.asMono());
    }

    private List<Message> loadHistory(String conversationId) {
        List<Message> history = new ArrayList<>();
        for (MessageRecord record : ledger.getMessages(conversationId, HISTORY_LIMIT, null, null)) {
            boolean dialogue = record.getRole() == MessageRole.USER || record.getRole() == MessageRole.ASSISTANT;
            if (dialogue && !record.isStructured()) {
                history.add(record.toMessage());
            }
        }
        return history;
    }

    /**
     * Retry diagnostics of a model call that later succeeded are trace-only.
     */
    static boolean isAlwaysEmitted(AgentEvent event) {
        if (event instanceof AgentEvent.ErrorEvent error) {
            return !error.recovered();
        }
        return event instanceof AgentEvent.DeltaEvent
                || event instanceof AgentEvent.RecollectionEvent;
    }

    /**
     * Per-turn mirroring and completion state.
     */
    private final class TurnRun {

        private final TurnInput input;
        private final String model;
        private final StartRequestResult request;
        private final String turnId;
        private final long startedAt;
        private final ConversationLedgerService.TraceContext trace;
        private final Map<String, StringBuilder> pendingDeltas = new HashMap<>();
        private final List<Message> assistantMessages = new ArrayList<>();
        private final AtomicBoolean finished = new AtomicBoolean();
        private final Sinks.One<TurnResult> result = Sinks.one();
        private String llmCallMessageId;

        private TurnRun(TurnInput input, String model, StartRequestResult request, String turnId, long startedAt) {
            this.input = input;
            this.model = model;
            this.request = request;
            this.turnId = turnId;
            this.startedAt = startedAt;
            this.trace = new ConversationLedgerService.TraceContext(request.conversationId(), request.requestId(),
                    turnId, null);
        }

        void mirror(AgentEvent event) {
            try {
                if (event instanceof AgentEvent.LlmCallEvent llmCall) {
                    llmCallMessageId = LedgerIds.newId("msg");
                    ledger.recordLlmCallStart(trace.withMessageId(llmCallMessageId), llmCall);
                } else if (event instanceof AgentEvent.LlmCallCompleteEvent complete) {
                    ledger.recordLlmCallComplete(trace.withMessageId(llmCallMessageId), complete);
                } else if (event instanceof AgentEvent.ToolCallEvent toolCall) {
                    ledger.recordToolCallStart(trace, toolCall);
                } else if (event instanceof AgentEvent.ToolCallCompleteEvent toolResult) {
                    ledger.recordToolCallComplete(trace, toolResult);
                } else if (event instanceof AgentEvent.DeltaEvent delta) {
                    mirrorDelta(delta);
                } else if (event instanceof AgentEvent.ErrorEvent error) {
                    if (error.recovered()) {
                        appendRetryNote(error.error());
                    } else {
                        appendError(error.error());
                    }
                }
            } catch (RuntimeException e) {
                log.warn("[Orchestrator] Failed to mirror {} event for turn {}: {}", event.type(), turnId,
                        e.getMessage());
            }
        }

        private void mirrorDelta(AgentEvent.DeltaEvent delta) {
            StringBuilder text = pendingDeltas.computeIfAbsent(delta.messageId(), id -> new StringBuilder());
            if (delta.delta() != null) {
                text.append(delta.delta());
            }
            if (!delta.isFinal()) {
                return;
            }
            pendingDeltas.remove(delta.messageId());
            Message message = Message.builder()
                    .id(delta.messageId())
                    .role(MessageRole.ASSISTANT)
                    .content(text.toString())
                    .build();
            assistantMessages.add(message);
            ledger.appendMessages(request.conversationId(), List.of(message));
        }

        private void appendError(String error) {
            Message message = Message.system(error);
            message.setName(ERROR_MESSAGE_NAME);
            ledger.appendMessages(request.conversationId(), List.of(message));
        }

        private void appendRetryNote(String note) {
            Message message = Message.system(note);
            message.setName(RetryingModelCaller.RETRY_NOTE_NAME);
            message.setMetadata(Map.of("traceType", RETRY_TRACE_TYPE));
            ledger.appendMessages(request.conversationId(), List.of(message));
        }

        void complete() {
            if (!finished.compareAndSet(false, true)) {
                return;
            }
            long latencyMs = System.currentTimeMillis() - startedAt;
            try {
                ledger.endTurn(turnId, TurnOutcome.ok(latencyMs));
                ledger.completeRequest(request.requestId(), latencyMs);
            } catch (RuntimeException e) {
                log.warn("[Orchestrator] Failed to close turn {} in the ledger: {}", turnId, e.getMessage());
            }
            result.tryEmitValue(new TurnResult(request.conversationId(), request.requestId(), turnId, TurnStatus.OK,
                    List.copyOf(assistantMessages), null, latencyMs));
        }

        AgentEvent.ErrorEvent fail(Throwable error) {
            String message = LlmErrorClassifier.describe(error);
            AgentEvent.ErrorEvent event = new AgentEvent.ErrorEvent(message);
            if (!finished.compareAndSet(false, true)) {
                return event;
            }
            long latencyMs = System.currentTimeMillis() - startedAt;
            LlmCallException.Kind kind = LlmErrorClassifier.classify(error);
            log.error("[Orchestrator] Turn {} failed ({}): {}", turnId, kind.value(), message);
            try {
                ledger.endTurn(turnId, TurnOutcome.error(kind.value(), latencyMs));
                if (kind == LlmCallException.Kind.RATE_LIMIT) {
                    ledger.recordRateLimit(input.token(), model, kind.value());
                }
                appendError(message);
                ledger.completeRequest(request.requestId(), latencyMs);
            } catch (RuntimeException e) {
                log.warn("[Orchestrator] Failed to record failure of turn {}: {}", turnId, e.getMessage());
            }
            result.tryEmitValue(new TurnResult(request.conversationId(), request.requestId(), turnId,
                    TurnStatus.ERROR, List.copyOf(assistantMessages), kind.value(), latencyMs));
            return event;
        }
    }
}
