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

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.AgentEvent;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ModelCallOutcome;
import me.golemcore.agent.domain.model.ToolCallOutcome;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.service.ConversationLedgerService;
import me.golemcore.agent.domain.service.LedgerIds;
import me.golemcore.agent.domain.system.llm.CancellationSignal;
import me.golemcore.agent.domain.system.llm.LlmCallException;
import me.golemcore.agent.domain.system.llm.LlmErrorClassifier;
import me.golemcore.agent.domain.system.llm.ModelCallResult;
import me.golemcore.agent.domain.system.llm.RequestAbortedException;
import me.golemcore.agent.domain.system.llm.RetryResult;
import me.golemcore.agent.domain.system.llm.RetryingModelCaller;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Bounded decide / act / respond loop for one turn.
 *
 * <p>
 * Each iteration asks the router model for tool calls, rejects structurally
 * invalid rounds with a correction note, drops duplicates and calls with
 * impossible coordinates, then either executes the remaining calls
 * concurrently or moves to responding. Responding happens when the model
 * answers in plain text, proposes nothing runnable, calls {@code respond}, or
 * when the loop is forced to stop (identical round repeated, tool failing
 * repeatedly). Running out of iterations without any of these produces an
 * emergency response followed by an {@code error} event. Calls that failed
 * inside a retried model invocation are still counted in the ledger.
 *
 * <p>
 * Events are emitted in order on a bounded-elastic worker. Cancelling the
 * request signal, or the subscription, ends the stream with
 * {@link RequestAbortedException} and no forced response.
 */
@Component
@Slf4j
public class RouterHarness {

    public static final String RESPOND_TOOL = "respond";

    public static final String TOOL_FORMAT_INSTRUCTIONS = "When you need a tool, call it through the function-calling "
            + "interface with a JSON object of arguments that matches its schema. Use only the listed tools, give every "
            + "call a distinct id, and do not repeat a call whose result you already have. When you have what you need, "
            + "call \"respond\" with no arguments instead of answering directly.";

    static final String MAX_ITERATIONS_ERROR = "Router harness reached maximum turn limit";

    private static final ToolDefinition RESPOND_DEFINITION = ToolDefinition.simple(RESPOND_TOOL,
            "Finish tool use and hand over to the final answer.");

    private final RetryingModelCaller retryingModelCaller;
    private final ResponseGenerator responseGenerator;
    private final ConversationLedgerService ledger;
    private final List<ToolComponent> tools;
    private final ToolCallSignatures signatures;
    private final AgentProperties.LlmProperties llm;
    private final AgentProperties.RouterProperties router;

    public RouterHarness(RetryingModelCaller retryingModelCaller, ResponseGenerator responseGenerator,
            ConversationLedgerService ledger, List<ToolComponent> tools, ObjectMapper objectMapper,
            AgentProperties properties) {
        this.retryingModelCaller = retryingModelCaller;
        this.responseGenerator = responseGenerator;
        this.ledger = ledger;
        this.tools = tools;
        this.signatures = new ToolCallSignatures(objectMapper);
        this.llm = properties.getLlm();
        this.router = properties.getRouter();
    }

    public Flux<AgentEvent> run(RouterRequest request) {
        return Flux.<AgentEvent>create(sink -> {
            sink.onCancel(request.signal()::cancel);
            try {
                execute(request, sink::next);
                sink.complete();
            } catch (RuntimeException e) {
                sink.error(e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Runs the loop synchronously, passing each event to {@code emit}.
     */
    void execute(RouterRequest request, Consumer<AgentEvent> emit) {
        CancellationSignal signal = request.signal();
        RouterTurnState state = new RouterTurnState();
        ToolAvailability availability = ToolAvailability.evaluate(tools);

        List<String> toolNames = new ArrayList<>(availability.ready().keySet());
        toolNames.add(RESPOND_TOOL);
        List<ToolDefinition> definitions = availability.definitions();
        definitions.add(RESPOND_DEFINITION);

        List<Message> context = prepareContext(request.messages(), availability, toolNames);
        LlmRequest template = LlmRequest.builder()
                .model(llm.getRouterModel())
                .tools(definitions)
                .temperature(llm.getTemperature())
                .maxTokens(llm.getMaxTokens())
                .timeoutMs(llm.getTimeoutMs())
                .build();
        String model = template.getModel();
        int maxIterations = Math.max(1, router.getMaxIterations());

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            signal.throwIfCancelled();
            emit.accept(new AgentEvent.LlmCallEvent(model, context, toolNames));
            RetryResult retry = callRouterModel(context, template, toolNames, request);
            retry.errorEvents().forEach(emit);
            ModelCallResult result = retry.result();
            emit.accept(new AgentEvent.LlmCallCompleteEvent(model, context, result.getMessage(), result.getUsage(),
                    result.getLatencyMs()));

            List<Message.ToolCall> calls = result.hasToolCalls() ? result.getToolCalls() : List.of();
            List<ToolCallValidator.Violation> violations = ToolCallValidator.validate(calls, toolNames,
                    router.getMaxParallelToolCalls());
            if (!violations.isEmpty()) {
                String correction = ToolCallValidator.buildCorrectionMessage(violations);
                log.debug("[Router] Iteration {} rejected: {}", iteration, correction);
                context.add(Message.system(correction));
                continue;
            }

            if (calls.isEmpty() && result.hasText()) {
                finishWithRouterText(result, emit);
                return;
            }

            List<Message.ToolCall> runnable = selectRunnable(calls, request);
            if (!runnable.isEmpty()) {
                int seen = state.recordSignature(signatures.roundSignature(runnable));
                if (seen >= router.getLoopCapThreshold()) {
                    state.forceRespond("Tool \"" + runnable.get(0).getName()
                            + "\" was requested with identical parameters " + seen + " times");
                }
            }
            if (state.isForced() || result.isEmpty() || runnable.isEmpty()) {
                log.debug("[Router] Responding after iteration {} (forced={}, runnable={})", iteration,
                        state.isForced(), runnable.size());
                responseGenerator.generate(context, state, request, emit);
                return;
            }

            executeRound(runnable, result, context, state, request, availability, emit);
            if (state.isForced()) {
                signal.throwIfCancelled();
                log.info("[Router] Forced response after iteration {}: {}", iteration, state.getForcedReason());
                responseGenerator.generate(context, state, request, emit);
                return;
            }
        }

        log.warn("[Router] Reached {} iterations without responding", maxIterations);
        responseGenerator.generate(context, state, request, emit);
        emit.accept(new AgentEvent.ErrorEvent(MAX_ITERATIONS_ERROR));
    }

    private List<Message> prepareContext(List<Message> messages, ToolAvailability availability,
            List<String> toolNames) {
        List<Message> context = new ArrayList<>();
        context.add(Message.system(router.getSystemPrompt()));
        context.add(Message.system(TOOL_FORMAT_INSTRUCTIONS));
        context.add(Message.system(availability.note(toolNames)));
        context.addAll(messages);
        return context;
    }

    private RetryResult callRouterModel(List<Message> context, LlmRequest template, List<String> toolNames,
            RouterRequest request) {
        long started = System.currentTimeMillis();
        RetryResult retry;
        try {
            retry = retryingModelCaller.callWithRetry(context, template, toolNames, request.signal());
        } catch (RequestAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            recordModel(request, template.getModel(), ModelCallOutcome.builder()
                    .ok(false)
                    .latencyMs(System.currentTimeMillis() - started)
                    .errorType(LlmErrorClassifier.classify(e).value())
                    .build());
            throw e;
        }
        LlmUsage usage = retry.result().getUsage();
        recordModel(request, template.getModel(), ModelCallOutcome.builder()
                .ok(true)
                .latencyMs(retry.result().getLatencyMs())
                .tokensIn(usage != null ? usage.getInputTokens() : null)
                .tokensOut(usage != null ? usage.getOutputTokens() : null)
                .build());
        for (LlmCallException.Kind kind : retry.failedAttempts()) {
            if (kind == LlmCallException.Kind.RATE_LIMIT) {
                recordRateLimit(request, template.getModel());
            } else {
                recordModel(request, template.getModel(), ModelCallOutcome.builder()
                        .ok(false)
                        .errorType(kind.value())
                        .build());
            }
        }
        return retry;
    }

    private void finishWithRouterText(ModelCallResult result, Consumer<AgentEvent> emit) {
        String messageId = LedgerIds.newId("msg");
        ResponseGenerator.emitText(messageId, result.getText(), emit);
        log.debug("[Router] Router answered directly ({} chars)", result.getText().length());
    }

    /**
     * Non-respond calls of the round after deduplication and the coordinate
     * check. A {@code respond} call is recorded as a tool use.
     */
    private List<Message.ToolCall> selectRunnable(List<Message.ToolCall> calls, RouterRequest request) {
        List<Message.ToolCall> candidates = new ArrayList<>();
        for (Message.ToolCall call : calls) {
            if (RESPOND_TOOL.equals(call.getName())) {
                recordTool(request, RESPOND_TOOL, ToolCallOutcome.success(0));
                continue;
            }
            if (signatures.hasInvalidCoordinates(call)) {
                log.debug("[Router] Dropping call {} with invalid coordinates", call.getName());
                continue;
            }
            candidates.add(call);
        }
        return signatures.deduplicate(candidates);
    }

    private void executeRound(List<Message.ToolCall> runnable, ModelCallResult result, List<Message> context,
            RouterTurnState state, RouterRequest request, ToolAvailability availability, Consumer<AgentEvent> emit) {
        for (Message.ToolCall call : runnable) {
            emit.accept(new AgentEvent.ToolCallEvent(AgentEvent.ToolCallPayload.of(call)));
        }
        List<ToolExecution> executions = executeConcurrently(runnable, availability, request.signal());

        context.add(Message.assistant(result.getText(), new ArrayList<>(runnable)));
        for (ToolExecution execution : executions) {
            Message.ToolCall call = execution.call();
            context.add(Message.tool(call.getId(), call.getName(), execution.content()));
            recordTool(request, call.getName(), execution.failed()
                    ? ToolCallOutcome.failure(execution.latencyMs(), execution.errorType())
                    : ToolCallOutcome.success(execution.latencyMs()));
            emit.accept(new AgentEvent.ToolCallCompleteEvent(AgentEvent.ToolCallPayload.of(call),
                    execution.content()));

            int streak = state.recordToolOutcome(call.getName(), execution.failed(),
                    execution.failed() ? execution.content() : null);
            if (streak >= router.getFailureStreakThreshold()) {
                state.forceRespond("Tool \"" + call.getName() + "\" failed " + streak + " times consecutively");
            }
        }
    }

    private List<ToolExecution> executeConcurrently(List<Message.ToolCall> calls, ToolAvailability availability,
            CancellationSignal signal) {
        List<CompletableFuture<ToolExecution>> futures = new ArrayList<>();
        for (Message.ToolCall call : calls) {
            futures.add(startExecution(call, availability.ready().get(call.getName())));
        }
        Runnable unregister = signal.onCancel(() -> futures.forEach(future -> future.cancel(true)));
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestAbortedException("Interrupted while executing tools", e);
        } catch (CancellationException e) {
            throw new RequestAbortedException(RequestAbortedException.DEFAULT_MESSAGE, e);
        } catch (ExecutionException e) {
            if (signal.isCancelled()) {
                throw new RequestAbortedException(RequestAbortedException.DEFAULT_MESSAGE, e.getCause());
            }
            throw new IllegalStateException("Tool execution failed unexpectedly", e.getCause());
        } finally {
            unregister.run();
        }
        signal.throwIfCancelled();

        List<ToolExecution> executions = new ArrayList<>(futures.size());
        for (CompletableFuture<ToolExecution> future : futures) {
            executions.add(future.join());
        }
        return executions;
    }

    private CompletableFuture<ToolExecution> startExecution(Message.ToolCall call, ToolComponent tool) {
        long started = System.currentTimeMillis();
        if (tool == null) {
            return CompletableFuture.completedFuture(new ToolExecution(call,
                    "Error: tool \"" + call.getName() + "\" is not available", true, 0, "not_available"));
        }
        CompletableFuture<ToolResult> future;
        try {
            Map<String, Object> parameters = signatures.parseArguments(call.getArguments());
            future = tool.execute(parameters);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.handle((toolResult, error) -> {
            long latencyMs = System.currentTimeMillis() - started;
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                log.warn("[Router] Tool {} threw: {}", call.getName(), cause.getMessage());
                String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                return new ToolExecution(call, "Error: " + message, true, latencyMs, "exception");
            }
            if (toolResult == null) {
                return new ToolExecution(call, "Error: tool returned no result", true, latencyMs, "empty_result");
            }
            String content = toolResult.toMessageContent();
            boolean failed = !toolResult.isSuccess() || content.toLowerCase(Locale.ROOT).startsWith("error");
            return new ToolExecution(call, content, failed, latencyMs, failed ? "tool_error" : null);
        });
    }

    private void recordModel(RouterRequest request, String model, ModelCallOutcome outcome) {
        try {
            ledger.recordOpenRouterResult(request.turnId(), model, outcome);
        } catch (RuntimeException e) {
            log.warn("[Router] Failed to record model metrics: {}", e.getMessage());
        }
    }

    private void recordRateLimit(RouterRequest request, String model) {
        try {
            ledger.recordRateLimit(request.token(), model, LlmCallException.Kind.RATE_LIMIT.value());
        } catch (RuntimeException e) {
            log.warn("[Router] Failed to record rate limit: {}", e.getMessage());
        }
    }

    private void recordTool(RouterRequest request, String toolName, ToolCallOutcome outcome) {
        try {
            ledger.recordToolResult(request.turnId(), toolName, outcome);
        } catch (RuntimeException e) {
            log.warn("[Router] Failed to record metrics for tool {}: {}", toolName, e.getMessage());
        }
    }

    private record ToolExecution(Message.ToolCall call, String content, boolean failed, long latencyMs,
            String errorType) {
    }
}
