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

import me.golemcore.agent.domain.model.AgentEvent;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessageRole;
import me.golemcore.agent.domain.model.ModelCallOutcome;
import me.golemcore.agent.domain.service.ConversationLedgerService;
import me.golemcore.agent.domain.service.LedgerIds;
import me.golemcore.agent.domain.system.llm.CancellationSignal;
import me.golemcore.agent.domain.system.llm.LlmErrorClassifier;
import me.golemcore.agent.domain.system.llm.ModelCallResult;
import me.golemcore.agent.domain.system.llm.ModelCaller;
import me.golemcore.agent.domain.system.llm.RequestAbortedException;
import me.golemcore.agent.domain.system.llm.RetryingModelCaller;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Produces the user-facing reply from the context the router accumulated.
 *
 * <p>
 * Router-only system notes are removed, the persona prompt is prepended and
 * tool exchanges are flattened into plain system notes, since the response
 * model is called without tools. The tools used during the turn are listed,
 * and a forced stop appends its reason and the failing tools so the reply can
 * explain what went wrong.
 */
@Component
@Slf4j
public class ResponseGenerator {

    static final String FINISH_REASON_STOP = "stop";
    static final String USED_TOOLS_PREFIX = "Tools used this turn: ";

    private final ModelCaller modelCaller;
    private final ConversationLedgerService ledger;
    private final AgentProperties.LlmProperties llm;
    private final AgentProperties.RouterProperties router;

    public ResponseGenerator(ModelCaller modelCaller, ConversationLedgerService ledger, AgentProperties properties) {
        this.modelCaller = modelCaller;
        this.ledger = ledger;
        this.llm = properties.getLlm();
        this.router = properties.getRouter();
    }

    /**
     * Calls the response model once and emits {@code llm_call}, the
     * {@code delta} stream and {@code llm_call_complete}.
     *
     * @return the final assistant message, its id matching the deltas
     */
    public Message generate(List<Message> routerContext, RouterTurnState state, RouterRequest request,
            Consumer<AgentEvent> emit) {
        CancellationSignal signal = request.signal();
        signal.throwIfCancelled();
        List<Message> context = buildContext(routerContext, state);
        String model = llm.getResponseModel();
        LlmRequest llmRequest = LlmRequest.builder()
                .model(model)
                .messages(context)
                .maxTokens(llm.getResponseMaxTokens())
                .timeoutMs(llm.getResponseTimeoutMs())
                .build();

        emit.accept(new AgentEvent.LlmCallEvent(model, context, List.of()));
        long started = System.currentTimeMillis();
        ModelCallResult result;
        try {
            result = modelCaller.call(llmRequest, signal);
        } catch (RequestAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            String error = LlmErrorClassifier.describe(e);
            recordModel(request, model, ModelCallOutcome.builder()
                    .ok(false)
                    .latencyMs(System.currentTimeMillis() - started)
                    .errorType(LlmErrorClassifier.classify(e).value())
                    .build());
            log.error("[Router] Response generation failed: {}", error);
            emit.accept(new AgentEvent.ErrorEvent(error));
            throw e;
        }

        LlmUsage usage = result.getUsage();
        recordModel(request, model, ModelCallOutcome.builder()
                .ok(true)
                .latencyMs(result.getLatencyMs())
                .tokensIn(usage != null ? usage.getInputTokens() : null)
                .tokensOut(usage != null ? usage.getOutputTokens() : null)
                .build());

        String messageId = LedgerIds.newId("msg");
        String text = result.getText() != null ? result.getText() : "";
        emitText(messageId, text, emit);
        Message reply = Message.builder()
                .id(messageId)
                .role(MessageRole.ASSISTANT)
                .content(text)
                .build();
        emit.accept(new AgentEvent.LlmCallCompleteEvent(model, context, reply, usage, result.getLatencyMs()));
        log.debug("[Router] Response generated ({} chars, forced={}, tools={})", text.length(), state.isForced(),
                state.getUsedTools());
        return reply;
    }

    /**
     * Emits {@code text} as one delta followed by the terminating delta.
     */
    static void emitText(String messageId, String text, Consumer<AgentEvent> emit) {
        if (!text.isEmpty()) {
            emit.accept(new AgentEvent.DeltaEvent(messageId, text, null));
        }
        emit.accept(new AgentEvent.DeltaEvent(messageId, "", FINISH_REASON_STOP));
    }

    List<Message> buildContext(List<Message> routerContext, RouterTurnState state) {
        List<Message> context = new ArrayList<>();
        context.add(Message.system(router.getPersonaPrompt()));
        for (Message message : routerContext) {
            if (message.getRole() == MessageRole.SYSTEM) {
                if (!isToolingNote(message)) {
                    context.add(message);
                }
            } else if (message.getRole() == MessageRole.TOOL) {
                String name = message.getToolName() != null ? message.getToolName() : "tool";
                context.add(Message.system(name + " result:\n" + nullToEmpty(message.getContent())));
            } else if (message.hasToolCalls()) {
                if (message.getContent() != null && !message.getContent().isBlank()) {
                    context.add(Message.assistant(message.getContent()));
                }
            } else {
                context.add(message);
            }
        }
        List<String> usedTools = state.getUsedTools();
        if (!usedTools.isEmpty()) {
            context.add(Message.system(USED_TOOLS_PREFIX + String.join(", ", usedTools)));
        }
        if (state.isForced()) {
            StringBuilder failure = new StringBuilder("Tool loop capped: ").append(state.getForcedReason());
            String failedTools = state.describeFailedTools();
            if (failedTools != null) {
                failure.append('\n').append(failedTools);
            }
            context.add(Message.system(failure.toString()));
        }
        return context;
    }

    private boolean isToolingNote(Message message) {
        if (RetryingModelCaller.RETRY_NOTE_NAME.equals(message.getName())) {
            return true;
        }
        String content = message.getContent();
        if (content == null) {
            return false;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        return content.equals(RouterHarness.TOOL_FORMAT_INSTRUCTIONS)
                || content.equals(router.getSystemPrompt())
                || lower.startsWith("available tools:")
                || lower.startsWith("unavailable tools")
                || lower.contains("last attempt to call a tool failed")
                || lower.startsWith("tool loop capped")
                || lower.contains("failed tools:")
                || lower.startsWith("error: invalid tool name")
                || lower.startsWith("error: invalid json parameters");
    }

    private void recordModel(RouterRequest request, String model, ModelCallOutcome outcome) {
        try {
            ledger.recordOpenRouterResult(request.turnId(), model, outcome);
        } catch (RuntimeException e) {
            log.warn("[Router] Failed to record model metrics: {}", e.getMessage());
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
