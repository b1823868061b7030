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

import me.golemcore.agent.domain.model.AgentEvent;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessageRole;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Wraps {@link ModelCaller} with bounded retries.
 *
 * <p>
 * Tool-call validation failures and retryable call failures append a system
 * note to the caller's working context, record an {@code error} diagnostic and
 * back off before the next attempt. Authentication failures and aborts are
 * rethrown at once. When validation still fails on the last attempt the
 * invalid result is returned so the turn can continue.
 */
@Component
@Slf4j
public class RetryingModelCaller {

    /**
     * Name carried by the system notes this caller appends to the context.
     */
    public static final String RETRY_NOTE_NAME = "router.retry";

    private final ModelCaller modelCaller;
    private final AgentProperties.RetryProperties retry;

    public RetryingModelCaller(ModelCaller modelCaller, AgentProperties properties) {
        this.modelCaller = modelCaller;
        this.retry = properties.getRetry();
    }

    /**
     * @param context
     *            working context; retry notes are appended to it in place
     * @param template
     *            model settings; its message list is replaced by {@code context}
     * @param toolNames
     *            names the model may call
     */
    public RetryResult callWithRetry(List<Message> context, LlmRequest template, Collection<String> toolNames,
            CancellationSignal signal) {
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        List<AgentEvent.ErrorEvent> errorEvents = new ArrayList<>();
        List<LlmCallException.Kind> failedAttempts = new ArrayList<>();
        RuntimeException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            signal.throwIfCancelled();
            LlmRequest request = template.toBuilder().messages(new ArrayList<>(context)).build();
            ModelCallResult result;
            try {
                result = modelCaller.call(request, signal);
            } catch (RequestAbortedException e) {
                throw e;
            } catch (RuntimeException e) {
                LlmCallException.Kind kind = LlmErrorClassifier.classify(e);
                if (signal.isCancelled() || kind == LlmCallException.Kind.ABORTED) {
                    throw new RequestAbortedException(RequestAbortedException.DEFAULT_MESSAGE, e);
                }
                if (kind == LlmCallException.Kind.AUTH) {
                    log.warn("[Retry] Authentication failure from model {}, not retrying", template.getModel());
                    throw e;
                }
                lastError = e;
                failedAttempts.add(kind);
                if (attempt == maxAttempts) {
                    break;
                }
                String note = "Error: " + LlmErrorClassifier.describe(e);
                context.add(retryNote(note));
                errorEvents.add(AgentEvent.ErrorEvent.retryNote(note));
                long backoffMs = kind == LlmCallException.Kind.RATE_LIMIT
                        ? attempt * retry.getRateLimitBackoffMs()
                        : retry.getGenericBackoffMs();
                log.warn("[Retry] Attempt {}/{} failed ({}), retrying in {}ms: {}", attempt, maxAttempts,
                        kind.value(), backoffMs, LlmErrorClassifier.describe(e));
                sleepBeforeRetry(backoffMs, signal);
                continue;
            }

            String validationError = validate(result, toolNames);
            if (validationError == null) {
                return new RetryResult(result, errorEvents, attempt, failedAttempts);
            }
            if (attempt == maxAttempts) {
                log.warn("[Retry] Returning invalid model output after {} attempts: {}", attempt, validationError);
                return new RetryResult(result, errorEvents, attempt, failedAttempts);
            }
            context.add(retryNote(validationError));
            errorEvents.add(AgentEvent.ErrorEvent.retryNote(validationError));
            log.debug("[Retry] Attempt {}/{} rejected: {}", attempt, maxAttempts, validationError);
            sleepBeforeRetry(retry.getValidationBackoffMs(), signal);
        }

        LlmCallException.Kind kind = LlmErrorClassifier.classify(lastError);
        throw new LlmCallException(kind, "max retries exceeded: " + LlmErrorClassifier.describe(lastError),
                lastError);
    }

    private static Message retryNote(String content) {
        return Message.builder()
                .role(MessageRole.SYSTEM)
                .name(RETRY_NOTE_NAME)
                .content(content)
                .build();
    }

    /**
     * Returns the correction note for the first invalid tool call, or
     * {@code null} when the result is acceptable.
     */
    String validate(ModelCallResult result, Collection<String> toolNames) {
        if (!result.hasToolCalls()) {
            return null;
        }
        for (Message.ToolCall call : result.getToolCalls()) {
            if (!toolNames.contains(call.getName())) {
                return "Error: Invalid tool name: " + call.getName() + ". Available tools: "
                        + String.join(", ", toolNames);
            }
            try {
                modelCaller.getNormalizer().parseArguments(call.getArguments());
            } catch (JsonProcessingException e) {
                return "Error: Invalid JSON parameters for tool " + call.getName() + ": " + e.getOriginalMessage();
            }
        }
        return null;
    }

    /**
     * Waits before the next attempt. Returns early and throws
     * {@link RequestAbortedException} when the signal is cancelled.
     */
    protected void sleepBeforeRetry(long backoffMs, CancellationSignal signal) {
        if (backoffMs <= 0) {
            signal.throwIfCancelled();
            return;
        }
        CountDownLatch latch = new CountDownLatch(1);
        Runnable unregister = signal.onCancel(latch::countDown);
        try {
            latch.await(backoffMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestAbortedException("Interrupted during retry backoff", e);
        } finally {
            unregister.run();
        }
        signal.throwIfCancelled();
    }
}
