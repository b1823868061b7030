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

import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.port.outbound.LlmPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Performs one request against the model provider.
 *
 * <p>
 * Applies the request's hard timeout and the caller's cancellation signal to
 * the provider future, normalizes tool calls once, and copies token usage only
 * when the provider reports it. Never retries.
 */
@Component
@Slf4j
public class ModelCaller {

    private final LlmPort llmPort;
    private final ToolCallNormalizer normalizer;

    public ModelCaller(LlmPort llmPort, ObjectMapper objectMapper) {
        this.llmPort = llmPort;
        this.normalizer = new ToolCallNormalizer(objectMapper);
    }

    public ToolCallNormalizer getNormalizer() {
        return normalizer;
    }

    /**
     * @throws LlmCallException
     *             on provider failure or timeout
     * @throws RequestAbortedException
     *             when the signal is cancelled before or during the call
     */
    public ModelCallResult call(LlmRequest request, CancellationSignal signal) {
        signal.throwIfCancelled();
        long startMs = System.currentTimeMillis();
        log.debug("[LLM] Calling model {} with {} messages, {} tools", request.getModel(),
                request.getMessages().size(), request.hasTools() ? request.getTools().size() : 0);

        CompletableFuture<LlmResponse> future = llmPort.chat(request);
        Runnable unregister = signal.onCancel(() -> future.cancel(true));
        LlmResponse response;
        try {
            response = request.getTimeoutMs() > 0
                    ? future.get(request.getTimeoutMs(), TimeUnit.MILLISECONDS)
                    : future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LlmCallException(LlmCallException.Kind.TIMEOUT,
                    "Model call timed out after " + request.getTimeoutMs() + "ms", e);
        } catch (CancellationException e) {
            throw new RequestAbortedException(RequestAbortedException.DEFAULT_MESSAGE, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RequestAbortedException(RequestAbortedException.DEFAULT_MESSAGE, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (signal.isCancelled()) {
                throw new RequestAbortedException(RequestAbortedException.DEFAULT_MESSAGE, cause);
            }
            if (cause instanceof LlmCallException || cause instanceof RequestAbortedException) {
                throw (RuntimeException) cause;
            }
            throw new LlmCallException(LlmErrorClassifier.classify(cause), LlmErrorClassifier.describe(cause),
                    cause);
        } finally {
            unregister.run();
        }

        if (response == null) {
            throw new LlmCallException(LlmCallException.Kind.OTHER, "Model returned no response");
        }

        long latencyMs = System.currentTimeMillis() - startMs;
        List<Message.ToolCall> toolCalls = normalizer.normalize(response.getToolCalls());
        String text = response.getContent();
        Message message = Message.assistant(text != null ? text : "", toolCalls.isEmpty() ? null : toolCalls);
        log.debug("[LLM] Model {} answered in {}ms: {} chars, {} tool calls", request.getModel(), latencyMs,
                text != null ? text.length() : 0, toolCalls.size());

        return ModelCallResult.builder()
                .text(text)
                .toolCalls(toolCalls)
                .usage(response.getUsage())
                .model(response.getModel() != null ? response.getModel() : request.getModel())
                .latencyMs(latencyMs)
                .message(message)
                .build();
    }
}
