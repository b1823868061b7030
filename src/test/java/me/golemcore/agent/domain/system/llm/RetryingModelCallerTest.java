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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RetryingModelCallerTest {

    private static final List<String> TOOLS = List.of("weather", "respond");

    private ModelCaller modelCaller;
    private List<Long> backoffs;
    private RetryingModelCaller retryingCaller;

    @BeforeEach
    void setUp() {
        modelCaller = mock(ModelCaller.class);
        when(modelCaller.getNormalizer()).thenReturn(new ToolCallNormalizer(new ObjectMapper()));
        backoffs = new ArrayList<>();
        retryingCaller = new RetryingModelCaller(modelCaller, new AgentProperties()) {
            @Override
            protected void sleepBeforeRetry(long backoffMs, CancellationSignal signal) {
                backoffs.add(backoffMs);
            }
        };
    }

    private static LlmRequest template() {
        return LlmRequest.builder().model("router-model").timeoutMs(1000).build();
    }

    private static ModelCallResult toolResult(String name, String arguments) {
        List<Message.ToolCall> calls = List.of(Message.ToolCall.builder()
                .id("call_1").name(name).arguments(arguments).build());
        return ModelCallResult.builder()
                .toolCalls(calls)
                .message(Message.assistant("", calls))
                .model("router-model")
                .build();
    }

    private static ModelCallResult textResult(String text) {
        return ModelCallResult.builder()
                .text(text)
                .toolCalls(List.of())
                .message(Message.assistant(text))
                .model("router-model")
                .build();
    }

    @Test
    void shouldReturnFirstValidResult() {
        ModelCallResult ok = toolResult("weather", "{\"city\":\"Oslo\"}");
        when(modelCaller.call(any(), any())).thenReturn(ok);
        List<Message> context = new ArrayList<>(List.of(Message.user("weather?")));

        RetryResult result = retryingCaller.callWithRetry(context, template(), TOOLS, CancellationSignal.create());

        assertSame(ok, result.result());
        assertEquals(1, result.attempts());
        assertTrue(result.errorEvents().isEmpty());
        assertEquals(1, context.size());
    }

    @Test
    void shouldRetryWithNoteOnUnknownToolName() {
        when(modelCaller.call(any(), any()))
                .thenReturn(toolResult("search", "{}"))
                .thenReturn(toolResult("weather", "{}"));
        List<Message> context = new ArrayList<>(List.of(Message.user("weather?")));

        RetryResult result = retryingCaller.callWithRetry(context, template(), TOOLS, CancellationSignal.create());

        assertEquals(2, result.attempts());
        assertEquals("weather", result.result().getToolCalls().get(0).getName());
        Message note = context.get(1);
        assertEquals(MessageRole.SYSTEM, note.getRole());
        assertEquals("Error: Invalid tool name: search. Available tools: weather, respond", note.getContent());
        assertEquals(1, result.errorEvents().size());
        assertEquals(note.getContent(), result.errorEvents().get(0).error());
        assertEquals(List.of(1_000L), backoffs);
    }

    @Test
    void shouldRetryWithNoteOnInvalidJsonArguments() {
        when(modelCaller.call(any(), any()))
                .thenReturn(toolResult("weather", "{city: Oslo"))
                .thenReturn(toolResult("weather", "{\"city\":\"Oslo\"}"));
        List<Message> context = new ArrayList<>(List.of(Message.user("weather?")));

        RetryResult result = retryingCaller.callWithRetry(context, template(), TOOLS, CancellationSignal.create());

        assertEquals(2, result.attempts());
        assertTrue(context.get(1).getContent().startsWith("Error: Invalid JSON parameters for tool weather: "));
    }

    @Test
    void shouldReturnInvalidResultAfterLastAttempt() {
        ModelCallResult invalid = toolResult("search", "{}");
        when(modelCaller.call(any(), any())).thenReturn(invalid);
        List<Message> context = new ArrayList<>();

        RetryResult result = retryingCaller.callWithRetry(context, template(), TOOLS, CancellationSignal.create());

        assertSame(invalid, result.result());
        assertEquals(3, result.attempts());
        assertEquals(2, result.errorEvents().size());
        verify(modelCaller, times(3)).call(any(), any());
    }

    @Test
    void shouldBackOffLinearlyOnRateLimit() {
        LlmCallException rateLimited = new LlmCallException(LlmCallException.Kind.RATE_LIMIT, "429 slow down");
        when(modelCaller.call(any(), any()))
                .thenThrow(rateLimited)
                .thenThrow(rateLimited)
                .thenReturn(textResult("Hello"));
        List<Message> context = new ArrayList<>();

        RetryResult result = retryingCaller.callWithRetry(context, template(), TOOLS, CancellationSignal.create());

        assertEquals(3, result.attempts());
        assertEquals(List.of(10_000L, 20_000L), backoffs);
        assertEquals("Error: 429 slow down", context.get(0).getContent());
        List<String> errors = result.errorEvents().stream().map(AgentEvent.ErrorEvent::error).toList();
        assertEquals(List.of("Error: 429 slow down", "Error: 429 slow down"), errors);
        assertEquals(List.of(LlmCallException.Kind.RATE_LIMIT, LlmCallException.Kind.RATE_LIMIT),
                result.failedAttempts());
    }

    @Test
    void shouldReportFailedKindsAndMarkNotesAsRecovered() {
        when(modelCaller.call(any(), any()))
                .thenThrow(new LlmCallException(LlmCallException.Kind.RATE_LIMIT, "429 slow down"))
                .thenThrow(new LlmCallException(LlmCallException.Kind.TIMEOUT, "timed out"))
                .thenReturn(textResult("Hello"));
        List<Message> context = new ArrayList<>();

        RetryResult result = retryingCaller.callWithRetry(context, template(), TOOLS, CancellationSignal.create());

        assertEquals(List.of(LlmCallException.Kind.RATE_LIMIT, LlmCallException.Kind.TIMEOUT),
                result.failedAttempts());
        assertEquals(2, context.size());
        assertTrue(context.stream().allMatch(note -> RetryingModelCaller.RETRY_NOTE_NAME.equals(note.getName())));
        assertTrue(result.errorEvents().stream().allMatch(AgentEvent.ErrorEvent::recovered));
    }

    @Test
    void shouldReportNoFailedKindsForValidationRetry() {
        when(modelCaller.call(any(), any()))
                .thenReturn(toolResult("search", "{}"))
                .thenReturn(toolResult("weather", "{}"));

        RetryResult result = retryingCaller.callWithRetry(new ArrayList<>(), template(), TOOLS,
                CancellationSignal.create());

        assertTrue(result.failedAttempts().isEmpty());
    }

    @Test
    void shouldNotRetryAuthenticationFailure() {
        LlmCallException auth = new LlmCallException(LlmCallException.Kind.AUTH, "401 unauthorized");
        when(modelCaller.call(any(), any())).thenThrow(auth);

        LlmCallException error = assertThrows(LlmCallException.class,
                () -> retryingCaller.callWithRetry(new ArrayList<>(), template(), TOOLS,
                        CancellationSignal.create()));

        assertSame(auth, error);
        verify(modelCaller, times(1)).call(any(), any());
        assertTrue(backoffs.isEmpty());
    }

    @Test
    void shouldNotRetryAbort() {
        when(modelCaller.call(any(), any())).thenThrow(new RequestAbortedException());

        assertThrows(RequestAbortedException.class,
                () -> retryingCaller.callWithRetry(new ArrayList<>(), template(), TOOLS,
                        CancellationSignal.create()));
        verify(modelCaller, times(1)).call(any(), any());
    }

    @Test
    void shouldFailWithMaxRetriesExceeded() {
        when(modelCaller.call(any(), any()))
                .thenThrow(new LlmCallException(LlmCallException.Kind.TIMEOUT, "Model call timed out after 1000ms"));

        LlmCallException error = assertThrows(LlmCallException.class,
                () -> retryingCaller.callWithRetry(new ArrayList<>(), template(), TOOLS,
                        CancellationSignal.create()));

        assertEquals(LlmCallException.Kind.TIMEOUT, error.getKind());
        assertEquals("max retries exceeded: Model call timed out after 1000ms", error.getMessage());
        assertEquals(List.of(1_000L, 1_000L), backoffs);
    }

    @Test
    void shouldStopWhenCancelledBetweenAttempts() {
        CancellationSignal signal = CancellationSignal.create();
        when(modelCaller.call(any(), any())).thenAnswer(invocation -> {
            signal.cancel();
            throw new LlmCallException(LlmCallException.Kind.OTHER, "boom");
        });

        assertThrows(RequestAbortedException.class,
                () -> retryingCaller.callWithRetry(new ArrayList<>(), template(), TOOLS, signal));
        verify(modelCaller, times(1)).call(any(), any());
    }
}
