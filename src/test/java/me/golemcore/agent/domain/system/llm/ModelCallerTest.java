package me.golemcore.agent.domain.system.llm;

import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.port.outbound.LlmPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.exception.RateLimitException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ModelCallerTest {

    private LlmPort llmPort;
    private ModelCaller modelCaller;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        modelCaller = new ModelCaller(llmPort, new ObjectMapper());
    }

    private static LlmRequest request(long timeoutMs) {
        return LlmRequest.builder()
                .model("router-model")
                .messages(List.of(Message.user("hi")))
                .timeoutMs(timeoutMs)
                .build();
    }

    @Test
    void shouldNormalizeToolCallsAndCopyUsage() {
        LlmResponse response = LlmResponse.builder()
                .content("")
                .toolCalls(List.of(Message.ToolCall.builder().name("weather").arguments("").build()))
                .usage(LlmUsage.of(12, 3))
                .build();
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(response));

        ModelCallResult result = modelCaller.call(request(1000), CancellationSignal.create());

        assertTrue(result.hasToolCalls());
        assertEquals("weather_0", result.getToolCalls().get(0).getId());
        assertEquals("{}", result.getToolCalls().get(0).getArguments());
        assertEquals(12, result.getUsage().getInputTokens());
        assertEquals("router-model", result.getModel());
        assertTrue(result.getMessage().hasToolCalls());
    }

    @Test
    void shouldLeaveUsageEmptyWhenProviderOmitsIt() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("Hello").model("provider-model").build()));

        ModelCallResult result = modelCaller.call(request(0), CancellationSignal.create());

        assertNull(result.getUsage());
        assertEquals("Hello", result.getText());
        assertEquals("provider-model", result.getModel());
        assertFalse(result.getMessage().hasToolCalls());
    }

    @Test
    void shouldFailWithTimeoutWhenProviderIsTooSlow() {
        CompletableFuture<LlmResponse> never = new CompletableFuture<>();
        when(llmPort.chat(any())).thenReturn(never);

        LlmCallException error = assertThrows(LlmCallException.class,
                () -> modelCaller.call(request(50), CancellationSignal.create()));

        assertEquals(LlmCallException.Kind.TIMEOUT, error.getKind());
        assertTrue(never.isCancelled());
    }

    @Test
    void shouldClassifyProviderFailure() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new RateLimitException("quota")));

        LlmCallException error = assertThrows(LlmCallException.class,
                () -> modelCaller.call(request(1000), CancellationSignal.create()));

        assertEquals(LlmCallException.Kind.RATE_LIMIT, error.getKind());
        assertEquals("quota", error.getMessage());
    }

    @Test
    void shouldFailWhenProviderReturnsNothing() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(null));

        LlmCallException error = assertThrows(LlmCallException.class,
                () -> modelCaller.call(request(1000), CancellationSignal.create()));

        assertEquals(LlmCallException.Kind.OTHER, error.getKind());
    }

    @Test
    void shouldAbortBeforeCallingWhenAlreadyCancelled() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        assertThrows(RequestAbortedException.class, () -> modelCaller.call(request(1000), signal));
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldAbortInFlightCallWhenSignalFires() {
        CompletableFuture<LlmResponse> pending = new CompletableFuture<>();
        when(llmPort.chat(any())).thenReturn(pending);
        CancellationSignal signal = CancellationSignal.create();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(signal::cancel, 50, TimeUnit.MILLISECONDS);

            assertThrows(RequestAbortedException.class, () -> modelCaller.call(request(5000), signal));
            assertTrue(pending.isCancelled());
        } finally {
            scheduler.shutdownNow();
        }
    }
}
