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
import me.golemcore.agent.domain.system.llm.RetryingModelCaller;
import me.golemcore.agent.domain.system.router.RouterHarness;
import me.golemcore.agent.domain.system.router.RouterRequest;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.RecollectionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TurnOrchestratorTest {

    private static final String TOKEN = "tok-1";
    private static final String CONVERSATION_ID = "rk-conv";
    private static final String REQUEST_ID = "req-1";
    private static final String TURN_ID = "turn-1";

    private ConversationLedgerService ledger;
    private RouterHarness routerHarness;
    private ObjectProvider<RecollectionPort> recollectionProvider;
    private TurnOrchestrator orchestrator;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        ledger = mock(ConversationLedgerService.class);
        routerHarness = mock(RouterHarness.class);
        recollectionProvider = mock(ObjectProvider.class);
        when(ledger.startRequest(eq(TOKEN), anyString(), any(StartRequestOptions.class)))
                .thenReturn(new StartRequestResult(REQUEST_ID, CONVERSATION_ID, true));
        when(ledger.startTurn(eq(REQUEST_ID), eq(CONVERSATION_ID), eq(TOKEN), anyString(), isNull()))
                .thenReturn(TURN_ID);
        when(ledger.getMessages(eq(CONVERSATION_ID), any(), isNull(), isNull())).thenReturn(List.of());
        orchestrator = new TurnOrchestrator(ledger, routerHarness, recollectionProvider, new AgentProperties());
    }

    @Test
    void shouldStreamOnlyDeltasWithoutTraceAndPersistAssistantMessage() {
        when(routerHarness.run(any())).thenReturn(Flux.fromIterable(answerEvents()));

        TurnHandle handle = orchestrator.run(input(false), CancellationSignal.create());

        assertEquals(CONVERSATION_ID, handle.conversationId());
        assertEquals(TURN_ID, handle.turnId());
        StepVerifier.create(handle.events())
                .expectNext(new AgentEvent.DeltaEvent("m1", "Hello ", null))
                .expectNext(new AgentEvent.DeltaEvent("m1", "there", "stop"))
                .verifyComplete();

        TurnResult result = handle.result().block(Duration.ofSeconds(1));
        assertEquals(TurnStatus.OK, result.status());
        assertNull(result.errorType());
        assertEquals(1, result.assistantMessages().size());
        assertEquals("Hello there", result.assistantMessages().get(0).getContent());
        assertEquals("m1", result.assistantMessages().get(0).getId());

        verify(ledger).appendMessages(CONVERSATION_ID, List.of(Message.user("What's the weather in Oslo?")));
        verify(ledger).appendMessages(eq(CONVERSATION_ID), argThat(messages -> messages.size() == 1
                && messages.get(0).getRole() == MessageRole.ASSISTANT
                && "Hello there".equals(messages.get(0).getContent())));
        ArgumentCaptor<TurnOutcome> outcome = ArgumentCaptor.forClass(TurnOutcome.class);
        verify(ledger).endTurn(eq(TURN_ID), outcome.capture());
        assertEquals(TurnStatus.OK, outcome.getValue().status());
        verify(ledger).completeRequest(eq(REQUEST_ID), any(Long.class));
    }

    @Test
    void shouldStreamTraceEventsAndMirrorThemWhenTraceRequested() {
        when(routerHarness.run(any())).thenReturn(Flux.fromIterable(answerEvents()));

        TurnHandle handle = orchestrator.run(input(true), CancellationSignal.create());

        StepVerifier.create(handle.events().map(AgentEvent::type))
                .expectNext("llm_call", "llm_call_complete", "tool_call", "tool_call_complete", "delta", "delta")
                .verifyComplete();
        verify(ledger).recordLlmCallStart(argThat(trace -> TURN_ID.equals(trace.turnId())
                && trace.messageId() != null), any(AgentEvent.LlmCallEvent.class));
        verify(ledger).recordLlmCallComplete(any(), any(AgentEvent.LlmCallCompleteEvent.class));
        verify(ledger).recordToolCallStart(any(), any(AgentEvent.ToolCallEvent.class));
        verify(ledger).recordToolCallComplete(any(), any(AgentEvent.ToolCallCompleteEvent.class));
    }

    @Test
    void shouldMirrorTraceEventsEvenWhenNotStreamed() {
        when(routerHarness.run(any())).thenReturn(Flux.fromIterable(answerEvents()));

        TurnHandle handle = orchestrator.run(input(false), CancellationSignal.create());
        handle.events().blockLast(Duration.ofSeconds(1));

        verify(ledger).recordToolCallComplete(any(), any(AgentEvent.ToolCallCompleteEvent.class));
    }

    @Test
    void shouldPassStoredDialogueHistoryToRouter() {
        when(ledger.getMessages(eq(CONVERSATION_ID), any(), isNull(), isNull())).thenReturn(List.of(
                record(MessageRole.USER, "Hi"),
                record(MessageRole.ASSISTANT, "Hello!"),
                record(MessageRole.SYSTEM, "trace"),
                record(MessageRole.ASSISTANT, Map.of("type", "llm_call"))));
        when(routerHarness.run(any())).thenReturn(Flux.empty());

        orchestrator.run(input(false), CancellationSignal.create()).events().blockLast(Duration.ofSeconds(1));

        ArgumentCaptor<RouterRequest> request = ArgumentCaptor.forClass(RouterRequest.class);
        verify(routerHarness).run(request.capture());
        List<Message> messages = request.getValue().messages();
        assertEquals(3, messages.size());
        assertEquals("Hi", messages.get(0).getContent());
        assertEquals("Hello!", messages.get(1).getContent());
        assertEquals("What's the weather in Oslo?", messages.get(2).getContent());
        assertEquals(TURN_ID, request.getValue().turnId());
    }

    @Test
    void shouldEmitErrorAndRecordRateLimitWhenRouterFails() {
        when(routerHarness.run(any())).thenReturn(Flux.concat(
                Flux.just(new AgentEvent.DeltaEvent("m1", "partial", null)),
                Flux.error(new LlmCallException(LlmCallException.Kind.RATE_LIMIT, "quota exceeded"))));

        TurnHandle handle = orchestrator.run(input(false), CancellationSignal.create());

        StepVerifier.create(handle.events())
                .expectNext(new AgentEvent.DeltaEvent("m1", "partial", null))
                .expectNext(new AgentEvent.ErrorEvent("quota exceeded"))
                .verifyComplete();

        TurnResult result = handle.result().block(Duration.ofSeconds(1));
        assertEquals(TurnStatus.ERROR, result.status());
        assertEquals("rate_limit", result.errorType());
        ArgumentCaptor<TurnOutcome> outcome = ArgumentCaptor.forClass(TurnOutcome.class);
        verify(ledger).endTurn(eq(TURN_ID), outcome.capture());
        assertEquals(TurnStatus.ERROR, outcome.getValue().status());
        assertEquals("rate_limit", outcome.getValue().errorType());
        verify(ledger).recordRateLimit(TOKEN, "gpt-4o-mini", "rate_limit");
        verify(ledger).appendMessages(eq(CONVERSATION_ID), argThat(messages -> messages.size() == 1
                && "orchestrator.error".equals(messages.get(0).getName())
                && "quota exceeded".equals(messages.get(0).getContent())));
    }

    @Test
    void shouldNotRecordRateLimitForOtherFailures() {
        when(routerHarness.run(any())).thenReturn(Flux.error(new IllegalStateException("router broke")));

        TurnHandle handle = orchestrator.run(input(false), CancellationSignal.create());
        StepVerifier.create(handle.events())
                .expectNext(new AgentEvent.ErrorEvent("router broke"))
                .verifyComplete();

        assertEquals("other", handle.result().block(Duration.ofSeconds(1)).errorType());
        verify(ledger, never()).recordRateLimit(anyString(), anyString(), anyString());
    }

    @Test
    void shouldStreamRecollectionsBeforeRouterOutput() {
        RecollectionPort recollection = mock(RecollectionPort.class);
        AgentEvent.RecollectionEvent recalled = new AgentEvent.RecollectionEvent("rc-1", "rk-old", 0,
                "Earlier we discussed Oslo", 0.9, 0, 4);
        when(recollection.recall(eq(CONVERSATION_ID), any())).thenReturn(Flux.just(recalled));
        when(recollectionProvider.getIfAvailable()).thenReturn(recollection);
        when(routerHarness.run(any())).thenReturn(Flux.fromIterable(answerEvents()));

        TurnHandle handle = orchestrator.run(input(false), CancellationSignal.create());

        StepVerifier.create(handle.events())
                .expectNext(recalled)
                .expectNextCount(2)
                .verifyComplete();
    }

    @Test
    void shouldContinueWhenRecollectionFails() {
        RecollectionPort recollection = mock(RecollectionPort.class);
        when(recollection.recall(eq(CONVERSATION_ID), any()))
                .thenReturn(Flux.error(new IllegalStateException("index offline")));
        when(recollectionProvider.getIfAvailable()).thenReturn(recollection);
        when(routerHarness.run(any())).thenReturn(Flux.fromIterable(answerEvents()));

        TurnHandle handle = orchestrator.run(input(false), CancellationSignal.create());

        StepVerifier.create(handle.events())
                .expectNextCount(2)
                .verifyComplete();
        assertTrue(handle.result().block(Duration.ofSeconds(1)).isOk());
    }

    @Test
    void shouldCancelSignalAndCloseTurnAsAbortedWhenSubscriberCancels() {
        when(routerHarness.run(any())).thenReturn(Flux.never());
        CancellationSignal signal = CancellationSignal.create();

        TurnHandle handle = orchestrator.run(input(false), signal);
        StepVerifier.create(handle.events())
                .expectSubscription()
                .thenCancel()
                .verify();

        assertTrue(signal.isCancelled());
        TurnResult result = handle.result().block(Duration.ofSeconds(1));
        assertEquals(TurnStatus.ERROR, result.status());
        assertEquals("aborted", result.errorType());
    }

    @Test
    void shouldUseRequestedModel() {
        when(routerHarness.run(any())).thenReturn(Flux.empty());
        TurnInput input = TurnInput.builder()
                .token(TOKEN)
                .model("gpt-4o")
                .messages(List.of(Message.user("hi")))
                .build();

        orchestrator.run(input, CancellationSignal.create());

        verify(ledger).startRequest(eq(TOKEN), eq("gpt-4o"), any(StartRequestOptions.class));
    }

    @Test
    void shouldHideRecoveredRetryNotesWithoutTraceAndPersistThemAsRetryTrace() {
        when(routerHarness.run(any())).thenReturn(Flux.just(
                AgentEvent.ErrorEvent.retryNote("Error: 429 slow down"),
                new AgentEvent.DeltaEvent("m1", "Sunny", "stop")));

        TurnHandle handle = orchestrator.run(input(false), CancellationSignal.create());

        StepVerifier.create(handle.events())
                .expectNext(new AgentEvent.DeltaEvent("m1", "Sunny", "stop"))
                .verifyComplete();
        assertEquals(TurnStatus.OK, handle.result().block(Duration.ofSeconds(1)).status());
        verify(ledger).appendMessages(eq(CONVERSATION_ID), argThat(messages -> messages.size() == 1
                && RetryingModelCaller.RETRY_NOTE_NAME.equals(messages.get(0).getName())
                && "retry".equals(messages.get(0).getMetadata().get("traceType"))
                && "Error: 429 slow down".equals(messages.get(0).getContent())));
        verify(ledger, never()).appendMessages(eq(CONVERSATION_ID), argThat(messages -> messages.size() == 1
                && "orchestrator.error".equals(messages.get(0).getName())));
    }

    @Test
    void shouldStreamRecoveredRetryNotesWhenTraceRequested() {
        when(routerHarness.run(any())).thenReturn(Flux.just(
                AgentEvent.ErrorEvent.retryNote("Error: 429 slow down"),
                new AgentEvent.DeltaEvent("m1", "Sunny", "stop")));

        TurnHandle handle = orchestrator.run(input(true), CancellationSignal.create());

        StepVerifier.create(handle.events().map(AgentEvent::type))
                .expectNext("error", "delta")
                .verifyComplete();
    }

    @Test
    void shouldPassCallerTokenToRouter() {
        when(routerHarness.run(any())).thenReturn(Flux.fromIterable(answerEvents()));

        orchestrator.run(input(false), CancellationSignal.create()).events().blockLast(Duration.ofSeconds(1));

        ArgumentCaptor<RouterRequest> request = ArgumentCaptor.forClass(RouterRequest.class);
        verify(routerHarness).run(request.capture());
        assertEquals(TOKEN, request.getValue().token());
    }

    @Test
    void shouldTreatDeltaErrorAndRecollectionAsAlwaysEmitted() {
        assertTrue(TurnOrchestrator.isAlwaysEmitted(new AgentEvent.ErrorEvent("x")));
        assertFalse(TurnOrchestrator.isAlwaysEmitted(AgentEvent.ErrorEvent.retryNote("x")));
        assertTrue(TurnOrchestrator.isAlwaysEmitted(new AgentEvent.DeltaEvent("m", "d", null)));
        assertFalse(TurnOrchestrator.isAlwaysEmitted(new AgentEvent.ToolCallEvent(null)));
    }

    private TurnInput input(boolean trace) {
        return TurnInput.builder()
                .token(TOKEN)
                .messages(List.of(Message.user("What's the weather in Oslo?")))
                .trace(trace)
                .build();
    }

    private static MessageRecord record(MessageRole role, Object content) {
        return MessageRecord.builder().id("msg-" + content.hashCode()).role(role).content(content).build();
    }

    private static List<AgentEvent> answerEvents() {
        Message.ToolCall call = Message.ToolCall.builder()
                .id("call-1")
                .name("weather")
                .arguments("{\"city\":\"Oslo\"}")
                .build();
        AgentEvent.ToolCallPayload payload = AgentEvent.ToolCallPayload.of(call);
        return List.of(
                new AgentEvent.LlmCallEvent("gpt-4o-mini", List.of(Message.user("What's the weather in Oslo?")),
                        List.of("weather", "respond")),
                new AgentEvent.LlmCallCompleteEvent("gpt-4o-mini", List.of(), Message.assistant(null, List.of(call)),
                        null, 12L),
                new AgentEvent.ToolCallEvent(payload),
                new AgentEvent.ToolCallCompleteEvent(payload, "{\"temp\":12}"),
                new AgentEvent.DeltaEvent("m1", "Hello ", null),
                new AgentEvent.DeltaEvent("m1", "there", "stop"));
    }
}
