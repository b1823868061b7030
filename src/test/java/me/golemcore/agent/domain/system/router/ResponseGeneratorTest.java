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
import me.golemcore.agent.domain.system.llm.CancellationSignal;
import me.golemcore.agent.domain.system.llm.LlmCallException;
import me.golemcore.agent.domain.system.llm.ModelCallResult;
import me.golemcore.agent.domain.system.llm.ModelCaller;
import me.golemcore.agent.domain.system.llm.RequestAbortedException;
import me.golemcore.agent.domain.system.llm.RetryingModelCaller;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ResponseGeneratorTest {

    private ModelCaller modelCaller;
    private ConversationLedgerService ledger;
    private AgentProperties properties;
    private ResponseGenerator generator;

    @BeforeEach
    void setUp() {
        modelCaller = mock(ModelCaller.class);
        ledger = mock(ConversationLedgerService.class);
        properties = new AgentProperties();
        properties.getLlm().setResponseModel("response-model");
        generator = new ResponseGenerator(modelCaller, ledger, properties);
    }

    private static RouterRequest request() {
        return RouterRequest.builder()
                .conversationId("conv_1")
                .requestId("req_1")
                .turnId("turn_1")
                .messages(List.of(Message.user("weather?")))
                .build();
    }

    private static ModelCallResult text(String text) {
        return ModelCallResult.builder()
                .text(text)
                .toolCalls(List.of())
                .usage(LlmUsage.of(50, 8))
                .latencyMs(120)
                .message(Message.assistant(text))
                .build();
    }

    @Test
    void shouldEmitCallDeltasAndCompletion() {
        when(modelCaller.call(any(), any())).thenReturn(text("Sunny today."));
        List<AgentEvent> events = new ArrayList<>();

        Message reply = generator.generate(List.of(Message.user("weather?")), new RouterTurnState(), request(),
                events::add);

        assertEquals(List.of("llm_call", "delta", "delta", "llm_call_complete"),
                events.stream().map(AgentEvent::type).toList());
        AgentEvent.DeltaEvent first = (AgentEvent.DeltaEvent) events.get(1);
        AgentEvent.DeltaEvent last = (AgentEvent.DeltaEvent) events.get(2);
        assertEquals("Sunny today.", first.delta());
        assertFalse(first.isFinal());
        assertEquals("", last.delta());
        assertEquals("stop", last.finishReason());
        assertEquals(reply.getId(), first.messageId());
        assertEquals(reply.getId(), last.messageId());
        assertEquals("Sunny today.", reply.getContent());
        assertEquals(MessageRole.ASSISTANT, reply.getRole());
        verify(ledger).recordOpenRouterResult("turn_1", "response-model", ModelCallOutcome.builder()
                .ok(true).latencyMs(120L).tokensIn(50).tokensOut(8).build());
    }

    @Test
    void shouldCallResponseModelWithoutTools() {
        when(modelCaller.call(any(), any())).thenReturn(text("ok"));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        generator.generate(List.of(Message.user("hi")), new RouterTurnState(), request(), event -> {
        });

        verify(modelCaller).call(captor.capture(), any(CancellationSignal.class));
        LlmRequest sent = captor.getValue();
        assertEquals("response-model", sent.getModel());
        assertFalse(sent.hasTools());
        assertEquals(properties.getLlm().getResponseMaxTokens(), sent.getMaxTokens());
        assertEquals(properties.getLlm().getResponseTimeoutMs(), sent.getTimeoutMs());
    }

    @Test
    void shouldEmitOnlyFinalDeltaForEmptyText() {
        when(modelCaller.call(any(), any())).thenReturn(text(null));
        List<AgentEvent> events = new ArrayList<>();

        Message reply = generator.generate(List.of(), new RouterTurnState(), request(), events::add);

        assertEquals(List.of("llm_call", "delta", "llm_call_complete"),
                events.stream().map(AgentEvent::type).toList());
        assertEquals("", reply.getContent());
    }

    @Test
    void shouldFlattenToolExchangeAndDropRouterNotes() {
        Message.ToolCall call = Message.ToolCall.builder().id("c1").name("weather").arguments("{}").build();
        List<Message> routerContext = List.of(
                Message.system(properties.getRouter().getSystemPrompt()),
                Message.system(RouterHarness.TOOL_FORMAT_INSTRUCTIONS),
                Message.system("Available tools: weather, respond"),
                Message.user("weather?"),
                Message.assistant("Checking.", List.of(call)),
                Message.tool("c1", "weather", "Sunny"),
                Message.assistant("", List.of(call)));

        List<Message> context = generator.buildContext(routerContext, new RouterTurnState());

        assertEquals(4, context.size());
        assertEquals(properties.getRouter().getPersonaPrompt(), context.get(0).getContent());
        assertEquals("weather?", context.get(1).getContent());
        assertEquals("Checking.", context.get(2).getContent());
        assertNull(context.get(2).getToolCalls());
        assertEquals(MessageRole.SYSTEM, context.get(3).getRole());
        assertEquals("weather result:\nSunny", context.get(3).getContent());
    }

    @Test
    void shouldAppendForcedReasonAndFailedTools() {
        RouterTurnState state = new RouterTurnState();
        state.recordToolOutcome("weather", true, "Error: down");
        state.forceRespond("Tool \"weather\" failed 1 times consecutively");

        List<Message> context = generator.buildContext(List.of(Message.user("weather?")), state);

        Message last = context.get(context.size() - 1);
        assertEquals("Tool loop capped: Tool \"weather\" failed 1 times consecutively\n"
                + "Failed tools: weather (failures=1, last_error=Error: down)", last.getContent());
    }

    @Test
    void shouldDropRetryNotesFromResponseContext() {
        Message namedNote = Message.builder()
                .role(MessageRole.SYSTEM)
                .name(RetryingModelCaller.RETRY_NOTE_NAME)
                .content("Error: 429 slow down")
                .build();
        List<Message> routerContext = List.of(
                Message.user("weather?"),
                namedNote,
                Message.system("Error: Invalid tool name: search. Available tools: weather, respond"),
                Message.system("Error: Invalid JSON parameters for tool weather: Unexpected character"),
                Message.system("Answer in French."));

        List<Message> context = generator.buildContext(routerContext, new RouterTurnState());

        List<String> contents = context.stream().map(Message::getContent).toList();
        assertEquals(List.of(properties.getRouter().getPersonaPrompt(), "weather?", "Answer in French."), contents);
    }

    @Test
    void shouldListUsedToolsBeforeForcedReason() {
        RouterTurnState state = new RouterTurnState();
        state.recordToolOutcome("weather", false, null);
        state.recordToolOutcome("search", true, "Error: down");
        state.forceRespond("Tool \"search\" failed 1 times consecutively");

        List<Message> context = generator.buildContext(List.of(Message.user("weather?")), state);

        Message usedTools = context.get(context.size() - 2);
        assertEquals(MessageRole.SYSTEM, usedTools.getRole());
        assertEquals("Tools used this turn: weather, search", usedTools.getContent());
        assertTrue(context.get(context.size() - 1).getContent().startsWith("Tool loop capped: "));
    }

    @Test
    void shouldListUsedToolsWithoutForcedStop() {
        RouterTurnState state = new RouterTurnState();
        state.recordToolOutcome("weather", false, null);

        List<Message> context = generator.buildContext(List.of(Message.user("weather?")), state);

        assertEquals(3, context.size());
        assertEquals("Tools used this turn: weather", context.get(2).getContent());
    }

    @Test
    void shouldEmitErrorAndRethrowWhenModelFails() {
        LlmCallException failure = new LlmCallException(LlmCallException.Kind.TIMEOUT, "Model call timed out");
        when(modelCaller.call(any(), any())).thenThrow(failure);
        List<AgentEvent> events = new ArrayList<>();

        LlmCallException thrown = assertThrows(LlmCallException.class,
                () -> generator.generate(List.of(), new RouterTurnState(), request(), events::add));

        assertEquals(failure, thrown);
        assertEquals(2, events.size());
        AgentEvent.ErrorEvent error = assertInstanceOf(AgentEvent.ErrorEvent.class, events.get(1));
        assertEquals("Model call timed out", error.error());
        ArgumentCaptor<ModelCallOutcome> outcome = ArgumentCaptor.forClass(ModelCallOutcome.class);
        verify(ledger).recordOpenRouterResult(eq("turn_1"), eq("response-model"), outcome.capture());
        assertFalse(outcome.getValue().ok());
        assertEquals("timeout", outcome.getValue().errorType());
    }

    @Test
    void shouldNotCallModelWhenAlreadyCancelled() {
        RouterRequest request = request();
        request.signal().cancel();

        assertThrows(RequestAbortedException.class,
                () -> generator.generate(List.of(), new RouterTurnState(), request, event -> {
                }));
        verifyNoInteractions(modelCaller);
        assertTrue(request.signal().isCancelled());
    }
}
