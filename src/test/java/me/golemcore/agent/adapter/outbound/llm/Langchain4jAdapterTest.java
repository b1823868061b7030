package me.golemcore.agent.adapter.outbound.llm;

import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String TEST_MODEL = "test-model";
    private static final String WEATHER = "weather";

    private AgentProperties properties;
    private ChatModel chatModel;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getLlm().setApiKey("test-key");
        chatModel = mock(ChatModel.class);
        adapter = new Langchain4jAdapter(properties);
        Map<String, ChatModel> models = getModels();
        models.put(TEST_MODEL, chatModel);
    }

    // ===== provider =====

    @Test
    void shouldReturnLangchain4jProviderId() {
        assertEquals("langchain4j", adapter.getProviderId());
    }

    @Test
    void shouldUseRouterModelAsCurrentModel() {
        assertEquals("gpt-4o-mini", adapter.getCurrentModel());
    }

    @Test
    void shouldBeAvailableOnlyWithApiKey() {
        assertTrue(adapter.isAvailable());

        properties.getLlm().setApiKey("  ");
        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldFailChatWhenProviderNotConfigured() {
        properties.getLlm().setApiKey(null);
        LlmRequest request = LlmRequest.builder()
                .model("unknown-model")
                .messages(List.of(Message.user("hi")))
                .build();

        ExecutionException error = assertThrows(ExecutionException.class, () -> adapter.chat(request).get());
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("Provider not configured"));
    }

    // ===== chat =====

    @Test
    void shouldConvertRequestAndToolCallResponse() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("call-1")
                        .name(WEATHER)
                        .arguments("{\"city\":\"Oslo\"}")
                        .build())))
                .tokenUsage(new TokenUsage(10, 5))
                .finishReason(FinishReason.TOOL_EXECUTION)
                .build());
        LlmRequest request = LlmRequest.builder()
                .model(TEST_MODEL)
                .messages(List.of(
                        Message.system("Be brief"),
                        Message.user("Weather in Oslo?"),
                        Message.assistant(null, List.of(Message.ToolCall.builder()
                                .id("call-0")
                                .name(WEATHER)
                                .arguments("{\"city\":\"Bergen\"}")
                                .build())),
                        Message.tool("call-0", WEATHER, "{\"temp\":8}")))
                .tools(List.of(weatherTool()))
                .temperature(0.0)
                .maxTokens(200)
                .build();

        LlmResponse response = adapter.chat(request).get();

        assertEquals("call-1", response.getToolCalls().get(0).getId());
        assertEquals(WEATHER, response.getToolCalls().get(0).getName());
        assertEquals("{\"city\":\"Oslo\"}", response.getToolCalls().get(0).getArguments());
        assertEquals(10, response.getUsage().getInputTokens());
        assertEquals(5, response.getUsage().getOutputTokens());
        assertEquals(15, response.getUsage().getTotalTokens());
        assertEquals("TOOL_EXECUTION", response.getFinishReason());
        assertEquals(TEST_MODEL, response.getModel());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        ChatRequest sent = captor.getValue();
        List<ChatMessage> messages = sent.messages();
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(UserMessage.class, messages.get(1));
        AiMessage assistant = assertInstanceOf(AiMessage.class, messages.get(2));
        assertEquals("call-0", assistant.toolExecutionRequests().get(0).id());
        ToolExecutionResultMessage toolResult = assertInstanceOf(ToolExecutionResultMessage.class, messages.get(3));
        assertEquals("call-0", toolResult.id());
        assertEquals("{\"temp\":8}", toolResult.text());
        assertEquals(200, sent.maxOutputTokens());
        assertEquals(0.0, sent.temperature());

        ToolSpecification spec = sent.toolSpecifications().get(0);
        assertEquals(WEATHER, spec.name());
        JsonObjectSchema parameters = spec.parameters();
        assertEquals(List.of("city"), parameters.required());
        assertInstanceOf(JsonStringSchema.class, parameters.properties().get("city"));
        assertInstanceOf(JsonIntegerSchema.class, parameters.properties().get("days"));
        assertInstanceOf(JsonEnumSchema.class, parameters.properties().get("units"));
    }

    @Test
    void shouldReturnTextResponseWithoutToolCalls() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("It is sunny."))
                .build());
        LlmRequest request = LlmRequest.builder()
                .model(TEST_MODEL)
                .messages(List.of(Message.user("Weather?")))
                .build();

        LlmResponse response = adapter.chat(request).get();

        assertEquals("It is sunny.", response.getContent());
        assertNull(response.getToolCalls());
        assertNull(response.getUsage());
        assertEquals("stop", response.getFinishReason());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        assertTrue(captor.getValue().toolSpecifications() == null
                || captor.getValue().toolSpecifications().isEmpty());
    }

    @Test
    void shouldPropagateProviderFailure() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("429 Too Many Requests"));
        LlmRequest request = LlmRequest.builder()
                .model(TEST_MODEL)
                .messages(List.of(Message.user("hi")))
                .build();

        ExecutionException error = assertThrows(ExecutionException.class, () -> adapter.chat(request).get());
        assertEquals("429 Too Many Requests", error.getCause().getMessage());
    }

    private static ToolDefinition weatherTool() {
        return ToolDefinition.builder()
                .name(WEATHER)
                .description("Current weather for a city")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "city", Map.of("type", "string", "description", "City name"),
                                "days", Map.of("type", "integer"),
                                "units", Map.of("type", "string", "enum", List.of("metric", "imperial"))),
                        "required", List.of("city")))
                .build();
    }

    @SuppressWarnings("unchecked")
    private Map<String, ChatModel> getModels() {
        return (Map<String, ChatModel>) ReflectionTestUtils.getField(adapter, "models");
    }
}
