package me.golemcore.agent.adapter.outbound.llm;

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
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicTokenUsage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiTokenUsage;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>OpenAI and any OpenAI-compatible API endpoint
 * <li>Anthropic (Claude models)
 * </ul>
 *
 * <p>
 * Provider-side retries are disabled; retry policy is owned by
 * {@link me.golemcore.agent.domain.system.llm.RetryingModelCaller}. One
 * {@link ChatModel} is built per model name and cached. Prompt-cache token
 * counters are copied when the provider reports them.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * <p>
 * Configuration via {@code agent.llm.*}.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";

    private final AgentProperties.LlmProperties llm;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public Langchain4jAdapter(AgentProperties properties) {
        this.llm = properties.getLlm();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null ? request.getModel() : getCurrentModel();
            ChatModel chatModel = models.computeIfAbsent(model, this::createModel);

            ChatRequest.Builder builder = ChatRequest.builder()
                    .messages(convertMessages(request))
                    .temperature(request.getTemperature());
            if (request.getMaxTokens() != null) {
                builder.maxOutputTokens(request.getMaxTokens());
            }
            List<ToolSpecification> tools = convertTools(request);
            if (!tools.isEmpty()) {
                log.trace("[LLM] Calling {} with {} tools", model, tools.size());
                builder.toolSpecifications(tools);
            }

            ChatResponse response = chatModel.chat(builder.build());
            return convertResponse(response, model);
        });
    }

    @Override
    public String getCurrentModel() {
        return llm.getRouterModel();
    }

    @Override
    public boolean isAvailable() {
        return llm.getApiKey() != null && !llm.getApiKey().isBlank();
    }

    private ChatModel createModel(String model) {
        if (!isAvailable()) {
            throw new IllegalStateException("Provider not configured: " + llm.getProvider()
                    + ". Set agent.llm.api-key");
        }
        log.info("[LLM] Creating {} chat model: {}", llm.getProvider(), model);
        if (PROVIDER_ANTHROPIC.equals(llm.getProvider())) {
            return createAnthropicModel(model);
        }
        // All non-Anthropic providers use the OpenAI-compatible API
        return createOpenAiModel(model);
    }

    private ChatModel createAnthropicModel(String modelName) {
        var builder = AnthropicChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .maxTokens(Math.max(llm.getMaxTokens(), llm.getResponseMaxTokens()))
                .timeout(Duration.ofMillis(Math.max(llm.getTimeoutMs(), llm.getResponseTimeoutMs())));

        if (llm.getBaseUrl() != null) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName) {
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .timeout(Duration.ofMillis(Math.max(llm.getTimeoutMs(), llm.getResponseTimeoutMs())));

        if (llm.getBaseUrl() != null) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : request.getMessages()) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole()) {
            case USER -> messages.add(UserMessage.from(content));
            case ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(tc.getArguments())
                                    .build())
                            .toList();
                    messages.add(content.isBlank()
                            ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    content));
            case SYSTEM -> messages.add(SystemMessage.from(content));
            default -> log.warn("[LLM] Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (!request.hasTools()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (properties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");
        boolean described = description != null && !description.isBlank();

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nested = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            // strings and unknown types
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private LlmResponse convertResponse(ChatResponse response, String model) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(ter.arguments())
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(convertUsage(response.tokenUsage()))
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private LlmUsage convertUsage(TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return null;
        }
        LlmUsage usage = LlmUsage.builder()
                .inputTokens(tokenUsage.inputTokenCount())
                .outputTokens(tokenUsage.outputTokenCount())
                .totalTokens(tokenUsage.totalTokenCount())
                .build();
        if (tokenUsage instanceof AnthropicTokenUsage anthropicUsage) {
            usage.setCacheReadTokens(anthropicUsage.cacheReadInputTokens());
            usage.setCacheWriteTokens(anthropicUsage.cacheCreationInputTokens());
        } else if (tokenUsage instanceof OpenAiTokenUsage openAiUsage && openAiUsage.inputTokensDetails() != null) {
            usage.setCacheReadTokens(openAiUsage.inputTokensDetails().cachedTokens());
        }
        return usage;
    }
}
