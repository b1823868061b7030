package me.golemcore.agent.adapter.outbound.summary;

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
import me.golemcore.agent.domain.model.MessageRecord;
import me.golemcore.agent.domain.model.SummaryResult;
import me.golemcore.agent.domain.system.llm.LlmErrorClassifier;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import me.golemcore.agent.port.outbound.SummarizerPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Summarizes closed conversations with the response model, asking for strict
 * JSON (summary, tags, keywords, places, flags). Any failure yields an empty
 * result flagged {@code summaryError}.
 */
@Component
@Slf4j
public class LlmConversationSummarizer implements SummarizerPort {

    static final String SYSTEM_PROMPT = "You are a concise archivist. Produce a safe, neutral summary and tags "
            + "for a voice assistant conversation.";

    private static final int STRUCTURED_CONTENT_LIMIT = 5000;

    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final AgentProperties.LlmProperties llm;
    private final int messageLimit;

    public LlmConversationSummarizer(LlmPort llmPort, ObjectMapper objectMapper, AgentProperties properties) {
        this.llmPort = llmPort;
        this.objectMapper = objectMapper;
        this.llm = properties.getLlm();
        this.messageLimit = properties.getLedger().getSummaryMessageLimit();
    }

    @Override
    public SummaryResult summarize(String conversationId, List<MessageRecord> messages) {
        List<MessageRecord> filtered = new ArrayList<>();
        for (MessageRecord record : messages) {
            if (!"llm_call".equals(record.getTraceType())) {
                filtered.add(record);
            }
        }
        if (filtered.size() > messageLimit) {
            filtered = filtered.subList(filtered.size() - messageLimit, filtered.size());
        }

        LlmRequest request = LlmRequest.builder()
                .model(llm.getResponseModel())
                .messages(List.of(Message.system(SYSTEM_PROMPT), Message.user(buildPrompt(conversationId, filtered))))
                .temperature(0.0)
                .timeoutMs(llm.getResponseTimeoutMs())
                .build();
        try {
            LlmResponse response = llmPort.chat(request).get(llm.getResponseTimeoutMs(), TimeUnit.MILLISECONDS);
            return parse(response != null ? response.getContent() : null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SummaryResult.failed("interrupted");
        } catch (TimeoutException e) {
            log.warn("[Summary] Timed out summarizing {}", conversationId);
            return SummaryResult.failed("summary timed out after " + llm.getResponseTimeoutMs() + "ms");
        } catch (ExecutionException | RuntimeException e) {
            String error = LlmErrorClassifier.describe(e);
            log.warn("[Summary] Failed to summarize {}: {}", conversationId, error);
            return SummaryResult.failed(error);
        }
    }

    String buildPrompt(String conversationId, List<MessageRecord> messages) {
        StringBuilder entries = new StringBuilder();
        for (MessageRecord record : messages) {
            entries.append('[').append(record.getRole() != null ? record.getRole().value() : "user").append("] ")
                    .append(renderContent(record.getContent())).append('\n');
        }
        return "Conversation ID: " + conversationId + "\n\n"
                + "Please return strict JSON with:\n"
                + "- summary: <= 120 words, neutral\n"
                + "- tags: 3-8 short tags\n"
                + "- keywords: 5-10 concise phrases\n"
                + "- places: list of place/location hints (can be empty)\n"
                + "- flags: { explicit: boolean, forbidden: boolean }\n\n"
                + "Messages:\n" + entries;
    }

    private String renderContent(Object content) {
        if (content == null) {
            return "";
        }
        if (content instanceof String text) {
            return text;
        }
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(content);
            return json.length() > STRUCTURED_CONTENT_LIMIT ? json.substring(0, STRUCTURED_CONTENT_LIMIT) : json;
        } catch (JsonProcessingException e) {
            return String.valueOf(content);
        }
    }

    SummaryResult parse(String content) {
        if (content == null || content.isBlank()) {
            return SummaryResult.failed("empty summary response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(content));
        } catch (JsonProcessingException e) {
            return SummaryResult.failed(e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return SummaryResult.builder()
                    .flags(SummaryResult.Flags.builder().summaryError(true).build())
                    .build();
        }
        JsonNode flags = root.path("flags");
        return SummaryResult.builder()
                .summary(root.path("summary").isTextual() ? root.path("summary").asText() : "")
                .tags(toStringList(root.path("tags")))
                .keywords(toStringList(root.path("keywords")))
                .places(toStringList(root.path("places")))
                .flags(SummaryResult.Flags.builder()
                        .explicit(flags.path("explicit").asBoolean(false))
                        .forbidden(flags.path("forbidden").asBoolean(false))
                        .summaryError(flags.path("summaryError").asBoolean(false))
                        .build())
                .build();
    }

    private static List<String> toStringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.isTextual() ? item.asText() : item.toString()));
        }
        return values;
    }

    private static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).trim();
    }
}
