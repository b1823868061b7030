package me.golemcore.agent.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the agent, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model provider and model names</li>
 * <li>{@link RetryProperties} - retry attempts and backoff</li>
 * <li>{@link RouterProperties} - tool-calling loop limits and prompts</li>
 * <li>{@link LedgerProperties} - conversation ledger namespace and idle
 * sweep</li>
 * <li>{@link TasksProperties} - task ledger namespace</li>
 * <li>{@link StorageProperties} - key-value store backend</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private LlmProperties llm = new LlmProperties();
    private RetryProperties retry = new RetryProperties();
    private RouterProperties router = new RouterProperties();
    private LedgerProperties ledger = new LedgerProperties();
    private TasksProperties tasks = new TasksProperties();
    private StorageProperties storage = new StorageProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /**
         * {@code openai} (any OpenAI-compatible endpoint) or {@code anthropic}.
         */
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String routerModel = "gpt-4o-mini";
        private String responseModel = "gpt-4o-mini";
        private long timeoutMs = 30_000;
        private long responseTimeoutMs = 60_000;
        private double temperature = 0.0;
        private int maxTokens = 1000;
        private int responseMaxTokens = 1024;
    }

    // ==================== RETRY ====================

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        private long validationBackoffMs = 1_000;
        private long genericBackoffMs = 1_000;
        /**
         * Multiplied by the attempt number: 10s, 20s, 30s.
         */
        private long rateLimitBackoffMs = 10_000;
    }

    // ==================== ROUTER ====================

    @Data
    public static class RouterProperties {
        private int maxIterations = 5;
        private int maxParallelToolCalls = 3;
        private int loopCapThreshold = 3;
        private int failureStreakThreshold = 5;
        private String systemPrompt = "You are the routing stage of a voice and chat assistant. "
                + "Decide which tools to call to gather the information needed for the user's last message. "
                + "Call several independent tools in the same round when possible. "
                + "When you have everything you need, or no tool applies, call the respond tool.";
        private String personaPrompt = "You are a helpful, concise assistant. "
                + "Answer the user using the tool results in the conversation. "
                + "Never mention tools, function calls or internal errors by name.";
    }

    // ==================== CONVERSATION LEDGER ====================

    @Data
    public static class LedgerProperties {
        private String namespace = "agent:rk";
        private String metricsNamespace = "agent:rk:metrics";
        private long idleMs = 600_000;
        private boolean sweepEnabled = true;
        private long sweepIntervalSeconds = 60;
        private int summaryMessageLimit = 80;
    }

    // ==================== TASK LEDGER ====================

    @Data
    public static class TasksProperties {
        private String namespace = "agent:task:rk";
        private String metricsNamespace = "agent:task:rk:metrics";
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        /**
         * {@code memory} (default) or {@code file}.
         */
        private String type = "memory";
        /**
         * Snapshot file of the {@code file} store.
         */
        private String path = "${user.home}/.golemcore/agent/store.json";
        private boolean backup = true;
    }
}
