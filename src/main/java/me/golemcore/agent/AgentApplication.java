package me.golemcore.agent;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Conversational agent backend.
 *
 * <p>
 * Hexagonal layout:
 *
 * <pre>
 * Domain Layer       → TurnOrchestrator, RouterHarness, ledgers
 * Ports              → LlmPort, KeyValueStorePort, SummarizerPort, RecollectionPort
 * Infrastructure     → langchain4j model adapter, in-memory store, LLM summarizer
 * </pre>
 *
 * <p>
 * Configuration lives under the {@code agent.*} prefix in
 * {@code application.yml}.
 */
@SpringBootApplication
public class AgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentApplication.class, args);
    }

}
