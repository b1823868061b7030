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

import java.util.Locale;

/**
 * Failure of a model call, tagged with the classified {@link Kind} so callers
 * can decide between retrying, failing fast and recording rate-limit metrics.
 */
public class LlmCallException extends RuntimeException {

    private final Kind kind;

    public LlmCallException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LlmCallException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public enum Kind {
        RATE_LIMIT, AUTH, TIMEOUT, ABORTED, OTHER;

        /**
         * Error type written to the ledger ({@code rate_limit}, {@code auth}, ...).
         */
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public boolean isRetryable() {
            return this != AUTH && this != ABORTED;
        }
    }
}
