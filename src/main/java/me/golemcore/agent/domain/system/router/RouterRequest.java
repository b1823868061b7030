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

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.system.llm.CancellationSignal;
import lombok.Builder;

import java.util.List;

/**
 * Input of one router invocation. The ids tie model and tool metrics to the
 * ledger turn; {@code token} is the caller's credential, used only for
 * rate-limit accounting; {@code messages} is the conversation as the model
 * should see it.
 */
@Builder
public record RouterRequest(String conversationId, String requestId, String turnId, String token,
        List<Message> messages, CancellationSignal signal) {

    public RouterRequest {
        messages = messages != null ? List.copyOf(messages) : List.of();
        signal = signal != null ? signal : CancellationSignal.create();
    }
}
