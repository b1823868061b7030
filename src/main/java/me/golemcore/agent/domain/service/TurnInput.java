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

import me.golemcore.agent.domain.model.Message;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * One user turn as received from the caller.
 *
 * @param token
 *            caller identity used to find the open conversation
 * @param trace
 *            when true, model and tool events are streamed as well
 * @param ghost
 *            a new conversation is never summarized or indexed
 */
@Builder
public record TurnInput(String token, String model, List<Message> messages, String conversationId, boolean trace,
        boolean ghost, String place, String userId, Map<String, Object> clientMeta) {

    public TurnInput {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }
}
