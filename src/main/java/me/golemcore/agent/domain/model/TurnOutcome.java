package me.golemcore.agent.domain.model;

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

import lombok.Builder;

/**
 * Terminal state of a turn as passed to {@code endTurn}.
 */
@Builder
public record TurnOutcome(TurnStatus status, Integer tokensIn, Integer tokensOut, Long latencyMs, String errorType) {

    public static TurnOutcome ok(long latencyMs) {
        return TurnOutcome.builder().status(TurnStatus.OK).latencyMs(latencyMs).build();
    }

    public static TurnOutcome error(String errorType, long latencyMs) {
        return TurnOutcome.builder().status(TurnStatus.ERROR).errorType(errorType).latencyMs(latencyMs).build();
    }
}
