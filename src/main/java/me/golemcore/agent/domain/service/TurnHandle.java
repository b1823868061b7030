package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.model.AgentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Running turn. Subscribing to {@code events} drives the turn; {@code result}
 * resolves when that stream terminates.
 */
public record TurnHandle(String conversationId, String requestId, String turnId, Flux<AgentEvent> events,
        Mono<TurnResult> result) {
}
