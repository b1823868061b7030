package me.golemcore.agent.domain.system.stream;

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

import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Concatenates phases of a turn into one stream in the order they are
 * chained, even when a phase is chained after {@link #sequence()} has been
 * subscribed.
 *
 * <p>
 * The next phase is subscribed only after the current one completes. The
 * sequence completes once {@link #done()} has been called and every chained
 * phase has completed; an error in any phase terminates it.
 *
 * @param <T>
 *            element type
 */
public class DelegateSequencer<T> {

    private final Sinks.Many<Publisher<? extends T>> phases = Sinks.many().unicast().onBackpressureBuffer();
    private final Flux<T> sequence = Flux.concat(phases.asFlux());
    private boolean done;

    /**
     * Appends a phase.
     *
     * @throws IllegalStateException
     *             after {@link #done()}
     */
    public synchronized DelegateSequencer<T> chain(Publisher<? extends T> phase) {
        if (done) {
            throw new IllegalStateException("Cannot chain after done()");
        }
        phases.emitNext(phase, Sinks.EmitFailureHandler.FAIL_FAST);
        return this;
    }

    /**
     * Marks that no more phases will be chained.
     */
    public synchronized void done() {
        if (done) {
            return;
        }
        done = true;
        phases.emitComplete(Sinks.EmitFailureHandler.FAIL_FAST);
    }

    public synchronized boolean isDone() {
        return done;
    }

    /**
     * The combined stream. It can be subscribed once.
     */
    public Flux<T> sequence() {
        return sequence;
    }
}
