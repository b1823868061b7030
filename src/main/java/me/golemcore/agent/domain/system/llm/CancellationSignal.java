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

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token threaded through one turn: the orchestrator,
 * the router harness, the retry wrapper and the model caller all observe the
 * same instance.
 *
 * <p>
 * Listeners registered with {@link #onCancel(Runnable)} run once, on the thread
 * that calls {@link #cancel()}. A listener registered after cancellation runs
 * immediately.
 */
@Slf4j
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed: {}", e.getMessage());
            }
        }
        listeners.clear();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new RequestAbortedException();
        }
    }

    /**
     * Registers a listener and returns a handle that unregisters it.
     */
    public Runnable onCancel(Runnable listener) {
        if (isCancelled()) {
            listener.run();
            return () -> {
            };
        }
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }
}
