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

import me.golemcore.agent.infrastructure.config.AgentProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically closes conversations that have been idle longer than the
 * configured window. Runs on a single daemon thread; a tick that starts while
 * the previous one is still running is skipped.
 */
@Component
@Slf4j
public class IdleConversationSweeper {

    private final ConversationLedgerService ledger;
    private final Clock clock;
    private final AgentProperties.LedgerProperties settings;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public IdleConversationSweeper(ConversationLedgerService ledger, Clock clock, AgentProperties properties) {
        this.ledger = ledger;
        this.clock = clock;
        this.settings = properties.getLedger();
    }

    @PostConstruct
    public void init() {
        if (!settings.isSweepEnabled()) {
            log.info("[IdleSweep] Idle sweep disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "idle-conversation-sweeper");
            t.setDaemon(true);
            return t;
        });
        long interval = Math.max(1, settings.getSweepIntervalSeconds());
        tickTask = scheduler.scheduleAtFixedRate(this::tick, interval, interval, TimeUnit.SECONDS);
        log.info("[IdleSweep] Started with interval {}s, idle window {}ms", interval, settings.getIdleMs());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[IdleSweep] Shut down");
    }

    /**
     * @return conversations closed by this tick, or -1 when skipped
     */
    int tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[IdleSweep] Tick skipped: previous sweep still in progress");
            return -1;
        }
        try {
            return ledger.closeIfIdle(clock.millis());
        } catch (RuntimeException e) {
            log.error("[IdleSweep] Sweep failed: {}", e.getMessage(), e);
            return 0;
        } finally {
            executing.set(false);
        }
    }
}
