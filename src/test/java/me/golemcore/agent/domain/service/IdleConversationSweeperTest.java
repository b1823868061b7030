package me.golemcore.agent.domain.service;

import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdleConversationSweeperTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ConversationLedgerService ledger;
    private MutableClock clock;
    private AgentProperties properties;
    private IdleConversationSweeper sweeper;

    @BeforeEach
    void setUp() {
        ledger = mock(ConversationLedgerService.class);
        clock = new MutableClock(NOW);
        properties = new AgentProperties();
        sweeper = new IdleConversationSweeper(ledger, clock, properties);
    }

    @Test
    void shouldCloseIdleConversationsAtCurrentClockTime() {
        when(ledger.closeIfIdle(NOW.toEpochMilli())).thenReturn(2);

        assertEquals(2, sweeper.tick());
        verify(ledger).closeIfIdle(NOW.toEpochMilli());
    }

    @Test
    void shouldReturnZeroWhenSweepFails() {
        when(ledger.closeIfIdle(anyLong())).thenThrow(new IllegalStateException("store unavailable"));

        assertEquals(0, sweeper.tick());
        when(ledger.closeIfIdle(anyLong())).thenReturn(1);
        assertEquals(1, sweeper.tick());
    }

    @Test
    void shouldSkipTickWhilePreviousSweepIsRunning() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(ledger.closeIfIdle(anyLong())).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return 3;
        });

        CompletableFuture<Integer> running = CompletableFuture.supplyAsync(sweeper::tick);
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertEquals(-1, sweeper.tick());
        release.countDown();
        assertEquals(3, running.get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldNotScheduleWhenSweepDisabled() {
        properties.getLedger().setSweepEnabled(false);
        IdleConversationSweeper disabled = new IdleConversationSweeper(ledger, clock, properties);

        disabled.init();

        assertDoesNotThrow(disabled::shutdown);
        verify(ledger, never()).closeIfIdle(anyLong());
    }

    @Test
    void shouldStartAndStopScheduler() {
        sweeper.init();

        assertDoesNotThrow(sweeper::shutdown);
    }
}
