package me.golemcore.agent.domain.system.router;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouterTurnStateTest {

    @Test
    void shouldCountRepeatedSignatures() {
        RouterTurnState state = new RouterTurnState();

        assertEquals(1, state.recordSignature("weather:{}"));
        assertEquals(2, state.recordSignature("weather:{}"));
        assertEquals(1, state.recordSignature("search:{}"));
    }

    @Test
    void shouldResetFailureStreakOnSuccess() {
        RouterTurnState state = new RouterTurnState();

        assertEquals(1, state.recordToolOutcome("weather", true, "Error: down"));
        assertEquals(2, state.recordToolOutcome("weather", true, "Error: still down"));
        assertEquals("Failed tools: weather (failures=2, last_error=Error: still down)",
                state.describeFailedTools());

        assertEquals(0, state.recordToolOutcome("weather", false, null));
        assertEquals(0, state.getFailureStreak("weather"));
        assertNull(state.describeFailedTools());
        assertEquals(List.of("weather"), state.getUsedTools());
    }

    @Test
    void shouldKeepFirstForcedReason() {
        RouterTurnState state = new RouterTurnState();
        assertFalse(state.isForced());

        state.forceRespond("first");
        state.forceRespond("second");

        assertTrue(state.isForced());
        assertEquals("first", state.getForcedReason());
    }
}
