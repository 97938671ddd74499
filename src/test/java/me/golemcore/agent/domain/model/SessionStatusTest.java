package me.golemcore.agent.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionStatusTest {

    @Test
    void shouldMarkOnlyCompletedAndFailedAsTerminal() {
        for (SessionStatus status : SessionStatus.values()) {
            boolean expected = status == SessionStatus.COMPLETED || status == SessionStatus.FAILED;
            assertEquals(expected, status.isTerminal(), status.name());
            assertEquals(!expected, status.isActive(), status.name());
        }
    }

    @Test
    void shouldNeverLeaveTerminalStatus() {
        for (SessionStatus target : SessionStatus.values()) {
            assertFalse(SessionStatus.COMPLETED.canTransitionTo(target));
            assertFalse(SessionStatus.FAILED.canTransitionTo(target));
        }
    }

    @Test
    void shouldNeverReturnToPending() {
        for (SessionStatus source : SessionStatus.values()) {
            assertFalse(source.canTransitionTo(SessionStatus.PENDING), source.name());
        }
    }

    @Test
    void shouldAllowFailureFromEveryActiveStatus() {
        for (SessionStatus source : SessionStatus.values()) {
            if (source.isActive()) {
                assertTrue(source.canTransitionTo(SessionStatus.FAILED), source.name());
            }
        }
    }

    @Test
    void shouldFollowReasoningCycle() {
        assertTrue(SessionStatus.PENDING.canTransitionTo(SessionStatus.REASONING));
        assertTrue(SessionStatus.REASONING.canTransitionTo(SessionStatus.TOOL_EXECUTING));
        assertTrue(SessionStatus.TOOL_EXECUTING.canTransitionTo(SessionStatus.REASONING));
        assertTrue(SessionStatus.REASONING.canTransitionTo(SessionStatus.AWAITING_INPUT));
        assertTrue(SessionStatus.AWAITING_INPUT.canTransitionTo(SessionStatus.REASONING));
        assertTrue(SessionStatus.REASONING.canTransitionTo(SessionStatus.COMPLETED));

        assertFalse(SessionStatus.PENDING.canTransitionTo(SessionStatus.COMPLETED));
        assertFalse(SessionStatus.TOOL_EXECUTING.canTransitionTo(SessionStatus.COMPLETED));
        assertFalse(SessionStatus.AWAITING_INPUT.canTransitionTo(SessionStatus.TOOL_EXECUTING));
    }
}
