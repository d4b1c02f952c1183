package com.story.knowledge.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.story.knowledge.transaction.TransactionState.*;
import static org.junit.jupiter.api.Assertions.*;

class StateTransitionTest {

    @Test
    @DisplayName("Should allow the commit path")
    void testCommitPath() {
        assertTrue(StateTransition.isAllowed(INIT, STAGING));
        assertTrue(StateTransition.isAllowed(STAGING, PREPARING));
        assertTrue(StateTransition.isAllowed(PREPARING, COMMITTING));
        assertTrue(StateTransition.isAllowed(COMMITTING, COMMITTED));
        assertTrue(StateTransition.isAllowed(COMMITTING, PARTIALLY_COMMITTED));
    }

    @Test
    @DisplayName("Should allow aborting from every phase before commit completes")
    void testAbortPaths() {
        assertTrue(StateTransition.isAllowed(STAGING, ABORTING));
        assertTrue(StateTransition.isAllowed(PREPARING, ABORTING));
        assertTrue(StateTransition.isAllowed(COMMITTING, ABORTING));
        assertTrue(StateTransition.isAllowed(ABORTING, ROLLED_BACK));
        assertTrue(StateTransition.isAllowed(ABORTING, ROLLBACK_FAILED));
    }

    @Test
    @DisplayName("Should reject skipping prepare")
    void testSkippingPrepare() {
        assertFalse(StateTransition.isAllowed(STAGING, COMMITTING));
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(STAGING, COMMITTED));
    }

    @ParameterizedTest
    @EnumSource(value = TransactionState.class, names = {"COMMITTED", "ROLLED_BACK", "PARTIALLY_COMMITTED", "ROLLBACK_FAILED"})
    @DisplayName("Should leave terminal states nowhere to go")
    void testTerminalStates(TransactionState terminal) {
        assertTrue(terminal.isTerminal());
        for (TransactionState next : TransactionState.values()) {
            assertFalse(StateTransition.isAllowed(terminal, next), terminal + " -> " + next);
        }
    }

    @Test
    @DisplayName("Should reject null states")
    void testNulls() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.isAllowed(null, STAGING));
    }
}
