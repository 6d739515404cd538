package com.demo.network.service.opportunity;

import com.demo.network.model.OpportunityStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static com.demo.network.model.OpportunityStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class OpportunityStateMachineTest {

    private final OpportunityStateMachine machine = new OpportunityStateMachine();

    @Test
    @DisplayName("terminal states have no way out")
    void terminal_noMoves() {
        for (OpportunityStatus s : OpportunityStatus.TERMINAL) {
            assertTrue(machine.validNextStates(s).isEmpty(), s + " should be terminal");
        }
    }

    @Test
    void pending_moves() {
        assertEquals(EnumSet.of(VIEWED, ACCEPTED, REJECTED, EXPIRED), machine.validNextStates(PENDING));
        assertFalse(machine.canTransition(PENDING, COMPLETED));
        assertFalse(machine.canTransition(ACCEPTED, EXPIRED));
        assertTrue(machine.canTransition(ACCEPTED, COMPLETED));
    }

    @Test
    @DisplayName("only the first real decision stamps actedAt")
    void marksAction() {
        assertFalse(machine.marksAction(PENDING, VIEWED));
        assertFalse(machine.marksAction(PENDING, EXPIRED));
        assertTrue(machine.marksAction(VIEWED, ACCEPTED));
        assertTrue(machine.marksAction(PENDING, REJECTED));
        assertFalse(machine.marksAction(ACCEPTED, IN_PROGRESS));
    }
}
