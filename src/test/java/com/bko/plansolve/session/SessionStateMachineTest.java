package com.bko.plansolve.session;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class SessionStateMachineTest {

    @Test
    void testHappyPathWithConfirmation() {
        SessionStateMachine machine = new SessionStateMachine("s-1");

        machine.transition(SessionStage.PLANNING);
        machine.transition(SessionStage.AWAITING_CONFIRM);
        machine.transition(SessionStage.SOLVING);
        machine.transition(SessionStage.AGGREGATING);
        machine.transition(SessionStage.COMPLETED);

        assertEquals(SessionStage.COMPLETED, machine.stage());
        assertTrue(machine.isTerminal());
    }

    @Test
    void testTerminalStagesAcceptNothing() {
        for (SessionStage terminal : EnumSet.of(SessionStage.COMPLETED, SessionStage.CANCELLED, SessionStage.ERROR)) {
            assertTrue(terminal.allowedTargets().isEmpty(), terminal.name());
        }
    }

    @Test
    void testEveryLiveStageCanBeCancelledOrFail() {
        for (SessionStage stage : SessionStage.values()) {
            if (stage.isTerminal()) {
                continue;
            }
            assertTrue(stage.canTransitionTo(SessionStage.CANCELLED), stage.name());
            assertTrue(stage.canTransitionTo(SessionStage.ERROR), stage.name());
        }
    }

    @Test
    void testReplanReentersPlanning() {
        assertTrue(SessionStage.SOLVING.canTransitionTo(SessionStage.PLANNING));
        assertTrue(SessionStage.AGGREGATING.canTransitionTo(SessionStage.PLANNING));
        assertTrue(SessionStage.AWAITING_CONFIRM.canTransitionTo(SessionStage.PLANNING));
        assertTrue(SessionStage.PLANNING.canTransitionTo(SessionStage.PLANNING));
        assertFalse(SessionStage.CREATED.canTransitionTo(SessionStage.AGGREGATING));
        assertFalse(SessionStage.PLANNING.canTransitionTo(SessionStage.AGGREGATING));
    }

    @Test
    void testIllegalTransitionLeavesStageUnchanged() {
        SessionStateMachine machine = new SessionStateMachine("s-1");
        machine.transition(SessionStage.CANCELLED);

        assertThrows(IllegalStateException.class, () -> machine.transition(SessionStage.PLANNING));
        assertEquals(SessionStage.CANCELLED, machine.stage());
        assertTrue(machine.isIn(SessionStage.PLANNING, SessionStage.CANCELLED));
        assertFalse(machine.isIn(SessionStage.PLANNING));
    }
}
