package com.chicu.airetrain.orchestrator;

import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.common.enums.RetrainState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TargetStateMachineTest {

    private static final Instant T0 = Instant.parse("2026-03-11T10:00:00Z");

    @Test
    void happyPath_shouldWalkThroughAllStatesBackToIdle() {
        TargetStateMachine m = new TargetStateMachine("t", null);

        m.moveTo(RetrainState.TRIGGERED, RetrainReason.ACCEPTED, T0);
        m.moveTo(RetrainState.QUEUED, RetrainReason.ACCEPTED, T0);
        m.moveTo(RetrainState.ADMITTED, RetrainReason.ACCEPTED, T0);
        m.attachJob("job-1");
        m.moveTo(RetrainState.TRAINING, RetrainReason.ACCEPTED, T0);
        m.moveTo(RetrainState.VALIDATING, RetrainReason.ACCEPTED, T0);
        m.moveTo(RetrainState.PROMOTED, RetrainReason.PROMOTED, T0);

        assertEquals("job-1", m.snapshot().currentJobId());

        m.moveTo(RetrainState.IDLE, RetrainReason.HEALTHY_AFTER_GRACE, T0.plusSeconds(60));

        TargetStateSnapshot s = m.snapshot();
        assertEquals(RetrainState.IDLE, s.state());
        assertEquals(RetrainReason.HEALTHY_AFTER_GRACE, s.lastReason());
        assertEquals(T0.plusSeconds(60), s.stateSince());
        assertNull(s.currentJobId());
    }

    @Test
    void illegalTransition_shouldThrowAndKeepState() {
        TargetStateMachine m = new TargetStateMachine("t", null);

        assertThrows(IllegalStateException.class, () -> m.moveTo(RetrainState.TRAINING, RetrainReason.ACCEPTED, T0));
        assertEquals(RetrainState.IDLE, m.state());
    }

    @Test
    void rejectedCannotBePromoted() {
        TargetStateMachine m = new TargetStateMachine("t", null);
        m.moveTo(RetrainState.TRIGGERED, RetrainReason.ACCEPTED, T0);
        m.moveTo(RetrainState.QUEUED, RetrainReason.ACCEPTED, T0);
        m.moveTo(RetrainState.ADMITTED, RetrainReason.ACCEPTED, T0);
        m.moveTo(RetrainState.REJECTED, RetrainReason.DATA_NOT_READY, T0);

        assertFalse(m.moveIfAllowed(RetrainState.PROMOTED, RetrainReason.PROMOTED, T0));
        assertEquals(RetrainState.REJECTED, m.state());
        assertTrue(m.moveIfAllowed(RetrainState.IDLE, RetrainReason.DATA_NOT_READY, T0));
    }

    @Test
    void forceIdle_shouldRecoverFromAnyState() {
        TargetStateMachine m = new TargetStateMachine("t", null);
        m.moveTo(RetrainState.TRIGGERED, RetrainReason.ACCEPTED, T0);
        m.moveTo(RetrainState.QUEUED, RetrainReason.ACCEPTED, T0);
        m.moveTo(RetrainState.ADMITTED, RetrainReason.ACCEPTED, T0);
        m.attachJob("job-1");
        m.moveTo(RetrainState.TRAINING, RetrainReason.ACCEPTED, T0);

        m.forceIdle(RetrainReason.UNEXPECTED_ERROR, T0);

        assertEquals(RetrainState.IDLE, m.state());
        assertNull(m.snapshot().currentJobId());
    }

    @Test
    void lastCompletedAt_isSeededAndUpdated() {
        TargetStateMachine m = new TargetStateMachine("t", T0);
        assertEquals(T0, m.lastCompletedAt());

        m.markCompleted(T0.plusSeconds(3600));
        assertEquals(T0.plusSeconds(3600), m.snapshot().lastCompletedAt());
    }
}
