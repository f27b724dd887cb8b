package com.chicu.airetrain.orchestrator;

import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.common.enums.RetrainState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * Машина состояний одного target. Переходы строго последовательны,
 * недопустимый переход: {@link IllegalStateException}.
 */
@Slf4j
public class TargetStateMachine {

    @Getter
    private final String targetId;

    private RetrainState state = RetrainState.IDLE;
    private RetrainReason lastReason;
    private Instant stateSince;
    private Instant lastCompletedAt;
    private String currentJobId;

    public TargetStateMachine(String targetId, Instant lastCompletedAt) {
        this.targetId = targetId;
        this.lastCompletedAt = lastCompletedAt;
    }

    public synchronized RetrainState state() {
        return state;
    }

    public synchronized void moveTo(RetrainState next, RetrainReason reason, Instant at) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal transition for target " + targetId + ": " + state + " → " + next);
        }
        log.info("🔀 target={} {} → {} reason={}", targetId, state, next, reason);
        state = next;
        lastReason = reason;
        stateSince = at;
        if (next == RetrainState.IDLE) {
            currentJobId = null;
        }
    }

    /**
     * Переход, если он допустим из текущего состояния.
     *
     * @return false: переход невозможен, состояние не менялось
     */
    public synchronized boolean moveIfAllowed(RetrainState next, RetrainReason reason, Instant at) {
        if (!state.canMoveTo(next)) {
            return false;
        }
        moveTo(next, reason, at);
        return true;
    }

    /**
     * Аварийный возврат в IDLE, когда штатного перехода нет (ошибка посреди цикла).
     */
    public synchronized void forceIdle(RetrainReason reason, Instant at) {
        log.error("🧯 target={} forced {} → IDLE reason={}", targetId, state, reason);
        state = RetrainState.IDLE;
        lastReason = reason;
        stateSince = at;
        currentJobId = null;
    }

    public synchronized void attachJob(String jobId) {
        this.currentJobId = jobId;
    }

    /**
     * Отметка окончания цикла, в котором реально стартовало обучение (от неё считается cooldown).
     */
    public synchronized void markCompleted(Instant at) {
        this.lastCompletedAt = at;
    }

    public synchronized Instant lastCompletedAt() {
        return lastCompletedAt;
    }

    public synchronized TargetStateSnapshot snapshot() {
        return TargetStateSnapshot.builder()
                .targetId(targetId)
                .state(state)
                .lastReason(lastReason)
                .stateSince(stateSince)
                .lastCompletedAt(lastCompletedAt)
                .currentJobId(currentJobId)
                .build();
    }
}
