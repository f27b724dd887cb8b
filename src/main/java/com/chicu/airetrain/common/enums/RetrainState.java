package com.chicu.airetrain.common.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Состояния цикла переобучения одного target.
 *
 * Счастливый путь:
 *   IDLE → TRIGGERED → QUEUED → ADMITTED → TRAINING → VALIDATING → PROMOTED → IDLE
 *
 * Откат: PROMOTED → ROLLING_BACK → ROLLED_BACK → IDLE
 */
public enum RetrainState {
    IDLE,
    TRIGGERED,
    QUEUED,
    ADMITTED,
    TRAINING,
    VALIDATING,
    PROMOTED,
    REJECTED,
    ROLLING_BACK,
    ROLLED_BACK;

    public Set<RetrainState> next() {
        return switch (this) {
            case IDLE -> EnumSet.of(TRIGGERED);
            case TRIGGERED -> EnumSet.of(QUEUED);
            // QUEUED → IDLE: заявку выбросили (бюджет кончился / окно перевернулось)
            case QUEUED -> EnumSet.of(ADMITTED, IDLE);
            // ADMITTED → REJECTED: DataNotReady
            case ADMITTED -> EnumSet.of(TRAINING, REJECTED);
            case TRAINING -> EnumSet.of(VALIDATING, REJECTED);
            case VALIDATING -> EnumSet.of(PROMOTED, REJECTED);
            case PROMOTED -> EnumSet.of(ROLLING_BACK, IDLE);
            // ROLLING_BACK → IDLE: откат не удался, target заморожен
            case ROLLING_BACK -> EnumSet.of(ROLLED_BACK, IDLE);
            case ROLLED_BACK, REJECTED -> EnumSet.of(IDLE);
        };
    }

    public boolean canMoveTo(RetrainState target) {
        return target != null && next().contains(target);
    }

    /**
     * Цикл уже идёт: новую заявку для target допускать нельзя.
     */
    public boolean isActiveCycle() {
        return this != IDLE && this != TRIGGERED && this != QUEUED;
    }
}
