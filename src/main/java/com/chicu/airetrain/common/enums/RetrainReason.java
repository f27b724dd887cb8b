package com.chicu.airetrain.common.enums;

/**
 * Короткий код причины решения/перехода. Пишется в аудит, в job и в уведомления.
 */
public enum RetrainReason {

    // intake
    ACCEPTED(false),
    IGNORED(false),
    COALESCED(false),
    STALE_REQUEST_REPLACED(false),
    IN_COOLDOWN(false),
    QUEUE_FULL(false),
    TARGET_FROZEN(false),

    // admission
    NO_FREE_SLOT(false),
    BUDGET_EXHAUSTED(false),
    WINDOW_ROLLED_OVER(false),

    // training
    DATA_NOT_READY(false),
    TRAINING_FAILURE(false),
    TIMED_OUT(false),
    ORPHANED_ON_RESTART(false),

    // validation
    INSUFFICIENT_EVAL_DATA(false),
    EVAL_SET_MISMATCH(false),
    BASELINE_UNAVAILABLE(false),
    VALIDATION_REGRESSION(false),
    VALIDATION_PASSED(false),

    // promotion / rollback
    PROMOTED(false),
    PROMOTION_CONFLICT(false),
    HEALTHY_AFTER_GRACE(false),
    HEALTH_CHECK_FAILED(false),
    ROLLBACK_FAILURE(true),

    UNEXPECTED_ERROR(false);

    /**
     * true: нужен оператор (системный алерт).
     */
    private final boolean fatal;

    RetrainReason(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
