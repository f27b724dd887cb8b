package com.chicu.airetrain.common.enums;

public enum NotificationType {
    PROMOTED,
    REJECTED,
    ROLLED_BACK,
    BUDGET_EXHAUSTED,
    DISCARDED,
    ROLLBACK_FAILURE_ALERT;

    public boolean isAlert() {
        return this == ROLLED_BACK || this == ROLLBACK_FAILURE_ALERT;
    }
}
