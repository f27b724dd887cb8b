package com.chicu.airetrain.promotion;

import lombok.Getter;

/**
 * Откат не удался: известного-хорошего состояния больше нет, target замораживается.
 */
@Getter
public class RollbackFailureException extends RuntimeException {

    private final String targetId;

    public RollbackFailureException(String targetId, String message) {
        super(message);
        this.targetId = targetId;
    }

    public RollbackFailureException(String targetId, String message, Throwable cause) {
        super(message, cause);
        this.targetId = targetId;
    }
}
