package com.chicu.airetrain.promotion;

import lombok.Getter;

/**
 * Для target уже идёт промоушен. Транзиентная ошибка, повторяется в {@link PromotionController#promoteWithRetry}.
 */
@Getter
public class PromotionConflictException extends RuntimeException {

    private final String targetId;

    public PromotionConflictException(String targetId) {
        super("Promotion already in progress for target " + targetId);
        this.targetId = targetId;
    }
}
