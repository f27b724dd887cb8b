package com.chicu.airetrain.promotion;

import lombok.Getter;

@Getter
public class TargetFrozenException extends RuntimeException {

    private final String targetId;

    public TargetFrozenException(String targetId) {
        super("Target " + targetId + " is frozen after a rollback failure, operator must unfreeze it");
        this.targetId = targetId;
    }
}
