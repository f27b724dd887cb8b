package com.chicu.airetrain.common.enums;

public enum ValidationDecision {
    PROMOTE,
    REJECT
}
