package com.chicu.airetrain.promotion;

import lombok.Builder;

import java.time.Instant;

/**
 * Что сейчас в проде и что было перед этим (ровно один шаг назад).
 */
@Builder
public record StabilityRecord(
        String targetId,
        String currentProductionRef,
        String previousStableRef,
        Instant promotedAt,
        Instant rolledBackAt,
        boolean frozen,
        String frozenReason
) {
}
