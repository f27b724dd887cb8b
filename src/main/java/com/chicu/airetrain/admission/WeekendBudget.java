package com.chicu.airetrain.admission;

import lombok.Builder;

import java.time.Instant;

/**
 * Снимок бюджета target в текущем окне.
 */
@Builder
public record WeekendBudget(
        String targetId,
        Instant windowStart,
        Instant windowEnd,
        boolean weekend,
        int retrainsUsed,
        int retrainsCap
) {

    public boolean exhausted() {
        return retrainsUsed >= retrainsCap;
    }

    public int remaining() {
        return Math.max(0, retrainsCap - retrainsUsed);
    }
}
