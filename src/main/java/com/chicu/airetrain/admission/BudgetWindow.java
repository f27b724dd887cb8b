package com.chicu.airetrain.admission;

import java.time.Instant;

/**
 * Окно бюджета [start, end).
 *
 * @param weekend окно выходных (cap = max-weekend-retrains) или будней (max-weekday-retrains)
 */
public record BudgetWindow(
        Instant start,
        Instant end,
        boolean weekend,
        int cap
) {

    public boolean contains(Instant at) {
        return !at.isBefore(start) && at.isBefore(end);
    }
}
