package com.chicu.airetrain.queue;

import lombok.Builder;

import java.time.Instant;
import java.util.UUID;

/**
 * Заявка на переобучение. На один target висит не больше одной (см. {@link RetrainRequestQueue}).
 *
 * @param attempt           0: первая попытка, 1: повтор после DataNotReady
 * @param budgetWindowStart начало окна бюджета, в котором заявка создана
 */
@Builder(toBuilder = true)
public record RetrainRequest(
        String requestId,
        String targetId,
        double triggerSeverity,
        int coalescedCount,
        Instant createdAt,
        int priority,
        int attempt,
        Instant budgetWindowStart
) {

    public static RetrainRequest create(String targetId, double severity, Instant now, Instant budgetWindowStart) {
        return RetrainRequest.builder()
                .requestId(UUID.randomUUID().toString())
                .targetId(targetId)
                .triggerSeverity(severity)
                .coalescedCount(1)
                .createdAt(now)
                .priority(priorityOf(severity))
                .attempt(0)
                .budgetWindowStart(budgetWindowStart)
                .build();
    }

    /**
     * Склейка нового события: severity = max, счётчик +1, createdAt не двигаем (FIFO).
     */
    public RetrainRequest absorb(double severity) {
        double max = Math.max(triggerSeverity, severity);
        return toBuilder()
                .triggerSeverity(max)
                .coalescedCount(coalescedCount + 1)
                .priority(priorityOf(max))
                .build();
    }

    /**
     * Новое событие пришло позже debounce-окна: старую заявку заменяет свежая.
     * severity = max, счётчик заново с 1, новый requestId и createdAt.
     */
    public RetrainRequest supersede(double severity, Instant now, Instant budgetWindowStart) {
        return create(targetId, Math.max(triggerSeverity, severity), now, budgetWindowStart);
    }

    /**
     * Повтор после DataNotReady: та же заявка, новая позиция в очереди и текущее окно бюджета.
     */
    public RetrainRequest retry(Instant now, Instant budgetWindowStart) {
        return toBuilder()
                .attempt(attempt + 1)
                .createdAt(now)
                .budgetWindowStart(budgetWindowStart)
                .build();
    }

    /**
     * 0..10, чем больше: тем раньше в очереди.
     */
    public static int priorityOf(double severity) {
        int p = (int) Math.floor(severity * 10.0);
        return Math.max(0, Math.min(10, p));
    }
}
