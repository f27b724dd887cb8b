package com.chicu.airetrain.registry;

import lombok.Builder;

import java.util.Map;

/**
 * Метрики модели на hold-out наборе.
 *
 * @param sampleErrors абсолютная ошибка по каждому sample id (для парного теста)
 */
@Builder
public record EvaluationMetrics(
        double mae,
        double rmse,
        int nSamples,
        Map<String, Double> sampleErrors
) {

    public EvaluationMetrics {
        sampleErrors = sampleErrors == null ? Map.of() : Map.copyOf(sampleErrors);
    }
}
