package com.chicu.airetrain.drift;

import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Сигнал дрейфа от внешнего детектора. Неизменяемый, Intake потребляет его один раз.
 */
@Builder
public record DriftEvent(
        String targetId,
        double severity,
        Instant detectedAt,
        Map<String, Double> featureBreakdown
) {

    public DriftEvent {
        List<String> violations = new ArrayList<>();

        if (targetId == null || targetId.isBlank()) {
            violations.add("targetId is required");
        }
        if (Double.isNaN(severity) || severity < 0.0 || severity > 1.0) {
            violations.add("severity must be within [0,1], got " + severity);
        }
        if (detectedAt == null) {
            violations.add("detectedAt is required");
        }
        if (featureBreakdown != null) {
            for (Map.Entry<String, Double> e : featureBreakdown.entrySet()) {
                if (e.getKey() == null || e.getValue() == null || e.getValue().isNaN()) {
                    violations.add("featureBreakdown has empty key or value: " + e.getKey());
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new DriftEventValidationException(violations);
        }

        targetId = targetId.trim();
        featureBreakdown = featureBreakdown == null ? Map.of() : Map.copyOf(featureBreakdown);
    }
}
