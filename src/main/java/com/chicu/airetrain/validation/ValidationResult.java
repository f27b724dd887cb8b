package com.chicu.airetrain.validation;

import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.common.enums.ValidationDecision;
import com.chicu.airetrain.registry.EvaluationMetrics;
import lombok.Builder;

/**
 * @param delta  (baseline.mae − candidate.mae) / baseline.mae; null: не считался
 * @param pValue null: тест не проводился
 */
@Builder
public record ValidationResult(
        String candidateId,
        EvaluationMetrics baselineMetrics,
        Double delta,
        Double pValue,
        ValidationDecision decision,
        RetrainReason reason
) {

    public boolean promote() {
        return decision == ValidationDecision.PROMOTE;
    }
}
