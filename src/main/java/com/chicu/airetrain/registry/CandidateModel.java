package com.chicu.airetrain.registry;

import lombok.Builder;

/**
 * Кандидат после успешного job. Живёт до решения validation gate.
 */
@Builder
public record CandidateModel(
        String candidateId,
        String jobRef,
        EvaluationMetrics metrics,
        String artifactRef
) {}
