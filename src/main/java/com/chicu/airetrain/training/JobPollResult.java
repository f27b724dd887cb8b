package com.chicu.airetrain.training;

import com.chicu.airetrain.common.enums.JobStatus;
import com.chicu.airetrain.registry.EvaluationMetrics;
import lombok.Builder;

/**
 * Ответ job runner'а на poll. metrics/artifactRef заполнены только при SUCCEEDED.
 */
@Builder
public record JobPollResult(
        JobStatus status,
        EvaluationMetrics metrics,
        String artifactRef,
        String message
) {}
