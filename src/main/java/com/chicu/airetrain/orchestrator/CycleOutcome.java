package com.chicu.airetrain.orchestrator;

import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.common.enums.RetrainState;
import lombok.Builder;

/**
 * Итог одного цикла target.
 *
 * @param finalState     последнее состояние перед возвратом в IDLE
 * @param trainingStarted job реально ушёл в runner (после этого считается cooldown)
 */
@Builder
public record CycleOutcome(
        String targetId,
        String requestId,
        String jobId,
        RetrainState finalState,
        RetrainReason reason,
        boolean trainingStarted,
        String candidateId,
        String productionRef
) {
}
