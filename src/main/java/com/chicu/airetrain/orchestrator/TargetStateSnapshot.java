package com.chicu.airetrain.orchestrator;

import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.common.enums.RetrainState;
import lombok.Builder;

import java.time.Instant;

@Builder
public record TargetStateSnapshot(
        String targetId,
        RetrainState state,
        RetrainReason lastReason,
        Instant stateSince,
        Instant lastCompletedAt,
        String currentJobId
) {
}
