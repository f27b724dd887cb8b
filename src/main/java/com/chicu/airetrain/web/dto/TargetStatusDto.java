package com.chicu.airetrain.web.dto;

import com.chicu.airetrain.admission.WeekendBudget;
import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.common.enums.RetrainState;
import com.chicu.airetrain.promotion.StabilityRecord;
import com.chicu.airetrain.queue.RetrainRequest;
import lombok.Builder;

import java.time.Instant;

@Builder
public record TargetStatusDto(
        String targetId,
        RetrainState state,
        RetrainReason lastReason,
        Instant stateSince,
        Instant lastCompletedAt,
        boolean inCooldown,
        String currentJobId,
        RetrainRequest pendingRequest,
        StabilityRecord stability,
        WeekendBudget budget,
        boolean frozen
) {
}
