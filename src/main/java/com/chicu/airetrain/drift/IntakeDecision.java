package com.chicu.airetrain.drift;

import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.queue.RetrainRequest;
import lombok.Builder;

import java.time.Instant;

@Builder
public record IntakeDecision(
        String targetId,
        IntakeOutcome outcome,
        RetrainReason reason,
        String requestId,
        Double triggerSeverity,
        Integer coalescedCount,
        Instant decidedAt
) {

    public static IntakeDecision ignored(DriftEvent event, Instant at) {
        return IntakeDecision.builder()
                .targetId(event.targetId())
                .outcome(IntakeOutcome.IGNORED)
                .reason(RetrainReason.IGNORED)
                .decidedAt(at)
                .build();
    }

    public static IntakeDecision dropped(DriftEvent event, RetrainReason reason, Instant at) {
        return IntakeDecision.builder()
                .targetId(event.targetId())
                .outcome(IntakeOutcome.DROPPED)
                .reason(reason)
                .decidedAt(at)
                .build();
    }

    public static IntakeDecision of(IntakeOutcome outcome, RetrainReason reason, RetrainRequest request, Instant at) {
        return IntakeDecision.builder()
                .targetId(request.targetId())
                .outcome(outcome)
                .reason(reason)
                .requestId(request.requestId())
                .triggerSeverity(request.triggerSeverity())
                .coalescedCount(request.coalescedCount())
                .decidedAt(at)
                .build();
    }
}
