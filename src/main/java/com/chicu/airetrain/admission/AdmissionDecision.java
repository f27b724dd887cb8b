package com.chicu.airetrain.admission;

import com.chicu.airetrain.common.enums.RetrainReason;
import lombok.Builder;

import java.time.Instant;

/**
 * @param keepQueued false при отказе: заявку выбрасываем
 */
@Builder
public record AdmissionDecision(
        boolean admitted,
        boolean keepQueued,
        RetrainReason reason,
        String jobId,
        Instant budgetWindowStart
) {

    public static AdmissionDecision admit(String jobId, Instant budgetWindowStart) {
        return AdmissionDecision.builder()
                .admitted(true)
                .keepQueued(false)
                .reason(RetrainReason.ACCEPTED)
                .jobId(jobId)
                .budgetWindowStart(budgetWindowStart)
                .build();
    }

    public static AdmissionDecision waitInQueue(RetrainReason reason) {
        return AdmissionDecision.builder().admitted(false).keepQueued(true).reason(reason).build();
    }

    public static AdmissionDecision discard(RetrainReason reason) {
        return AdmissionDecision.builder().admitted(false).keepQueued(false).reason(reason).build();
    }
}
