package com.chicu.airetrain.orchestrator;

import com.chicu.airetrain.queue.RetrainRequest;

import java.time.Instant;

/**
 * Заявка, прошедшая admission: слот занят, бюджет списан, job создан (QUEUED).
 */
public record AdmittedCycle(
        RetrainRequest request,
        String jobId,
        Instant budgetWindowStart,
        String versionLabel
) {

    public String targetId() {
        return request.targetId();
    }
}
