package com.chicu.airetrain.web.dto;

import com.chicu.airetrain.common.enums.JobStatus;
import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.training.TrainingJobEntity;

import java.time.Instant;

public record TrainingJobView(
        String jobId,
        String requestRef,
        String versionLabel,
        JobStatus status,
        RetrainReason reason,
        String artifactRef,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        String message
) {

    public static TrainingJobView of(TrainingJobEntity e) {
        return new TrainingJobView(
                e.getJobId(),
                e.getRequestRef(),
                e.getVersionLabel(),
                e.getStatus(),
                e.getReason(),
                e.getArtifactRef(),
                e.getCreatedAt(),
                e.getStartedAt(),
                e.getFinishedAt(),
                e.getMessage()
        );
    }
}
