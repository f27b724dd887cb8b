package com.chicu.airetrain.training;

import com.chicu.airetrain.common.enums.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TrainingJobRepository extends JpaRepository<TrainingJobEntity, Long> {

    Optional<TrainingJobEntity> findByJobId(String jobId);

    List<TrainingJobEntity> findByStatusIn(Collection<JobStatus> statuses);

    List<TrainingJobEntity> findTop20ByTargetIdOrderByCreatedAtDesc(String targetId);

    // ✅ для восстановления cooldown после рестарта
    Optional<TrainingJobEntity> findTopByTargetIdAndStartedAtIsNotNullAndFinishedAtIsNotNullOrderByFinishedAtDesc(String targetId);

    long countByTargetIdAndStatus(String targetId, JobStatus status);
}
