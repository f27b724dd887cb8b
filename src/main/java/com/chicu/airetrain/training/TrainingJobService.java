package com.chicu.airetrain.training;

import com.chicu.airetrain.common.enums.JobStatus;
import com.chicu.airetrain.common.enums.RetrainReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Переходы статусов TrainingJob. Создание job в {@code WeekendBudgetService.admit}
 * (одна транзакция со списанием бюджета).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingJobService {

    private final TrainingJobRepository repo;

    @Transactional
    public TrainingJobEntity markRunning(String jobId, String externalJobId, String datasetRef,
                                         String warmStartRef, Instant at) {
        TrainingJobEntity job = require(jobId);
        ensureStatus(job, JobStatus.QUEUED);

        job.setStatus(JobStatus.RUNNING);
        job.setExternalJobId(externalJobId);
        job.setDatasetRef(datasetRef);
        job.setWarmStartRef(warmStartRef);
        job.setStartedAt(at);
        return repo.save(job);
    }

    @Transactional
    public TrainingJobEntity markSucceeded(String jobId, String artifactRef, Instant at) {
        TrainingJobEntity job = require(jobId);
        ensureStatus(job, JobStatus.RUNNING);

        job.setStatus(JobStatus.SUCCEEDED);
        job.setArtifactRef(artifactRef);
        job.setFinishedAt(at);
        return repo.save(job);
    }

    /**
     * FAILED или TIMED_OUT. Бюджет не возвращается.
     */
    @Transactional
    public TrainingJobEntity markFinishedUnsuccessfully(String jobId, JobStatus status, RetrainReason reason,
                                                        String message, Instant at) {
        if (status != JobStatus.FAILED && status != JobStatus.TIMED_OUT) {
            throw new IllegalArgumentException("not a failure status: " + status);
        }
        TrainingJobEntity job = require(jobId);
        if (job.getStatus().isTerminal()) {
            log.warn("⚠️ Job {} уже в терминальном статусе {}, {} пропущен", jobId, job.getStatus(), status);
            return job;
        }

        job.setStatus(status);
        job.setReason(reason);
        job.setMessage(shrink(message));
        job.setFinishedAt(at);
        return repo.save(job);
    }

    /**
     * После рестарта: всё, что осталось QUEUED/RUNNING, живого исполнения не имеет → TIMED_OUT.
     */
    @Transactional
    public int recoverOrphans(Instant now) {
        List<TrainingJobEntity> orphans = repo.findByStatusIn(EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING));
        for (TrainingJobEntity job : orphans) {
            log.warn("🧟 Orphaned job {} target={} status={} → TIMED_OUT", job.getJobId(), job.getTargetId(), job.getStatus());
            job.setStatus(JobStatus.TIMED_OUT);
            job.setReason(RetrainReason.ORPHANED_ON_RESTART);
            job.setFinishedAt(now);
            if (job.getStartedAt() == null) {
                job.setStartedAt(now);
            }
        }
        repo.saveAll(orphans);
        return orphans.size();
    }

    @Transactional(readOnly = true)
    public Optional<Instant> lastCompletedAt(String targetId) {
        return repo.findTopByTargetIdAndStartedAtIsNotNullAndFinishedAtIsNotNullOrderByFinishedAtDesc(targetId)
                .map(TrainingJobEntity::getFinishedAt);
    }

    @Transactional(readOnly = true)
    public List<TrainingJobEntity> recent(String targetId) {
        return repo.findTop20ByTargetIdOrderByCreatedAtDesc(targetId);
    }

    @Transactional(readOnly = true)
    public Optional<TrainingJobEntity> find(String jobId) {
        return repo.findByJobId(jobId);
    }

    private TrainingJobEntity require(String jobId) {
        return repo.findByJobId(jobId)
                .orElseThrow(() -> new IllegalStateException("TrainingJob not found jobId=" + jobId));
    }

    private static void ensureStatus(TrainingJobEntity job, JobStatus expected) {
        if (job.getStatus() != expected) {
            throw new IllegalStateException("TrainingJob " + job.getJobId() + " status=" + job.getStatus()
                    + ", expected " + expected);
        }
    }

    private static String shrink(String s) {
        if (s == null) return null;
        String x = s.trim();
        return x.length() > 1000 ? x.substring(0, 1000) : x;
    }
}
