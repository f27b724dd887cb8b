package com.chicu.airetrain.training;

import com.chicu.airetrain.common.enums.JobStatus;
import com.chicu.airetrain.common.enums.RetrainReason;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(TrainingJobService.class)
class TrainingJobServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-11T10:00:00Z");
    private static final Instant WINDOW = Instant.parse("2026-03-09T00:00:00Z");

    @Autowired private TrainingJobService service;
    @Autowired private TrainingJobRepository repo;

    @Test
    void lifecycle_queuedRunningSucceeded() {
        String jobId = queued("tj-life");

        service.markRunning(jobId, "ext-1", "ds-1", "model-v1", T0);
        TrainingJobEntity done = service.markSucceeded(jobId, "model-v2", T0.plusSeconds(600));

        assertEquals(JobStatus.SUCCEEDED, done.getStatus());
        assertEquals("ext-1", done.getExternalJobId());
        assertEquals("model-v1", done.getWarmStartRef());
        assertEquals("model-v2", done.getArtifactRef());
        assertEquals(T0.plusSeconds(600), service.lastCompletedAt("tj-life").orElseThrow());
    }

    @Test
    void succeededRequiresRunning() {
        String jobId = queued("tj-order");

        assertThrows(IllegalStateException.class, () -> service.markSucceeded(jobId, "model-v2", T0));
    }

    @Test
    void terminalStatus_isNotOverwritten() {
        String jobId = queued("tj-terminal");
        service.markFinishedUnsuccessfully(jobId, JobStatus.FAILED, RetrainReason.DATA_NOT_READY, "no data", T0);

        TrainingJobEntity again = service.markFinishedUnsuccessfully(jobId, JobStatus.TIMED_OUT,
                RetrainReason.TIMED_OUT, "late", T0.plusSeconds(5));

        assertEquals(JobStatus.FAILED, again.getStatus());
        assertEquals(RetrainReason.DATA_NOT_READY, again.getReason());
    }

    @Test
    void jobThatNeverStarted_doesNotCountForCooldown() {
        String jobId = queued("tj-nostart");
        service.markFinishedUnsuccessfully(jobId, JobStatus.FAILED, RetrainReason.DATA_NOT_READY, "no data", T0);

        assertTrue(service.lastCompletedAt("tj-nostart").isEmpty());
    }

    @Test
    void failureStatusOnly() {
        String jobId = queued("tj-bad");

        assertThrows(IllegalArgumentException.class,
                () -> service.markFinishedUnsuccessfully(jobId, JobStatus.SUCCEEDED, RetrainReason.ACCEPTED, "x", T0));
    }

    @Test
    void recoverOrphans_shouldTimeOutQueuedAndRunningJobs() {
        String q = queued("tj-orphan-q");
        String r = queued("tj-orphan-r");
        service.markRunning(r, "ext-r", "ds", null, T0);
        String done = queued("tj-orphan-done");
        service.markRunning(done, "ext-d", "ds", null, T0);
        service.markSucceeded(done, "model", T0.plusSeconds(10));

        Instant restart = T0.plusSeconds(3600);
        int recovered = service.recoverOrphans(restart);

        assertEquals(2, recovered);
        for (String id : new String[]{q, r}) {
            TrainingJobEntity j = service.find(id).orElseThrow();
            assertEquals(JobStatus.TIMED_OUT, j.getStatus());
            assertEquals(RetrainReason.ORPHANED_ON_RESTART, j.getReason());
            assertEquals(restart, j.getFinishedAt());
        }
        assertEquals(JobStatus.SUCCEEDED, service.find(done).orElseThrow().getStatus());
        // после рестарта cooldown считается и от осиротевших job
        assertEquals(restart, service.lastCompletedAt("tj-orphan-q").orElseThrow());
    }

    private String queued(String targetId) {
        String jobId = UUID.randomUUID().toString();
        repo.save(TrainingJobEntity.builder()
                .jobId(jobId)
                .targetId(targetId)
                .requestRef(UUID.randomUUID().toString())
                .status(JobStatus.QUEUED)
                .budgetWindowStart(WINDOW)
                .createdAt(T0)
                .build());
        return jobId;
    }
}
