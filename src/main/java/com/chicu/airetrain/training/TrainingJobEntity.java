package com.chicu.airetrain.training;

import com.chicu.airetrain.common.enums.JobStatus;
import com.chicu.airetrain.common.enums.RetrainReason;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * TrainingJob принадлежит только оркестратору. Job runner лишь сообщает статусы,
 * сам job не создаёт и не удаляет.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "retrain_training_job",
        indexes = {
                @Index(name = "ux_training_job_job_id", columnList = "job_id", unique = true),
                @Index(name = "ix_training_job_target_created", columnList = "target_id,created_at"),
                @Index(name = "ix_training_job_status", columnList = "status")
        }
)
public class TrainingJobEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 64, unique = true)
    private String jobId;

    @Column(name = "target_id", nullable = false, length = 128)
    private String targetId;

    /**
     * requestId заявки, из которой родился job.
     */
    @Column(name = "request_ref", nullable = false, length = 64)
    private String requestRef;

    @Column(name = "trigger_severity")
    private Double triggerSeverity;

    /**
     * Версия артефакта: {target}_{yyyyMMddHHmmss}_drift_{requestId}.
     */
    @Column(name = "version_label", length = 256)
    private String versionLabel;

    /**
     * id на стороне job runner'а (после submit).
     */
    @Column(name = "external_job_id", length = 128)
    private String externalJobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private JobStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", length = 48)
    private RetrainReason reason;

    @Column(name = "dataset_ref", length = 512)
    private String datasetRef;

    @Column(name = "warm_start_ref", length = 512)
    private String warmStartRef;

    @Column(name = "artifact_ref", length = 512)
    private String artifactRef;

    /**
     * Окно бюджета, из которого списан retrain (для refund).
     */
    @Column(name = "budget_window_start", nullable = false)
    private Instant budgetWindowStart;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "message", length = 1000)
    private String message;
}
