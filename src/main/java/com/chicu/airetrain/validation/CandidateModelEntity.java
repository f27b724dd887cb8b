package com.chicu.airetrain.validation;

import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.common.enums.ValidationDecision;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Аудит кандидатов: отклонённые сохраняют только artifact_ref и решение gate.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "retrain_candidate_model",
        indexes = {
                @Index(name = "ix_candidate_target_created", columnList = "target_id,created_at"),
                @Index(name = "ix_candidate_job", columnList = "job_ref")
        }
)
public class CandidateModelEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "candidate_id", nullable = false, length = 128)
    private String candidateId;

    @Column(name = "target_id", nullable = false, length = 128)
    private String targetId;

    @Column(name = "job_ref", nullable = false, length = 64)
    private String jobRef;

    @Column(name = "artifact_ref", length = 512)
    private String artifactRef;

    @Column(name = "baseline_ref", length = 512)
    private String baselineRef;

    @Column(name = "mae")
    private Double mae;

    @Column(name = "rmse")
    private Double rmse;

    @Column(name = "n_samples")
    private Integer nSamples;

    @Column(name = "baseline_mae")
    private Double baselineMae;

    @Column(name = "delta")
    private Double delta;

    @Column(name = "p_value")
    private Double pValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision", nullable = false, length = 16)
    private ValidationDecision decision;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 48)
    private RetrainReason reason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
