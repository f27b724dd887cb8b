package com.chicu.airetrain.drift;

import com.chicu.airetrain.common.enums.RetrainReason;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "retrain_intake_audit",
        indexes = {
                @Index(name = "ix_intake_audit_target_created", columnList = "target_id,created_at"),
                @Index(name = "ix_intake_audit_request", columnList = "request_id")
        }
)
public class IntakeAuditEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "target_id", nullable = false, length = 128)
    private String targetId;

    @Column(name = "severity", nullable = false)
    private double severity;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 16)
    private IntakeOutcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 48)
    private RetrainReason reason;

    /**
     * Заявка, в которую попало событие (null для ignored/dropped).
     */
    @Column(name = "request_id", length = 64)
    private String requestId;

    /**
     * JSON с разбивкой по фичам. Храним строкой, чтобы не тащить отдельные таблицы.
     */
    @Column(name = "feature_breakdown_json", length = 4000)
    private String featureBreakdownJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        if (targetId != null) targetId = targetId.trim();
    }
}
