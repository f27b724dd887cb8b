package com.chicu.airetrain.promotion;

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
        name = "retrain_stability_record",
        uniqueConstraints = @UniqueConstraint(name = "ux_stability_record_target", columnNames = "target_id")
)
public class StabilityRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "target_id", nullable = false, length = 128)
    private String targetId;

    /**
     * Прошёл Validation Gate или исходный baseline из registry.
     */
    @Column(name = "current_production_ref", length = 512)
    private String currentProductionRef;

    @Column(name = "previous_stable_ref", length = 512)
    private String previousStableRef;

    @Column(name = "promoted_at")
    private Instant promotedAt;

    @Column(name = "rolled_back_at")
    private Instant rolledBackAt;

    @Column(name = "frozen", nullable = false)
    private boolean frozen;

    @Column(name = "frozen_reason", length = 1000)
    private String frozenReason;

    @Column(name = "frozen_at")
    private Instant frozenAt;

    @Version
    @Column(name = "version")
    private Long version;

    public StabilityRecord toRecord() {
        return StabilityRecord.builder()
                .targetId(targetId)
                .currentProductionRef(currentProductionRef)
                .previousStableRef(previousStableRef)
                .promotedAt(promotedAt)
                .rolledBackAt(rolledBackAt)
                .frozen(frozen)
                .frozenReason(frozenReason)
                .build();
    }
}
