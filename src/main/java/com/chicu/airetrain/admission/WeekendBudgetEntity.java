package com.chicu.airetrain.admission;

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
        name = "retrain_weekend_budget",
        uniqueConstraints = @UniqueConstraint(name = "ux_weekend_budget_target", columnNames = "target_id")
)
public class WeekendBudgetEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "target_id", nullable = false, length = 128)
    private String targetId;

    @Column(name = "window_start", nullable = false)
    private Instant windowStart;

    @Column(name = "window_end", nullable = false)
    private Instant windowEnd;

    @Column(name = "weekend", nullable = false)
    private boolean weekend;

    @Column(name = "retrains_used", nullable = false)
    private int retrainsUsed;

    @Column(name = "retrains_cap", nullable = false)
    private int retrainsCap;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public WeekendBudget toSnapshot() {
        return WeekendBudget.builder()
                .targetId(targetId)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .weekend(weekend)
                .retrainsUsed(retrainsUsed)
                .retrainsCap(retrainsCap)
                .build();
    }
}
