package com.chicu.airetrain.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "retrain")
public class RetrainProperties {

    // ==========================
    // INTAKE
    // ==========================

    /** Минимальная severity drift-события, ниже: игнор */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double severityThreshold = 0.8;

    /** Окно склейки событий в одну заявку */
    @Min(0)
    private long debounceSeconds = 300;

    /** Пауза после завершённого цикла, прежде чем target можно снова триггерить */
    @Min(0)
    private long cooldownSeconds = 1800;

    /** Защита от шторма: сколько заявок может висеть в очереди по всем target */
    @Min(1)
    private int maxPendingRequests = 50;

    // ==========================
    // BUDGET / ADMISSION
    // ==========================

    @Min(0)
    private int maxWeekendRetrains = 3;

    @Min(0)
    private int maxWeekdayRetrains = 10;

    @NotNull
    private Set<DayOfWeek> weekendDays = EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);

    @NotBlank
    private String budgetZone = "UTC";

    /** Потолок одновременных TrainingJob по всем target */
    @Min(1)
    private int resourceConcurrencyCeiling = 2;

    @Min(10)
    private long dispatchIntervalMs = 1000;

    // ==========================
    // TRAINING
    // ==========================

    @NotNull
    private Duration maxTrainingDuration = Duration.ofHours(2);

    @NotNull
    private Duration jobPollInterval = Duration.ofSeconds(15);

    @NotNull
    private Duration dataNotReadyBackoff = Duration.ofMinutes(5);

    // ==========================
    // VALIDATION GATE
    // ==========================

    /** Относительное улучшение MAE (0.05 = 5%) */
    @DecimalMin("0.0")
    private double improvementThreshold = 0.05;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double significanceLevel = 0.05;

    @Min(2)
    private int minEvalSamples = 30;

    // ==========================
    // PROMOTION / ROLLBACK
    // ==========================

    @NotNull
    private Duration rollbackGracePeriod = Duration.ofMinutes(10);

    @NotNull
    private Duration healthPollInterval = Duration.ofSeconds(30);

    @Min(0)
    private int promotionConflictRetries = 3;

    @NotNull
    private Duration promotionConflictBackoff = Duration.ofSeconds(2);

    public ZoneId zone() {
        return ZoneId.of(budgetZone.trim());
    }

    public Duration debounce() {
        return Duration.ofSeconds(debounceSeconds);
    }

    public Duration cooldown() {
        return Duration.ofSeconds(cooldownSeconds);
    }
}
