package com.chicu.airetrain.web.dto;

import com.chicu.airetrain.drift.DriftEvent;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftEventPayload {

    @NotBlank
    private String targetId;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double severity;

    @NotNull
    private Instant detectedAt;

    private Map<String, Double> featureBreakdown;

    public DriftEvent toEvent() {
        return DriftEvent.builder()
                .targetId(targetId)
                .severity(severity)
                .detectedAt(detectedAt)
                .featureBreakdown(featureBreakdown)
                .build();
    }
}
