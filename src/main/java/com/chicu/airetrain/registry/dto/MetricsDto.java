package com.chicu.airetrain.registry.dto;

import com.chicu.airetrain.registry.EvaluationMetrics;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsDto {

    private Double mae;
    private Double rmse;
    // ✅ на проводе "nSamples"; поле названо иначе, чтобы getter не превратился в "nsamples"
    @JsonProperty("nSamples")
    private Integer sampleCount;

    @Builder.Default
    private Map<String, Double> sampleErrors = Map.of();

    public EvaluationMetrics toMetrics() {
        if (mae == null) {
            throw new IllegalStateException("metrics без mae");
        }
        Map<String, Double> errors = sampleErrors != null ? sampleErrors : Map.of();
        return EvaluationMetrics.builder()
                .mae(mae)
                .rmse(rmse != null ? rmse : Double.NaN)
                .nSamples(sampleCount != null ? sampleCount : errors.size())
                .sampleErrors(errors)
                .build();
    }

    public static MetricsDto from(EvaluationMetrics m) {
        return MetricsDto.builder()
                .mae(m.mae())
                .rmse(m.rmse())
                .sampleCount(m.nSamples())
                .sampleErrors(m.sampleErrors())
                .build();
    }
}
