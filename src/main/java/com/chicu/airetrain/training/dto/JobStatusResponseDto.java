package com.chicu.airetrain.training.dto;

import com.chicu.airetrain.registry.dto.MetricsDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponseDto {

    private String jobId;

    /**
     * queued / running / succeeded / failed / timed_out
     */
    private String status;

    private MetricsDto metrics;
    private String artifactRef;
    private String message;
}
