package com.chicu.airetrain.registry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterCandidateRequestDto {

    private String targetId;
    private String artifactRef;
    private String versionLabel;
    private MetricsDto metrics;
}
