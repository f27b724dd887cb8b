package com.chicu.airetrain.training.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitJobRequestDto {

    private String targetId;
    private String datasetRef;
    private String warmStartRef;
    private String versionLabel;

    @Builder.Default
    private Map<String, Object> meta = Map.of();
}
