package com.chicu.airetrain.registry;

import com.chicu.airetrain.common.http.JsonHttpClient;
import com.chicu.airetrain.config.ExternalServicesProperties;
import com.chicu.airetrain.registry.dto.MetricsDto;
import com.chicu.airetrain.registry.dto.ProductionRefDto;
import com.chicu.airetrain.registry.dto.RegisterCandidateRequestDto;
import com.chicu.airetrain.registry.dto.RegisterCandidateResponseDto;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
public class HttpModelRegistryClient implements ModelRegistryClient {

    private final JsonHttpClient client;

    public HttpModelRegistryClient(OkHttpClient okHttpClient,
                                   ObjectMapper objectMapper,
                                   ExternalServicesProperties props) {
        this.client = new JsonHttpClient("Model registry", okHttpClient, objectMapper, props.getRegistry());
    }

    @Override
    public Optional<String> getProduction(String targetId) {
        return client.get(ProductionRefDto.class, "models", targetId, "production")
                .map(ProductionRefDto::getArtifactRef)
                .filter(ref -> !ref.isBlank());
    }

    @Override
    public String register(String targetId, String artifactRef, EvaluationMetrics metrics, String versionLabel) {
        RegisterCandidateRequestDto req = RegisterCandidateRequestDto.builder()
                .targetId(targetId)
                .artifactRef(artifactRef)
                .versionLabel(versionLabel)
                .metrics(MetricsDto.from(metrics))
                .build();

        RegisterCandidateResponseDto resp = client.post(req, RegisterCandidateResponseDto.class, "candidates");
        if (resp.getCandidateId() == null || resp.getCandidateId().isBlank()) {
            throw new IllegalStateException("Model registry не вернул candidateId для " + artifactRef);
        }

        log.info("📦 Registry: candidate {} registered target={} artifact={} version={}",
                resp.getCandidateId(), targetId, artifactRef, versionLabel);
        return resp.getCandidateId();
    }

    @Override
    public Optional<EvaluationMetrics> getMetrics(String artifactRef) {
        return client.get(MetricsDto.class, "artifacts", artifactRef, "metrics")
                .map(MetricsDto::toMetrics);
    }

    @Override
    public void markProduction(String targetId, String artifactRef) {
        client.put(ProductionRefDto.builder().targetId(targetId).artifactRef(artifactRef).build(),
                "models", targetId, "production");
        log.info("📦 Registry: production target={} → {}", targetId, artifactRef);
    }
}
