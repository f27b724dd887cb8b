package com.chicu.airetrain.data;

import com.chicu.airetrain.common.http.JsonHttpClient;
import com.chicu.airetrain.config.ExternalServicesProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class HttpDataReadinessClient implements DataReadinessClient {

    private final JsonHttpClient client;

    public HttpDataReadinessClient(OkHttpClient okHttpClient,
                                   ObjectMapper objectMapper,
                                   ExternalServicesProperties props) {
        this.client = new JsonHttpClient("Data readiness", okHttpClient, objectMapper, props.getData());
    }

    @Override
    public DataReadiness check(String targetId) {
        ReadinessResponseDto resp = client.get(ReadinessResponseDto.class, "readiness", targetId).orElse(null);
        if (resp == null) {
            return DataReadiness.notReady("no dataset registered for " + targetId);
        }

        boolean ready = resp.isReady() && resp.getDatasetRef() != null && !resp.getDatasetRef().isBlank();
        if (resp.isReady() && !ready) {
            log.warn("⚠️ Data readiness: target={} ready=true без datasetRef, считаю not ready", targetId);
        }

        return DataReadiness.builder()
                .ready(ready)
                .datasetRef(ready ? resp.getDatasetRef().trim() : null)
                .details(resp.getDetails())
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ReadinessResponseDto {
        private boolean ready;
        private String datasetRef;
        private String details;
    }
}
