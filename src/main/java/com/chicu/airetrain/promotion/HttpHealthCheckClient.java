package com.chicu.airetrain.promotion;

import com.chicu.airetrain.common.http.JsonHttpClient;
import com.chicu.airetrain.config.ExternalServicesProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

@Component
public class HttpHealthCheckClient implements HealthCheckClient {

    private final JsonHttpClient client;

    public HttpHealthCheckClient(OkHttpClient okHttpClient,
                                 ObjectMapper objectMapper,
                                 ExternalServicesProperties props) {
        this.client = new JsonHttpClient("Health check", okHttpClient, objectMapper, props.getHealth());
    }

    @Override
    public boolean check(String targetId) {
        return client.get(HealthResponseDto.class, "health", targetId)
                .map(HealthResponseDto::isHealthy)
                .orElseThrow(() -> new IllegalStateException("Health check не знает target " + targetId));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class HealthResponseDto {
        private boolean healthy;
        private String details;
    }
}
