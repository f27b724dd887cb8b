package com.chicu.airetrain.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Адреса внешних коллабораторов: job runner, registry, data readiness, health check.
 */
@Data
@ConfigurationProperties(prefix = "retrain.external")
public class ExternalServicesProperties {

    private Endpoint runner = new Endpoint("http://127.0.0.1:8101");
    private Endpoint registry = new Endpoint("http://127.0.0.1:8102");
    private Endpoint data = new Endpoint("http://127.0.0.1:8103");
    private Endpoint health = new Endpoint("http://127.0.0.1:8104");

    @Data
    public static class Endpoint {

        /**
         * Пример: http://127.0.0.1:8101
         */
        private String baseUrl;

        /**
         * Пустой: заголовок X-API-KEY не шлём.
         */
        private String apiKey = "";

        private long connectTimeoutMs = 1000;
        private long readTimeoutMs = 8000;

        public Endpoint() {
        }

        public Endpoint(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
