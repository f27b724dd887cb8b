package com.chicu.airetrain.config;

import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class HttpClientConfig {

    /**
     * 🌐 Базовый клиент для внешних сервисов (runner, registry, data, health, webhook).
     * Адаптеры делают newBuilder() и ставят свои таймауты из {@link ExternalServicesProperties}.
     */
    @Bean
    public OkHttpClient okHttpClient(RetrainProperties props) {
        // поллинг job-статусов держит по соединению на воркер
        int workers = Math.max(props.getResourceConcurrencyCeiling(), 1);

        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequestsPerHost(workers * 2);

        log.info("🌐 OkHttp: pool={} conns, maxPerHost={}", workers * 2, dispatcher.getMaxRequestsPerHost());

        return new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectionPool(new ConnectionPool(workers * 2, 2, TimeUnit.MINUTES))
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(Duration.ofSeconds(20))
                .callTimeout(Duration.ofSeconds(60))
                .retryOnConnectionFailure(true)
                .build();
    }
}
