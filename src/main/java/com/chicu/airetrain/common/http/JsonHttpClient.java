package com.chicu.airetrain.common.http;

import com.chicu.airetrain.config.ExternalServicesProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * JSON поверх OkHttp для внешних коллабораторов.
 * Не-2xx → IllegalStateException с обрезанным телом, 404 на get → Optional.empty().
 */
@Slf4j
public class JsonHttpClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final String name;
    private final OkHttpClient http;
    private final ObjectMapper objectMapper;
    private final ExternalServicesProperties.Endpoint endpoint;

    public JsonHttpClient(String name,
                          OkHttpClient baseClient,
                          ObjectMapper objectMapper,
                          ExternalServicesProperties.Endpoint endpoint) {
        if (endpoint == null || endpoint.getBaseUrl() == null || endpoint.getBaseUrl().isBlank()) {
            throw new IllegalStateException(name + ": baseUrl не задан");
        }
        this.name = name;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.http = baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, endpoint.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, endpoint.getReadTimeoutMs())))
                .build();
    }

    public <T> T post(Object body, Class<T> responseType, String... pathSegments) {
        return send("POST", body, responseType, pathSegments)
                .orElseThrow(() -> new IllegalStateException(name + " 404: " + String.join("/", pathSegments)));
    }

    public void put(Object body, String... pathSegments) {
        send("PUT", body, Void.class, pathSegments);
    }

    public <T> Optional<T> get(Class<T> responseType, String... pathSegments) {
        return send("GET", null, responseType, pathSegments);
    }

    private <T> Optional<T> send(String method, Object body, Class<T> responseType, String... pathSegments) {
        HttpUrl url = url(pathSegments);

        try {
            Request.Builder rb = new Request.Builder().url(url);
            if (body != null) {
                String json = objectMapper.writeValueAsString(body);
                rb.method(method, RequestBody.create(json, JSON));
            } else {
                rb.method(method, null);
            }

            if (endpoint.getApiKey() != null && !endpoint.getApiKey().isBlank()) {
                rb.header("X-API-KEY", endpoint.getApiKey().trim());
            }

            try (Response resp = http.newCall(rb.build()).execute()) {

                String respBody = resp.body() != null ? resp.body().string() : "";

                if (resp.code() == 404 && "GET".equals(method)) {
                    return Optional.empty();
                }

                if (!resp.isSuccessful()) {
                    log.warn("🌐 {} error: {} {} -> {} body={}", name, method, url.encodedPath(), resp.code(), shrink(respBody));
                    throw new IllegalStateException(name + " HTTP " + resp.code() + ": " + shrink(respBody));
                }

                if (responseType == Void.class) {
                    return Optional.empty();
                }

                if (respBody.isBlank()) {
                    throw new IllegalStateException(name + " пустой ответ: " + url.encodedPath());
                }

                return Optional.of(objectMapper.readValue(respBody, responseType));
            }

        } catch (IOException e) {
            throw new IllegalStateException(name + " IO error: " + url + " -> " + e.getMessage(), e);
        }
    }

    private HttpUrl url(String... pathSegments) {
        HttpUrl base = HttpUrl.parse(endpoint.getBaseUrl().trim());
        if (base == null) {
            throw new IllegalStateException(name + ": кривой baseUrl " + endpoint.getBaseUrl());
        }
        HttpUrl.Builder b = base.newBuilder();
        for (String s : pathSegments) {
            b.addPathSegment(s);
        }
        return b.build();
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 400) return x;
        return x.substring(0, 400) + "...";
    }
}
