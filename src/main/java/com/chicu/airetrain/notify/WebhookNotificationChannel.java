package com.chicu.airetrain.notify;

import com.chicu.airetrain.config.NotificationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POST JSON на retrain.notifications.webhook-url. Включается только если URL задан.
 */
@Slf4j
@Component
@ConditionalOnExpression("!'${retrain.notifications.webhook-url:}'.isBlank()")
public class WebhookNotificationChannel implements NotificationChannel {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient http;
    private final ObjectMapper mapper;
    private final String url;

    public WebhookNotificationChannel(OkHttpClient baseClient, ObjectMapper mapper, NotificationProperties props) {
        this.mapper = mapper;
        this.url = props.getWebhookUrl().trim();
        this.http = baseClient.newBuilder()
                .callTimeout(Duration.ofMillis(props.getTimeoutMs()))
                .build();
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public void send(NotificationEvent e) {
        String json;
        try {
            json = mapper.writeValueAsString(toPayload(e));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Notification serialize failed: " + ex.getMessage(), ex);
        }

        Request req = new Request.Builder()
                .url(url)
                .post(RequestBody.create(json, JSON))
                .build();

        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw new IllegalStateException("Webhook HTTP " + resp.code() + " for " + e.type());
            }
            log.debug("📤 Webhook sent {} target={}", e.type(), e.targetId());
        } catch (IOException ex) {
            throw new IllegalStateException("Webhook call failed: " + ex.getMessage(), ex);
        }
    }

    private static Map<String, Object> toPayload(NotificationEvent e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", e.type() != null ? e.type().name() : null);
        m.put("level", e.level());
        m.put("targetId", e.targetId());
        m.put("reason", e.reason() != null ? e.reason().name() : null);
        m.put("occurredAt", e.occurredAt() != null ? e.occurredAt().toString() : null);
        m.put("details", e.details());
        return m;
    }
}
