package com.chicu.airetrain.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "retrain.notifications")
public class NotificationProperties {

    /**
     * Куда POST'ить уведомления. Пусто: только лог.
     */
    private String webhookUrl = "";

    private long timeoutMs = 5000;
}
