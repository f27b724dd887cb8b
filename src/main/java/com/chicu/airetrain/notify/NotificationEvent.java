package com.chicu.airetrain.notify;

import com.chicu.airetrain.common.enums.NotificationType;
import com.chicu.airetrain.common.enums.RetrainReason;
import lombok.Builder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Структурированное событие о терминальном переходе цикла.
 */
@Builder
public record NotificationEvent(
        NotificationType type,
        String targetId,
        RetrainReason reason,
        Instant occurredAt,
        Map<String, Object> details
) {

    public NotificationEvent {
        details = details == null ? Map.of() : new LinkedHashMap<>(details);
    }

    public boolean alert() {
        return type != null && type.isAlert();
    }

    public String level() {
        if (type == NotificationType.ROLLBACK_FAILURE_ALERT) return "ALERT";
        return alert() ? "WARN" : "INFO";
    }
}
