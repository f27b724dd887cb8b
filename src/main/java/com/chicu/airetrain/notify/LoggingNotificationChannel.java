package com.chicu.airetrain.notify;

import com.chicu.airetrain.common.enums.NotificationType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingNotificationChannel implements NotificationChannel {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void send(NotificationEvent e) {
        if (e.type() == NotificationType.ROLLBACK_FAILURE_ALERT) {
            log.error("🚨 [ALERT] {} target={} reason={} at={} details={}",
                    e.type(), e.targetId(), e.reason(), e.occurredAt(), e.details());
        } else if (e.alert()) {
            log.warn("📣 {} target={} reason={} at={} details={}",
                    e.type(), e.targetId(), e.reason(), e.occurredAt(), e.details());
        } else {
            log.info("📣 {} target={} reason={} at={} details={}",
                    e.type(), e.targetId(), e.reason(), e.occurredAt(), e.details());
        }
    }
}
