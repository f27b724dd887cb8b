package com.chicu.airetrain.notify;

import com.chicu.airetrain.common.enums.NotificationType;
import com.chicu.airetrain.common.enums.RetrainReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Рассылает событие во все каналы. Падение канала логируется и не мешает остальным.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final List<NotificationChannel> channels;
    private final Clock clock;

    public void publish(NotificationEvent event) {
        for (NotificationChannel ch : channels) {
            try {
                ch.send(event);
            } catch (RuntimeException e) {
                log.warn("⚠️ Notification channel '{}' failed for {} target={}: {}",
                        ch.name(), event.type(), event.targetId(), e.getMessage());
            }
        }
    }

    public void notify(NotificationType type, String targetId, RetrainReason reason, Map<String, Object> details) {
        publish(NotificationEvent.builder()
                .type(type)
                .targetId(targetId)
                .reason(reason)
                .occurredAt(clock.instant())
                .details(details)
                .build());
    }
}
