package com.chicu.airetrain.orchestrator;

import com.chicu.airetrain.admission.AdmissionController;
import com.chicu.airetrain.queue.RetrainRequestQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Компонент "retrain" в /actuator/health: глубина очереди и занятость слотов обучения.
 * Полная очередь не валит health, это штатный backpressure.
 */
@Component
@RequiredArgsConstructor
public class RetrainHealthIndicator implements HealthIndicator {

    private final RetrainRequestQueue queue;
    private final AdmissionController admission;

    @Override
    public Health health() {
        return Health.up()
                .withDetail("pendingRequests", queue.size())
                .withDetail("slotsInUse", admission.slotsInUse())
                .withDetail("slotCeiling", admission.ceiling())
                .build();
    }
}
