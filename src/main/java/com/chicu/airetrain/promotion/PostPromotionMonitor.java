package com.chicu.airetrain.promotion;

import com.chicu.airetrain.config.RetrainProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Наблюдение за новой моделью в течение rollback-grace-period.
 *
 * Только явный {@code false} от health check считается провалом.
 * Исключение при опросе = результат неизвестен, опрос продолжается.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostPromotionMonitor {

    private final HealthCheckClient healthCheck;
    private final RetrainProperties props;

    /**
     * Блокирует вызывающий поток на время grace period.
     *
     * @return false: health check явно провалился
     */
    public boolean watch(String targetId) {
        Duration grace = props.getRollbackGracePeriod();
        Duration interval = props.getHealthPollInterval();
        long intervalMs = Math.max(1, interval.toMillis());
        long polls = Math.max(1, (grace.toMillis() + intervalMs - 1) / intervalMs);

        log.info("👀 Grace period target={} grace={} polls={}", targetId, grace, polls);

        int inconclusive = 0;
        for (long i = 0; i < polls; i++) {
            try {
                if (!healthCheck.check(targetId)) {
                    log.warn("💔 Health check FAILED target={} poll {}/{}", targetId, i + 1, polls);
                    return false;
                }
            } catch (RuntimeException e) {
                inconclusive++;
                log.warn("⚠️ Health check inconclusive target={} poll {}/{}: {}", targetId, i + 1, polls, e.getMessage());
            }

            if (i + 1 < polls && !pause(intervalMs)) {
                log.warn("⏹ Grace period interrupted target={}", targetId);
                break;
            }
        }

        log.info("💚 Grace period passed target={} inconclusivePolls={}", targetId, inconclusive);
        return true;
    }

    private static boolean pause(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
