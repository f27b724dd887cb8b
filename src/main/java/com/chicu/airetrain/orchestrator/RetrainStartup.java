package com.chicu.airetrain.orchestrator;

import com.chicu.airetrain.training.TrainingJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Старт после рестарта: сначала закрываем осиротевшие job'ы, потом запускаем диспетчер.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrainStartup implements ApplicationRunner {

    private final TrainingJobService trainingJobs;
    private final RetrainDispatcher dispatcher;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        try {
            int n = trainingJobs.recoverOrphans(clock.instant());
            if (n > 0) {
                log.warn("🧟 Restart recovery: {} orphaned job(s) marked TIMED_OUT", n);
            } else {
                log.info("✅ Restart recovery: no orphaned jobs");
            }
        } catch (RuntimeException e) {
            // без восстановления всё равно стартуем, job'ы останутся висеть до следующего рестарта
            log.warn("⚠️ Restart recovery failed: {}", e.getMessage());
        }
        dispatcher.start();
    }
}
