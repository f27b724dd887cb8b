package com.chicu.airetrain.promotion;

import com.chicu.airetrain.config.RetrainProperties;
import com.chicu.airetrain.registry.ModelRegistryClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Единственное место, которое меняет "какая модель в проде".
 *
 * Один промоушен на target за раз: второй параллельный получает {@link PromotionConflictException} сразу,
 * без ожидания. Откат ждёт текущую операцию и выполняется всегда.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionController {

    private final StabilityStore store;
    private final ModelRegistryClient registry;
    private final RetrainProperties props;
    private final Clock clock;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public StabilityRecord promote(String targetId, String candidateRef, String baselineRef) {
        ReentrantLock lock = lockFor(targetId);
        if (!lock.tryLock()) {
            log.warn("🔒 PromotionConflict target={} candidate={}", targetId, candidateRef);
            throw new PromotionConflictException(targetId);
        }
        try {
            if (store.isFrozen(targetId)) {
                throw new TargetFrozenException(targetId);
            }

            // registry первым: если serving не переключился, StabilityRecord не трогаем
            registry.markProduction(targetId, candidateRef);
            try {
                return store.promote(targetId, candidateRef, baselineRef, clock.instant());
            } catch (RuntimeException e) {
                restoreRegistry(targetId, baselineRef, e);
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Единая точка повтора для PromotionConflict.
     */
    public StabilityRecord promoteWithRetry(String targetId, String candidateRef, String baselineRef) {
        int retries = Math.max(0, props.getPromotionConflictRetries());
        Duration backoff = props.getPromotionConflictBackoff();

        for (int attempt = 0; ; attempt++) {
            try {
                return promote(targetId, candidateRef, baselineRef);
            } catch (PromotionConflictException e) {
                if (attempt >= retries) {
                    log.warn("🔒 PromotionConflict target={} retries exhausted ({})", targetId, retries);
                    throw e;
                }
                log.info("🔁 PromotionConflict target={} retry {}/{} in {}", targetId, attempt + 1, retries, backoff);
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    /**
     * Откат на previous_stable_ref. Любая ошибка → target заморожен, {@link RollbackFailureException}.
     */
    public StabilityRecord rollback(String targetId) {
        ReentrantLock lock = lockFor(targetId);
        lock.lock();
        try {
            StabilityRecord rec = store.rollback(targetId, clock.instant());
            registry.markProduction(targetId, rec.currentProductionRef());
            return rec;

        } catch (RuntimeException e) {
            log.error("🔥 ROLLBACK FAILED target={}: {}", targetId, e.getMessage(), e);
            freezeQuietly(targetId, "Rollback failure: " + e.getMessage(), e);
            if (e instanceof RollbackFailureException) {
                throw (RollbackFailureException) e;
            }
            throw new RollbackFailureException(targetId, "Rollback failed for target " + targetId + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    public boolean unfreeze(String targetId) {
        ReentrantLock lock = lockFor(targetId);
        lock.lock();
        try {
            return store.unfreeze(targetId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isFrozen(String targetId) {
        return store.isFrozen(targetId);
    }

    private void restoreRegistry(String targetId, String baselineRef, RuntimeException cause) {
        log.error("❌ Stability write failed after registry switch target={}: {}", targetId, cause.getMessage());
        if (baselineRef == null) {
            return;
        }
        try {
            registry.markProduction(targetId, baselineRef);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("❌ Registry restore failed target={} baseline={}: {}", targetId, baselineRef, e.getMessage());
        }
    }

    private void freezeQuietly(String targetId, String reason, RuntimeException cause) {
        try {
            store.freeze(targetId, reason, clock.instant());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("❌ Freeze failed target={}: {}", targetId, e.getMessage());
        }
    }

    private ReentrantLock lockFor(String targetId) {
        return locks.computeIfAbsent(targetId, k -> new ReentrantLock());
    }
}
