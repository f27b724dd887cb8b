package com.chicu.airetrain.promotion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Долговременная запись "что сейчас в проде" по target.
 * Мутирует только {@link PromotionController}; каждая мутация под блокировкой строки.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StabilityStore {

    private final StabilityRecordRepository repo;

    @Transactional(readOnly = true)
    public Optional<StabilityRecord> find(String targetId) {
        return repo.findByTargetId(targetId).map(StabilityRecordEntity::toRecord);
    }

    @Transactional(readOnly = true)
    public boolean isFrozen(String targetId) {
        return repo.existsByTargetIdAndFrozenTrue(targetId);
    }

    /**
     * Первая запись для target: current = исходный baseline из registry.
     */
    @Transactional
    public StabilityRecord seedBaseline(String targetId, String baselineRef) {
        return repo.findForUpdate(targetId)
                .orElseGet(() -> {
                    log.info("🌱 Stability seed target={} baseline={}", targetId, baselineRef);
                    return repo.save(StabilityRecordEntity.builder()
                            .targetId(targetId)
                            .currentProductionRef(baselineRef)
                            .frozen(false)
                            .build());
                })
                .toRecord();
    }

    /**
     * previous := current, current := newRef, promoted_at := now. Одна транзакция.
     *
     * @param baselineRef чем засеять запись, если её ещё нет
     */
    @Transactional
    public StabilityRecord promote(String targetId, String newRef, String baselineRef, Instant now) {
        StabilityRecordEntity rec = repo.findForUpdate(targetId)
                .orElseGet(() -> StabilityRecordEntity.builder()
                        .targetId(targetId)
                        .currentProductionRef(baselineRef)
                        .frozen(false)
                        .build());

        if (rec.isFrozen()) {
            throw new TargetFrozenException(targetId);
        }

        String old = rec.getCurrentProductionRef();
        rec.setPreviousStableRef(old);
        rec.setCurrentProductionRef(newRef);
        rec.setPromotedAt(now);
        rec = repo.save(rec);

        log.info("🚀 Stability PROMOTE target={} {} → {}", targetId, old, newRef);
        return rec.toRecord();
    }

    /**
     * current := previous, previous := null. Дальше одного шага назад не уходит.
     */
    @Transactional
    public StabilityRecord rollback(String targetId, Instant now) {
        StabilityRecordEntity rec = repo.findForUpdate(targetId)
                .orElseThrow(() -> new RollbackFailureException(targetId, "No stability record for target " + targetId));

        String previous = rec.getPreviousStableRef();
        if (previous == null || previous.isBlank()) {
            throw new RollbackFailureException(targetId,
                    "No previous stable model for target " + targetId + " (current=" + rec.getCurrentProductionRef() + ")");
        }

        String bad = rec.getCurrentProductionRef();
        rec.setCurrentProductionRef(previous);
        rec.setPreviousStableRef(null);
        rec.setRolledBackAt(now);
        rec = repo.save(rec);

        log.warn("⏪ Stability ROLLBACK target={} {} → {}", targetId, bad, previous);
        return rec.toRecord();
    }

    @Transactional
    public StabilityRecord freeze(String targetId, String reason, Instant now) {
        StabilityRecordEntity rec = repo.findForUpdate(targetId)
                .orElseGet(() -> StabilityRecordEntity.builder().targetId(targetId).build());

        rec.setFrozen(true);
        rec.setFrozenReason(shrink(reason));
        rec.setFrozenAt(now);
        rec = repo.save(rec);

        log.error("🧊 Target FROZEN target={} reason={}", targetId, reason);
        return rec.toRecord();
    }

    /**
     * @return false: target и не был заморожен
     */
    @Transactional
    public boolean unfreeze(String targetId) {
        Optional<StabilityRecordEntity> opt = repo.findForUpdate(targetId);
        if (opt.isEmpty() || !opt.get().isFrozen()) {
            return false;
        }
        StabilityRecordEntity rec = opt.get();
        rec.setFrozen(false);
        rec.setFrozenReason(null);
        rec.setFrozenAt(null);
        repo.save(rec);

        log.info("🔓 Target UNFROZEN target={} current={}", targetId, rec.getCurrentProductionRef());
        return true;
    }

    private static String shrink(String s) {
        if (s == null) return null;
        return s.length() > 1000 ? s.substring(0, 1000) : s;
    }
}
