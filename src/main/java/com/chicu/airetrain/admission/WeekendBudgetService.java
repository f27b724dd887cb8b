package com.chicu.airetrain.admission;

import com.chicu.airetrain.common.enums.JobStatus;
import com.chicu.airetrain.queue.RetrainRequest;
import com.chicu.airetrain.training.TrainingJobEntity;
import com.chicu.airetrain.training.TrainingJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Учёт retrains_used по окнам.
 *
 * Инвариант: retrains_used ≤ retrains_cap внутри окна. Списание идёт под блокировкой строки
 * и в одной транзакции с созданием TrainingJob.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WeekendBudgetService {

    private final WeekendBudgetRepository repo;
    private final TrainingJobRepository jobRepo;
    private final BudgetWindowPolicy windowPolicy;

    /**
     * Бюджет на момент {@code now}. Переворот окна учитывается, но в БД не пишется.
     */
    @Transactional(readOnly = true)
    public WeekendBudget current(String targetId, Instant now) {
        BudgetWindow window = windowPolicy.windowAt(now);
        return repo.findByTargetId(targetId)
                .filter(b -> b.getWindowStart().equals(window.start()))
                .map(WeekendBudgetEntity::toSnapshot)
                .orElseGet(() -> WeekendBudget.builder()
                        .targetId(targetId)
                        .windowStart(window.start())
                        .windowEnd(window.end())
                        .weekend(window.weekend())
                        .retrainsUsed(0)
                        .retrainsCap(window.cap())
                        .build());
    }

    /**
     * Списывает один retrain и создаёт TrainingJob (QUEUED).
     *
     * @return пусто: бюджет окна исчерпан, ничего не изменено
     */
    @Transactional
    public Optional<TrainingJobEntity> admit(RetrainRequest request, String versionLabel, Instant now) {
        String targetId = request.targetId();
        BudgetWindow window = windowPolicy.windowAt(now);

        WeekendBudgetEntity budget = repo.findForUpdate(targetId)
                .orElseGet(() -> repo.saveAndFlush(newBudget(targetId, window, now)));

        rollIfNeeded(budget, window, now);

        if (budget.getRetrainsUsed() >= budget.getRetrainsCap()) {
            log.info("⛔ Budget exhausted target={} used={}/{} window={}..{}",
                    targetId, budget.getRetrainsUsed(), budget.getRetrainsCap(),
                    budget.getWindowStart(), budget.getWindowEnd());
            repo.save(budget);
            return Optional.empty();
        }

        budget.setRetrainsUsed(budget.getRetrainsUsed() + 1);
        budget.setUpdatedAt(now);
        repo.save(budget);

        TrainingJobEntity job = TrainingJobEntity.builder()
                .jobId(UUID.randomUUID().toString())
                .targetId(targetId)
                .requestRef(request.requestId())
                .triggerSeverity(request.triggerSeverity())
                .versionLabel(versionLabel)
                .status(JobStatus.QUEUED)
                .budgetWindowStart(budget.getWindowStart())
                .createdAt(now)
                .build();
        job = jobRepo.save(job);

        log.info("🎟 Budget charged target={} used={}/{} job={} request={}",
                targetId, budget.getRetrainsUsed(), budget.getRetrainsCap(), job.getJobId(), request.requestId());
        return Optional.of(job);
    }

    /**
     * Возврат единицы бюджета (обучение так и не стартовало). Только в том же окне.
     */
    @Transactional
    public boolean refund(String targetId, Instant windowStart) {
        Optional<WeekendBudgetEntity> opt = repo.findForUpdate(targetId);
        if (opt.isEmpty()) {
            return false;
        }
        WeekendBudgetEntity budget = opt.get();
        if (!budget.getWindowStart().equals(windowStart) || budget.getRetrainsUsed() <= 0) {
            log.info("↩️ Refund skipped target={} (window moved or nothing to refund)", targetId);
            return false;
        }
        budget.setRetrainsUsed(budget.getRetrainsUsed() - 1);
        repo.save(budget);
        log.info("↩️ Budget refunded target={} used={}/{}", targetId, budget.getRetrainsUsed(), budget.getRetrainsCap());
        return true;
    }

    private static void rollIfNeeded(WeekendBudgetEntity budget, BudgetWindow window, Instant now) {
        if (budget.getWindowStart().equals(window.start())) {
            // cap мог поменяться в конфиге; внутри окна он не опускается ниже уже потраченного
            budget.setRetrainsCap(Math.max(window.cap(), budget.getRetrainsUsed()));
            return;
        }
        log.info("🔄 Budget window rolled over target={} {} → {} (used {} reset)",
                budget.getTargetId(), budget.getWindowStart(), window.start(), budget.getRetrainsUsed());
        budget.setWindowStart(window.start());
        budget.setWindowEnd(window.end());
        budget.setWeekend(window.weekend());
        budget.setRetrainsCap(window.cap());
        budget.setRetrainsUsed(0);
        budget.setUpdatedAt(now);
    }

    private static WeekendBudgetEntity newBudget(String targetId, BudgetWindow window, Instant now) {
        return WeekendBudgetEntity.builder()
                .targetId(targetId)
                .windowStart(window.start())
                .windowEnd(window.end())
                .weekend(window.weekend())
                .retrainsUsed(0)
                .retrainsCap(window.cap())
                .updatedAt(now)
                .build();
    }
}
