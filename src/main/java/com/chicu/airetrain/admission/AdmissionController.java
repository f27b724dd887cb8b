package com.chicu.airetrain.admission;

import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.config.RetrainProperties;
import com.chicu.airetrain.queue.RetrainRequest;
import com.chicu.airetrain.training.TrainingJobEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Допуск заявки к обучению.
 *
 * Порядок проверок:
 * 1) окно бюджета, в котором создана заявка, ещё текущее, иначе WINDOW_ROLLED_OVER (выбросить);
 * 2) бюджет окна не исчерпан, иначе BUDGET_EXHAUSTED (выбросить);
 * 3) есть свободный слот из resource-concurrency-ceiling, иначе NO_FREE_SLOT (ждать в очереди);
 * 4) списание бюджета + создание job одной транзакцией.
 */
@Slf4j
@Component
public class AdmissionController {

    private final WeekendBudgetService budgetService;
    private final BudgetWindowPolicy windowPolicy;
    private final Clock clock;

    private final int ceiling;
    private final Semaphore slots;
    private final AtomicInteger inUse = new AtomicInteger();

    public AdmissionController(WeekendBudgetService budgetService,
                               BudgetWindowPolicy windowPolicy,
                               RetrainProperties props,
                               Clock clock) {
        this.budgetService = budgetService;
        this.windowPolicy = windowPolicy;
        this.clock = clock;
        this.ceiling = props.getResourceConcurrencyCeiling();
        this.slots = new Semaphore(ceiling, true);
    }

    public AdmissionDecision tryAdmit(RetrainRequest request, String versionLabel) {
        Instant now = clock.instant();
        String targetId = request.targetId();

        BudgetWindow window = windowPolicy.windowAt(now);
        if (request.budgetWindowStart() != null && !window.start().equals(request.budgetWindowStart())) {
            log.info("🔄 Admission DISCARD target={} request={} created in window {} (now {})",
                    targetId, request.requestId(), request.budgetWindowStart(), window.start());
            return AdmissionDecision.discard(RetrainReason.WINDOW_ROLLED_OVER);
        }

        WeekendBudget budget = budgetService.current(targetId, now);
        if (budget.exhausted()) {
            log.info("⛔ Admission DISCARD target={} request={} budget {}/{}",
                    targetId, request.requestId(), budget.retrainsUsed(), budget.retrainsCap());
            return AdmissionDecision.discard(RetrainReason.BUDGET_EXHAUSTED);
        }

        if (!slots.tryAcquire()) {
            log.debug("⏳ Admission WAIT target={} request={} no free slot ({}/{})",
                    targetId, request.requestId(), inUse.get(), ceiling);
            return AdmissionDecision.waitInQueue(RetrainReason.NO_FREE_SLOT);
        }
        inUse.incrementAndGet();

        try {
            Optional<TrainingJobEntity> job = budgetService.admit(request, versionLabel, now);
            if (job.isEmpty()) {
                releaseSlot();
                return AdmissionDecision.discard(RetrainReason.BUDGET_EXHAUSTED);
            }

            log.info("✅ Admission OK target={} request={} job={} slots {}/{}",
                    targetId, request.requestId(), job.get().getJobId(), inUse.get(), ceiling);
            return AdmissionDecision.admit(job.get().getJobId(), job.get().getBudgetWindowStart());

        } catch (RuntimeException e) {
            releaseSlot();
            log.warn("⚠️ Admission failed target={} request={}: {}", targetId, request.requestId(), e.getMessage());
            return AdmissionDecision.waitInQueue(RetrainReason.UNEXPECTED_ERROR);
        }
    }

    /**
     * Освобождает слот обучения. Лишний вызов игнорируется.
     */
    public void releaseSlot() {
        int before = inUse.getAndUpdate(v -> v > 0 ? v - 1 : 0);
        if (before <= 0) {
            log.warn("⚠️ releaseSlot() without acquired slot");
            return;
        }
        slots.release();
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public int slotsInUse() {
        return inUse.get();
    }

    public int ceiling() {
        return ceiling;
    }
}
