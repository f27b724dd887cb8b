package com.chicu.airetrain.orchestrator;

import com.chicu.airetrain.admission.AdmissionController;
import com.chicu.airetrain.admission.BudgetWindowPolicy;
import com.chicu.airetrain.admission.WeekendBudgetService;
import com.chicu.airetrain.common.enums.JobStatus;
import com.chicu.airetrain.common.enums.NotificationType;
import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.common.enums.RetrainState;
import com.chicu.airetrain.common.lock.TargetLocks;
import com.chicu.airetrain.config.RetrainProperties;
import com.chicu.airetrain.data.DataReadiness;
import com.chicu.airetrain.data.DataReadinessClient;
import com.chicu.airetrain.notify.NotificationService;
import com.chicu.airetrain.promotion.PostPromotionMonitor;
import com.chicu.airetrain.promotion.PromotionConflictException;
import com.chicu.airetrain.promotion.PromotionController;
import com.chicu.airetrain.promotion.RollbackFailureException;
import com.chicu.airetrain.promotion.StabilityRecord;
import com.chicu.airetrain.promotion.TargetFrozenException;
import com.chicu.airetrain.queue.RetrainRequest;
import com.chicu.airetrain.queue.RetrainRequestQueue;
import com.chicu.airetrain.registry.CandidateModel;
import com.chicu.airetrain.registry.EvaluationMetrics;
import com.chicu.airetrain.registry.ModelRegistryClient;
import com.chicu.airetrain.training.JobPollResult;
import com.chicu.airetrain.training.JobRunnerAdapter;
import com.chicu.airetrain.training.TrainingJobService;
import com.chicu.airetrain.validation.CandidateAuditService;
import com.chicu.airetrain.validation.ValidationGate;
import com.chicu.airetrain.validation.ValidationResult;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Прогон одного цикла target после admission:
 * readiness → submit → poll до терминального статуса → validation gate → promotion → grace period → rollback.
 *
 * Каждый цикл идёт в своём worker-потоке; любая ошибка остаётся внутри цикла и не задевает другие target.
 * Слот обучения отпускается сразу, как только job закончился.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrainCycleRunner {

    private final TargetStateRegistry states;
    private final TargetLocks locks;
    private final RetrainRequestQueue queue;
    private final AdmissionController admission;
    private final WeekendBudgetService budget;
    private final BudgetWindowPolicy windowPolicy;
    private final TrainingJobService jobs;
    private final DataReadinessClient dataReadiness;
    private final JobRunnerAdapter jobRunner;
    private final ModelRegistryClient modelRegistry;
    private final ValidationGate validationGate;
    private final CandidateAuditService candidateAudit;
    private final PromotionController promotion;
    private final PostPromotionMonitor monitor;
    private final NotificationService notifications;
    private final RetrainProperties props;
    private final Clock clock;

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicLong ctr = new AtomicLong(1);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(prefix + ctr.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /** Циклы живут дольше слота (validation + grace), поэтому пул не ограничен потолком слотов */
    private final ExecutorService workers = Executors.newCachedThreadPool(new NamedThreadFactory("retrain-cycle-"));

    private final ScheduledExecutorService retryScheduler =
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("retrain-retry-"));

    // ==============================================================
    // ▶️ LAUNCH
    // ==============================================================

    public Future<CycleOutcome> launch(AdmittedCycle cycle, Runnable onFinished) {
        try {
            return workers.submit(() -> runCycle(cycle, onFinished));
        } catch (RejectedExecutionException e) {
            log.error("❌ Cycle rejected by executor target={} job={}: {}", cycle.targetId(), cycle.jobId(), e.getMessage());
            admission.releaseSlot();
            Instant now = clock.instant();
            jobs.markFinishedUnsuccessfully(cycle.jobId(), JobStatus.FAILED, RetrainReason.UNEXPECTED_ERROR,
                    "executor rejected cycle", now);
            locks.withLock(cycle.targetId(), () -> states.machine(cycle.targetId()).forceIdle(RetrainReason.UNEXPECTED_ERROR, now));
            throw e;
        }
    }

    /**
     * Синхронный прогон цикла (в worker-потоке или в тесте).
     */
    public CycleOutcome runCycle(AdmittedCycle cycle, Runnable onFinished) {
        String targetId = cycle.targetId();
        TargetStateMachine machine = states.machine(targetId);
        SlotLease slot = new SlotLease();
        CycleContext ctx = new CycleContext(cycle, machine, slot, onFinished);

        CycleOutcome outcome;
        try {
            outcome = execute(ctx);
        } catch (RuntimeException e) {
            log.error("❗ Cycle crashed target={} job={} state={}: {}",
                    targetId, cycle.jobId(), machine.state(), e.getMessage(), e);
            outcome = crash(ctx, e);
        } finally {
            slot.release();
        }

        finishCycle(ctx, outcome);
        runQuietly(onFinished);
        return outcome;
    }

    // ==============================================================
    // 🔁 CYCLE
    // ==============================================================

    private CycleOutcome execute(CycleContext ctx) {
        AdmittedCycle cycle = ctx.cycle;
        String targetId = cycle.targetId();

        // 1) данные
        DataReadiness readiness = checkReadiness(targetId);
        if (!readiness.ready()) {
            return dataNotReady(ctx, readiness);
        }

        // 2) submit (warm start = текущий прод)
        String baselineRef = currentProduction(targetId);
        String externalJobId;
        try {
            externalJobId = jobRunner.submit(targetId, readiness.datasetRef(), baselineRef, cycle.versionLabel());
        } catch (RuntimeException e) {
            log.warn("❌ Submit failed target={} job={}: {}", targetId, cycle.jobId(), e.getMessage());
            jobs.markFinishedUnsuccessfully(cycle.jobId(), JobStatus.FAILED, RetrainReason.TRAINING_FAILURE,
                    "submit failed: " + e.getMessage(), clock.instant());
            return reject(ctx, RetrainReason.TRAINING_FAILURE, details("stage", "submit", "error", e.getMessage()));
        }

        Instant startedAt = clock.instant();
        jobs.markRunning(cycle.jobId(), externalJobId, readiness.datasetRef(), baselineRef, startedAt);
        ctx.trainingStarted = true;
        ctx.machine.moveTo(RetrainState.TRAINING, RetrainReason.ACCEPTED, startedAt);
        log.info("🏋️ Training started target={} job={} external={} dataset={} warmStart={}",
                targetId, cycle.jobId(), externalJobId, readiness.datasetRef(), baselineRef);

        // 3) ждём терминальный статус
        JobPollResult result = awaitTerminal(externalJobId, startedAt);
        Instant finishedAt = clock.instant();

        if (result == null) {
            jobs.markFinishedUnsuccessfully(cycle.jobId(), JobStatus.TIMED_OUT, RetrainReason.TIMED_OUT,
                    "exceeded max-training-duration " + props.getMaxTrainingDuration(), finishedAt);
            ctx.slot.release();
            return reject(ctx, RetrainReason.TIMED_OUT, details("maxTrainingDuration", props.getMaxTrainingDuration().toString()));
        }

        if (result.status() != JobStatus.SUCCEEDED) {
            RetrainReason reason = result.status() == JobStatus.TIMED_OUT ? RetrainReason.TIMED_OUT : RetrainReason.TRAINING_FAILURE;
            jobs.markFinishedUnsuccessfully(cycle.jobId(), result.status(), reason, result.message(), finishedAt);
            ctx.slot.release();
            return reject(ctx, reason, details("message", result.message()));
        }

        if (result.artifactRef() == null || result.artifactRef().isBlank() || result.metrics() == null) {
            jobs.markFinishedUnsuccessfully(cycle.jobId(), JobStatus.FAILED, RetrainReason.TRAINING_FAILURE,
                    "succeeded without artifact or metrics", finishedAt);
            ctx.slot.release();
            return reject(ctx, RetrainReason.TRAINING_FAILURE, details("message", "succeeded without artifact or metrics"));
        }

        jobs.markSucceeded(cycle.jobId(), result.artifactRef(), finishedAt);
        ctx.slot.release();
        ctx.machine.moveTo(RetrainState.VALIDATING, RetrainReason.ACCEPTED, finishedAt);

        // 4) кандидат + gate
        String candidateId = modelRegistry.register(targetId, result.artifactRef(), result.metrics(), cycle.versionLabel());
        CandidateModel candidate = CandidateModel.builder()
                .candidateId(candidateId)
                .jobRef(cycle.jobId())
                .metrics(result.metrics())
                .artifactRef(result.artifactRef())
                .build();
        ctx.candidateId = candidateId;

        EvaluationMetrics baselineMetrics = baselineMetrics(targetId, baselineRef);
        ValidationResult verdict = validationGate.evaluate(candidate, baselineMetrics);
        auditCandidate(targetId, candidate, baselineRef, verdict);

        if (!verdict.promote()) {
            return reject(ctx, verdict.reason(), details(
                    "candidateId", candidateId,
                    "artifactRef", result.artifactRef(),
                    "delta", verdict.delta(),
                    "pValue", verdict.pValue()));
        }

        // 5) promotion
        StabilityRecord promoted;
        try {
            promoted = promotion.promoteWithRetry(targetId, result.artifactRef(), baselineRef);
        } catch (PromotionConflictException e) {
            return reject(ctx, RetrainReason.PROMOTION_CONFLICT, details("candidateId", candidateId));
        } catch (TargetFrozenException e) {
            return reject(ctx, RetrainReason.TARGET_FROZEN, details("candidateId", candidateId));
        }

        ctx.machine.moveTo(RetrainState.PROMOTED, RetrainReason.PROMOTED, clock.instant());
        notifications.notify(NotificationType.PROMOTED, targetId, RetrainReason.PROMOTED, details(
                "candidateId", candidateId,
                "productionRef", promoted.currentProductionRef(),
                "previousStableRef", promoted.previousStableRef(),
                "versionLabel", cycle.versionLabel(),
                "delta", verdict.delta(),
                "pValue", verdict.pValue()));

        // 6) grace period
        if (monitor.watch(targetId)) {
            return outcome(ctx, RetrainState.PROMOTED, RetrainReason.HEALTHY_AFTER_GRACE, promoted.currentProductionRef());
        }

        return rollback(ctx, result.artifactRef());
    }

    private CycleOutcome rollback(CycleContext ctx, String badRef) {
        String targetId = ctx.cycle.targetId();
        ctx.machine.moveTo(RetrainState.ROLLING_BACK, RetrainReason.HEALTH_CHECK_FAILED, clock.instant());

        try {
            StabilityRecord restored = promotion.rollback(targetId);
            ctx.machine.moveTo(RetrainState.ROLLED_BACK, RetrainReason.HEALTH_CHECK_FAILED, clock.instant());
            notifications.notify(NotificationType.ROLLED_BACK, targetId, RetrainReason.HEALTH_CHECK_FAILED, details(
                    "candidateId", ctx.candidateId,
                    "rolledBackRef", badRef,
                    "productionRef", restored.currentProductionRef()));
            return outcome(ctx, RetrainState.ROLLED_BACK, RetrainReason.HEALTH_CHECK_FAILED, restored.currentProductionRef());

        } catch (RollbackFailureException e) {
            notifications.notify(NotificationType.ROLLBACK_FAILURE_ALERT, targetId, RetrainReason.ROLLBACK_FAILURE, details(
                    "candidateId", ctx.candidateId,
                    "badRef", badRef,
                    "error", e.getMessage(),
                    "frozen", true));
            return outcome(ctx, RetrainState.ROLLING_BACK, RetrainReason.ROLLBACK_FAILURE, null);
        }
    }

    // ==============================================================
    // 📦 DATA NOT READY → один повтор
    // ==============================================================

    private CycleOutcome dataNotReady(CycleContext ctx, DataReadiness readiness) {
        AdmittedCycle cycle = ctx.cycle;
        String targetId = cycle.targetId();
        Instant now = clock.instant();

        jobs.markFinishedUnsuccessfully(cycle.jobId(), JobStatus.FAILED, RetrainReason.DATA_NOT_READY, readiness.details(), now);
        ctx.slot.release();
        // обучение не запускалось: единицу бюджета возвращаем
        budget.refund(targetId, cycle.budgetWindowStart());

        ctx.machine.moveTo(RetrainState.REJECTED, RetrainReason.DATA_NOT_READY, now);

        boolean retry = cycle.request().attempt() == 0;
        notifications.notify(
                retry ? NotificationType.REJECTED : NotificationType.DISCARDED,
                targetId,
                RetrainReason.DATA_NOT_READY,
                details("requestId", cycle.request().requestId(),
                        "attempt", cycle.request().attempt(),
                        "retryScheduled", retry,
                        "details", readiness.details()));

        if (retry) {
            log.info("⏳ DataNotReady target={} retry in {}", targetId, props.getDataNotReadyBackoff());
            retryScheduler.schedule(
                    () -> requeue(cycle.request(), ctx.onFinished),
                    props.getDataNotReadyBackoff().toMillis(),
                    TimeUnit.MILLISECONDS);
        } else {
            log.info("🗑 DataNotReady target={} second time, request {} discarded", targetId, cycle.request().requestId());
        }

        return outcome(ctx, RetrainState.REJECTED, RetrainReason.DATA_NOT_READY, null);
    }

    /**
     * Возвращает заявку в очередь после backoff. Если за это время пришла новая: склеиваемся с ней.
     */
    void requeue(RetrainRequest request, Runnable onRequeued) {
        String targetId = request.targetId();
        try {
            locks.withLock(targetId, () -> {
                if (promotion.isFrozen(targetId)) {
                    log.warn("🧊 Retry dropped target={} request={} (frozen)", targetId, request.requestId());
                    return;
                }
                Instant now = clock.instant();
                RetrainRequest retry = request.retry(now, windowPolicy.windowAt(now).start());
                boolean inserted = queue.offerOrMerge(retry);

                TargetStateMachine machine = states.machine(targetId);
                if (machine.state() == RetrainState.IDLE) {
                    machine.moveTo(RetrainState.TRIGGERED, RetrainReason.DATA_NOT_READY, now);
                    machine.moveTo(RetrainState.QUEUED, RetrainReason.DATA_NOT_READY, now);
                }
                log.info("🔁 Retry queued target={} request={} attempt={} merged={}",
                        targetId, retry.requestId(), retry.attempt(), !inserted);
            });
        } catch (RuntimeException e) {
            log.error("❗ Retry requeue failed target={}: {}", targetId, e.getMessage(), e);
        }
        runQuietly(onRequeued);
    }

    // ==============================================================
    // 🏁 FINISH
    // ==============================================================

    private void finishCycle(CycleContext ctx, CycleOutcome outcome) {
        String targetId = ctx.cycle.targetId();
        TargetStateMachine machine = ctx.machine;

        locks.withLock(targetId, () -> {
            Instant now = clock.instant();
            if (outcome.trainingStarted()) {
                machine.markCompleted(now);
            }
            if (!machine.moveIfAllowed(RetrainState.IDLE, outcome.reason(), now)) {
                machine.forceIdle(outcome.reason(), now);
            }

            // пока цикл шёл, могла накопиться новая заявка
            if (queue.hasPending(targetId)) {
                machine.moveTo(RetrainState.TRIGGERED, RetrainReason.ACCEPTED, now);
                machine.moveTo(RetrainState.QUEUED, RetrainReason.ACCEPTED, now);
            }
        });

        log.info("🏁 Cycle done target={} job={} final={} reason={} trainingStarted={}",
                targetId, outcome.jobId(), outcome.finalState(), outcome.reason(), outcome.trainingStarted());
    }

    private CycleOutcome crash(CycleContext ctx, RuntimeException e) {
        AdmittedCycle cycle = ctx.cycle;
        Instant now = clock.instant();
        try {
            jobs.markFinishedUnsuccessfully(cycle.jobId(), JobStatus.FAILED, RetrainReason.UNEXPECTED_ERROR, e.getMessage(), now);
        } catch (RuntimeException ex) {
            e.addSuppressed(ex);
            log.warn("⚠️ Could not close job {} after crash: {}", cycle.jobId(), ex.getMessage());
        }

        RetrainState state = ctx.machine.state();
        if (state == RetrainState.PROMOTED || state == RetrainState.ROLLING_BACK) {
            // прод уже переключён, REJECTED отсюда недостижим
            notifications.notify(NotificationType.REJECTED, cycle.targetId(), RetrainReason.UNEXPECTED_ERROR,
                    details("stage", state.name(), "error", e.getMessage()));
            return outcome(ctx, state, RetrainReason.UNEXPECTED_ERROR, null);
        }
        ctx.machine.moveIfAllowed(RetrainState.REJECTED, RetrainReason.UNEXPECTED_ERROR, now);
        notifications.notify(NotificationType.REJECTED, cycle.targetId(), RetrainReason.UNEXPECTED_ERROR,
                details("stage", state.name(), "error", e.getMessage()));
        return outcome(ctx, RetrainState.REJECTED, RetrainReason.UNEXPECTED_ERROR, null);
    }

    // ==============================================================
    // helpers
    // ==============================================================

    private JobPollResult awaitTerminal(String externalJobId, Instant startedAt) {
        Instant deadline = startedAt.plus(props.getMaxTrainingDuration());
        long pollMs = Math.max(1, props.getJobPollInterval().toMillis());

        while (true) {
            try {
                JobPollResult r = jobRunner.poll(externalJobId);
                if (r != null && r.status() != null && r.status().isTerminal()) {
                    return r;
                }
            } catch (RuntimeException e) {
                log.warn("⚠️ Poll failed job={}: {}", externalJobId, e.getMessage());
            }

            if (!clock.instant().isBefore(deadline)) {
                log.warn("⏰ Job {} exceeded {} → TIMED_OUT", externalJobId, props.getMaxTrainingDuration());
                return null;
            }

            try {
                Thread.sleep(pollMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("⏹ Poll interrupted job={} → TIMED_OUT", externalJobId);
                return null;
            }
        }
    }

    private DataReadiness checkReadiness(String targetId) {
        try {
            DataReadiness r = dataReadiness.check(targetId);
            return r != null ? r : DataReadiness.notReady("no readiness answer");
        } catch (RuntimeException e) {
            log.warn("⚠️ Readiness check failed target={}: {}", targetId, e.getMessage());
            return DataReadiness.notReady("readiness check failed: " + e.getMessage());
        }
    }

    private String currentProduction(String targetId) {
        try {
            return modelRegistry.getProduction(targetId).orElse(null);
        } catch (RuntimeException e) {
            log.warn("⚠️ getProduction failed target={}: {}", targetId, e.getMessage());
            return null;
        }
    }

    private EvaluationMetrics baselineMetrics(String targetId, String baselineRef) {
        if (baselineRef == null) {
            return null;
        }
        try {
            Optional<EvaluationMetrics> m = modelRegistry.getMetrics(baselineRef);
            return m.orElse(null);
        } catch (RuntimeException e) {
            log.warn("⚠️ Baseline metrics unavailable target={} ref={}: {}", targetId, baselineRef, e.getMessage());
            return null;
        }
    }

    private void auditCandidate(String targetId, CandidateModel candidate, String baselineRef, ValidationResult verdict) {
        try {
            candidateAudit.record(targetId, candidate, baselineRef, verdict, clock.instant());
        } catch (RuntimeException e) {
            log.warn("⚠️ Candidate audit failed target={} candidate={}: {}", targetId, candidate.candidateId(), e.getMessage());
        }
    }

    private CycleOutcome reject(CycleContext ctx, RetrainReason reason, Map<String, Object> details) {
        String targetId = ctx.cycle.targetId();
        ctx.machine.moveTo(RetrainState.REJECTED, reason, clock.instant());

        Map<String, Object> d = new LinkedHashMap<>(details);
        d.put("jobId", ctx.cycle.jobId());
        d.put("requestId", ctx.cycle.request().requestId());
        notifications.notify(NotificationType.REJECTED, targetId, reason, d);

        return outcome(ctx, RetrainState.REJECTED, reason, null);
    }

    private static CycleOutcome outcome(CycleContext ctx, RetrainState finalState, RetrainReason reason, String productionRef) {
        return CycleOutcome.builder()
                .targetId(ctx.cycle.targetId())
                .requestId(ctx.cycle.request().requestId())
                .jobId(ctx.cycle.jobId())
                .finalState(finalState)
                .reason(reason)
                .trainingStarted(ctx.trainingStarted)
                .candidateId(ctx.candidateId)
                .productionRef(productionRef)
                .build();
    }

    private static Map<String, Object> details(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            m.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return m;
    }

    private static void runQuietly(Runnable r) {
        if (r == null) return;
        try {
            r.run();
        } catch (RuntimeException e) {
            log.warn("⚠️ Cycle callback failed: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("💤 RetrainCycleRunner shutting down…");
        retryScheduler.shutdownNow();
        workers.shutdownNow();
    }

    /**
     * Слот обучения, отпускается ровно один раз.
     */
    private final class SlotLease {
        private final AtomicBoolean released = new AtomicBoolean(false);

        void release() {
            if (released.compareAndSet(false, true)) {
                admission.releaseSlot();
            }
        }
    }

    private static final class CycleContext {
        final AdmittedCycle cycle;
        final TargetStateMachine machine;
        final SlotLease slot;
        final Runnable onFinished;
        boolean trainingStarted;
        String candidateId;

        CycleContext(AdmittedCycle cycle, TargetStateMachine machine, SlotLease slot, Runnable onFinished) {
            this.cycle = cycle;
            this.machine = machine;
            this.slot = slot;
            this.onFinished = onFinished;
        }
    }
}
