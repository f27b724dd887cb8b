package com.chicu.airetrain.orchestrator;

import com.chicu.airetrain.admission.AdmissionController;
import com.chicu.airetrain.admission.AdmissionDecision;
import com.chicu.airetrain.common.enums.NotificationType;
import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.common.enums.RetrainState;
import com.chicu.airetrain.common.lock.TargetLocks;
import com.chicu.airetrain.config.RetrainProperties;
import com.chicu.airetrain.notify.NotificationService;
import com.chicu.airetrain.queue.RetrainRequest;
import com.chicu.airetrain.queue.RetrainRequestQueue;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Разбор очереди: берёт заявки в порядке приоритета и прогоняет через admission.
 *
 * Работает в одном потоке: по тику раз в dispatch-interval-ms и по запросу (новая заявка / освободился слот).
 * Заявки target, у которого уже идёт цикл или не вышел cooldown, пропускаются без потери места в очереди.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrainDispatcher {

    enum Step { SKIPPED, ADMITTED, DISCARDED, WAIT, NO_SLOT }

    private final RetrainRequestQueue queue;
    private final AdmissionController admission;
    private final TargetStateRegistry states;
    private final TargetLocks locks;
    private final ModelVersionFactory versions;
    private final RetrainCycleRunner cycles;
    private final NotificationService notifications;
    private final RetrainProperties props;
    private final Clock clock;

    private final AtomicBoolean dispatchRequested = new AtomicBoolean(false);
    private volatile ScheduledExecutorService executor;

    // ==============================================================
    // ▶️ START / STOP
    // ==============================================================

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retrain-dispatch");
            t.setDaemon(true);
            return t;
        });
        long interval = props.getDispatchIntervalMs();
        executor.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("⏱ Dispatcher started (interval={}ms, ceiling={})", interval, admission.ceiling());
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (executor != null) {
            log.info("💤 Dispatcher shutting down…");
            executor.shutdownNow();
        }
    }

    /**
     * Внеочередной разбор. Несколько запросов подряд схлопываются в один проход.
     */
    public void requestDispatch() {
        ScheduledExecutorService ex = executor;
        if (ex == null || ex.isShutdown()) {
            return;
        }
        if (!dispatchRequested.compareAndSet(false, true)) {
            return;
        }
        try {
            ex.execute(() -> {
                dispatchRequested.set(false);
                tick();
            });
        } catch (RejectedExecutionException e) {
            dispatchRequested.set(false);
            log.debug("Dispatcher is stopped, request ignored");
        }
    }

    private void tick() {
        try {
            dispatchOnce();
            evictSettledTargets();
        } catch (RuntimeException e) {
            // исключение в scheduled-задаче отменило бы все следующие тики
            log.error("❗ Dispatch pass failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Убирает из памяти машины target, у которых нет ни цикла, ни заявки, ни cooldown.
     *
     * @return сколько удалено
     */
    public int evictSettledTargets() {
        Instant now = clock.instant();
        int evicted = 0;
        for (TargetStateMachine m : List.copyOf(states.all())) {
            String targetId = m.getTargetId();
            boolean removed = locks.withLock(targetId,
                    () -> !queue.hasPending(targetId) && states.evictIfSettled(targetId, now, props.cooldown()));
            if (removed) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("🧹 Evicted {} settled target state(s)", evicted);
        }
        return evicted;
    }

    // ==============================================================
    // 🔁 DISPATCH
    // ==============================================================

    /**
     * Один проход по очереди.
     *
     * @return сколько заявок допущено к обучению
     */
    public synchronized int dispatchOnce() {
        int admitted = 0;
        for (RetrainRequest snapshot : queue.ordered()) {
            String targetId = snapshot.targetId();
            Step step;
            try {
                step = locks.withLock(targetId, () -> admitOne(targetId, snapshot.requestId()));
            } catch (RuntimeException e) {
                log.error("❗ Dispatch failed target={} request={}: {}", targetId, snapshot.requestId(), e.getMessage(), e);
                continue;
            }

            if (step == Step.ADMITTED) {
                admitted++;
            } else if (step == Step.NO_SLOT) {
                break;
            }
        }
        return admitted;
    }

    private Step admitOne(String targetId, String requestId) {
        Instant now = clock.instant();
        TargetStateMachine machine = states.machine(targetId);

        // цикл target ещё идёт: ≤1 job на target
        if (machine.state() != RetrainState.QUEUED) {
            return Step.SKIPPED;
        }

        RetrainRequest request = queue.pending(targetId).orElse(null);
        if (request == null || !request.requestId().equals(requestId)) {
            return Step.SKIPPED;
        }

        if (states.inCooldown(targetId, now, props.cooldown())) {
            return Step.SKIPPED;
        }

        String versionLabel = versions.build(targetId, now, request.requestId());
        AdmissionDecision decision = admission.tryAdmit(request, versionLabel);

        if (decision.admitted()) {
            RetrainRequest taken = queue.remove(targetId, request.requestId()).orElse(request);
            machine.moveTo(RetrainState.ADMITTED, RetrainReason.ACCEPTED, now);
            machine.attachJob(decision.jobId());

            cycles.launch(new AdmittedCycle(taken, decision.jobId(), decision.budgetWindowStart(), versionLabel),
                    this::requestDispatch);
            return Step.ADMITTED;
        }

        if (decision.keepQueued()) {
            return decision.reason() == RetrainReason.NO_FREE_SLOT ? Step.NO_SLOT : Step.WAIT;
        }

        // отказ без ожидания: бюджет исчерпан / окно перевернулось
        RetrainRequest dropped = queue.remove(targetId, request.requestId()).orElse(request);
        machine.moveTo(RetrainState.IDLE, decision.reason(), now);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requestId", dropped.requestId());
        details.put("triggerSeverity", dropped.triggerSeverity());
        details.put("coalescedCount", dropped.coalescedCount());
        details.put("budgetWindowStart", dropped.budgetWindowStart());
        notifications.notify(
                decision.reason() == RetrainReason.BUDGET_EXHAUSTED ? NotificationType.BUDGET_EXHAUSTED : NotificationType.DISCARDED,
                targetId,
                decision.reason(),
                details);
        return Step.DISCARDED;
    }
}
