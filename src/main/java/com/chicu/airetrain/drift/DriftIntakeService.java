package com.chicu.airetrain.drift;

import com.chicu.airetrain.admission.BudgetWindowPolicy;
import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.common.enums.RetrainState;
import com.chicu.airetrain.common.lock.TargetLocks;
import com.chicu.airetrain.config.RetrainProperties;
import com.chicu.airetrain.orchestrator.RetrainDispatcher;
import com.chicu.airetrain.orchestrator.TargetStateMachine;
import com.chicu.airetrain.orchestrator.TargetStateRegistry;
import com.chicu.airetrain.promotion.StabilityStore;
import com.chicu.airetrain.queue.RetrainRequest;
import com.chicu.airetrain.queue.RetrainRequestQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Приём drift-событий.
 *
 * Порядок решений (под блокировкой target):
 * <ol>
 *     <li>severity &lt; threshold → IGNORED;</li>
 *     <li>target заморожен после неудачного отката → DROPPED(TARGET_FROZEN);</li>
 *     <li>есть pending-заявка моложе debounce → COALESCED (severity = max, count + 1);</li>
 *     <li>есть pending-заявка старше debounce → ACCEPTED(STALE_REQUEST_REPLACED): её место занимает свежая;</li>
 *     <li>последний цикл закончился раньше cooldown → DROPPED(IN_COOLDOWN);</li>
 *     <li>очередь заполнена → DROPPED(QUEUE_FULL);</li>
 *     <li>иначе новая заявка → ACCEPTED.</li>
 * </ol>
 * Порог severity проверяется до блокировки: на мусорные target id блокировки не заводим.
 * Никогда не ждёт обучение: дальше заявку забирает {@link RetrainDispatcher}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriftIntakeService {

    private final RetrainProperties props;
    private final RetrainRequestQueue queue;
    private final TargetStateRegistry states;
    private final TargetLocks locks;
    private final StabilityStore stabilityStore;
    private final BudgetWindowPolicy windowPolicy;
    private final IntakeAuditLog auditLog;
    private final RetrainDispatcher dispatcher;
    private final Clock clock;

    public IntakeDecision ingest(DriftEvent event) {
        IntakeDecision decision = event.severity() < props.getSeverityThreshold()
                ? IntakeDecision.ignored(event, clock.instant())
                : locks.withLock(event.targetId(), () -> decide(event));

        try {
            auditLog.record(event, decision);
        } catch (RuntimeException e) {
            log.warn("⚠️ Intake audit failed target={} outcome={}: {}", event.targetId(), decision.outcome(), e.getMessage());
        }

        if (decision.outcome() == IntakeOutcome.ACCEPTED) {
            dispatcher.requestDispatch();
        }
        return decision;
    }

    private IntakeDecision decide(DriftEvent event) {
        Instant now = clock.instant();
        String targetId = event.targetId();

        if (stabilityStore.isFrozen(targetId)) {
            log.warn("🧊 Intake DROP target={} severity={} (frozen)", targetId, event.severity());
            return IntakeDecision.dropped(event, RetrainReason.TARGET_FROZEN, now);
        }

        Optional<RetrainRequest> pending = queue.pending(targetId);
        if (pending.isPresent()) {
            RetrainRequest stale = pending.get();
            if (!now.isAfter(stale.createdAt().plus(props.debounce()))) {
                RetrainRequest merged = queue.coalesce(targetId, event.severity()).orElse(stale);
                return IntakeDecision.of(IntakeOutcome.COALESCED, RetrainReason.COALESCED, merged, now);
            }
            RetrainRequest fresh = stale.supersede(event.severity(), now, windowPolicy.windowAt(now).start());
            if (queue.replace(stale.requestId(), fresh)) {
                log.info("♻️ Intake: target={} pending {} older than debounce {}s, replaced by {} severity={}",
                        targetId, stale.requestId(), props.getDebounceSeconds(), fresh.requestId(), fresh.triggerSeverity());
                return IntakeDecision.of(IntakeOutcome.ACCEPTED, RetrainReason.STALE_REQUEST_REPLACED, fresh, now);
            }
        }

        if (states.inCooldown(targetId, now, props.cooldown())) {
            return IntakeDecision.dropped(event, RetrainReason.IN_COOLDOWN, now);
        }

        if (queue.isFull(props.getMaxPendingRequests())) {
            log.warn("🌪 Intake DROP target={} queue full ({}/{})", targetId, queue.size(), props.getMaxPendingRequests());
            return IntakeDecision.dropped(event, RetrainReason.QUEUE_FULL, now);
        }

        RetrainRequest request = RetrainRequest.create(targetId, event.severity(), now, windowPolicy.windowAt(now).start());
        if (!queue.offer(request)) {
            // под блокировкой target сюда не попадаем, но очередь своё слово сказала
            return queue.coalesce(targetId, event.severity())
                    .map(r -> IntakeDecision.of(IntakeOutcome.COALESCED, RetrainReason.COALESCED, r, now))
                    .orElseGet(() -> IntakeDecision.dropped(event, RetrainReason.UNEXPECTED_ERROR, now));
        }

        TargetStateMachine machine = states.machine(targetId);
        if (machine.state() == RetrainState.IDLE) {
            machine.moveTo(RetrainState.TRIGGERED, RetrainReason.ACCEPTED, now);
            machine.moveTo(RetrainState.QUEUED, RetrainReason.ACCEPTED, now);
        } else {
            log.info("📥 Intake: target={} cycle in progress ({}), request {} waits", targetId, machine.state(), request.requestId());
        }

        return IntakeDecision.of(IntakeOutcome.ACCEPTED, RetrainReason.ACCEPTED, request, now);
    }
}
