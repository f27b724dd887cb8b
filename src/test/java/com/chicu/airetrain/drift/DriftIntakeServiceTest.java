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
import com.chicu.airetrain.support.MutableClock;
import com.chicu.airetrain.training.TrainingJobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DriftIntakeServiceTest {

    @Mock private TrainingJobService trainingJobs;
    @Mock private StabilityStore stabilityStore;
    @Mock private IntakeAuditLog auditLog;
    @Mock private RetrainDispatcher dispatcher;

    private final MutableClock clock = MutableClock.at("2026-03-11T10:00:00Z");
    private final RetrainProperties props = new RetrainProperties();
    private final RetrainRequestQueue queue = new RetrainRequestQueue();
    private final TargetLocks locks = spy(new TargetLocks());

    private TargetStateRegistry states;
    private DriftIntakeService intake;

    @BeforeEach
    void setUp() {
        lenient().when(trainingJobs.lastCompletedAt(anyString())).thenReturn(Optional.empty());
        lenient().when(stabilityStore.isFrozen(anyString())).thenReturn(false);

        states = new TargetStateRegistry(trainingJobs);
        intake = new DriftIntakeService(props, queue, states, locks, stabilityStore,
                new BudgetWindowPolicy(props), auditLog, dispatcher, clock);
    }

    @Test
    void belowThreshold_shouldBeIgnoredAndAudited() {
        IntakeDecision d = intake.ingest(event("demand-eu", 0.79));

        assertEquals(IntakeOutcome.IGNORED, d.outcome());
        assertEquals(0, queue.size());
        verify(auditLog).record(any(), eq(d));
        verifyNoInteractions(dispatcher, locks);
        assertTrue(states.find("demand-eu").isEmpty());
    }

    @Test
    void scenarioA_secondEventWithinDebounce_shouldCoalesceIntoFirstRequest() {
        IntakeDecision first = intake.ingest(event("demand-eu", 0.85));

        clock.advance(Duration.ofSeconds(120));
        IntakeDecision second = intake.ingest(event("demand-eu", 0.9));

        assertEquals(IntakeOutcome.ACCEPTED, first.outcome());
        assertEquals(IntakeOutcome.COALESCED, second.outcome());
        assertEquals(first.requestId(), second.requestId());

        RetrainRequest r1 = queue.pending("demand-eu").orElseThrow();
        assertEquals(0.9, r1.triggerSeverity());
        assertEquals(2, r1.coalescedCount());
        assertEquals(1, queue.size());

        assertEquals(RetrainState.QUEUED, states.machine("demand-eu").state());
        verify(dispatcher, times(1)).requestDispatch();
    }

    @Test
    void eventExactlyAtDebounceBoundary_shouldStillCoalesce() {
        IntakeDecision first = intake.ingest(event("demand-eu", 0.85));

        clock.advance(props.debounce());
        IntakeDecision second = intake.ingest(event("demand-eu", 0.82));

        assertEquals(IntakeOutcome.COALESCED, second.outcome());
        assertEquals(first.requestId(), second.requestId());
        RetrainRequest pending = queue.pending("demand-eu").orElseThrow();
        assertEquals(2, pending.coalescedCount());
        assertEquals(0.85, pending.triggerSeverity());
    }

    @Test
    void eventAfterDebounce_shouldReplaceStaleRequest() {
        IntakeDecision first = intake.ingest(event("demand-eu", 0.95));
        Instant firstCreated = queue.pending("demand-eu").orElseThrow().createdAt();

        clock.advance(Duration.ofSeconds(3600));
        IntakeDecision second = intake.ingest(event("demand-eu", 0.85));

        assertEquals(IntakeOutcome.ACCEPTED, second.outcome());
        assertEquals(RetrainReason.STALE_REQUEST_REPLACED, second.reason());
        assertNotEquals(first.requestId(), second.requestId());

        RetrainRequest pending = queue.pending("demand-eu").orElseThrow();
        assertEquals(second.requestId(), pending.requestId());
        assertEquals(1, pending.coalescedCount());
        assertEquals(0.95, pending.triggerSeverity());
        assertTrue(pending.createdAt().isAfter(firstCreated));
        assertEquals(1, queue.size());
        assertEquals(RetrainState.QUEUED, states.machine("demand-eu").state());
    }

    @Test
    void longDebounce_shouldKeepCoalescingOldRequest() {
        props.setDebounceSeconds(100_000);
        IntakeDecision first = intake.ingest(event("demand-eu", 0.85));

        clock.advance(Duration.ofSeconds(3600));
        IntakeDecision second = intake.ingest(event("demand-eu", 0.9));

        assertEquals(IntakeOutcome.COALESCED, second.outcome());
        assertEquals(first.requestId(), second.requestId());
        assertEquals(2, queue.pending("demand-eu").orElseThrow().coalescedCount());
    }

    @Test
    void burstOfConcurrentEvents_shouldProduceSingleRequestWithMaxSeverity() throws Exception {
        int n = 16;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<IntakeDecision>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < n; i++) {
                double severity = 0.8 + i * 0.01;
                Callable<IntakeDecision> task = () -> {
                    start.await();
                    return intake.ingest(event("demand-eu", severity));
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            int accepted = 0;
            int coalesced = 0;
            for (Future<IntakeDecision> f : futures) {
                IntakeDecision d = f.get(10, TimeUnit.SECONDS);
                if (d.outcome() == IntakeOutcome.ACCEPTED) accepted++;
                if (d.outcome() == IntakeOutcome.COALESCED) coalesced++;
            }

            assertEquals(1, accepted);
            assertEquals(n - 1, coalesced);
        } finally {
            pool.shutdownNow();
        }

        RetrainRequest r = queue.pending("demand-eu").orElseThrow();
        assertEquals(1, queue.size());
        assertEquals(n, r.coalescedCount());
        assertEquals(0.8 + (n - 1) * 0.01, r.triggerSeverity(), 1e-9);
    }

    @Test
    void recentlyCompletedCycle_shouldDropWithInCooldown() {
        states.machine("demand-eu").markCompleted(clock.instant().minus(Duration.ofMinutes(10)));

        IntakeDecision d = intake.ingest(event("demand-eu", 0.95));

        assertEquals(IntakeOutcome.DROPPED, d.outcome());
        assertEquals(RetrainReason.IN_COOLDOWN, d.reason());
        assertFalse(queue.hasPending("demand-eu"));
    }

    @Test
    void cooldownElapsed_shouldAcceptAgain() {
        states.machine("demand-eu").markCompleted(clock.instant().minus(Duration.ofSeconds(props.getCooldownSeconds())));

        IntakeDecision d = intake.ingest(event("demand-eu", 0.95));

        assertEquals(IntakeOutcome.ACCEPTED, d.outcome());
    }

    @Test
    void fullQueue_shouldDropNewTargetsButStillCoalesceExisting() {
        props.setMaxPendingRequests(1);

        intake.ingest(event("a", 0.9));
        IntakeDecision other = intake.ingest(event("b", 0.9));
        IntakeDecision same = intake.ingest(event("a", 0.95));

        assertEquals(RetrainReason.QUEUE_FULL, other.reason());
        assertEquals(IntakeOutcome.COALESCED, same.outcome());
        assertEquals(1, queue.size());
    }

    @Test
    void frozenTarget_shouldBeDropped() {
        when(stabilityStore.isFrozen("demand-eu")).thenReturn(true);

        IntakeDecision d = intake.ingest(event("demand-eu", 0.99));

        assertEquals(IntakeOutcome.DROPPED, d.outcome());
        assertEquals(RetrainReason.TARGET_FROZEN, d.reason());
        assertEquals(0, queue.size());
    }

    @Test
    void eventDuringActiveCycle_shouldQueueWithoutTouchingState() {
        TargetStateMachine m = states.machine("demand-eu");
        Instant now = clock.instant();
        m.moveTo(RetrainState.TRIGGERED, RetrainReason.ACCEPTED, now);
        m.moveTo(RetrainState.QUEUED, RetrainReason.ACCEPTED, now);
        m.moveTo(RetrainState.ADMITTED, RetrainReason.ACCEPTED, now);
        m.moveTo(RetrainState.TRAINING, RetrainReason.ACCEPTED, now);

        IntakeDecision d = intake.ingest(event("demand-eu", 0.9));

        assertEquals(IntakeOutcome.ACCEPTED, d.outcome());
        assertTrue(queue.hasPending("demand-eu"));
        assertEquals(RetrainState.TRAINING, m.state());
    }

    @Test
    void auditFailure_shouldNotBreakIntake() {
        doThrow(new IllegalStateException("db down")).when(auditLog).record(any(), any());

        IntakeDecision d = intake.ingest(event("demand-eu", 0.9));

        assertEquals(IntakeOutcome.ACCEPTED, d.outcome());
        assertTrue(queue.hasPending("demand-eu"));
    }

    private DriftEvent event(String target, double severity) {
        return DriftEvent.builder()
                .targetId(target)
                .severity(severity)
                .detectedAt(clock.instant())
                .featureBreakdown(Map.of("load", severity))
                .build();
    }
}
