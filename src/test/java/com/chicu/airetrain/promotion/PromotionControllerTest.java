package com.chicu.airetrain.promotion;

import com.chicu.airetrain.config.RetrainProperties;
import com.chicu.airetrain.registry.ModelRegistryClient;
import com.chicu.airetrain.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PromotionControllerTest {

    @Mock private StabilityStore store;
    @Mock private ModelRegistryClient registry;

    private final MutableClock clock = MutableClock.at("2026-03-11T10:00:00Z");
    private final RetrainProperties props = new RetrainProperties();
    private PromotionController controller;

    @BeforeEach
    void setUp() {
        props.setPromotionConflictRetries(3);
        props.setPromotionConflictBackoff(Duration.ofMillis(20));
        controller = new PromotionController(store, registry, props, clock);
    }

    @Test
    void promote_shouldSwitchRegistryThenStabilityRecord() {
        when(store.promote(eq("t"), eq("v2"), eq("v1"), any())).thenReturn(record("v2", "v1"));

        StabilityRecord r = controller.promote("t", "v2", "v1");

        assertEquals("v2", r.currentProductionRef());
        InOrder order = inOrder(registry, store);
        order.verify(registry).markProduction("t", "v2");
        order.verify(store).promote(eq("t"), eq("v2"), eq("v1"), any());
    }

    @Test
    void registryFailure_shouldLeaveStabilityRecordUntouched() {
        doThrow(new IllegalStateException("registry 503")).when(registry).markProduction("t", "v2");

        assertThrows(IllegalStateException.class, () -> controller.promote("t", "v2", "v1"));

        verify(store, never()).promote(any(), any(), any(), any());
    }

    @Test
    void storeFailure_shouldPointRegistryBackToBaseline() {
        when(store.promote(any(), any(), any(), any())).thenThrow(new IllegalStateException("db down"));

        assertThrows(IllegalStateException.class, () -> controller.promote("t", "v2", "v1"));

        verify(registry).markProduction("t", "v2");
        verify(registry).markProduction("t", "v1");
    }

    @Test
    void frozenTarget_shouldNotBePromoted() {
        when(store.isFrozen("t")).thenReturn(true);

        assertThrows(TargetFrozenException.class, () -> controller.promote("t", "v2", "v1"));

        verifyNoInteractions(registry);
    }

    @Test
    void concurrentPromotion_shouldFailFastWithConflict_andRetrySucceedsAfterFirstCompletes() throws Exception {
        CountDownLatch insideFirst = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);

        doAnswer(inv -> {
            if ("v2".equals(inv.getArgument(1))) {
                insideFirst.countDown();
                assertTrue(releaseFirst.await(5, TimeUnit.SECONDS));
            }
            return null;
        }).when(registry).markProduction(eq("t"), anyString());
        when(store.promote(eq("t"), anyString(), anyString(), any()))
                .thenAnswer(inv -> record(inv.getArgument(1), inv.getArgument(2)));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<StabilityRecord> first = pool.submit(() -> controller.promote("t", "v2", "v1"));
            assertTrue(insideFirst.await(5, TimeUnit.SECONDS));

            assertThrows(PromotionConflictException.class, () -> controller.promote("t", "v3", "v2"));

            releaseFirst.countDown();
            assertEquals("v2", first.get(5, TimeUnit.SECONDS).currentProductionRef());

            assertEquals("v3", controller.promoteWithRetry("t", "v3", "v2").currentProductionRef());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void promoteWithRetry_shouldWaitForRunningPromotion() throws Exception {
        CountDownLatch insideFirst = new CountDownLatch(1);

        doAnswer(inv -> {
            if ("v2".equals(inv.getArgument(1))) {
                insideFirst.countDown();
                Thread.sleep(30);
            }
            return null;
        }).when(registry).markProduction(eq("t"), anyString());
        when(store.promote(eq("t"), anyString(), anyString(), any()))
                .thenAnswer(inv -> record(inv.getArgument(1), inv.getArgument(2)));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<StabilityRecord> first = pool.submit(() -> controller.promote("t", "v2", "v1"));
            assertTrue(insideFirst.await(5, TimeUnit.SECONDS));

            StabilityRecord second = controller.promoteWithRetry("t", "v3", "v2");

            assertEquals("v2", first.get(5, TimeUnit.SECONDS).currentProductionRef());
            assertEquals("v3", second.currentProductionRef());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rollback_shouldRestorePreviousAndMirrorToRegistry() {
        when(store.rollback(eq("t"), any())).thenReturn(record("v1", null));

        StabilityRecord r = controller.rollback("t");

        assertEquals("v1", r.currentProductionRef());
        verify(registry).markProduction("t", "v1");
        verify(store, never()).freeze(any(), any(), any());
    }

    @Test
    void rollbackWithoutPrevious_shouldFreezeTarget() {
        when(store.rollback(eq("t"), any())).thenThrow(new RollbackFailureException("t", "No previous stable model"));

        assertThrows(RollbackFailureException.class, () -> controller.rollback("t"));

        verify(store).freeze(eq("t"), contains("No previous stable model"), any());
        verifyNoInteractions(registry);
    }

    @Test
    void registryFailureDuringRollback_shouldFreezeAndWrap() {
        when(store.rollback(eq("t"), any())).thenReturn(record("v1", null));
        doThrow(new IllegalStateException("registry 500")).when(registry).markProduction("t", "v1");

        RollbackFailureException ex = assertThrows(RollbackFailureException.class, () -> controller.rollback("t"));

        assertInstanceOf(IllegalStateException.class, ex.getCause());
        verify(store).freeze(eq("t"), anyString(), any());
    }

    private static StabilityRecord record(String current, String previous) {
        return StabilityRecord.builder()
                .targetId("t")
                .currentProductionRef(current)
                .previousStableRef(previous)
                .build();
    }
}
