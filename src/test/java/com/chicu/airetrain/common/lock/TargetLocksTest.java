package com.chicu.airetrain.common.lock;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TargetLocksTest {

    private final TargetLocks locks = new TargetLocks();

    @Test
    void entriesShouldBeReleasedAfterUse() {
        for (int i = 0; i < 1000; i++) {
            locks.withLock("target-" + i, () -> { });
        }

        assertEquals(0, locks.activeTargets());
    }

    @Test
    void nestedCallOnSameTarget_shouldBeReentrant() {
        int inner = locks.withLock("demand-eu", () -> locks.withLock("demand-eu", () -> locks.activeTargets()));

        assertEquals(1, inner);
        assertEquals(0, locks.activeTargets());
    }

    @Test
    void sameTarget_shouldNeverRunConcurrently() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    locks.withLock("demand-eu", () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        inside.decrementAndGet();
                    });
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxInside.get());
        assertEquals(0, locks.activeTargets());
    }

    @Test
    void exceptionInAction_shouldStillReleaseEntry() {
        assertThrows(IllegalStateException.class,
                () -> locks.withLock("demand-eu", (Runnable) () -> {
                    throw new IllegalStateException("boom");
                }));

        assertEquals(0, locks.activeTargets());
    }
}
