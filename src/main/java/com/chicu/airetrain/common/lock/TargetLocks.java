package com.chicu.airetrain.common.lock;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Взаимоисключение по target_id: intake, очередь и завершение цикла одного target
 * никогда не пересекаются, разные target друг друга не блокируют.
 * Запись живёт, пока есть хоть один держатель или ждущий: потом удаляется.
 */
@Component
public class TargetLocks {

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        // меняется только внутри compute по этому ключу
        int users;
    }

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String targetId, Supplier<T> action) {
        Entry entry = locks.compute(targetId, (k, cur) -> {
            Entry e = cur != null ? cur : new Entry();
            e.users++;
            return e;
        });
        try {
            entry.lock.lock();
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(targetId, (k, cur) -> --cur.users == 0 ? null : cur);
        }
    }

    public void withLock(String targetId, Runnable action) {
        withLock(targetId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Сколько target сейчас под блокировкой или в ожидании.
     */
    public int activeTargets() {
        return locks.size();
    }
}
