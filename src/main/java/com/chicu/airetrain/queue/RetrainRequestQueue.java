package com.chicu.airetrain.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Очередь заявок на переобучение.
 *
 * Инвариант: не больше одной pending-заявки на target. Операции над одним target атомарны
 * (compute по ключу), вызывающий код дополнительно держит {@code TargetLocks}.
 * Порядок выдачи: priority по убыванию, внутри приоритета: FIFO по createdAt.
 */
@Slf4j
@Component
public class RetrainRequestQueue {

    public static final Comparator<RetrainRequest> ORDER =
            Comparator.comparingInt(RetrainRequest::priority).reversed()
                    .thenComparing(RetrainRequest::createdAt)
                    .thenComparing(RetrainRequest::requestId);

    private final Map<String, RetrainRequest> pendingByTarget = new ConcurrentHashMap<>();

    public Optional<RetrainRequest> pending(String targetId) {
        return Optional.ofNullable(pendingByTarget.get(targetId));
    }

    public boolean hasPending(String targetId) {
        return pendingByTarget.containsKey(targetId);
    }

    /**
     * @return true: заявка встала в очередь; false: для target уже есть pending
     */
    public boolean offer(RetrainRequest request) {
        RetrainRequest prev = pendingByTarget.putIfAbsent(request.targetId(), request);
        if (prev != null) {
            log.warn("⚠️ Queue: target={} уже имеет pending {}, новая {} не добавлена",
                    request.targetId(), prev.requestId(), request.requestId());
            return false;
        }
        return true;
    }

    /**
     * Склеивает severity в pending-заявку target, если она есть.
     */
    public Optional<RetrainRequest> coalesce(String targetId, double severity) {
        return Optional.ofNullable(pendingByTarget.computeIfPresent(targetId, (k, r) -> r.absorb(severity)));
    }

    /**
     * Меняет pending-заявку target на fresh, только если в очереди всё ещё expectedRequestId.
     *
     * @return true: замена состоялась
     */
    public boolean replace(String expectedRequestId, RetrainRequest fresh) {
        AtomicBoolean replaced = new AtomicBoolean(false);
        pendingByTarget.computeIfPresent(fresh.targetId(), (k, r) -> {
            if (r.requestId().equals(expectedRequestId)) {
                replaced.set(true);
                return fresh;
            }
            return r;
        });
        return replaced.get();
    }

    /**
     * Снимает заявку, только если в очереди всё ещё именно она (по requestId).
     *
     * @return актуальная версия снятой заявки (с учётом склеек)
     */
    public Optional<RetrainRequest> remove(String targetId, String requestId) {
        AtomicReference<RetrainRequest> removed = new AtomicReference<>();
        pendingByTarget.computeIfPresent(targetId, (k, r) -> {
            if (r.requestId().equals(requestId)) {
                removed.set(r);
                return null;
            }
            return r;
        });
        return Optional.ofNullable(removed.get());
    }

    public List<RetrainRequest> ordered() {
        List<RetrainRequest> list = new ArrayList<>(pendingByTarget.values());
        list.sort(ORDER);
        return list;
    }

    public int size() {
        return pendingByTarget.size();
    }

    public boolean isFull(int capacity) {
        return pendingByTarget.size() >= capacity;
    }

    /**
     * Кладёт заявку или вливает её severity в уже существующую.
     *
     * @return true: встала как новая
     */
    public boolean offerOrMerge(RetrainRequest request) {
        AtomicBoolean inserted = new AtomicBoolean(false);
        pendingByTarget.compute(request.targetId(), (k, existing) -> {
            if (existing == null) {
                inserted.set(true);
                return request;
            }
            return existing.absorb(request.triggerSeverity());
        });
        return inserted.get();
    }
}
