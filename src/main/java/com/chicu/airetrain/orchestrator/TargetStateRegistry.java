package com.chicu.airetrain.orchestrator;

import com.chicu.airetrain.common.enums.RetrainState;
import com.chicu.airetrain.training.TrainingJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Машины состояний по target. После рестарта cooldown восстанавливается из последнего завершённого job.
 * IDLE-машину с истёкшим cooldown можно выбросить: при следующем обращении она соберётся заново из job'ов.
 */
@Component
@RequiredArgsConstructor
public class TargetStateRegistry {

    private final TrainingJobService trainingJobs;

    private final Map<String, TargetStateMachine> machines = new ConcurrentHashMap<>();

    public TargetStateMachine machine(String targetId) {
        return machines.computeIfAbsent(targetId,
                t -> new TargetStateMachine(t, trainingJobs.lastCompletedAt(t).orElse(null)));
    }

    public Optional<TargetStateMachine> find(String targetId) {
        return Optional.ofNullable(machines.get(targetId));
    }

    public boolean inCooldown(String targetId, Instant now, Duration cooldown) {
        Instant last = machine(targetId).lastCompletedAt();
        return last != null && now.isBefore(last.plus(cooldown));
    }

    /**
     * Вызывать под блокировкой target.
     *
     * @return true: машина была IDLE вне cooldown и удалена
     */
    public boolean evictIfSettled(String targetId, Instant now, Duration cooldown) {
        TargetStateMachine m = machines.get(targetId);
        if (m == null || m.state() != RetrainState.IDLE) {
            return false;
        }
        Instant last = m.lastCompletedAt();
        if (last != null && now.isBefore(last.plus(cooldown))) {
            return false;
        }
        return machines.remove(targetId, m);
    }

    public Collection<TargetStateMachine> all() {
        return machines.values();
    }
}
