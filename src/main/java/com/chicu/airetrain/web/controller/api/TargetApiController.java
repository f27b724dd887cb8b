package com.chicu.airetrain.web.controller.api;

import com.chicu.airetrain.admission.WeekendBudgetService;
import com.chicu.airetrain.config.RetrainProperties;
import com.chicu.airetrain.orchestrator.TargetStateMachine;
import com.chicu.airetrain.orchestrator.TargetStateRegistry;
import com.chicu.airetrain.orchestrator.TargetStateSnapshot;
import com.chicu.airetrain.promotion.PromotionController;
import com.chicu.airetrain.promotion.StabilityRecord;
import com.chicu.airetrain.promotion.StabilityStore;
import com.chicu.airetrain.queue.RetrainRequestQueue;
import com.chicu.airetrain.training.TrainingJobEntity;
import com.chicu.airetrain.training.TrainingJobService;
import com.chicu.airetrain.web.dto.TargetStatusDto;
import com.chicu.airetrain.web.dto.TrainingJobView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Операторская поверхность: состояние target, история job'ов, ручная разморозка.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/targets")
public class TargetApiController {

    private final TargetStateRegistry states;
    private final RetrainRequestQueue queue;
    private final StabilityStore stabilityStore;
    private final WeekendBudgetService budgetService;
    private final TrainingJobService trainingJobs;
    private final PromotionController promotionController;
    private final RetrainProperties props;
    private final Clock clock;

    @GetMapping("/{targetId}")
    public TargetStatusDto status(@PathVariable String targetId) {
        Optional<TargetStateMachine> machine = states.find(targetId);
        Optional<StabilityRecord> stability = stabilityStore.find(targetId);
        List<TrainingJobEntity> jobs = trainingJobs.recent(targetId);

        if (machine.isEmpty() && stability.isEmpty() && jobs.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown target: " + targetId);
        }

        Instant now = clock.instant();
        TargetStateSnapshot snap = machine.map(TargetStateMachine::snapshot).orElse(null);

        return TargetStatusDto.builder()
                .targetId(targetId)
                .state(snap != null ? snap.state() : null)
                .lastReason(snap != null ? snap.lastReason() : null)
                .stateSince(snap != null ? snap.stateSince() : null)
                .lastCompletedAt(snap != null ? snap.lastCompletedAt() : null)
                .inCooldown(snap != null && states.inCooldown(targetId, now, props.cooldown()))
                .currentJobId(snap != null ? snap.currentJobId() : null)
                .pendingRequest(queue.pending(targetId).orElse(null))
                .stability(stability.orElse(null))
                .budget(budgetService.current(targetId, now))
                .frozen(stability.map(StabilityRecord::frozen).orElse(false))
                .build();
    }

    @GetMapping("/{targetId}/jobs")
    public List<TrainingJobView> jobs(@PathVariable String targetId) {
        return trainingJobs.recent(targetId).stream()
                .map(TrainingJobView::of)
                .toList();
    }

    @PostMapping("/{targetId}/unfreeze")
    public Map<String, Object> unfreeze(@PathVariable String targetId) {
        boolean changed = promotionController.unfreeze(targetId);
        log.info("🔓 Unfreeze requested target={} changed={}", targetId, changed);
        return Map.of("targetId", targetId, "unfrozen", changed);
    }
}
