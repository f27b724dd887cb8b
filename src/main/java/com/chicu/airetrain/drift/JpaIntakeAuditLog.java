package com.chicu.airetrain.drift;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaIntakeAuditLog implements IntakeAuditLog {

    private static final int MAX_JSON = 4000;

    private final IntakeAuditRepository repo;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public void record(DriftEvent event, IntakeDecision decision) {
        IntakeAuditEntity e = IntakeAuditEntity.builder()
                .targetId(event.targetId())
                .severity(event.severity())
                .detectedAt(event.detectedAt())
                .outcome(decision.outcome())
                .reason(decision.reason())
                .requestId(decision.requestId())
                .featureBreakdownJson(toJson(event.featureBreakdown()))
                .createdAt(decision.decidedAt())
                .build();

        repo.save(e);

        // лог минимальный, без спама
        if (decision.outcome() == IntakeOutcome.IGNORED) {
            log.debug("🧾 Intake: target={} severity={} IGNORED", event.targetId(), event.severity());
        } else {
            log.info("🧾 Intake: target={} severity={} outcome={} reason={} request={}",
                    event.targetId(), event.severity(), decision.outcome(), decision.reason(),
                    safe(decision.requestId()));
        }
    }

    private String toJson(Map<String, Double> breakdown) {
        if (breakdown == null || breakdown.isEmpty()) return null;
        try {
            String json = objectMapper.writeValueAsString(breakdown);
            return json.length() <= MAX_JSON ? json : json.substring(0, MAX_JSON);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ featureBreakdown не сериализуется: {}", e.getMessage());
            return null;
        }
    }

    private static String safe(String s) {
        return (s == null || s.isBlank()) ? "-" : s;
    }
}
