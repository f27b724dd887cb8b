package com.chicu.airetrain.orchestrator;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

@Component
public class ModelVersionFactory {

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    /**
     * Пример:
     * demand-eu_20260314093000_drift_3f2a9c1e-...
     */
    public String build(String targetId, Instant at, String requestId) {
        return norm(targetId) + "_" + TS.format(at) + "_drift_" + norm(requestId);
    }

    private static String norm(String s) {
        if (s == null) return "NULL";
        String x = s.trim().replaceAll("[^A-Za-z0-9._\\-]", "-");
        return x.isEmpty() ? "NULL" : x;
    }
}
