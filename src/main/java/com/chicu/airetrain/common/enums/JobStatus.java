package com.chicu.airetrain.common.enums;

import java.util.Locale;

public enum JobStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }

    /**
     * Статус из ответа job runner'а ("running", "Succeeded", "timed-out" ...).
     */
    public static JobStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalStateException("job status is empty");
        }
        String x = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (x.equals("TIMEDOUT")) return TIMED_OUT;
        return JobStatus.valueOf(x);
    }
}
