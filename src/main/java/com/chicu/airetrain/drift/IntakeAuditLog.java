package com.chicu.airetrain.drift;

/**
 * Аудит каждого решения intake (ignored / coalesced / dropped / accepted).
 */
public interface IntakeAuditLog {

    void record(DriftEvent event, IntakeDecision decision);
}
