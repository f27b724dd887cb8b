package com.chicu.airetrain.promotion;

/**
 * Пост-промоушн health check: опрашивается в течение grace period.
 */
public interface HealthCheckClient {

    boolean check(String targetId);
}
