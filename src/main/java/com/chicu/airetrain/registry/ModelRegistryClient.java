package com.chicu.airetrain.registry;

import java.util.Optional;

/**
 * Внешний registry артефактов. Источник правды «что сейчас в проде»: StabilityRecord,
 * registry лишь зеркалит его для serving'а через {@link #markProduction}.
 */
public interface ModelRegistryClient {

    Optional<String> getProduction(String targetId);

    /**
     * @return candidateId
     */
    String register(String targetId, String artifactRef, EvaluationMetrics metrics, String versionLabel);

    /**
     * Метрики артефакта на hold-out наборе (baseline для validation gate).
     */
    Optional<EvaluationMetrics> getMetrics(String artifactRef);

    void markProduction(String targetId, String artifactRef);
}
