package com.chicu.airetrain.training;

/**
 * Тонкий интерфейс к внешней среде обучения (локально / удалённо / GPU: не наше дело).
 */
public interface JobRunnerAdapter {

    /**
     * @param warmStartRef артефакт для warm start, может быть null
     * @return id job'а на стороне runner'а
     */
    String submit(String targetId, String datasetRef, String warmStartRef, String versionLabel);

    JobPollResult poll(String externalJobId);
}
