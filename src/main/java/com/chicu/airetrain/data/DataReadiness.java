package com.chicu.airetrain.data;

import lombok.Builder;

/**
 * @param datasetRef ссылка на последний пригодный снапшот датасета (только при ready=true)
 */
@Builder
public record DataReadiness(
        boolean ready,
        String datasetRef,
        String details
) {

    public static DataReadiness notReady(String details) {
        return DataReadiness.builder().ready(false).details(details).build();
    }
}
