package com.chicu.airetrain.web.dto;

import java.time.Instant;
import java.util.List;

/**
 * Тело ошибки REST API. violations пустой, если ошибка не про валидацию.
 */
public record ApiErrorBody(
        int code,
        String error,
        String message,
        String path,
        Instant timestamp,
        List<String> violations
) {
}
