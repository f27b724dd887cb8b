package com.chicu.airetrain.web.controller.api;

import com.chicu.airetrain.drift.DriftEventValidationException;
import com.chicu.airetrain.promotion.PromotionConflictException;
import com.chicu.airetrain.promotion.TargetFrozenException;
import com.chicu.airetrain.web.dto.ApiErrorBody;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

/**
 * Ошибки /api/** в едином формате {@link ApiErrorBody}.
 * 4xx пишем в warn без стека, 5xx в error со стеком.
 */
@Slf4j
@RestControllerAdvice
public class ApiErrorHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorBody> onBeanValidation(MethodArgumentNotValidException e, HttpServletRequest req) {
        List<String> violations = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        return reply(HttpStatus.BAD_REQUEST, e, req, "Malformed drift event", violations);
    }

    @ExceptionHandler(DriftEventValidationException.class)
    public ResponseEntity<ApiErrorBody> onDriftEvent(DriftEventValidationException e, HttpServletRequest req) {
        return reply(HttpStatus.BAD_REQUEST, e, req, messageOf(e), e.getViolations());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiErrorBody> onUnreadable(Exception e, HttpServletRequest req) {
        return reply(HttpStatus.BAD_REQUEST, e, req, "Malformed request body", List.of(messageOf(e)));
    }

    @ExceptionHandler({TargetFrozenException.class, PromotionConflictException.class})
    public ResponseEntity<ApiErrorBody> onTargetConflict(RuntimeException e, HttpServletRequest req) {
        return reply(HttpStatus.CONFLICT, e, req, messageOf(e), List.of());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiErrorBody> onWrongMethod(HttpRequestMethodNotSupportedException e, HttpServletRequest req) {
        return reply(HttpStatus.METHOD_NOT_ALLOWED, e, req, "Method " + e.getMethod() + " is not supported", List.of());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiErrorBody> onStatus(ResponseStatusException e, HttpServletRequest req) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        String reason = e.getReason() != null ? e.getReason() : messageOf(e);
        return reply(status, e, req, reason, List.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorBody> onUnexpected(Exception e, HttpServletRequest req) {
        return reply(HttpStatus.INTERNAL_SERVER_ERROR, e, req, messageOf(e), List.of());
    }

    private ResponseEntity<ApiErrorBody> reply(HttpStatus status, Exception e, HttpServletRequest req,
                                               String message, List<String> violations) {
        String path = req != null ? req.getRequestURI() : "/";
        if (status.is5xxServerError()) {
            log.error("❌ {} {}: {}", status.value(), path, message, e);
        } else {
            log.warn("⚠️ {} {}: {} {}", status.value(), path, message, violations);
        }
        ApiErrorBody body = new ApiErrorBody(
                status.value(),
                e.getClass().getSimpleName(),
                message,
                path,
                Instant.now(),
                violations
        );
        return ResponseEntity.status(status).body(body);
    }

    private static String messageOf(Throwable e) {
        String m = e.getMessage();
        return m != null && !m.isBlank() ? m : e.getClass().getSimpleName();
    }
}
