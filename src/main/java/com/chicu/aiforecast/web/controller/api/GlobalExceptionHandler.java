package com.chicu.aiforecast.web.controller.api;

import com.chicu.aiforecast.common.exception.DuplicatePredictionException;
import com.chicu.aiforecast.common.exception.FeatureSchemaException;
import com.chicu.aiforecast.common.exception.ForecastException;
import com.chicu.aiforecast.common.exception.InsufficientTrainingDataException;
import com.chicu.aiforecast.common.exception.MarketDataUnavailableException;
import com.chicu.aiforecast.common.exception.ModelNotAvailableException;
import com.chicu.aiforecast.common.exception.TemporalIntegrityViolationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ForecastException.class)
    public ResponseEntity<Map<String, Object>> handleForecast(ForecastException ex, HttpServletRequest req) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError() || ex instanceof TemporalIntegrityViolationException) {
            log.error("{} at {}: [{}] {}", status.value(), safePath(req), ex.getErrorCode(), safeMsg(ex));
        } else {
            log.warn("{} at {}: [{}] {}", status.value(), safePath(req), ex.getErrorCode(), safeMsg(ex));
        }

        Map<String, Object> body = body(status, ex.getErrorCode(), safeMsg(ex), req);
        if (ex instanceof TemporalIntegrityViolationException tiv && tiv.getReport() != null) {
            body.put("violations", tiv.getReport().violations());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest req) {
        log.warn("400 Bad Request at {}: {}", safePath(req), ex.toString());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", safeMsg(ex), req));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("{} at {}: {}", status.value(), safePath(req), ex.getReason());
        return ResponseEntity.status(status).body(body(status, status.name(),
                ex.getReason() != null ? ex.getReason() : safeMsg(ex), req));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException ex, HttpServletRequest req) {
        log.error("500 at {}: {}", safePath(req), safeMsg(ex), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "ERROR", safeMsg(ex), req));
    }

    static HttpStatus statusOf(ForecastException ex) {
        if (ex instanceof FeatureSchemaException) return HttpStatus.BAD_REQUEST;
        if (ex instanceof DuplicatePredictionException) return HttpStatus.CONFLICT;
        if (ex instanceof TemporalIntegrityViolationException) return HttpStatus.LOCKED;
        if (ex instanceof InsufficientTrainingDataException) return HttpStatus.UNPROCESSABLE_ENTITY;
        if (ex instanceof MarketDataUnavailableException) return HttpStatus.SERVICE_UNAVAILABLE;
        if (ex instanceof ModelNotAvailableException) return HttpStatus.SERVICE_UNAVAILABLE;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    // ---------- helpers ----------

    private static Map<String, Object> body(HttpStatus status, String code, String message, HttpServletRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("code", code);
        body.put("message", message);
        body.put("path", safePath(req));
        body.put("timestamp", Instant.now().toString());
        return body;
    }

    private static String safeMsg(Throwable e) {
        String m = (e != null ? e.getMessage() : null);
        return (m != null && !m.isBlank()) ? m : (e != null ? e.getClass().getSimpleName() : "Error");
    }

    private static String safePath(HttpServletRequest req) {
        return req != null ? req.getRequestURI() : "/";
    }
}
