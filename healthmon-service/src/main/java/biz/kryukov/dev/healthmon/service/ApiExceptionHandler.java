package biz.kryukov.dev.healthmon.service;

import biz.kryukov.dev.healthmon.HealthMonitorException;
import biz.kryukov.dev.healthmon.RefreshInterruptedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders refresh failures as a JSON error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RefreshInterruptedException.class)
    public ResponseEntity<Map<String, String>> refreshInterrupted(RefreshInterruptedException e) {
        logger.warn("healthmon: refresh abandoned: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(HealthMonitorException.class)
    public ResponseEntity<Map<String, String>> monitorFailure(HealthMonitorException e) {
        logger.error("healthmon: request failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("detail", detail != null ? detail : "");
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
