package com.traceharvest.controller;

import com.traceharvest.exception.AllFetchesFailedException;
import com.traceharvest.exception.BackendUnavailableException;
import com.traceharvest.exception.NoSummariesException;
import com.traceharvest.exception.TraceHarvestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class HarvestExceptionHandler {

    @ExceptionHandler(NoSummariesException.class)
    public ResponseEntity<Map<String, Object>> handleNoSummaries(NoSummariesException e) {
        log.warn("Collection aborted: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({AllFetchesFailedException.class, BackendUnavailableException.class})
    public ResponseEntity<Map<String, Object>> handleBackendFailure(TraceHarvestException e) {
        log.error("Collection failed: {}", e.getMessage(), e);
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(TraceHarvestException.class)
    public ResponseEntity<Map<String, Object>> handleHarvestFailure(TraceHarvestException e) {
        log.error("Collection failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, Exception e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getClass().getSimpleName());
        body.put("message", e.getMessage());
        if (e.getCause() != null) {
            body.put("cause", e.getCause().getMessage());
        }
        return ResponseEntity.status(status).body(body);
    }
}
