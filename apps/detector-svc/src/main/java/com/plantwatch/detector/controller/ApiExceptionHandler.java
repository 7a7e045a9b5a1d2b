package com.plantwatch.detector.controller;

import com.plantwatch.detector.controller.dto.ErrorResponseDto;
import com.plantwatch.detector.error.ModelNotFoundException;
import com.plantwatch.detector.error.RegistrySwapException;
import com.plantwatch.detector.error.StoreUnavailableException;
import com.plantwatch.detector.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleModelNotFound(ModelNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "MODEL_NOT_FOUND", ex.getMessage(), Map.of("variableId", ex.variableId()));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponseDto> handleStoreUnavailable(StoreUnavailableException ex) {
        log.warn("Store unavailable: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", "Store temporarily unavailable", Map.of(
                "operation", ex.operation(),
                "attempts", ex.attempts()
        ));
    }

    @ExceptionHandler(RegistrySwapException.class)
    public ResponseEntity<ErrorResponseDto> handleRegistrySwap(RegistrySwapException ex) {
        log.error("Retraining failed", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "RETRAIN_FAILED", ex.getMessage(), reason(ex.getCause()));
    }

    @ExceptionHandler(CannotGetJdbcConnectionException.class)
    public ResponseEntity<ErrorResponseDto> handleJdbc(CannotGetJdbcConnectionException ex) {
        String specific = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        return build(HttpStatus.SERVICE_UNAVAILABLE, "DB_UNAVAILABLE", "Database temporarily unavailable", reason(specific));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        String msg = ex.getMessage() != null ? ex.getMessage().toLowerCase() : "";
        if (msg.contains("relation \"anomaly_records\" does not exist") || msg.contains("relation \"process_readings\" does not exist")) {
            return build(HttpStatus.INTERNAL_SERVER_ERROR, "DB_SCHEMA_MISSING", "Database schema not initialized", Map.of(
                    "action", "Enable DETECTOR_DB_BOOTSTRAP=true once or apply db/bootstrap/schema.sql",
                    "reason", ex.getMessage()
            ));
        }
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", reason(ex.getMessage()));
    }

    private static Map<String, Object> reason(Object reason) {
        // Map.of rejects null values
        Map<String, Object> details = new HashMap<>();
        if (reason instanceof Throwable throwable) {
            details.put("reason", throwable.getMessage());
        } else if (reason != null) {
            details.put("reason", reason);
        }
        return details;
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
