package com.billing.leakdetector.controller;

import com.billing.leakdetector.controller.dto.ErrorResponse;
import com.billing.leakdetector.exception.AdapterUnavailableException;
import com.billing.leakdetector.exception.AlreadyProcessingException;
import com.billing.leakdetector.exception.DuplicateRowException;
import com.billing.leakdetector.exception.InvalidRowException;
import com.billing.leakdetector.exception.InvalidTransitionException;
import com.billing.leakdetector.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(AlreadyProcessingException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyProcessing(AlreadyProcessingException ex) {
        return build(HttpStatus.CONFLICT, "ALREADY_PROCESSING", ex.getMessage(), Map.of(
                "uploadId", ex.getUploadId(),
                "activeJobId", ex.getActiveJobId()));
    }

    @ExceptionHandler(DuplicateRowException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateRow(DuplicateRowException ex) {
        return build(HttpStatus.CONFLICT, "DUPLICATE_ROW", ex.getMessage(), Map.of(
                "uploadId", ex.getUploadId(),
                "rowIndex", ex.getRowIndex()));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex) {
        return build(HttpStatus.CONFLICT, "INVALID_TRANSITION", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({InvalidRowException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be read", Map.of());
    }

    @ExceptionHandler(AdapterUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleAdapterUnavailable(AdapterUnavailableException ex) {
        log.warn("Inference adapter unavailable: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "ADAPTER_UNAVAILABLE", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex) {
        // framework errors such as unknown routes carry their own status
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            HttpStatus status = HttpStatus.resolve(framework.getStatusCode().value());
            if (status != null && status.is4xxClientError()) {
                return build(status, status.name(), ex.getMessage(), Map.of());
            }
        }
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex.getMessage() != null) {
            details.put("reason", ex.getMessage());
        }
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", details);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                Map<String, Object> details) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, details));
    }
}
