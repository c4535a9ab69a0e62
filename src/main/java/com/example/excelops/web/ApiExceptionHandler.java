package com.example.excelops.web;

import com.example.excelops.service.pipeline.UnknownSheetException;
import com.example.excelops.service.pivot.PivotException;
import com.example.excelops.service.preset.PresetNotFoundException;
import com.example.excelops.service.vlookup.VlookupException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns the services' exceptions into {@link ApiError} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(VlookupException.class)
    public ResponseEntity<ApiError> vlookup(VlookupException e) {
        log.warn("VLOOKUP rejected ({}): {}", e.getReason(), e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getReason().name(), e.getMessage());
    }

    @ExceptionHandler(PivotException.class)
    public ResponseEntity<ApiError> pivot(PivotException e) {
        log.warn("Pivot rejected: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "PIVOT", e.getMessage());
    }

    @ExceptionHandler({UnknownSheetException.class, PresetNotFoundException.class})
    public ResponseEntity<ApiError> notFound(RuntimeException e) {
        return body(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> badArgument(IllegalArgumentException e) {
        if (e.getMessage() != null && e.getMessage().contains("already exists")) {
            return body(HttpStatus.CONFLICT, "CONFLICT", e.getMessage());
        }
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> badState(IllegalStateException e) {
        log.warn("Request failed: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "FAILED", e.getMessage());
    }

    private static ResponseEntity<ApiError> body(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ApiError(code, message));
    }
}
