package com.lynkvertx.batteryopt.config;

import com.lynkvertx.batteryopt.dto.ApiResponse;
import com.lynkvertx.batteryopt.exception.InfeasibleModelException;
import com.lynkvertx.batteryopt.exception.InvalidInputException;
import com.lynkvertx.batteryopt.exception.SolverException;
import com.lynkvertx.batteryopt.exception.UnboundedModelException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global Exception Handler
 * Maps optimization failures onto the unified error response. A failed run
 * never returns schedule or savings data.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidInput(InvalidInputException ex) {
        log.warn("Invalid input: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(ApiResponse.error(400, "INVALID_INPUT", ex.getMessage()));
    }

    @ExceptionHandler(InfeasibleModelException.class)
    public ResponseEntity<ApiResponse<Void>> handleInfeasible(InfeasibleModelException ex) {
        log.warn("Infeasible model: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(ApiResponse.error(422, "INFEASIBLE_MODEL", ex.getMessage()));
    }

    @ExceptionHandler(UnboundedModelException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnbounded(UnboundedModelException ex) {
        log.error("Unbounded model", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.error(500, "UNBOUNDED_MODEL", ex.getMessage()));
    }

    @ExceptionHandler(SolverException.class)
    public ResponseEntity<ApiResponse<Void>> handleSolverError(SolverException ex) {
        log.error("Solver error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.error(500, "SOLVER_ERROR", ex.getMessage()));
    }

    /**
     * Handle bean validation failures on request bodies
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Map<String, String>>> handleValidationExceptions(
            MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        log.warn("Validation failed: {}", errors);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(ApiResponse.error(400, "INVALID_INPUT", "Validation failed", errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(ApiResponse.error(400, "INVALID_INPUT", "Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleAllExceptions(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.error(500, "INTERNAL_ERROR", "Internal server error"));
    }
}
