package com.lynkvertx.batteryopt.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Standard API Response wrapper
 * A failed run carries an error type and message but never a schedule payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    /**
     * HTTP-style status code
     */
    private int code;

    /**
     * Response message
     */
    private String message;

    /**
     * Failure category (INVALID_INPUT, INFEASIBLE_MODEL, ...); absent on success
     */
    private String errorType;

    /**
     * Response data payload
     */
    private T data;

    /**
     * Response timestamp in ISO 8601 format
     */
    private String timestamp;

    public static <T> ApiResponse<T> success(String message, T data) {
        return ApiResponse.<T>builder()
            .code(200)
            .message(message)
            .data(data)
            .timestamp(Instant.now().toString())
            .build();
    }

    public static <T> ApiResponse<T> error(int code, String errorType, String message) {
        return ApiResponse.<T>builder()
            .code(code)
            .errorType(errorType)
            .message(message)
            .timestamp(Instant.now().toString())
            .build();
    }

    /**
     * Error response with details (e.g., per-field validation errors)
     */
    public static <T> ApiResponse<T> error(int code, String errorType, String message, T details) {
        return ApiResponse.<T>builder()
            .code(code)
            .errorType(errorType)
            .message(message)
            .data(details)
            .timestamp(Instant.now().toString())
            .build();
    }
}
