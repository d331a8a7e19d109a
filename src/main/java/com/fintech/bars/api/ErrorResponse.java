package com.fintech.bars.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Uniform error body for API failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "503")
    int status,

    @Schema(description = "Error type/category", example = "NOT_CONNECTED")
    String error,

    @Schema(description = "Human-readable error message", example = "Quote feed is not connected")
    String message,

    @Schema(description = "Request path that caused the error", example = "/api/v1/quotes/subscribe")
    String path,

    @Schema(description = "Timestamp of the error", example = "2025-12-09T10:30:00Z")
    Instant timestamp,

    @Schema(description = "Field-level validation errors (if applicable)")
    List<ValidationError> validationErrors
) {

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path, List<ValidationError> validationErrors) {
        this(status, error, message, path, Instant.now(), validationErrors);
    }

    @Schema(description = "Field-level validation error")
    public record ValidationError(
        @Schema(description = "Field name that failed validation", example = "interval")
        String field,

        @Schema(description = "Rejected value", example = "7m")
        String rejectedValue,

        @Schema(description = "Validation error message", example = "Unsupported interval")
        String message
    ) {
    }
}
