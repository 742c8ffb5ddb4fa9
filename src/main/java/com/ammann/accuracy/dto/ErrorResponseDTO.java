/* (C)2026 */
package com.ammann.accuracy.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Standardized error payload for REST responses.
 *
 * @param message human-readable error message
 * @param errorCode machine-readable error code
 * @param path request path that failed, if known
 * @param status HTTP status code
 * @param timestamp server-side error timestamp
 */
@Schema(description = "API error response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponseDTO(
        @Schema(description = "Error message describing what went wrong") String message,
        @Schema(description = "Error code for programmatic handling") String errorCode,
        @Schema(description = "Request path") String path,
        @Schema(description = "HTTP status code") Integer status,
        @Schema(description = "Timestamp when the error occurred") Instant timestamp) {

    public ErrorResponseDTO(String message, String errorCode, String path, int status) {
        this(message, errorCode, path, status, Instant.now());
    }
}
