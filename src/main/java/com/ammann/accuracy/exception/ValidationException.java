/* (C)2026 */
package com.ammann.accuracy.exception;

/**
 * Exception indicating that a client-supplied observation, ranking record or parameter
 * does not meet the required constraints for the requested operation.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 * Provides factory methods for common validation failure patterns. Messages always
 * name the offending field.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for insufficient data.
     */
    public static ValidationException insufficientData(String resourceType, int required, int actual) {
        return new ValidationException(
                String.format("Insufficient %s: need at least %d, but got %d",
                        resourceType, required, actual));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a required field that is absent.
     */
    public static ValidationException missingField(String fieldName) {
        return new ValidationException(
                String.format("Missing required field '%s'", fieldName));
    }
}
