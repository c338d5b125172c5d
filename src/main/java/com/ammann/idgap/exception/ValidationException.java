package com.ammann.idgap.exception;

/**
 * Exception indicating that a client-supplied parameter does not meet the required
 * constraints for the requested operation.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 * Provides factory methods for common validation failure patterns.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for a result that would exceed a configured limit.
     */
    public static ValidationException limitExceeded(String resourceType, long limit, long actual) {
        return new ValidationException(
                String.format("Too many %s: at most %d allowed, but got %d",
                        resourceType, limit, actual));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
