package com.ammann.idgap.exception;

/**
 * Base unchecked exception for all application-level errors of the gap analysis API.
 *
 * <p>Subclasses represent specific error categories (invalid input, missing data,
 * record store failures, timeouts, internal errors) and are mapped to appropriate HTTP
 * status codes by {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }

    public ApiException(Throwable cause) {
        super(cause);
    }
}
