/* (C)2026 */
package com.ammann.idgap.exception;

import java.time.Duration;

/**
 * Exception indicating that an analysis did not finish within the caller's timeout.
 *
 * <p>Mapped to HTTP 504 (Gateway Timeout) by {@link GlobalExceptionHandler}.
 */
public class AnalysisTimeoutException extends ApiException
{
    public AnalysisTimeoutException(String message)
    {
        super(message);
    }

    public AnalysisTimeoutException(String message, Throwable cause)
    {
        super(message, cause);
    }

    /**
     * Creates an exception for an analysis that exceeded its timeout.
     */
    public static AnalysisTimeoutException after(String entityId, Duration timeout)
    {
        return new AnalysisTimeoutException(
                String.format("Gap analysis for entity %s timed out after %d ms",
                        entityId, timeout.toMillis()));
    }
}
