/* (C)2026 */
package com.ammann.idgap.exception;

/**
 * Exception indicating a failure in communication with the remote record store.
 *
 * <p>Within record aggregation a failed page degrades the result to a partial one;
 * this exception reaches the caller only when partial results are disabled or when the
 * failing call has no partial fallback (bounds, entity lookup).
 *
 * <p>Mapped to HTTP 502 (Bad Gateway) by {@link GlobalExceptionHandler}.
 */
public class PageFetchException extends ApiException
{
    public PageFetchException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public PageFetchException(String message)
    {
        super(message);
    }
}
