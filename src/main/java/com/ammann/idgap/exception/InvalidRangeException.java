/* (C)2026 */
package com.ammann.idgap.exception;

/**
 * Exception indicating that a requested ID range is malformed: {@code startId > endId},
 * {@code startId < 1}, or a one-sided override that lies outside the known bounds.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class InvalidRangeException extends ValidationException
{
    public InvalidRangeException(String message)
    {
        super(message);
    }

    /**
     * Creates an exception for a start ID greater than the end ID.
     */
    public static InvalidRangeException startAfterEnd(long startId, long endId)
    {
        return new InvalidRangeException(
                String.format("Invalid ID range: startId %d is greater than endId %d", startId, endId));
    }

    /**
     * Creates an exception for a start ID below 1.
     */
    public static InvalidRangeException startBelowOne(long startId)
    {
        return new InvalidRangeException(
                String.format("Invalid ID range: startId must be at least 1, but got %d", startId));
    }
}
