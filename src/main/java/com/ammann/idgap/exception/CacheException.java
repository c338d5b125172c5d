/* (C)2026 */
package com.ammann.idgap.exception;

/**
 * Internal failure of the analysis cache.
 *
 * <p>Never surfaced to API clients: the cache logs it and falls back to a fresh
 * computation.
 */
public class CacheException extends RuntimeException
{
    public CacheException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
