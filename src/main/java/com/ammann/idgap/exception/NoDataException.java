/* (C)2026 */
package com.ammann.idgap.exception;

/**
 * Exception indicating that the record store knows no data for an entity, so there is
 * no ID space to analyse.
 *
 * <p>Mapped to HTTP 404 (Not Found) by {@link GlobalExceptionHandler}.
 */
public class NoDataException extends ApiException
{
    private final String entityId;

    public NoDataException(String entityId, String message)
    {
        super(message);
        this.entityId = entityId;
    }

    /**
     * Creates an exception for an entity without a known highest ID.
     */
    public static NoDataException noBounds(String entityId)
    {
        return new NoDataException(
                entityId, "No ID bounds found for entity " + entityId + ": nothing to analyse");
    }

    public String getEntityId()
    {
        return entityId;
    }
}
