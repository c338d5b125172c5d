/* (C)2026 */
package com.ammann.idgap.client;

import com.ammann.idgap.dto.EntityConfigDTO;
import com.ammann.idgap.dto.IdBoundsDTO;
import com.ammann.idgap.dto.RecordPageDTO;
import com.ammann.idgap.exception.PageFetchException;
import java.util.Optional;

/**
 * Read access to the remote record store.
 *
 * <p>All methods block until the remote call completes. Transport and server errors are
 * reported as {@link PageFetchException}; "not found" answers are reported as empty
 * optionals.
 */
public interface RecordStoreGateway {

    /**
     * Looks up the configuration of an entity.
     *
     * @param entityId entity identifier
     * @return the entity, or empty if the store does not know it
     */
    Optional<EntityConfigDTO> findEntity(String entityId);

    /**
     * Looks up the known ID bounds of an entity.
     *
     * @param entityId entity identifier
     * @return the bounds, or empty if the store has no data for the entity
     */
    Optional<IdBoundsDTO> getBounds(String entityId);

    /**
     * Fetches one page of records.
     *
     * @param entityId entity identifier
     * @param limit maximum number of records on the page
     * @param continuationToken token returned with the previous page, {@code null} for the first
     * @return the page, never {@code null}
     */
    RecordPageDTO listRecords(String entityId, int limit, String continuationToken);
}
