/* (C)2026 */
package com.ammann.idgap.service;

import com.ammann.idgap.client.RecordStoreGateway;
import com.ammann.idgap.dto.IdBoundsDTO;
import com.ammann.idgap.exception.InvalidRangeException;
import com.ammann.idgap.exception.NoDataException;
import com.ammann.idgap.model.IdRange;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Determines the ID range an analysis covers.
 *
 * <p>The range starts at 1 and ends at the highest ID the record store knows, unless the
 * caller overrides either end. The record store is only asked for bounds when the end is
 * not supplied.
 */
@ApplicationScoped
public class BoundsResolverService {

    private static final Logger LOG = Logger.getLogger(BoundsResolverService.class);

    static final long DEFAULT_MIN_ID = 1L;

    private final RecordStoreGateway gateway;

    @Inject
    public BoundsResolverService(RecordStoreGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Rejects malformed overrides without touching the record store.
     *
     * @param startId requested first ID, or {@code null}
     * @param endId requested last ID, or {@code null}
     * @throws InvalidRangeException if {@code startId < 1} or the start lies after the end
     */
    public static void validateRequestedRange(Long startId, Long endId) {
        if (startId != null && startId < DEFAULT_MIN_ID) {
            throw InvalidRangeException.startBelowOne(startId);
        }
        long effectiveStart = startId != null ? startId : DEFAULT_MIN_ID;
        if (endId != null && effectiveStart > endId) {
            throw InvalidRangeException.startAfterEnd(effectiveStart, endId);
        }
    }

    /**
     * Resolves the analysed range.
     *
     * @param entityId entity whose bounds are used when {@code endId} is absent
     * @param startId explicit first ID, or {@code null} for 1
     * @param endId explicit last ID, or {@code null} for the highest known ID
     * @return validated range
     * @throws InvalidRangeException if the overrides are malformed or the start lies
     *     beyond the highest known ID
     * @throws NoDataException if the bounds are needed but the entity has none
     */
    public IdRange resolveBounds(String entityId, Long startId, Long endId) {
        validateRequestedRange(startId, endId);

        long minId = startId != null ? startId : DEFAULT_MIN_ID;
        if (endId != null) {
            return new IdRange(minId, endId);
        }

        long highestId = getBounds(entityId).highestId();
        if (minId > highestId) {
            throw new InvalidRangeException(
                    String.format(
                            "Invalid ID range: startId %d is beyond the highest known ID %d of entity %s",
                            minId, highestId, entityId));
        }

        LOG.debugf("Resolved range [%d, %d] for entity %s", minId, highestId, entityId);
        return new IdRange(minId, highestId);
    }

    /**
     * Fetches the known bounds of an entity.
     *
     * @param entityId entity identifier
     * @return bounds with a highest ID
     * @throws NoDataException if the record store has no data for the entity
     */
    public IdBoundsDTO getBounds(String entityId) {
        return gateway.getBounds(entityId)
                .filter(IdBoundsDTO::hasData)
                .orElseThrow(() -> NoDataException.noBounds(entityId));
    }
}
