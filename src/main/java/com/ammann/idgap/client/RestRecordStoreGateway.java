/* (C)2026 */
package com.ammann.idgap.client;

import com.ammann.idgap.dto.EntityConfigDTO;
import com.ammann.idgap.dto.IdBoundsDTO;
import com.ammann.idgap.dto.RecordPageDTO;
import com.ammann.idgap.exception.PageFetchException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import java.util.Optional;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

/**
 * {@link RecordStoreGateway} backed by the {@link RecordStoreClient} REST client.
 *
 * <p>Translates HTTP 404 answers into empty results and every other client failure into
 * {@link PageFetchException}.
 */
@ApplicationScoped
public class RestRecordStoreGateway implements RecordStoreGateway {

    private static final Logger LOG = Logger.getLogger(RestRecordStoreGateway.class);

    private final RecordStoreClient client;

    @Inject
    public RestRecordStoreGateway(@RestClient RecordStoreClient client) {
        this.client = client;
    }

    @Override
    public Optional<EntityConfigDTO> findEntity(String entityId) {
        try {
            return Optional.ofNullable(client.getEntity(entityId));
        } catch (WebApplicationException e) {
            if (isNotFound(e)) {
                LOG.debugf("Entity %s not found in record store", entityId);
                return Optional.empty();
            }
            throw failure("entity lookup", entityId, e);
        } catch (ProcessingException e) {
            throw failure("entity lookup", entityId, e);
        }
    }

    @Override
    public Optional<IdBoundsDTO> getBounds(String entityId) {
        try {
            return Optional.ofNullable(client.getBounds(entityId)).filter(IdBoundsDTO::hasData);
        } catch (WebApplicationException e) {
            if (isNotFound(e)) {
                LOG.debugf("No bounds for entity %s (404)", entityId);
                return Optional.empty();
            }
            throw failure("bounds lookup", entityId, e);
        } catch (ProcessingException e) {
            throw failure("bounds lookup", entityId, e);
        }
    }

    @Override
    public RecordPageDTO listRecords(String entityId, int limit, String continuationToken) {
        try {
            RecordPageDTO page = client.listRecords(entityId, limit, continuationToken);
            return page != null ? page : new RecordPageDTO(null, null);
        } catch (WebApplicationException | ProcessingException e) {
            throw failure("record page fetch", entityId, e);
        }
    }

    private static boolean isNotFound(WebApplicationException e) {
        return e.getResponse() != null
                && e.getResponse().getStatus() == Response.Status.NOT_FOUND.getStatusCode();
    }

    private static PageFetchException failure(String operation, String entityId, RuntimeException e) {
        LOG.warnf("Record store %s failed for entity %s: %s", operation, entityId, e.getMessage());
        return new PageFetchException(
                "Record store " + operation + " failed for entity " + entityId + ": " + e.getMessage(),
                e);
    }
}
