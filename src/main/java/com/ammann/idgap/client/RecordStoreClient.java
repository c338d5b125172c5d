/* (C)2026 */
package com.ammann.idgap.client;

import com.ammann.idgap.dto.EntityConfigDTO;
import com.ammann.idgap.dto.IdBoundsDTO;
import com.ammann.idgap.dto.RecordPageDTO;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client of the remote record store.
 *
 * <p>Base URL and timeouts are configured under {@code quarkus.rest-client.record-store}.
 */
@RegisterRestClient(configKey = "record-store")
@Path("/entities")
@Produces(MediaType.APPLICATION_JSON)
public interface RecordStoreClient {

    @GET
    @Path("/{entityId}")
    EntityConfigDTO getEntity(@PathParam("entityId") String entityId);

    @GET
    @Path("/{entityId}/bounds")
    IdBoundsDTO getBounds(@PathParam("entityId") String entityId);

    @GET
    @Path("/{entityId}/records")
    RecordPageDTO listRecords(
            @PathParam("entityId") String entityId,
            @QueryParam("limit") int limit,
            @QueryParam("nextToken") String nextToken);
}
