/* (C)2026 */
package com.ammann.idgap.resource;

import com.ammann.idgap.dto.AnalysisRequestDTO;
import com.ammann.idgap.dto.CsvExportDTO;
import com.ammann.idgap.dto.GapAnalysisResponseDTO;
import com.ammann.idgap.dto.IdBoundsDTO;
import com.ammann.idgap.dto.IdStatusDTO;
import com.ammann.idgap.exception.ValidationException;
import com.ammann.idgap.properties.ApiProperties;
import com.ammann.idgap.service.GapAnalysisService;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for gap analysis of an entity's ID space.
 *
 * <p>Provides the cached gap analysis, cache invalidation, CSV export of missing IDs,
 * the known ID bounds, a per-ID status grid and the list of IDs that have a record.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Entities.BASE)
@Tag(name = "Gap Analysis API", description = "Missing-ID detection and coverage statistics")
@Produces(MediaType.APPLICATION_JSON)
public class GapAnalysisResource {

    private static final Logger LOG = Logger.getLogger(GapAnalysisResource.class);
    static final String TEXT_CSV = "text/csv";
    static final int MAX_TIMEOUT_SECONDS = 600;
    static final int DEFAULT_EXISTING_IDS_LIMIT = 1000;

    @Inject GapAnalysisService gapAnalysisService;

    @GET
    @Path(ApiProperties.Entities.GAP_ANALYSIS)
    @Operation(
            summary = "Analyze ID Gaps",
            description =
                    "Finds the missing IDs of the entity's ID space and computes coverage. Results"
                            + " are cached for a few minutes; use forceRefresh to recompute.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Analysis completed, possibly with partial data",
                content =
                        @Content(schema = @Schema(implementation = GapAnalysisResponseDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid range or parameters"),
        @APIResponse(responseCode = "404", description = "No data for the entity"),
        @APIResponse(responseCode = "502", description = "Record store unavailable"),
        @APIResponse(responseCode = "504", description = "Analysis timed out")
    })
    public Response analyze(
            @Parameter(description = "Entity identifier") @PathParam("entityId") String entityId,
            @Parameter(description = "Bypass the cache and recompute")
                    @QueryParam("forceRefresh")
                    @DefaultValue("false")
                    boolean forceRefresh,
            @Parameter(description = "First ID of the range (default 1)") @QueryParam("startId")
                    Long startId,
            @Parameter(description = "Last ID of the range (default: highest known ID)")
                    @QueryParam("endId")
                    Long endId,
            @Parameter(description = "Do not report excluded IDs as gaps")
                    @QueryParam("skipExcluded")
                    @DefaultValue("true")
                    boolean skipExcluded,
            @Parameter(description = "Timeout in seconds (max 600)") @QueryParam("timeoutSeconds")
                    Integer timeoutSeconds) {

        LOG.debugf(
                "Gap analysis request: entity=%s, forceRefresh=%s, range=%s-%s, skipExcluded=%s",
                entityId, forceRefresh, startId, endId, skipExcluded);

        var request =
                new AnalysisRequestDTO(
                        entityId,
                        forceRefresh,
                        startId,
                        endId,
                        skipExcluded,
                        parseTimeout(timeoutSeconds));

        return Response.ok(gapAnalysisService.analyze(request)).build();
    }

    @DELETE
    @Path(ApiProperties.Entities.GAP_ANALYSIS)
    @Operation(
            summary = "Invalidate Cached Analyses",
            description = "Drops every cached analysis of the entity")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Cache entries dropped"),
        @APIResponse(responseCode = "400", description = "Invalid entity identifier")
    })
    public Response invalidate(
            @Parameter(description = "Entity identifier") @PathParam("entityId") String entityId) {

        int removed = gapAnalysisService.invalidate(entityId);
        return Response.ok(Map.of("entityId", entityId, "invalidated", removed)).build();
    }

    @GET
    @Path(ApiProperties.Entities.GAP_EXPORT)
    @Produces(TEXT_CSV)
    @Operation(
            summary = "Export Missing IDs as CSV",
            description =
                    "Exports the missing IDs with their source URLs. Pass range=a-b (repeatable) to"
                            + " export selected gaps only.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "CSV file"),
        @APIResponse(responseCode = "400", description = "Malformed range or export too large"),
        @APIResponse(responseCode = "404", description = "Unknown entity or no data")
    })
    public Response exportCsv(
            @Parameter(description = "Entity identifier") @PathParam("entityId") String entityId,
            @Parameter(description = "Gap to export, e.g. 3-4") @QueryParam("range")
                    List<String> ranges,
            @Parameter(description = "Do not report excluded IDs as gaps")
                    @QueryParam("skipExcluded")
                    @DefaultValue("true")
                    boolean skipExcluded) {

        CsvExportDTO export = gapAnalysisService.exportGaps(entityId, ranges, skipExcluded);

        LOG.infof("CSV export of entity %s: %d rows", entityId, export.rowCount());
        return Response.ok(export.content(), TEXT_CSV)
                .header(
                        HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"" + export.fileName() + "\"")
                .build();
    }

    @GET
    @Path(ApiProperties.Entities.BOUNDS)
    @Operation(summary = "Get ID Bounds", description = "Returns the known ID bounds of the entity")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Bounds retrieved",
                content = @Content(schema = @Schema(implementation = IdBoundsDTO.class))),
        @APIResponse(responseCode = "404", description = "No data for the entity")
    })
    public Response getBounds(
            @Parameter(description = "Entity identifier") @PathParam("entityId") String entityId) {
        return Response.ok(gapAnalysisService.getBounds(entityId)).build();
    }

    @GET
    @Path(ApiProperties.Entities.ID_STATUSES)
    @Operation(
            summary = "Get Per-ID Status Grid",
            description = "Classifies every ID of the range, including IDs without a record")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Statuses retrieved",
                content = @Content(schema = @Schema(implementation = IdStatusDTO[].class))),
        @APIResponse(responseCode = "400", description = "Invalid or oversized range"),
        @APIResponse(responseCode = "404", description = "No data for the entity"),
        @APIResponse(responseCode = "502", description = "Record store unavailable")
    })
    public Response getIdStatuses(
            @Parameter(description = "Entity identifier") @PathParam("entityId") String entityId,
            @Parameter(description = "First ID of the range (default 1)") @QueryParam("startId")
                    Long startId,
            @Parameter(description = "Last ID of the range (default: highest known ID)")
                    @QueryParam("endId")
                    Long endId) {

        List<IdStatusDTO> statuses = gapAnalysisService.classifyRange(entityId, startId, endId);
        LOG.debugf("Status grid of entity %s: %d IDs", entityId, statuses.size());
        return Response.ok(statuses).build();
    }

    @GET
    @Path(ApiProperties.Entities.EXISTING_IDS)
    @Operation(
            summary = "List Existing IDs",
            description = "Returns the IDs of the range that have a record, ascending")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "IDs retrieved"),
        @APIResponse(responseCode = "400", description = "Invalid range or limit"),
        @APIResponse(responseCode = "404", description = "No data for the entity"),
        @APIResponse(responseCode = "502", description = "Record store unavailable")
    })
    public Response listExistingIds(
            @Parameter(description = "Entity identifier") @PathParam("entityId") String entityId,
            @Parameter(description = "First ID of the range (default 1)") @QueryParam("startId")
                    Long startId,
            @Parameter(description = "Last ID of the range (default: highest known ID)")
                    @QueryParam("endId")
                    Long endId,
            @Parameter(description = "Maximum number of IDs (max 10000)")
                    @QueryParam("limit")
                    @DefaultValue("1000")
                    int limit) {

        List<Long> ids = gapAnalysisService.listExistingIds(entityId, startId, endId, limit);
        return Response.ok(Map.of("entityId", entityId, "ids", ids, "count", ids.size())).build();
    }

    private static Duration parseTimeout(Integer timeoutSeconds) {
        if (timeoutSeconds == null) {
            return null;
        }
        if (timeoutSeconds < 1 || timeoutSeconds > MAX_TIMEOUT_SECONDS) {
            throw ValidationException.invalidParameter(
                    "timeoutSeconds",
                    timeoutSeconds,
                    "a value between 1 and " + MAX_TIMEOUT_SECONDS);
        }
        return Duration.ofSeconds(timeoutSeconds);
    }
}
