/* (C)2026 */
package com.ammann.idgap.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Describes why record aggregation stopped before the last page.
 *
 * @param pageNumber 1-based number of the page that could not be fetched
 * @param message error description
 * @param recordsCollected records collected before the failure
 */
@Schema(description = "Record page fetch failure attached to a partial result")
public record PageFetchFailureDTO(
        @Schema(description = "1-based number of the failed page") Integer pageNumber,
        @Schema(description = "Error description") String message,
        @Schema(description = "Records collected before the failure") Integer recordsCollected) {
}
