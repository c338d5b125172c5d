/* (C)2026 */
package com.ammann.idgap.dto;

import com.ammann.idgap.enumeration.StatusClassification;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Classified status of a single ID, used for the status grid.
 *
 * @param id the ID
 * @param status classification of the ID
 * @param displayName display name of the linked result, if any
 * @param archivedLocator locator of the archived raw document, if any
 */
@Schema(description = "Status of a single ID")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IdStatusDTO(
        @Schema(description = "The ID") Long id,
        @Schema(description = "Classified status") StatusClassification status,
        @Schema(description = "Display name of the linked result") String displayName,
        @Schema(description = "Locator of the archived raw document") String archivedLocator) {
}
