/* (C)2026 */
package com.ammann.idgap.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Known bounds of an entity's ID space as reported by the record store.
 *
 * @param entityId entity identifier
 * @param lowestId lowest ID with a stored result, {@code null} for an empty dataset
 * @param highestId highest ID with a stored result, {@code null} for an empty dataset
 * @param totalCount number of stored results
 */
@Schema(description = "Known ID bounds of an entity")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdBoundsDTO(
        @Schema(description = "Entity identifier") String entityId,
        @Schema(description = "Lowest known ID") Long lowestId,
        @Schema(description = "Highest known ID") Long highestId,
        @Schema(description = "Number of stored results") Long totalCount) {

    /** Returns whether the record store knows a highest ID for the entity. */
    public boolean hasData() {
        return highestId != null && highestId >= 1;
    }
}
