/* (C)2026 */
package com.ammann.idgap.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Per-ID metadata record as returned by the record store.
 *
 * <p>Records are created and refreshed by the fetch pipeline that owns the record store.
 * This service only reads and classifies them.
 *
 * @param id ID within the entity's ID space (1 or greater)
 * @param linkedResultId identifier of the stored result for this ID, if any
 * @param exclusionReason reason the ID was intentionally never fully processed
 * @param lastFetchOutcome outcome of the last fetch attempt (e.g. ERROR, NOT_FOUND)
 * @param archivedLocator location of the archived raw document
 * @param displayName human-readable name of the result
 */
@Schema(description = "Per-ID metadata record")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdRecordDTO(
        @Schema(description = "ID within the entity's ID space") Long id,
        @Schema(description = "Identifier of the linked result") String linkedResultId,
        @Schema(description = "Reason the ID was excluded from processing") String exclusionReason,
        @Schema(description = "Outcome of the last fetch attempt") String lastFetchOutcome,
        @Schema(description = "Locator of the archived raw document") String archivedLocator,
        @Schema(description = "Display name of the linked result") String displayName) {

    /**
     * Creates a record that carries only an ID.
     *
     * @param id record ID
     * @return record without any metadata
     */
    public static IdRecordDTO bare(long id) {
        return new IdRecordDTO(id, null, null, null, null, null);
    }
}
