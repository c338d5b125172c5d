/* (C)2026 */
package com.ammann.idgap.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Reconstructed source URL of a missing ID.
 *
 * @param id missing ID
 * @param url source URL of the ID
 */
@Schema(description = "Source URL of a missing ID")
public record GapUrlDTO(
        @Schema(description = "Missing ID") Long id,
        @Schema(description = "Source URL") String url) {
}
