/* (C)2026 */
package com.ammann.idgap.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Analysis result as handed to the dashboard, with cache information.
 *
 * @param result the analysis result
 * @param fromCache whether the result was served from the cache
 * @param cacheAgeSeconds seconds since the result was computed, 0 for fresh results
 * @param summary human-readable one-line summary
 */
@Schema(description = "Gap analysis response")
public record GapAnalysisResponseDTO(
        @Schema(description = "Analysis result") GapAnalysisResultDTO result,
        @Schema(description = "Whether the result came from the cache") Boolean fromCache,
        @Schema(description = "Age of the cached result in seconds") Long cacheAgeSeconds,
        @Schema(description = "Human-readable summary") String summary) {
}
