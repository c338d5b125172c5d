/* (C)2026 */
package com.ammann.idgap.dto;

import com.ammann.idgap.enumeration.GapSeverity;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Closed interval describing consecutive missing IDs.
 *
 * @param start first missing ID in the gap
 * @param end last missing ID in the gap
 * @param count number of missing IDs in the closed interval
 * @param severity severity derived from {@code count}
 */
@Schema(description = "Represents a range of missing IDs")
public record GapRangeDTO(
        @Schema(description = "First missing ID in this gap") Long start,
        @Schema(description = "Last missing ID in this gap") Long end,
        @Schema(description = "Total count of missing IDs in this gap") Long count,
        @Schema(description = "Severity derived from the gap size") GapSeverity severity) {
    /**
     * Creates a gap DTO and derives the inclusive count and severity from bounds.
     *
     * @param start first missing ID
     * @param end last missing ID
     * @return immutable gap DTO
     */
    public static GapRangeDTO of(long start, long end) {
        long count = end - start + 1;
        return new GapRangeDTO(start, end, count, GapSeverity.fromCount(count));
    }

    /**
     * Returns the selector key of this gap, {@code start-end}.
     *
     * @return range key as used by export selections
     */
    public String key() {
        return start + "-" + end;
    }
}
