/* (C)2026 */
package com.ammann.idgap.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Coverage statistics of an analysed ID range.
 *
 * @param totalSlots number of IDs in the analysed range
 * @param totalStored number of IDs in the range that have a record
 * @param totalMissing number of IDs covered by gaps
 * @param gapCount number of gaps
 * @param coveragePercent share of the range not covered by gaps, rounded to two decimals
 * @param largestGap first gap with the greatest count, {@code null} without gaps
 */
@Schema(description = "Coverage statistics of an analysed ID range")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CoverageStatsDTO(
        @Schema(description = "Number of IDs in the analysed range") Long totalSlots,
        @Schema(description = "Number of IDs that have a record") Long totalStored,
        @Schema(description = "Number of IDs covered by gaps") Long totalMissing,
        @Schema(description = "Number of gaps") Integer gapCount,
        @Schema(description = "Coverage in percent (0 - 100)") Double coveragePercent,
        @Schema(description = "Largest gap") GapRangeDTO largestGap) {
}
