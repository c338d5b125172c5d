/* (C)2026 */
package com.ammann.idgap.dto;

import com.ammann.idgap.enumeration.StatusClassification;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Immutable result of one gap analysis run.
 *
 * <p>Superseded, never mutated, by the next run for the same request.
 */
@Schema(description = "Result of a gap analysis run")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GapAnalysisResultDTO(
        @Schema(description = "Analysed entity")
        String entityId,

        @Schema(description = "First ID of the analysed range")
        Long minId,

        @Schema(description = "Last ID of the analysed range")
        Long maxId,

        @Schema(description = "Whether excluded IDs were skipped from the gap list")
        Boolean skipExcluded,

        @Schema(description = "Gaps in ascending order")
        List<GapRangeDTO> gaps,

        @Schema(description = "Coverage statistics")
        CoverageStatsDTO stats,

        @Schema(description = "Number of IDs per status, EMPTY included")
        Map<StatusClassification, Long> statusCounts,

        @Schema(description = "Timestamp of the computation")
        Instant computedAt,

        @Schema(description = "Whether the record data is incomplete")
        Boolean partial,

        @Schema(description = "Page fetch failure of a partial result")
        PageFetchFailureDTO failure
) {
    public GapAnalysisResultDTO {
        gaps = List.copyOf(gaps);
        EnumMap<StatusClassification, Long> ordered = new EnumMap<>(StatusClassification.class);
        ordered.putAll(statusCounts);
        statusCounts = Collections.unmodifiableMap(ordered);
    }
}
