/* (C)2026 */
package com.ammann.idgap.dto;

import java.time.Duration;

/**
 * Parameters of a gap analysis request.
 *
 * @param entityId entity to analyse
 * @param forceRefresh bypass the cache and recompute
 * @param startId explicit first ID, {@code null} for the default of 1
 * @param endId explicit last ID, {@code null} to use the highest known ID
 * @param skipExcluded whether excluded IDs are skipped from the gap list
 * @param timeout maximum duration of the request, {@code null} for the configured default
 */
public record AnalysisRequestDTO(
        String entityId,
        boolean forceRefresh,
        Long startId,
        Long endId,
        boolean skipExcluded,
        Duration timeout) {

    /**
     * Creates a default request: cached, full range, excluded IDs skipped.
     *
     * @param entityId entity to analyse
     * @return request with default options
     */
    public static AnalysisRequestDTO of(String entityId) {
        return new AnalysisRequestDTO(entityId, false, null, null, true, null);
    }

    /** Returns whether both range ends were supplied. */
    public boolean hasExplicitRange() {
        return startId != null && endId != null;
    }
}
