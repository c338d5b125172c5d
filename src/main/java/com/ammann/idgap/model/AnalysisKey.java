/* (C)2026 */
package com.ammann.idgap.model;

import com.ammann.idgap.dto.AnalysisRequestDTO;

/**
 * Cache key of a gap analysis: entity, optional range override and classifier options.
 *
 * @param entityId analysed entity
 * @param startId explicit first ID, or {@code null}
 * @param endId explicit last ID, or {@code null}
 * @param skipExcluded whether excluded IDs are skipped from the gap list
 */
public record AnalysisKey(String entityId, Long startId, Long endId, boolean skipExcluded) {

    /**
     * Derives the cache key of a request. Refresh and timeout options are not part of it.
     *
     * @param request analysis request
     * @return cache key
     */
    public static AnalysisKey from(AnalysisRequestDTO request) {
        return new AnalysisKey(
                request.entityId(), request.startId(), request.endId(), request.skipExcluded());
    }

    @Override
    public String toString() {
        return entityId
                + ":start=" + (startId == null ? "*" : startId)
                + ":end=" + (endId == null ? "*" : endId)
                + ":skipExcluded=" + skipExcluded;
    }
}
