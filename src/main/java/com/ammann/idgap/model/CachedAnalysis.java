/* (C)2026 */
package com.ammann.idgap.model;

import com.ammann.idgap.dto.GapAnalysisResultDTO;
import java.time.Duration;

/**
 * Analysis result together with where it came from.
 *
 * @param result the analysis result
 * @param fromCache whether it was read from the cache rather than computed for this call
 * @param age time elapsed since the result was computed
 */
public record CachedAnalysis(GapAnalysisResultDTO result, boolean fromCache, Duration age) {

    /** Wraps a result computed for the current call. */
    public static CachedAnalysis fresh(GapAnalysisResultDTO result) {
        return new CachedAnalysis(result, false, Duration.ZERO);
    }
}
