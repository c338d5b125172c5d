/* (C)2026 */
package com.ammann.idgap.model;

import com.ammann.idgap.dto.IdRecordDTO;
import com.ammann.idgap.dto.PageFetchFailureDTO;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Records collected by draining the record pages of an entity.
 *
 * @param records records inside the requested range, keyed and sorted by ID
 * @param failure page failure that stopped the drain early, or {@code null} if complete
 * @param pagesFetched number of pages fetched successfully
 * @param duplicates number of records that overwrote an earlier record with the same ID
 * @param discarded number of records dropped for lying outside the range or lacking an ID
 */
public record AggregationResult(
        NavigableMap<Long, IdRecordDTO> records,
        PageFetchFailureDTO failure,
        int pagesFetched,
        int duplicates,
        int discarded) {

    public AggregationResult {
        records = Collections.unmodifiableNavigableMap(new TreeMap<>(records));
    }

    /** Returns whether the drain stopped before the last page. */
    public boolean isPartial() {
        return failure != null;
    }
}
