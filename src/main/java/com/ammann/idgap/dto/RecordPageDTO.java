/* (C)2026 */
package com.ammann.idgap.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * One page of records from the record store.
 *
 * @param items records on this page (may be {@code null} for an empty page)
 * @param nextToken continuation token of the next page, {@code null} or blank on the last page
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordPageDTO(List<IdRecordDTO> items, String nextToken) {

    /** Returns the page items, never {@code null}. */
    public List<IdRecordDTO> itemsOrEmpty() {
        return items == null ? List.of() : items;
    }

    /** Returns whether another page follows this one. */
    public boolean hasNext() {
        return nextToken != null && !nextToken.isBlank();
    }
}
