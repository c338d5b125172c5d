/* (C)2026 */
package com.ammann.idgap.model;

/**
 * Closed, validated range {@code [minId, maxId]} of an ID space.
 *
 * @param minId first ID, 1 or greater
 * @param maxId last ID, not below {@code minId}
 */
public record IdRange(long minId, long maxId) {

    public IdRange {
        if (minId < 1 || maxId < minId) {
            throw new IllegalArgumentException(
                    "Invalid ID range [" + minId + ", " + maxId + "]");
        }
    }

    /** Returns the number of IDs in the range. */
    public long size() {
        return maxId - minId + 1;
    }

    /** Returns whether the ID lies in the range. */
    public boolean contains(long id) {
        return id >= minId && id <= maxId;
    }
}
