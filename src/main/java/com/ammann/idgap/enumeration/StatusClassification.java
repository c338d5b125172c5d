/* (C)2026 */
package com.ammann.idgap.enumeration;

/**
 * Status of a single ID in an analysed ID space.
 *
 * <p>{@link #EMPTY} means no record exists for the ID. Every other value means a record
 * exists and was classified by {@link com.ammann.idgap.service.StatusClassifier}.
 */
public enum StatusClassification
{
    /** The record links to a stored result. */
    HAS_RESULT,
    /** The record carries a configured exclusion reason (e.g. NOT_PUBLISHED). */
    EXCLUDED,
    /** The last fetch of the ID failed. */
    ERROR,
    /** The last fetch found nothing usable (NOT_FOUND, BLANK, NOT_IN_USE). */
    NOT_FOUND,
    /** A record exists but matches none of the other rules. */
    OTHER,
    /** No record exists for the ID. */
    EMPTY;

    /**
     * Returns whether an ID with this status is excluded from the gap list.
     *
     * @param skipExcluded whether excluded IDs are skipped (not reported as gaps)
     * @return {@code true} if the ID counts as present
     */
    public boolean countsAsPresent(boolean skipExcluded) {
        return switch (this) {
            case HAS_RESULT, ERROR, NOT_FOUND, OTHER -> true;
            case EXCLUDED -> skipExcluded;
            case EMPTY -> false;
        };
    }
}
