/* (C)2026 */
package com.ammann.idgap.enumeration;

/**
 * Severity of a gap derived from the number of missing IDs it covers.
 *
 * <p>Each level defines a minimum count. A gap is classified into the highest level
 * whose threshold it meets or exceeds.
 */
public enum GapSeverity
{
    /** 100 or more missing IDs. */
    HIGH(100),
    /** 10 to 99 missing IDs. */
    MEDIUM(10),
    /** Fewer than 10 missing IDs. */
    LOW(1);

    private final long threshold;

    GapSeverity(long threshold) {
        this.threshold = threshold;
    }

    /**
     * Returns the severity for a gap of the given size.
     *
     * @param count number of missing IDs in the gap
     * @return the highest severity whose threshold the count meets
     */
    public static GapSeverity fromCount(long count) {
        if (count >= HIGH.threshold) return HIGH;
        if (count >= MEDIUM.threshold) return MEDIUM;
        return LOW;
    }

    public long getThreshold() { return threshold; }
}
