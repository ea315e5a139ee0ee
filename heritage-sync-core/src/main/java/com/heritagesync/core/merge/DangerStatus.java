package com.heritagesync.core.merge;

/**
 * Endangered status of a property, derived from the free-text danger column.
 *
 * <p>The column is empty for properties that were never listed as in danger and otherwise
 * holds the listing period, e.g. {@code "Y 2012"} or {@code "P 1992-2004"}.
 *
 * @param endangered whether the property carries any danger listing
 * @param period trimmed listing text, empty when not endangered
 */
public record DangerStatus(boolean endangered, String period) {

    private static final DangerStatus NONE = new DangerStatus(false, "");

    public DangerStatus {
        period = period == null ? "" : period;
    }

    /**
     * Parses the raw danger column.
     *
     * @param raw raw value, may be null
     * @return parsed status
     */
    public static DangerStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        return new DangerStatus(true, raw.trim());
    }
}
