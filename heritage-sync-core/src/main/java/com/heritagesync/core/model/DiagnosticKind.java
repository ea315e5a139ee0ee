package com.heritagesync.core.model;

/**
 * Kind of a per-record diagnostic raised while building or reconciling the dataset.
 *
 * <p>None of these abort a run. They are logged, counted and reported in the run summary.
 */
public enum DiagnosticKind {

    /** Source record skipped: unparsable coordinates, blank id or unknown category. */
    UNPARSABLE_RECORD,

    /** Component discarded: missing, zero, unparsable or out-of-range coordinates. */
    INVALID_COMPONENT_COORDINATES,

    /** Component discarded: its point coincides with the parent's point. */
    PSEUDO_COMPONENT_FILTERED,

    /** Component discarded: its id collides with the reserved visit-key prefix. */
    RESERVED_COMPONENT_ID,

    /** Component discarded: its URI does not carry the configured prefix. */
    INVALID_COMPONENT_URI,

    /** Component discarded: its label is blank, so it would have no name. */
    MISSING_COMPONENT_NAME,

    /** Component discarded: another attached component already derived the same id. */
    DUPLICATE_COMPONENT_ID,

    /** Every candidate component of a property was discarded. */
    EMPTY_AFTER_FILTERING,

    /** A component URI appeared more than once and was merged. */
    DUPLICATE_COMPONENT_URI,

    /** A component group references a property that is not in the dataset. */
    UNMATCHED_COMPONENT_GROUP
}
