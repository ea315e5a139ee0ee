package com.heritagesync.core.model;

import java.util.Objects;

/**
 * A dataset invariant that does not hold.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ValidationViolation v = ValidationViolation.fatal(
 *     "438", null, "latitude-range", "Invalid latitude 95.0");
 * }</pre>
 *
 * @param siteId id of the offending property (may be empty if the id itself is missing)
 * @param componentId id of the offending component, or null for property-level rules
 * @param rule short rule code, e.g. "latitude-range"
 * @param message human-readable description
 * @param severity violation severity
 */
public record ValidationViolation(
    String siteId,
    String componentId,
    String rule,
    String message,
    ViolationSeverity severity
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationViolation {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        siteId = siteId == null ? "" : siteId;
    }

    /**
     * Creates a fatal violation.
     *
     * @param siteId property id
     * @param componentId component id or null
     * @param rule rule code
     * @param message message
     * @return fatal violation
     */
    public static ValidationViolation fatal(String siteId, String componentId, String rule, String message) {
        return new ValidationViolation(siteId, componentId, rule, message, ViolationSeverity.FATAL);
    }

    /**
     * Creates a warning.
     *
     * @param siteId property id
     * @param rule rule code
     * @param message message
     * @return warning violation
     */
    public static ValidationViolation warning(String siteId, String rule, String message) {
        return new ValidationViolation(siteId, null, rule, message, ViolationSeverity.WARNING);
    }

    /**
     * Returns true if this violation blocks publication.
     *
     * @return true if fatal
     */
    public boolean isFatal() {
        return severity == ViolationSeverity.FATAL;
    }
}
