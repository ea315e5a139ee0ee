package com.heritagesync.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Complete list of violations found in one validation pass.
 *
 * @param sitesChecked number of properties examined
 * @param componentsChecked number of components examined
 * @param violations every violation, in scan order
 */
public record ValidationReport(
    int sitesChecked,
    int componentsChecked,
    List<ValidationViolation> violations
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationReport {
        Objects.requireNonNull(violations, "violations must not be null");
        violations = List.copyOf(violations);
    }

    /**
     * Returns true if any violation is fatal.
     *
     * @return true if publication must be blocked
     */
    public boolean hasFatal() {
        return violations.stream().anyMatch(ValidationViolation::isFatal);
    }

    /**
     * Returns the fatal violations.
     *
     * @return fatal violations
     */
    public List<ValidationViolation> fatal() {
        return violations.stream().filter(ValidationViolation::isFatal).toList();
    }

    /**
     * Returns the advisory violations.
     *
     * @return warnings
     */
    public List<ValidationViolation> warnings() {
        return violations.stream().filter(v -> !v.isFatal()).toList();
    }
}
