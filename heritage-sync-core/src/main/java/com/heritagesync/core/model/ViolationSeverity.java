package com.heritagesync.core.model;

/**
 * Severity of a dataset validation violation.
 */
public enum ViolationSeverity {

    /**
     * Advisory: reported, does not block publication.
     */
    WARNING,

    /**
     * Fatal: the dataset must not be published.
     */
    FATAL
}
