package com.heritagesync.core.exception;

import com.heritagesync.core.model.ValidationReport;

/**
 * The dataset has at least one fatal violation and must not be published.
 */
public class ValidationFailedException extends PipelineException {

    private final transient ValidationReport report;

    public ValidationFailedException(ValidationReport report) {
        super("Dataset validation failed with " + report.fatal().size() + " fatal violation(s)");
        this.report = report;
    }

    /**
     * Returns the full validation report, warnings included.
     *
     * @return validation report
     */
    public ValidationReport getReport() {
        return report;
    }
}
