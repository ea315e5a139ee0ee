package com.heritagesync.core.exception;

/**
 * Base class for conditions that terminate a pipeline run.
 *
 * <p>Per-record problems are never raised as exceptions; they are reported as
 * {@link com.heritagesync.core.model.Diagnostic}s and the run continues.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
