package com.heritagesync.core.exception;

/**
 * Publication failed. Every target is left as it was before the attempt.
 */
public class PublishException extends PipelineException {

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
