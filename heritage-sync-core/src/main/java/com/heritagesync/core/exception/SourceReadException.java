package com.heritagesync.core.exception;

import java.nio.file.Path;

/**
 * A source file exists but could not be read or parsed as a whole.
 */
public class SourceReadException extends PipelineException {

    private final transient Path file;

    public SourceReadException(Path file, Throwable cause) {
        super("Failed to read source file: " + file + " - " + cause.getMessage(), cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
