package com.heritagesync.core.exception;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A required source file does not exist.
 */
public class MissingInputFileException extends PipelineException {

    private final List<Path> missingFiles;

    public MissingInputFileException(List<Path> missingFiles) {
        super("Required input file(s) not found: " + missingFiles.stream()
            .map(Path::toString)
            .collect(Collectors.joining(", ")));
        this.missingFiles = List.copyOf(missingFiles);
    }

    /**
     * Returns every missing file detected.
     *
     * @return missing files
     */
    public List<Path> getMissingFiles() {
        return missingFiles;
    }
}
