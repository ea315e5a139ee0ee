package com.heritagesync.core.publish;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result of a successful publish.
 *
 * @param files every written target
 */
public record PublishReport(List<PublishedFile> files) {

    public PublishReport {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * A written target.
     *
     * @param path target path
     * @param sizeBytes size of the written dataset
     */
    public record PublishedFile(Path path, long sizeBytes) {
        public PublishedFile {
            Objects.requireNonNull(path, "path must not be null");
        }
    }
}
