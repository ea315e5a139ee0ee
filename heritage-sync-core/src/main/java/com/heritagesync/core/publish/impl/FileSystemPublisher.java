package com.heritagesync.core.publish.impl;

import com.heritagesync.core.exception.PublishException;
import com.heritagesync.core.publish.DatasetPublisher;
import com.heritagesync.core.publish.DatasetSerializer;
import com.heritagesync.core.publish.PublishReport;
import com.heritagesync.core.publish.PublishReport.PublishedFile;
import com.heritagesync.core.publish.PublishRequest;
import com.heritagesync.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publisher that writes the dataset to one or more files.
 *
 * <p>The dataset is serialized once and the same bytes go to every target. Publication runs
 * in two phases:
 * <ol>
 *   <li><b>Stage</b> - a temp file is written next to every target. If any write fails, all
 *       temp files are deleted and no target is touched.</li>
 *   <li><b>Swap</b> - each existing target is copied to a backup, then the temp file is moved
 *       over it (atomically where the file system supports it). If a move fails, targets
 *       already swapped are restored from their backups (or deleted if they did not exist
 *       before).</li>
 * </ol>
 *
 * <p>Parent directories are created as needed.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * PublishRequest request = new PublishRequest(
 *     sites,
 *     Paths.get("data/sites.json"),
 *     List.of(Paths.get("public/sites.json"))
 * );
 *
 * PublishReport report = new FileSystemPublisher().publish(request);
 * }</pre>
 */
public class FileSystemPublisher implements DatasetPublisher {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemPublisher.class);

    private final DatasetSerializer serializer;

    public FileSystemPublisher() {
        this(new DatasetSerializer());
    }

    public FileSystemPublisher(DatasetSerializer serializer) {
        this.serializer = serializer;
    }

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public PublishReport publish(PublishRequest request) {
        List<Path> targets = request.targets();
        byte[] content = serializer.serialize(request.sites());
        logger.info("Publishing {} sites ({}) to {} target(s)",
            request.sites().size(), FileUtils.formatSize(content.length), targets.size());

        Map<Path, Path> staged = stage(targets, content);
        swap(staged);

        List<PublishedFile> files = new ArrayList<>();
        for (Path target : targets) {
            files.add(new PublishedFile(target, content.length));
            logger.info("Wrote file: {} ({} bytes)", target, content.length);
        }
        return new PublishReport(files);
    }

    /**
     * Writes a temp file next to every target.
     *
     * @return temp file per target, in target order
     */
    private Map<Path, Path> stage(List<Path> targets, byte[] content) {
        Map<Path, Path> staged = new LinkedHashMap<>();
        for (Path target : targets) {
            try {
                Path parentDir = target.getParent();
                if (parentDir != null) {
                    Files.createDirectories(parentDir);
                }
                Path temp = Files.createTempFile(parentDir, "." + target.getFileName(), ".tmp");
                staged.put(target, temp);
                Files.write(temp, content);
                logger.debug("Staged {} at {}", target, temp);
            } catch (IOException e) {
                deleteQuietly(staged.values());
                throw new PublishException("Failed to stage dataset for " + target + ", nothing was published", e);
            }
        }
        return staged;
    }

    private void swap(Map<Path, Path> staged) {
        List<Path> swapped = new ArrayList<>();
        Map<Path, Path> backups = new LinkedHashMap<>();

        for (Map.Entry<Path, Path> entry : staged.entrySet()) {
            Path target = entry.getKey();
            Path temp = entry.getValue();
            try {
                if (Files.exists(target)) {
                    Path backup = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".bak");
                    Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING);
                    backups.put(target, backup);
                }
                move(temp, target);
                swapped.add(target);
            } catch (IOException e) {
                logger.error("Failed to replace {}: {}. Rolling back {} target(s)", target, e.getMessage(), swapped.size());
                rollback(swapped, backups);
                deleteQuietly(staged.values());
                deleteQuietly(backups.values());
                throw new PublishException("Failed to publish dataset to " + target + ", previous files restored", e);
            }
        }

        deleteQuietly(backups.values());
    }

    private void rollback(List<Path> swapped, Map<Path, Path> backups) {
        for (Path target : swapped) {
            try {
                Path backup = backups.get(target);
                if (backup != null) {
                    Files.move(backup, target, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    Files.deleteIfExists(target);
                }
                logger.info("Restored {}", target);
            } catch (IOException e) {
                logger.error("Failed to restore {}: {}", target, e.getMessage());
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Iterable<Path> paths) {
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                logger.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
            }
        }
    }
}
