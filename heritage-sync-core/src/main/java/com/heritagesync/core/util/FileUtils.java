package com.heritagesync.core.util;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Resolves a configured location against a base directory.
     *
     * <p>Absolute locations are returned unchanged.
     *
     * @param baseDir base directory
     * @param location configured location
     * @return normalized absolute path
     */
    public static Path resolve(Path baseDir, String location) {
        Path path = Path.of(location);
        Path resolved = path.isAbsolute() ? path : baseDir.resolve(path);
        return resolved.toAbsolutePath().normalize();
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return lower-case file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Formats a byte count for operator output.
     *
     * @param bytes size in bytes
     * @return size such as "512 B", "12.40 KB" or "3.05 MB"
     */
    public static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.2f KB", bytes / 1024.0);
        }
        return String.format(Locale.ROOT, "%.2f MB", bytes / 1024.0 / 1024.0);
    }
}
