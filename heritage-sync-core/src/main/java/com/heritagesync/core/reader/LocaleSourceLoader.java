package com.heritagesync.core.reader;

import com.heritagesync.core.exception.MissingInputFileException;
import com.heritagesync.core.exception.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Loads every per-locale source file for a run.
 *
 * <p>Files are independent, so they may be read concurrently. The returned map is always
 * ordered by the locale list, never by completion order, which keeps the downstream merge
 * deterministic.
 *
 * <p>All files are checked for existence before any read starts, so a run with several
 * missing files reports all of them at once.
 */
public class LocaleSourceLoader {

    private static final Logger log = LoggerFactory.getLogger(LocaleSourceLoader.class);

    private final SiteSourceReader reader;
    private final Function<String, Path> fileResolver;
    private final boolean parallel;

    /**
     * Creates a loader.
     *
     * @param reader per-file reader
     * @param fileResolver maps a locale code to its source file
     * @param parallel whether to read files concurrently
     */
    public LocaleSourceLoader(SiteSourceReader reader, Function<String, Path> fileResolver, boolean parallel) {
        this.reader = reader;
        this.fileResolver = fileResolver;
        this.parallel = parallel;
    }

    /**
     * Reads the source file of every locale.
     *
     * @param locales locales in merge order
     * @return rows per locale, in {@code locales} order
     * @throws MissingInputFileException if any locale file is missing
     */
    public Map<String, List<RawSiteRecord>> loadAll(List<String> locales) {
        Map<String, Path> files = new LinkedHashMap<>();
        List<Path> missing = new ArrayList<>();
        for (String locale : locales) {
            Path file = fileResolver.apply(locale);
            files.put(locale, file);
            if (!Files.isRegularFile(file)) {
                log.error("Missing {} source file: {}", locale, file);
                missing.add(file);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingInputFileException(missing);
        }

        if (!parallel || locales.size() < 2) {
            Map<String, List<RawSiteRecord>> result = new LinkedHashMap<>();
            files.forEach((locale, file) -> result.put(locale, reader.read(file, locale)));
            return result;
        }
        return loadConcurrently(files);
    }

    private Map<String, List<RawSiteRecord>> loadConcurrently(Map<String, Path> files) {
        int threads = Math.min(files.size(), Runtime.getRuntime().availableProcessors());
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threads));
        try {
            Map<String, Future<List<RawSiteRecord>>> futures = new LinkedHashMap<>();
            files.forEach((locale, file) -> futures.put(locale, executor.submit(() -> reader.read(file, locale))));

            Map<String, List<RawSiteRecord>> result = new LinkedHashMap<>();
            for (Map.Entry<String, Future<List<RawSiteRecord>>> entry : futures.entrySet()) {
                result.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
            }
            return result;
        } finally {
            executor.shutdownNow();
        }
    }

    private List<RawSiteRecord> await(String locale, Future<List<RawSiteRecord>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while reading " + locale + " source", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException pipelineException) {
                throw pipelineException;
            }
            throw new PipelineException("Failed to read " + locale + " source: " + cause.getMessage(), cause);
        }
    }
}
