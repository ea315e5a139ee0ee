package com.heritagesync.core.reader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.heritagesync.core.exception.SourceReadException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reader for the external component list.
 *
 * <p>The file is a flat JSON array, one object per (parent reference, component) pair:
 * <pre>{@code
 * [
 *   {
 *     "whs_id": "1133bis",
 *     "component": "http://www.wikidata.org/entity/Q29583927",
 *     "componentLabel": "Badaling",
 *     "lat": "40.3597",
 *     "lon": "116.0200"
 *   }
 * ]
 * }</pre>
 *
 * <p>The component list is optional: when the file is absent the reconciliation stage is
 * skipped and the dataset is published without components.
 */
public class ComponentSourceReader extends AbstractJacksonReader {

    private static final TypeReference<List<RawComponentRecord>> RECORD_LIST = new TypeReference<>() {};

    /**
     * Reads the component list.
     *
     * @param file component list file
     * @return records in file order, or empty if the file does not exist
     * @throws SourceReadException if the file exists but cannot be parsed
     */
    public Optional<List<RawComponentRecord>> read(Path file) {
        if (!Files.isRegularFile(file)) {
            log.warn("Component source not found: {}. Skipping component reconciliation.", file);
            return Optional.empty();
        }

        log.info("Reading component source: {}", file);
        try {
            List<RawComponentRecord> records = objectMapper.readValue(file.toFile(), RECORD_LIST);
            List<RawComponentRecord> present = records == null
                ? List.of()
                : records.stream().filter(Objects::nonNull).toList();
            log.info("Loaded {} component records", present.size());
            return Optional.of(present);
        } catch (IOException e) {
            throw new SourceReadException(file, e);
        }
    }
}
