package com.heritagesync.core.reader;

import com.fasterxml.jackson.databind.JsonNode;
import com.heritagesync.core.exception.MissingInputFileException;
import com.heritagesync.core.exception.SourceReadException;
import com.heritagesync.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader for per-locale property exports.
 *
 * <p>Two layouts are accepted, chosen by file extension:
 * <ul>
 *   <li>{@code .xml} - the UNESCO syndication export, {@code <query><row>...</row></query>}
 *       with one child element per field ({@code id_number}, {@code site}, ...)</li>
 *   <li>{@code .json} - an array of objects using the same field names</li>
 * </ul>
 *
 * <p><b>Example XML:</b>
 * <pre>{@code
 * <query>
 *   <row>
 *     <id_number>438</id_number>
 *     <site>The Great Wall</site>
 *     <latitude>40.4167</latitude>
 *     <longitude>116.0833</longitude>
 *     <category>Cultural</category>
 *     ...
 *   </row>
 * </query>
 * }</pre>
 *
 * <p>Rows are returned in file order and are not interpreted: numeric parsing, text cleaning
 * and merging happen in the record builder.
 */
public class SiteSourceReader extends AbstractJacksonReader {

    /**
     * Reads every row of a per-locale file.
     *
     * @param file source file
     * @param locale locale the file belongs to (for logging)
     * @return rows in file order
     * @throws MissingInputFileException if the file does not exist
     * @throws SourceReadException if the file cannot be parsed
     */
    public List<RawSiteRecord> read(Path file, String locale) {
        if (!Files.isRegularFile(file)) {
            throw new MissingInputFileException(List.of(file));
        }

        log.info("Reading {} source: {}", locale, file);
        try {
            boolean json = "json".equals(FileUtils.getExtension(file));
            JsonNode root = json ? parseJson(file) : parseXml(file);
            if (root == null) {
                log.warn("Source file {} is empty", file);
                return List.of();
            }
            JsonNode rows = root.isArray() ? root : normalizeToArray(root.get("row"));

            List<RawSiteRecord> records = new ArrayList<>(rows.size());
            for (JsonNode row : rows) {
                if (row.isObject()) {
                    records.add(toRecord(row));
                }
            }
            log.info("Parsed {} {} rows from {}", records.size(), locale, file.getFileName());
            return records;
        } catch (IOException e) {
            throw new SourceReadException(file, e);
        }
    }

    private RawSiteRecord toRecord(JsonNode row) {
        return new RawSiteRecord(
            extractText(row, "id_number"),
            extractText(row, "unique_number"),
            extractText(row, "site"),
            extractText(row, "short_description"),
            extractText(row, "states"),
            extractText(row, "location"),
            extractText(row, "justification"),
            extractText(row, "latitude"),
            extractText(row, "longitude"),
            extractText(row, "region"),
            extractText(row, "iso_code"),
            extractText(row, "category"),
            extractText(row, "criteria_txt"),
            extractText(row, "date_inscribed"),
            extractText(row, "secondary_dates"),
            extractText(row, "danger"),
            extractText(row, "transboundary"),
            extractText(row, "extension"),
            extractText(row, "revision"),
            extractText(row, "http_url"),
            extractText(row, "image_url")
        );
    }
}
