package com.heritagesync.core.publish;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.heritagesync.core.exception.SourceReadException;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.reconcile.SiteIds;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/**
 * Reads and writes the published dataset format: a pretty-printed JSON array of sites.
 *
 * <p>Output is deterministic. Sites are ordered by numeric {@code idNumber}, map entries by
 * key, indentation is two spaces and line breaks are {@code \n} on every platform, so the
 * same sites always serialize to the same bytes.
 */
public class DatasetSerializer {

    private static final TypeReference<List<HeritageSite>> SITE_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public DatasetSerializer() {
        this.mapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
            .withObjectIndenter(indenter)
            .withArrayIndenter(indenter)
            .withSeparators(Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        this.writer = mapper.writer(printer);
    }

    /**
     * Serializes sites in publication order.
     *
     * @param sites sites in any order
     * @return UTF-8 JSON bytes
     */
    public byte[] serialize(List<HeritageSite> sites) {
        List<HeritageSite> ordered = sites.stream()
            .sorted(Comparator.comparing(HeritageSite::idNumber, SiteIds::compareNumeric))
            .toList();
        try {
            return (writer.writeValueAsString(ordered) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize dataset", e);
        }
    }

    /**
     * Reads a published dataset.
     *
     * @param file dataset file
     * @return sites in file order
     * @throws SourceReadException if the file cannot be read or parsed
     */
    public List<HeritageSite> read(Path file) {
        try {
            List<HeritageSite> sites = mapper.readValue(Files.readString(file, StandardCharsets.UTF_8), SITE_LIST);
            return sites == null ? List.of() : sites;
        } catch (IOException | IllegalArgumentException e) {
            throw new SourceReadException(file, e);
        }
    }
}
