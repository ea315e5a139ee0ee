package com.heritagesync.core.merge;

import com.heritagesync.core.model.Diagnostic;
import com.heritagesync.core.model.DiagnosticKind;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.model.SiteCategory;
import com.heritagesync.core.model.SiteTranslation;
import com.heritagesync.core.reader.RawSiteRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Merges per-locale source rows into canonical {@link HeritageSite} records.
 *
 * <p>Rows are joined on their {@code id_number}. The first locale that carries a usable row
 * for an id supplies the entity-level fields (coordinates, category, dates, ...); every
 * locale, including the first, then sets its own translation slot. A row whose coordinates
 * do not parse, whose id is blank or whose category is unknown is skipped with an
 * {@link DiagnosticKind#UNPARSABLE_RECORD} diagnostic. A later locale may still create the
 * entity if its row for the same id is usable.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Map<String, List<RawSiteRecord>> rows = loader.loadAll(List.of("en", "zh"));
 * BuildResult result = new CanonicalRecordBuilder().build(rows);
 * }</pre>
 */
public class CanonicalRecordBuilder {

    private static final Logger log = LoggerFactory.getLogger(CanonicalRecordBuilder.class);

    /**
     * Builds canonical sites.
     *
     * @param rowsByLocale rows per locale, iterated in map order
     * @return sites in first-seen order plus skip diagnostics
     */
    public BuildResult build(Map<String, List<RawSiteRecord>> rowsByLocale) {
        Map<String, HeritageSite> sites = new LinkedHashMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (Map.Entry<String, List<RawSiteRecord>> entry : rowsByLocale.entrySet()) {
            String locale = entry.getKey();
            int merged = 0;

            for (RawSiteRecord row : entry.getValue()) {
                String id = trim(row.idNumber());
                if (id.isEmpty()) {
                    diagnostics.add(skip("", locale, "blank id_number"));
                    continue;
                }

                HeritageSite site = sites.get(id);
                if (site == null) {
                    Optional<HeritageSite> created = create(id, row, locale, diagnostics);
                    if (created.isEmpty()) {
                        continue;
                    }
                    site = created.get();
                }

                sites.put(id, site.withTranslation(locale, toTranslation(row)));
                merged++;
            }

            log.info("Merged {} {} rows ({} sites so far)", merged, locale, sites.size());
        }

        if (!diagnostics.isEmpty()) {
            log.warn("Skipped {} unparsable source rows", diagnostics.size());
        }
        return new BuildResult(new ArrayList<>(sites.values()), diagnostics);
    }

    private Optional<HeritageSite> create(String id, RawSiteRecord row, String locale, List<Diagnostic> diagnostics) {
        OptionalDouble latitude = parseDouble(row.latitude());
        OptionalDouble longitude = parseDouble(row.longitude());
        if (latitude.isEmpty() || longitude.isEmpty()) {
            diagnostics.add(skip(id, locale, "invalid coordinates (" + row.latitude() + ", " + row.longitude() + ")"));
            return Optional.empty();
        }

        Optional<SiteCategory> category = SiteCategory.parse(row.category());
        if (category.isEmpty()) {
            diagnostics.add(skip(id, locale, "unknown category '" + row.category() + "'"));
            return Optional.empty();
        }

        DangerStatus danger = DangerStatus.parse(row.danger());
        return Optional.of(new HeritageSite(
            id,
            id,
            trim(row.uniqueNumber()),
            latitude.getAsDouble(),
            longitude.getAsDouble(),
            trim(row.region()),
            parseIsoCodes(row.isoCode()),
            category.get(),
            trim(row.criteriaText()),
            parseInt(row.dateInscribed()),
            trim(row.secondaryDates()),
            danger.endangered(),
            danger.period(),
            "1".equals(trim(row.transboundary())),
            parseInt(row.extension()),
            parseInt(row.revision()),
            trim(row.httpUrl()),
            trim(row.imageUrl()),
            Map.of(),
            false,
            0,
            List.of()
        ));
    }

    private SiteTranslation toTranslation(RawSiteRecord row) {
        return new SiteTranslation(
            trim(row.site()),
            TextCleaner.clean(row.shortDescription()),
            trim(row.states()),
            trim(row.location()),
            TextCleaner.clean(row.justification())
        );
    }

    private Diagnostic skip(String id, String locale, String reason) {
        String message = "Skipping " + locale + " row " + (id.isEmpty() ? "<no id>" : id) + ": " + reason;
        log.debug(message);
        return new Diagnostic(DiagnosticKind.UNPARSABLE_RECORD, id, message);
    }

    static List<String> parseIsoCodes(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(code -> !code.isEmpty())
            .map(String::toLowerCase)
            .toList();
    }

    static OptionalDouble parseDouble(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalDouble.empty();
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    static int parseInt(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
