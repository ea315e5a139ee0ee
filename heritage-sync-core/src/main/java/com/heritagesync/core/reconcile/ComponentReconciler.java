package com.heritagesync.core.reconcile;

import com.heritagesync.core.config.PipelineConfig;
import com.heritagesync.core.model.ComponentSite;
import com.heritagesync.core.model.Diagnostic;
import com.heritagesync.core.model.DiagnosticKind;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.model.VisitScope;
import com.heritagesync.core.reader.RawComponentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Attaches external component records to canonical sites.
 *
 * <p>A pass runs in four steps:
 * <ol>
 *   <li><b>Deduplicate</b> by component URI. The first record wins unless a later duplicate
 *       carries coordinates and the retained one does not.</li>
 *   <li><b>Group</b> by base property id ({@link SiteIds#extractBaseId}).</li>
 *   <li><b>Filter</b> each site's group: invalid coordinates, pseudo-components sitting on the
 *       parent's own point, URIs outside the configured prefix, ids that collide with the
 *       reserved visit-key prefix or with an already attached component, and blank labels
 *       are dropped.</li>
 *   <li><b>Finalize</b> every site through {@link HeritageSite#withComponents}.</li>
 * </ol>
 *
 * <p>Every dropped record produces a {@link Diagnostic}. Nothing here aborts the run, and
 * nothing attached here can fail a component rule of the validator.
 */
public class ComponentReconciler {

    private static final Logger log = LoggerFactory.getLogger(ComponentReconciler.class);

    private final List<String> locales;
    private final double tolerance;
    private final String uriPrefix;

    /**
     * Creates a reconciler accepting Wikidata entity URIs.
     *
     * @param locales locales the component name is published in
     * @param tolerance pseudo-component tolerance in degrees
     */
    public ComponentReconciler(List<String> locales, double tolerance) {
        this(locales, tolerance, PipelineConfig.DEFAULT_COMPONENT_URI_PREFIX);
    }

    /**
     * Creates a reconciler.
     *
     * @param locales locales the component name is published in
     * @param tolerance pseudo-component tolerance in degrees
     * @param uriPrefix prefix every component URI must carry
     */
    public ComponentReconciler(List<String> locales, double tolerance, String uriPrefix) {
        this.locales = List.copyOf(Objects.requireNonNull(locales, "locales must not be null"));
        if (tolerance <= 0) {
            throw new IllegalArgumentException("tolerance must be positive: " + tolerance);
        }
        this.tolerance = tolerance;
        this.uriPrefix = Objects.requireNonNull(uriPrefix, "uriPrefix must not be null");
    }

    /**
     * Reconciles components into sites.
     *
     * @param sites canonical sites
     * @param records raw component records in file order
     * @return sites with components finalized, diagnostics and counters
     */
    public ReconciliationResult reconcile(List<HeritageSite> sites, List<RawComponentRecord> records) {
        Counters counters = new Counters();
        List<Diagnostic> diagnostics = new ArrayList<>();

        Map<String, RawComponentRecord> unique = deduplicate(records, diagnostics, counters);
        log.info("Deduplicated {} component records to {} unique components", records.size(), unique.size());

        Map<String, List<RawComponentRecord>> groups = new LinkedHashMap<>();
        for (RawComponentRecord record : unique.values()) {
            groups.computeIfAbsent(SiteIds.extractBaseId(record.whsId()), k -> new ArrayList<>()).add(record);
        }
        log.info("Grouped components into {} properties", groups.size());

        List<HeritageSite> result = new ArrayList<>(sites.size());
        Set<String> matchedGroups = new LinkedHashSet<>();
        Set<String> attachedIds = new HashSet<>();
        for (HeritageSite site : sites) {
            List<RawComponentRecord> group = groups.get(site.idNumber());
            if (group == null || group.isEmpty()) {
                result.add(site.withComponents(List.of()));
                continue;
            }
            matchedGroups.add(site.idNumber());

            List<ComponentSite> attached = attach(site, group, attachedIds, diagnostics, counters);
            if (attached.isEmpty()) {
                counters.sitesEmptied++;
                String message = "Site " + site.id() + ": all " + group.size() + " components were filtered out";
                log.warn(message);
                diagnostics.add(new Diagnostic(DiagnosticKind.EMPTY_AFTER_FILTERING, site.id(), message));
            } else {
                counters.sitesEnriched++;
                counters.componentsAttached += attached.size();
            }
            result.add(site.withComponents(attached));
        }

        for (Map.Entry<String, List<RawComponentRecord>> group : groups.entrySet()) {
            if (!matchedGroups.contains(group.getKey())) {
                counters.unmatchedGroups++;
                String message = "No site matches component group " + group.getKey()
                    + " (" + group.getValue().size() + " components)";
                log.debug(message);
                diagnostics.add(new Diagnostic(DiagnosticKind.UNMATCHED_COMPONENT_GROUP, group.getKey(), message));
            }
        }

        ReconciliationSummary summary = counters.toSummary();
        log.info("Enriched {} sites with {} components ({} emptied by filtering, {} pseudo-components filtered)",
            summary.sitesEnriched(), summary.componentsAttached(),
            summary.sitesEmptiedByFiltering(), summary.pseudoComponentsFiltered());
        return new ReconciliationResult(result, diagnostics, summary);
    }

    private Map<String, RawComponentRecord> deduplicate(List<RawComponentRecord> records,
                                                        List<Diagnostic> diagnostics,
                                                        Counters counters) {
        Map<String, RawComponentRecord> unique = new LinkedHashMap<>();
        for (RawComponentRecord record : records) {
            String uri = record.componentUri() == null ? "" : record.componentUri().trim();
            if (uri.isEmpty()) {
                String message = "Skipping component record without URI for " + record.whsId();
                log.debug(message);
                diagnostics.add(new Diagnostic(DiagnosticKind.UNPARSABLE_RECORD,
                    SiteIds.extractBaseId(record.whsId()), message));
                continue;
            }

            RawComponentRecord existing = unique.get(uri);
            if (existing == null) {
                unique.put(uri, record);
                continue;
            }

            counters.duplicatesMerged++;
            boolean replace = hasCoordinates(record) && !hasCoordinates(existing);
            if (replace) {
                // Map.put on an existing key keeps the first-seen position
                unique.put(uri, record);
            }
            String message = "Duplicate component " + uri + " (" + existing.whsId() + ", " + record.whsId()
                + "), kept " + (replace ? "later record with coordinates" : "first record");
            log.debug(message);
            diagnostics.add(new Diagnostic(DiagnosticKind.DUPLICATE_COMPONENT_URI,
                SiteIds.extractBaseId(existing.whsId()), message));
        }
        return unique;
    }

    private List<ComponentSite> attach(HeritageSite site, List<RawComponentRecord> group, Set<String> attachedIds,
                                       List<Diagnostic> diagnostics, Counters counters) {
        List<ComponentSite> attached = new ArrayList<>();
        for (RawComponentRecord record : group) {
            Double lat = parseCoordinate(record.lat());
            Double lon = parseCoordinate(record.lon());
            String label = record.label() == null ? "" : record.label().trim();

            if (lat == null || lon == null || lat == 0 || lon == 0) {
                counters.invalidCoordinates++;
                diagnostics.add(new Diagnostic(DiagnosticKind.INVALID_COMPONENT_COORDINATES, site.id(),
                    "Component " + label + " has no usable coordinates (" + record.lat() + ", " + record.lon() + ")"));
                continue;
            }
            if (lat < -90 || lat > 90 || lon < -180 || lon > 180) {
                counters.invalidCoordinates++;
                diagnostics.add(new Diagnostic(DiagnosticKind.INVALID_COMPONENT_COORDINATES, site.id(),
                    "Component " + label + " has out-of-range coordinates (" + lat + ", " + lon + ")"));
                continue;
            }
            if (isPseudoComponent(site, lat, lon)) {
                counters.pseudoFiltered++;
                String message = "Filtering pseudo-component for site " + site.idNumber() + ": " + label
                    + " (same coordinates as property)";
                log.info(message);
                diagnostics.add(new Diagnostic(DiagnosticKind.PSEUDO_COMPONENT_FILTERED, site.id(), message));
                continue;
            }

            String uri = record.componentUri().trim();
            if (!uri.startsWith(uriPrefix)) {
                counters.malformed++;
                String message = "Component " + uri + " does not start with " + uriPrefix;
                log.warn(message);
                diagnostics.add(new Diagnostic(DiagnosticKind.INVALID_COMPONENT_URI, site.id(), message));
                continue;
            }
            String componentId = SiteIds.componentIdOf(uri);
            if (VisitScope.isReserved(componentId)) {
                counters.reservedIds++;
                String message = "Component " + uri + " derives reserved id " + componentId;
                log.warn(message);
                diagnostics.add(new Diagnostic(DiagnosticKind.RESERVED_COMPONENT_ID, site.id(), message));
                continue;
            }
            if (attachedIds.contains(componentId)) {
                counters.malformed++;
                String message = "Component " + uri + " derives id " + componentId + " already taken by another component";
                log.warn(message);
                diagnostics.add(new Diagnostic(DiagnosticKind.DUPLICATE_COMPONENT_ID, site.id(), message));
                continue;
            }
            if (label.isEmpty()) {
                counters.malformed++;
                String message = "Component " + uri + " has no label";
                log.warn(message);
                diagnostics.add(new Diagnostic(DiagnosticKind.MISSING_COMPONENT_NAME, site.id(), message));
                continue;
            }
            attachedIds.add(componentId);

            Map<String, String> names = new LinkedHashMap<>();
            for (String locale : locales) {
                names.put(locale, label);
            }
            attached.add(new ComponentSite(componentId, uri, site.id(), lat, lon, names,
                record.area(), blankToNull(record.designation())));
        }
        return attached;
    }

    /**
     * Tests whether a point coincides with the site's own point on both axes.
     *
     * @param site parent site
     * @param latitude candidate latitude
     * @param longitude candidate longitude
     * @param tolerance tolerance in degrees
     * @return true when both deltas are below the tolerance
     */
    public static boolean coincides(HeritageSite site, double latitude, double longitude, double tolerance) {
        return Math.abs(latitude - site.latitude()) < tolerance
            && Math.abs(longitude - site.longitude()) < tolerance;
    }

    private boolean isPseudoComponent(HeritageSite site, double latitude, double longitude) {
        return coincides(site, latitude, longitude, tolerance);
    }

    private static boolean hasCoordinates(RawComponentRecord record) {
        return parseCoordinate(record.lat()) != null && parseCoordinate(record.lon()) != null;
    }

    private static Double parseCoordinate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static final class Counters {
        int sitesEnriched;
        int componentsAttached;
        int sitesEmptied;
        int pseudoFiltered;
        int invalidCoordinates;
        int reservedIds;
        int malformed;
        int duplicatesMerged;
        int unmatchedGroups;

        ReconciliationSummary toSummary() {
            return new ReconciliationSummary(sitesEnriched, componentsAttached, sitesEmptied,
                pseudoFiltered, invalidCoordinates, reservedIds, malformed, duplicatesMerged, unmatchedGroups);
        }
    }
}
