package com.heritagesync.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate figures about a dataset, for operator visibility only.
 *
 * @param totalSites number of properties
 * @param byCategory property count per category (every category present)
 * @param byRegion property count per region, largest first
 * @param transboundary number of transboundary properties
 * @param endangered number of properties listed in danger
 * @param sitesWithComponents number of properties with at least one component
 * @param totalComponents total number of components
 * @param minComponents smallest component count among properties with components
 * @param medianComponents median component count among properties with components
 * @param maxComponents largest component count among properties with components
 *
 * @since 1.0.0
 */
public record DatasetStatistics(
    int totalSites,
    Map<SiteCategory, Integer> byCategory,
    Map<String, Integer> byRegion,
    int transboundary,
    int endangered,
    int sitesWithComponents,
    int totalComponents,
    int minComponents,
    int medianComponents,
    int maxComponents
) {
    /**
     * Compact constructor keeping map ordering and making maps immutable.
     */
    public DatasetStatistics {
        Objects.requireNonNull(byCategory, "byCategory must not be null");
        Objects.requireNonNull(byRegion, "byRegion must not be null");
        byCategory = byCategory.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(byCategory));
        byRegion = Collections.unmodifiableMap(new LinkedHashMap<>(byRegion));
    }

    /**
     * Average number of components per property that has components.
     *
     * @return average, or 0 if no property has components
     */
    public double getAverageComponents() {
        if (sitesWithComponents == 0) {
            return 0.0;
        }
        return (double) totalComponents / sitesWithComponents;
    }

    /**
     * Share of properties with components.
     *
     * @return percentage (0-100)
     */
    public double getComponentCoveragePercentage() {
        if (totalSites == 0) {
            return 0.0;
        }
        return sitesWithComponents * 100.0 / totalSites;
    }
}
