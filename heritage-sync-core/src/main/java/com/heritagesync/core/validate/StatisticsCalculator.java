package com.heritagesync.core.validate;

import com.heritagesync.core.model.DatasetStatistics;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.model.SiteCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes descriptive statistics of a dataset for the run summary.
 *
 * <p>Component distribution figures (min, median, max) only consider sites that have
 * components. The median is the element at index {@code floor(n / 2)} of the sorted counts.
 */
public class StatisticsCalculator {

    private static final Logger log = LoggerFactory.getLogger(StatisticsCalculator.class);

    /**
     * Calculates statistics.
     *
     * @param sites dataset
     * @return statistics
     */
    public DatasetStatistics calculate(List<HeritageSite> sites) {
        Map<SiteCategory, Integer> byCategory = new EnumMap<>(SiteCategory.class);
        for (SiteCategory category : SiteCategory.values()) {
            byCategory.put(category, 0);
        }
        Map<String, Integer> regionCounts = new HashMap<>();
        int transboundary = 0;
        int endangered = 0;

        for (HeritageSite site : sites) {
            byCategory.merge(site.category(), 1, Integer::sum);
            String region = site.region() == null || site.region().isBlank() ? "Unknown" : site.region();
            regionCounts.merge(region, 1, Integer::sum);
            if (site.transboundary()) {
                transboundary++;
            }
            if (site.danger()) {
                endangered++;
            }
        }

        Map<String, Integer> byRegion = new LinkedHashMap<>();
        regionCounts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .forEach(e -> byRegion.put(e.getKey(), e.getValue()));

        List<Integer> counts = sites.stream()
            .filter(HeritageSite::hasComponents)
            .map(s -> s.components().size())
            .sorted()
            .toList();
        int total = counts.stream().mapToInt(Integer::intValue).sum();
        int min = counts.isEmpty() ? 0 : counts.get(0);
        int max = counts.isEmpty() ? 0 : counts.get(counts.size() - 1);
        int median = counts.isEmpty() ? 0 : counts.get(counts.size() / 2);

        DatasetStatistics statistics = new DatasetStatistics(sites.size(), byCategory, byRegion,
            transboundary, endangered, counts.size(), total, min, median, max);
        log.debug("Calculated statistics: {}", statistics);
        return statistics;
    }
}
