package com.heritagesync.cli;

import com.heritagesync.core.model.DatasetStatistics;
import com.heritagesync.core.model.SiteCategory;

import java.util.Locale;
import java.util.Map;

/**
 * Prints dataset statistics to stdout.
 */
final class StatisticsPrinter {

    private StatisticsPrinter() {
        // Utility class
    }

    static void print(DatasetStatistics stats) {
        System.out.println();
        System.out.println("Statistics:");
        System.out.println("  Sites: " + stats.totalSites());
        for (Map.Entry<SiteCategory, Integer> entry : stats.byCategory().entrySet()) {
            System.out.println("    " + entry.getKey().label() + ": " + entry.getValue());
        }
        System.out.println("  Transboundary: " + stats.transboundary());
        System.out.println("  In danger: " + stats.endangered());
        System.out.println(String.format(Locale.ROOT, "  Sites with components: %d (%.1f%%)",
            stats.sitesWithComponents(), stats.getComponentCoveragePercentage()));
        System.out.println("  Total components: " + stats.totalComponents());
        if (stats.sitesWithComponents() > 0) {
            System.out.println(String.format(Locale.ROOT, "  Components per site: min %d, median %d, max %d, avg %.1f",
                stats.minComponents(), stats.medianComponents(), stats.maxComponents(),
                stats.getAverageComponents()));
        }
        if (!stats.byRegion().isEmpty()) {
            System.out.println("  By region:");
            stats.byRegion().forEach((region, count) -> System.out.println("    " + region + ": " + count));
        }
    }
}
