package com.heritagesync.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.heritagesync.core.model.DatasetStatistics;
import com.heritagesync.core.publish.DatasetSerializer;
import com.heritagesync.core.validate.StatisticsCalculator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to print statistics of a published dataset.
 */
@Command(
    name = "stats",
    description = "Print statistics of a published dataset",
    mixinStandardHelpOptions = true
)
public class StatsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StatsCommand.class);

    @Parameters(index = "0", description = "Dataset file", defaultValue = "data/sites.json")
    private Path datasetFile;

    @Override
    public Integer call() {
        try {
            if (!Files.isRegularFile(datasetFile)) {
                System.err.println("✗ Dataset not found: " + datasetFile);
                return 1;
            }

            DatasetStatistics stats = new StatisticsCalculator().calculate(new DatasetSerializer().read(datasetFile));
            StatisticsPrinter.print(stats);
            return 0;

        } catch (Exception e) {
            log.error("Failed to compute statistics", e);
            System.err.println("✗ Failed to compute statistics: " + e.getMessage());
            return 1;
        }
    }
}
