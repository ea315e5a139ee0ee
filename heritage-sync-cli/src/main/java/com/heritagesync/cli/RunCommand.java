package com.heritagesync.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.heritagesync.core.config.ConfigLoader;
import com.heritagesync.core.config.PipelineConfig;
import com.heritagesync.core.exception.MissingInputFileException;
import com.heritagesync.core.exception.ValidationFailedException;
import com.heritagesync.core.model.DiagnosticKind;
import com.heritagesync.core.model.ValidationViolation;
import com.heritagesync.core.pipeline.PipelineResult;
import com.heritagesync.core.pipeline.ReconciliationPipeline;
import com.heritagesync.core.pipeline.RunOptions;
import com.heritagesync.core.publish.PublishReport;
import com.heritagesync.core.reconcile.ReconciliationSummary;
import com.heritagesync.core.util.FileUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to run the reconciliation pipeline and publish the dataset.
 *
 * <p>Runs every stage:
 * <ol>
 *   <li>Read the per-locale source files</li>
 *   <li>Merge them into canonical sites</li>
 *   <li>Attach components from the component list, if present</li>
 *   <li>Validate the dataset</li>
 *   <li>Publish it to the primary and secondary locations</li>
 * </ol>
 *
 * <p>Exits with 1 on a missing source file, a fatal validation violation or a failed
 * publish; in every such case no output file is modified.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Run in current directory
 * heritagesync run
 *
 * # Run against another project directory
 * heritagesync run /path/to/project
 *
 * # Dry run (validate only, nothing written)
 * heritagesync run --dry-run
 * }</pre>
 */
@Command(
    name = "run",
    description = "Run the reconciliation pipeline and publish the dataset",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: heritagesync.yaml)"
    )
    private Path configPath = Paths.get("heritagesync.yaml");

    @Option(
        names = {"--dry-run"},
        description = "Run every stage but don't publish the dataset"
    )
    private boolean dryRun;

    @Option(
        names = {"-o", "--output"},
        description = "Primary output file (overrides config)"
    )
    private Path output;

    @Override
    public Integer call() {
        try {
            log.info("Starting run in: {}", projectPath.toAbsolutePath());
            System.out.println("Reconciling project: " + projectPath.toAbsolutePath());
            System.out.println();

            if (dryRun) {
                System.out.println("Running in dry-run mode (no output will be written)");
                System.out.println();
            }

            PipelineConfig config = loadConfiguration();
            System.out.println("✓ Locales: " + String.join(", ", config.locales()));

            PipelineResult result = new ReconciliationPipeline().run(new RunOptions(projectPath, config, dryRun));
            printSummary(result);

            if (dryRun) {
                System.out.println();
                System.out.println("Dry-run mode: Skipping publication");
                return 0;
            }

            PublishReport report = result.published().orElseThrow();
            for (PublishReport.PublishedFile file : report.files()) {
                System.out.println("✓ Wrote " + file.path() + " (" + FileUtils.formatSize(file.sizeBytes()) + ")");
            }

            System.out.println();
            System.out.println("✓ Run complete");
            return 0;

        } catch (MissingInputFileException e) {
            log.error("Run failed: missing input", e);
            System.err.println("✗ Missing input file(s):");
            e.getMissingFiles().forEach(file -> System.err.println("  - " + file));
            return 1;
        } catch (ValidationFailedException e) {
            log.error("Run failed: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage() + ", nothing was written:");
            for (ValidationViolation violation : e.getReport().fatal()) {
                System.err.println("  - [" + violation.rule() + "] site " + violation.siteId() + ": " + violation.message());
            }
            return 1;
        } catch (Exception e) {
            log.error("Run failed", e);
            System.err.println("✗ Run failed: " + e.getMessage());
            if (log.isDebugEnabled()) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    /**
     * Loads configuration and applies command-line overrides.
     */
    private PipelineConfig loadConfiguration() {
        Path absoluteConfigPath = configPath.isAbsolute()
            ? configPath
            : projectPath.resolve(configPath);

        log.debug("Loading configuration from: {}", absoluteConfigPath);
        PipelineConfig config = ConfigLoader.load(absoluteConfigPath);

        if (output == null) {
            return config;
        }
        log.debug("Primary output overridden: {}", output);
        return new PipelineConfig(
            config.locales(),
            config.primaryLocale(),
            config.input(),
            new PipelineConfig.OutputConfig(output.toAbsolutePath().toString(), config.output().secondary()),
            config.reconciliation()
        );
    }

    private void printSummary(PipelineResult result) {
        System.out.println("✓ Built " + result.sites().size() + " sites");

        Map<DiagnosticKind, Integer> counts = result.diagnosticCounts();
        int skipped = counts.getOrDefault(DiagnosticKind.UNPARSABLE_RECORD, 0);
        if (skipped > 0) {
            System.out.println("⚠ Skipped " + skipped + " unparsable record(s)");
        }

        if (!result.componentsReconciled()) {
            System.out.println("⚠ No component source found, dataset published without components");
        } else {
            ReconciliationSummary summary = result.reconciliation();
            System.out.println("✓ Enriched " + summary.sitesEnriched() + " sites with "
                + summary.componentsAttached() + " components");
            System.out.println("  → " + summary.duplicatesMerged() + " duplicate(s) merged, "
                + summary.pseudoComponentsFiltered() + " pseudo-component(s) filtered, "
                + summary.invalidCoordinates() + " invalid coordinate(s)");
            if (summary.malformedRejected() > 0) {
                System.out.println("⚠ " + summary.malformedRejected() + " malformed component(s) rejected");
            }
            if (summary.sitesEmptiedByFiltering() > 0) {
                System.out.println("⚠ " + summary.sitesEmptiedByFiltering() + " site(s) lost all components to filtering");
            }
            if (summary.unmatchedGroups() > 0) {
                System.out.println("⚠ " + summary.unmatchedGroups() + " component group(s) matched no site");
            }
        }

        int warnings = result.validation().warnings().size();
        System.out.println("✓ Validation passed" + (warnings > 0 ? " (" + warnings + " warning(s))" : ""));
        StatisticsPrinter.print(result.statistics());
    }
}
