package com.heritagesync.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.heritagesync.core.config.ConfigLoader;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.model.ValidationReport;
import com.heritagesync.core.model.ValidationViolation;
import com.heritagesync.core.publish.DatasetSerializer;
import com.heritagesync.core.validate.DatasetValidator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate a published dataset.
 *
 * <p>Runs the same checks as the pipeline does before publishing. Exits with 1 if any fatal
 * violation is found.
 */
@Command(
    name = "validate",
    description = "Validate a published dataset",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Dataset file to validate", defaultValue = "data/sites.json")
    private Path datasetFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: heritagesync.yaml)"
    )
    private Path configPath = Paths.get("heritagesync.yaml");

    @Override
    public Integer call() {
        try {
            log.info("Validating dataset: {}", datasetFile);
            if (!Files.isRegularFile(datasetFile)) {
                System.err.println("✗ Dataset not found: " + datasetFile);
                return 1;
            }

            List<HeritageSite> sites = new DatasetSerializer().read(datasetFile);
            ValidationReport report = DatasetValidator.from(ConfigLoader.load(configPath)).validate(sites);

            System.out.println("✓ Checked " + report.sitesChecked() + " sites and "
                + report.componentsChecked() + " components");
            for (ValidationViolation warning : report.warnings()) {
                System.out.println("⚠ [" + warning.rule() + "] site " + warning.siteId() + ": " + warning.message());
            }

            if (report.hasFatal()) {
                System.err.println("✗ " + report.fatal().size() + " fatal violation(s):");
                for (ValidationViolation violation : report.fatal()) {
                    System.err.println("  - [" + violation.rule() + "] site " + violation.siteId()
                        + (violation.componentId() == null ? "" : " component " + violation.componentId())
                        + ": " + violation.message());
                }
                return 1;
            }

            System.out.println("✓ Dataset is valid");
            return 0;

        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
