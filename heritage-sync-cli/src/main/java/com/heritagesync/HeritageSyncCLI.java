package com.heritagesync;

import com.heritagesync.cli.LookupCommand;
import com.heritagesync.cli.RunCommand;
import com.heritagesync.cli.StatsCommand;
import com.heritagesync.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for HeritageSync.
 *
 * <p>HeritageSync reconciles heritage-property records from per-locale UNESCO exports and an
 * external component list into one validated JSON dataset.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code run} - Run the full pipeline and publish the dataset</li>
 *   <li>{@code validate} - Validate a published dataset</li>
 *   <li>{@code stats} - Print statistics of a published dataset</li>
 *   <li>{@code lookup} - Resolve a visit key to its property</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Run the pipeline in the current directory
 * heritagesync run
 *
 * # Check everything without writing output
 * heritagesync -v run --dry-run
 *
 * # Which property does a component belong to?
 * heritagesync lookup data/sites.json Q29583927
 * }</pre>
 */
@Command(
    name = "heritagesync",
    mixinStandardHelpOptions = true,
    version = "HeritageSync 1.0.0-SNAPSHOT",
    description = "Reconciles multi-source heritage-site records into one canonical dataset",
    subcommands = {
        RunCommand.class,
        ValidateCommand.class,
        StatsCommand.class,
        LookupCommand.class
    }
)
public class HeritageSyncCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HeritageSyncCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("HeritageSync - Heritage Site Reconciliation Pipeline");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'heritagesync --help' to see available commands");
        System.out.println("Use 'heritagesync <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        HeritageSyncCLI cli = new HeritageSyncCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
