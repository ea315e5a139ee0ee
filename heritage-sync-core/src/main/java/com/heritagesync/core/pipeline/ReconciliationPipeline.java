package com.heritagesync.core.pipeline;

import com.heritagesync.core.config.PipelineConfig;
import com.heritagesync.core.exception.ValidationFailedException;
import com.heritagesync.core.merge.BuildResult;
import com.heritagesync.core.merge.CanonicalRecordBuilder;
import com.heritagesync.core.model.DatasetStatistics;
import com.heritagesync.core.model.Diagnostic;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.model.ValidationReport;
import com.heritagesync.core.publish.DatasetPublisher;
import com.heritagesync.core.publish.PublishReport;
import com.heritagesync.core.publish.PublishRequest;
import com.heritagesync.core.publish.impl.FileSystemPublisher;
import com.heritagesync.core.reader.ComponentSourceReader;
import com.heritagesync.core.reader.LocaleSourceLoader;
import com.heritagesync.core.reader.RawComponentRecord;
import com.heritagesync.core.reader.RawSiteRecord;
import com.heritagesync.core.reader.SiteSourceReader;
import com.heritagesync.core.reconcile.ComponentReconciler;
import com.heritagesync.core.reconcile.ReconciliationResult;
import com.heritagesync.core.reconcile.ReconciliationSummary;
import com.heritagesync.core.reconcile.SiteIds;
import com.heritagesync.core.util.FileUtils;
import com.heritagesync.core.validate.DatasetValidator;
import com.heritagesync.core.validate.StatisticsCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one reconciliation run from raw sources to the published dataset.
 *
 * <p><b>Stages:</b>
 * <ol>
 *   <li>Read every per-locale source file ({@link LocaleSourceLoader})</li>
 *   <li>Merge rows into canonical sites ({@link CanonicalRecordBuilder})</li>
 *   <li>Attach components ({@link ComponentReconciler}); skipped when the component source
 *       is absent, in which case every site is published without components</li>
 *   <li>Validate the whole dataset ({@link DatasetValidator})</li>
 *   <li>Compute statistics ({@link StatisticsCalculator})</li>
 *   <li>Publish to every output location ({@link DatasetPublisher}), unless dry run</li>
 * </ol>
 *
 * <p>A missing locale file or a fatal validation violation ends the run with an exception
 * before anything is written. The pipeline keeps no state between runs: the same inputs
 * always produce the same output bytes.
 */
public class ReconciliationPipeline {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationPipeline.class);

    private final SiteSourceReader siteReader;
    private final ComponentSourceReader componentReader;
    private final DatasetPublisher publisher;

    public ReconciliationPipeline() {
        this(new SiteSourceReader(), new ComponentSourceReader(), new FileSystemPublisher());
    }

    public ReconciliationPipeline(SiteSourceReader siteReader,
                                  ComponentSourceReader componentReader,
                                  DatasetPublisher publisher) {
        this.siteReader = siteReader;
        this.componentReader = componentReader;
        this.publisher = publisher;
    }

    /**
     * Runs the pipeline.
     *
     * @param options run options
     * @return run outcome
     * @throws com.heritagesync.core.exception.MissingInputFileException if a locale source is missing
     * @throws com.heritagesync.core.exception.SourceReadException if a source cannot be parsed
     * @throws ValidationFailedException if the dataset has fatal violations; nothing is written
     * @throws com.heritagesync.core.exception.PublishException if publication fails; no target is modified
     */
    public PipelineResult run(RunOptions options) {
        PipelineConfig config = options.config();
        Path projectDir = options.projectDir();
        Path inputDir = FileUtils.resolve(projectDir, config.input().directory());
        log.info("Starting reconciliation run in {} (locales: {})", projectDir, config.locales());

        // 1. Read
        LocaleSourceLoader loader = new LocaleSourceLoader(
            siteReader,
            locale -> inputDir.resolve(config.input().siteFileName(locale)),
            config.input().parallelReads()
        );
        Map<String, List<RawSiteRecord>> rows = loader.loadAll(config.locales());

        // 2. Merge
        BuildResult built = new CanonicalRecordBuilder().build(rows);
        List<Diagnostic> diagnostics = new ArrayList<>(built.diagnostics());
        log.info("Built {} canonical sites ({} rows skipped)", built.sites().size(), built.skippedCount());

        // 3. Reconcile
        Optional<List<RawComponentRecord>> components =
            componentReader.read(inputDir.resolve(config.input().componentsFile()));
        List<HeritageSite> sites;
        ReconciliationSummary summary;
        if (components.isPresent()) {
            ReconciliationResult reconciled = new ComponentReconciler(
                config.locales(),
                config.reconciliation().tolerance(),
                config.reconciliation().componentUriPrefix()
            ).reconcile(built.sites(), components.get());
            sites = reconciled.sites();
            summary = reconciled.summary();
            diagnostics.addAll(reconciled.diagnostics());
        } else {
            sites = built.sites().stream().map(site -> site.withComponents(List.of())).toList();
            summary = ReconciliationSummary.empty();
        }
        sites = sites.stream()
            .sorted(Comparator.comparing(HeritageSite::idNumber, SiteIds::compareNumeric))
            .toList();

        // 4. Validate
        ValidationReport report = DatasetValidator.from(config).validate(sites);
        if (report.hasFatal()) {
            throw new ValidationFailedException(report);
        }

        // 5. Statistics
        DatasetStatistics statistics = new StatisticsCalculator().calculate(sites);
        log.info("Dataset: {} sites, {} with components, {} components in total",
            statistics.totalSites(), statistics.sitesWithComponents(), statistics.totalComponents());

        // 6. Publish
        PublishReport published = null;
        if (options.dryRun()) {
            log.info("Dry run: skipping publication");
        } else {
            PublishRequest request = new PublishRequest(
                sites,
                FileUtils.resolve(projectDir, config.output().primary()),
                config.output().secondary().stream().map(location -> FileUtils.resolve(projectDir, location)).toList()
            );
            published = publisher.publish(request);
        }

        return new PipelineResult(sites, diagnostics, summary, components.isPresent(), report, statistics, published);
    }
}
