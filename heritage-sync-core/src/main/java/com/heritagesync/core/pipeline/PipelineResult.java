package com.heritagesync.core.pipeline;

import com.heritagesync.core.model.DatasetStatistics;
import com.heritagesync.core.model.Diagnostic;
import com.heritagesync.core.model.DiagnosticKind;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.model.ValidationReport;
import com.heritagesync.core.publish.PublishReport;
import com.heritagesync.core.reconcile.ReconciliationSummary;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a successful pipeline run.
 *
 * @param sites final dataset in publication order
 * @param diagnostics every diagnostic of the build and reconciliation stages
 * @param reconciliation reconciliation counters, all zero when the stage was skipped
 * @param componentsReconciled whether a component source was available
 * @param validation validation report (without fatal violations)
 * @param statistics dataset statistics
 * @param publishReport written files, {@code null} on a dry run
 */
public record PipelineResult(
    List<HeritageSite> sites,
    List<Diagnostic> diagnostics,
    ReconciliationSummary reconciliation,
    boolean componentsReconciled,
    ValidationReport validation,
    DatasetStatistics statistics,
    PublishReport publishReport
) {
    public PipelineResult {
        Objects.requireNonNull(sites, "sites must not be null");
        Objects.requireNonNull(reconciliation, "reconciliation must not be null");
        Objects.requireNonNull(validation, "validation must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
        sites = List.copyOf(sites);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Returns the publish report.
     *
     * @return report, empty on a dry run
     */
    public Optional<PublishReport> published() {
        return Optional.ofNullable(publishReport);
    }

    /**
     * Counts diagnostics per kind.
     *
     * @return counts for every kind that occurred
     */
    public Map<DiagnosticKind, Integer> diagnosticCounts() {
        Map<DiagnosticKind, Integer> counts = new EnumMap<>(DiagnosticKind.class);
        for (Diagnostic diagnostic : diagnostics) {
            counts.merge(diagnostic.kind(), 1, Integer::sum);
        }
        return counts;
    }
}
