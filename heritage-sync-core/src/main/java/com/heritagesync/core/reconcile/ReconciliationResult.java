package com.heritagesync.core.reconcile;

import com.heritagesync.core.model.Diagnostic;
import com.heritagesync.core.model.HeritageSite;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link ComponentReconciler#reconcile}.
 *
 * @param sites every input site, in input order, with components finalized
 * @param diagnostics per-record diagnostics
 * @param summary aggregate counters
 */
public record ReconciliationResult(
    List<HeritageSite> sites,
    List<Diagnostic> diagnostics,
    ReconciliationSummary summary
) {
    public ReconciliationResult {
        Objects.requireNonNull(sites, "sites must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        sites = List.copyOf(sites);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
