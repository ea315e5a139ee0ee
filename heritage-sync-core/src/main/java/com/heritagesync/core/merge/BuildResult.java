package com.heritagesync.core.merge;

import com.heritagesync.core.model.Diagnostic;
import com.heritagesync.core.model.HeritageSite;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link CanonicalRecordBuilder#build}.
 *
 * @param sites canonical sites in first-seen order
 * @param diagnostics records that were skipped, with the reason
 */
public record BuildResult(List<HeritageSite> sites, List<Diagnostic> diagnostics) {

    public BuildResult {
        Objects.requireNonNull(sites, "sites must not be null");
        sites = List.copyOf(sites);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Returns the number of skipped records.
     *
     * @return skipped record count
     */
    public int skippedCount() {
        return diagnostics.size();
    }
}
