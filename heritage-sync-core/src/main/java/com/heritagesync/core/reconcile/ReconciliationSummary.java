package com.heritagesync.core.reconcile;

/**
 * Aggregate counters of one reconciliation pass, reported in the run summary.
 *
 * @param sitesEnriched sites that received at least one component
 * @param componentsAttached total components attached
 * @param sitesEmptiedByFiltering sites whose whole group was filtered out
 * @param pseudoComponentsFiltered candidates dropped for sitting on the parent's point
 * @param invalidCoordinates candidates dropped for missing, zero or out-of-range coordinates
 * @param reservedIdsRejected candidates dropped for a reserved component id
 * @param malformedRejected candidates dropped for a foreign URI, a blank label or an id
 *     already taken by another component
 * @param duplicatesMerged records folded into an earlier record with the same URI
 * @param unmatchedGroups component groups whose base id matched no site
 */
public record ReconciliationSummary(
    int sitesEnriched,
    int componentsAttached,
    int sitesEmptiedByFiltering,
    int pseudoComponentsFiltered,
    int invalidCoordinates,
    int reservedIdsRejected,
    int malformedRejected,
    int duplicatesMerged,
    int unmatchedGroups
) {
    /**
     * Summary of a pass that was skipped because no component source was available.
     *
     * @return all-zero summary
     */
    public static ReconciliationSummary empty() {
        return new ReconciliationSummary(0, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
