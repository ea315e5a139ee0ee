package com.heritagesync.core.model;

import java.util.Objects;

/**
 * Informational finding about a single record.
 *
 * @param kind diagnostic kind
 * @param siteId id of the property concerned, or the raw reference when unresolved
 * @param message human-readable description
 */
public record Diagnostic(
    DiagnosticKind kind,
    String siteId,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        siteId = siteId == null ? "" : siteId;
    }
}
