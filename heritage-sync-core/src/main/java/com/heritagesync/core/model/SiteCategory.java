package com.heritagesync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Classification category of a heritage property.
 *
 * <p>The set is closed: source records carrying any other value are rejected by the
 * record builder.
 */
public enum SiteCategory {

    CULTURAL("Cultural"),
    NATURAL("Natural"),
    MIXED("Mixed");

    private final String label;

    SiteCategory(String label) {
        this.label = label;
    }

    /**
     * Returns the label used in source files and in the published dataset.
     *
     * @return category label, e.g. "Cultural"
     */
    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Parses a category label, ignoring case and surrounding whitespace.
     *
     * @param value raw label
     * @return matching category, or empty if the label is unknown
     */
    public static Optional<SiteCategory> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (SiteCategory category : values()) {
            if (category.label.equalsIgnoreCase(trimmed)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static SiteCategory fromLabel(String value) {
        return parse(value).orElseThrow(
            () -> new IllegalArgumentException("Unknown site category: " + value));
    }
}
