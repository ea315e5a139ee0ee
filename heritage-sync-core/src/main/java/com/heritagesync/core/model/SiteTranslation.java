package com.heritagesync.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Locale-specific text of a heritage property.
 *
 * @param name property name
 * @param description short description, markup already stripped
 * @param states states parties text
 * @param location location text
 * @param justification inscription justification, markup already stripped
 */
public record SiteTranslation(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("states") String states,
    @JsonProperty("location") String location,
    @JsonProperty("justification") String justification
) {
    /**
     * Compact constructor normalizing absent text to empty strings.
     */
    public SiteTranslation {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        states = states == null ? "" : states;
        location = location == null ? "" : location;
        justification = justification == null ? "" : justification;
    }

    /**
     * Returns true if this translation carries a non-blank name.
     *
     * @return true if named
     */
    public boolean hasName() {
        return !name.isBlank();
    }
}
