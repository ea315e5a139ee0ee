package com.heritagesync.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Geographically distinct component of a serial or transboundary property.
 *
 * @param componentId identifier extracted from the component URI (e.g. "Q29583927")
 * @param wikidataUri original URI identity of the component in its source
 * @param parentId id of the owning {@link HeritageSite}
 * @param latitude latitude in degrees
 * @param longitude longitude in degrees
 * @param name component name per locale
 * @param area optional area in square kilometres
 * @param designation optional protection designation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComponentSite(
    @JsonProperty("componentId") String componentId,
    @JsonProperty("wikidataUri") String wikidataUri,
    @JsonProperty("parentId") String parentId,
    @JsonProperty("latitude") double latitude,
    @JsonProperty("longitude") double longitude,
    @JsonProperty("name") Map<String, String> name,
    @JsonProperty("area") Double area,
    @JsonProperty("designation") String designation
) {
    /**
     * Compact constructor with validation.
     */
    public ComponentSite {
        Objects.requireNonNull(componentId, "componentId must not be null");
        Objects.requireNonNull(wikidataUri, "wikidataUri must not be null");
        Objects.requireNonNull(parentId, "parentId must not be null");
        name = name == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(name));
    }

    /**
     * Returns the name for a locale.
     *
     * @param locale locale code
     * @return name, or empty string if absent
     */
    public String nameIn(String locale) {
        return name.getOrDefault(locale, "");
    }
}
