package com.heritagesync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Canonical record of one heritage property, merged from every per-locale source.
 *
 * <p>This is the unit of the published dataset. It is created by the record builder from the
 * first source record seen for an {@code idNumber}, receives one {@link SiteTranslation} per
 * locale, and finally gets its {@link ComponentSite}s attached by the component reconciler.
 *
 * <p>{@code hasComponents} and {@code componentCount} are derived from {@code components}
 * when the list is attached through {@link #withComponents(List)}. They are kept as stored
 * fields so that a dataset read back from disk can be checked for consistency.
 *
 * @param id stable identifier, equal to {@code idNumber}
 * @param idNumber cross-source join key
 * @param uniqueNumber source-assigned unique number
 * @param latitude representative latitude in degrees
 * @param longitude representative longitude in degrees
 * @param region geographic region
 * @param isoCodes lower-case ISO country codes
 * @param category classification category
 * @param criteriaText inscription criteria
 * @param dateInscribed year of inscription, 0 if unknown
 * @param secondaryDates extension or revision dates
 * @param danger whether the property is listed as endangered
 * @param dangerPeriod free-text danger period, empty if not endangered
 * @param transboundary whether the property spans several states
 * @param extension extension counter
 * @param revision revision counter
 * @param httpUrl public page URL
 * @param imageUrl image URL
 * @param translations translation slot per locale
 * @param hasComponents whether any component is attached
 * @param componentCount number of attached components
 * @param components attached components
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HeritageSite(
    @JsonProperty("id") String id,
    @JsonProperty("idNumber") String idNumber,
    @JsonProperty("uniqueNumber") String uniqueNumber,
    @JsonProperty("latitude") double latitude,
    @JsonProperty("longitude") double longitude,
    @JsonProperty("region") String region,
    @JsonProperty("isoCodes") List<String> isoCodes,
    @JsonProperty("category") SiteCategory category,
    @JsonProperty("criteriaText") String criteriaText,
    @JsonProperty("dateInscribed") int dateInscribed,
    @JsonProperty("secondaryDates") String secondaryDates,
    @JsonProperty("danger") boolean danger,
    @JsonProperty("dangerPeriod") String dangerPeriod,
    @JsonProperty("transboundary") boolean transboundary,
    @JsonProperty("extension") int extension,
    @JsonProperty("revision") int revision,
    @JsonProperty("httpUrl") String httpUrl,
    @JsonProperty("imageUrl") String imageUrl,
    @JsonProperty("translations") Map<String, SiteTranslation> translations,
    @JsonProperty("hasComponents") boolean hasComponents,
    @JsonProperty("componentCount") int componentCount,
    @JsonProperty("components") List<ComponentSite> components
) {
    /**
     * Compact constructor normalizing collections.
     */
    public HeritageSite {
        Objects.requireNonNull(category, "category must not be null");
        isoCodes = isoCodes == null ? List.of() : List.copyOf(isoCodes);
        translations = translations == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(translations));
        components = components == null ? List.of() : List.copyOf(components);
    }

    /**
     * Returns a copy with the translation slot for {@code locale} set or overwritten.
     *
     * @param locale locale code
     * @param translation translation to store
     * @return updated copy
     */
    public HeritageSite withTranslation(String locale, SiteTranslation translation) {
        Map<String, SiteTranslation> updated = new TreeMap<>(translations);
        updated.put(locale, translation);
        return new HeritageSite(id, idNumber, uniqueNumber, latitude, longitude, region, isoCodes,
            category, criteriaText, dateInscribed, secondaryDates, danger, dangerPeriod,
            transboundary, extension, revision, httpUrl, imageUrl, updated,
            hasComponents, componentCount, components);
    }

    /**
     * Returns a copy with {@code components} attached and the derived flags recomputed.
     *
     * @param attached components to attach (may be empty)
     * @return updated copy
     */
    public HeritageSite withComponents(List<ComponentSite> attached) {
        List<ComponentSite> list = attached == null ? List.of() : attached;
        return new HeritageSite(id, idNumber, uniqueNumber, latitude, longitude, region, isoCodes,
            category, criteriaText, dateInscribed, secondaryDates, danger, dangerPeriod,
            transboundary, extension, revision, httpUrl, imageUrl, translations,
            !list.isEmpty(), list.size(), list);
    }

    /**
     * Returns true if at least one locale carries a non-blank name.
     *
     * @return true if the site is named in any locale
     */
    @JsonIgnore
    public boolean hasAnyName() {
        return translations.values().stream().anyMatch(t -> t != null && t.hasName());
    }

    /**
     * Returns the first non-blank name, preferring {@code locale}.
     *
     * @param locale preferred locale
     * @return display name, or the id if the site has no name
     */
    public String displayName(String locale) {
        SiteTranslation preferred = translations.get(locale);
        if (preferred != null && preferred.hasName()) {
            return preferred.name();
        }
        return translations.values().stream()
            .filter(t -> t != null && t.hasName())
            .map(SiteTranslation::name)
            .findFirst()
            .orElse(id);
    }
}
