package com.heritagesync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Root configuration for a HeritageSync run.
 *
 * <p>Loaded from {@code heritagesync.yaml} in the project directory. Defines the locales to
 * merge, where source files live, where the dataset is published and the reconciliation
 * thresholds.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * locales: [en, zh]
 * primaryLocale: en
 *
 * input:
 *   directory: data/raw
 *   sitePattern: "whc-{locale}.xml"
 *   componentsFile: multi-sites-data.json
 *   parallelReads: true
 *
 * output:
 *   primary: data/sites.json
 *   secondary:
 *     - public/sites.json
 *
 * reconciliation:
 *   tolerance: 0.0001
 *   componentUriPrefix: "http://www.wikidata.org/entity/"
 * }</pre>
 *
 * <p>Any section left out of the file falls back to {@link #defaults()}; see
 * {@link #withDefaults()}. A primary locale outside {@code locales} is replaced by the first
 * configured locale.
 *
 * @param locales locales to merge, in merge order
 * @param primaryLocale locale whose component name is mandatory
 * @param input source file configuration
 * @param output publication targets
 * @param reconciliation reconciliation thresholds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineConfig(
    @JsonProperty("locales") List<String> locales,
    @JsonProperty("primaryLocale") String primaryLocale,
    @JsonProperty("input") InputConfig input,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("reconciliation") ReconciliationConfig reconciliation
) {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final double DEFAULT_TOLERANCE = 0.0001;
    public static final String DEFAULT_COMPONENT_URI_PREFIX = "http://www.wikidata.org/entity/";

    /**
     * Creates the default configuration: English and Chinese UNESCO exports under
     * {@code data/raw}, published to {@code data/sites.json} and {@code public/sites.json}.
     *
     * @return default configuration
     */
    public static PipelineConfig defaults() {
        return new PipelineConfig(
            List.of("en", "zh"),
            "en",
            new InputConfig("data/raw", "whc-{locale}.xml", "multi-sites-data.json", true),
            new OutputConfig("data/sites.json", List.of("public/sites.json")),
            new ReconciliationConfig(DEFAULT_TOLERANCE, DEFAULT_COMPONENT_URI_PREFIX)
        );
    }

    /**
     * Returns a copy where every missing section or value is taken from {@link #defaults()}.
     *
     * @return fully populated configuration
     */
    public PipelineConfig withDefaults() {
        PipelineConfig d = defaults();
        List<String> effectiveLocales = locales == null || locales.isEmpty() ? d.locales() : List.copyOf(locales);
        String effectivePrimary = primaryLocale == null || primaryLocale.isBlank()
            ? effectiveLocales.get(0)
            : primaryLocale;
        if (!effectiveLocales.contains(effectivePrimary)) {
            log.warn("Primary locale '{}' is not one of {}, using '{}'",
                effectivePrimary, effectiveLocales, effectiveLocales.get(0));
            effectivePrimary = effectiveLocales.get(0);
        }

        InputConfig in = input == null ? d.input() : new InputConfig(
            orDefault(input.directory(), d.input().directory()),
            orDefault(input.sitePattern(), d.input().sitePattern()),
            orDefault(input.componentsFile(), d.input().componentsFile()),
            input.parallelReads() == null ? d.input().parallelReads() : input.parallelReads()
        );
        OutputConfig out = output == null ? d.output() : new OutputConfig(
            orDefault(output.primary(), d.output().primary()),
            output.secondary() == null ? d.output().secondary() : List.copyOf(output.secondary())
        );
        ReconciliationConfig rec = reconciliation == null ? d.reconciliation() : new ReconciliationConfig(
            reconciliation.tolerance() == null || reconciliation.tolerance() <= 0
                ? d.reconciliation().tolerance()
                : reconciliation.tolerance(),
            orDefault(reconciliation.componentUriPrefix(), d.reconciliation().componentUriPrefix())
        );
        return new PipelineConfig(effectiveLocales, effectivePrimary, in, out, rec);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    /**
     * Source file configuration.
     *
     * @param directory directory holding the raw source files
     * @param sitePattern per-locale file name, {@code {locale}} is substituted
     * @param componentsFile component list file name
     * @param parallelReads whether per-locale files are read concurrently
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("sitePattern") String sitePattern,
        @JsonProperty("componentsFile") String componentsFile,
        @JsonProperty("parallelReads") Boolean parallelReads
    ) {
        /**
         * Resolves the file name for a locale.
         *
         * @param locale locale code
         * @return file name with the locale substituted
         */
        public String siteFileName(String locale) {
            return sitePattern.replace("{locale}", locale);
        }
    }

    /**
     * Publication targets.
     *
     * @param primary primary dataset location
     * @param secondary additional serving locations that must receive the same bytes
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("primary") String primary,
        @JsonProperty("secondary") List<String> secondary
    ) {}

    /**
     * Reconciliation thresholds.
     *
     * @param tolerance coordinate tolerance in degrees for the pseudo-component filter
     * @param componentUriPrefix prefix every component URI must carry
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReconciliationConfig(
        @JsonProperty("tolerance") Double tolerance,
        @JsonProperty("componentUriPrefix") String componentUriPrefix
    ) {}
}
