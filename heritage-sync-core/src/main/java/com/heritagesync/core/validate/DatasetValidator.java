package com.heritagesync.core.validate;

import com.heritagesync.core.config.PipelineConfig;
import com.heritagesync.core.index.ComponentIndex;
import com.heritagesync.core.model.ComponentSite;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.model.SiteTranslation;
import com.heritagesync.core.model.ValidationReport;
import com.heritagesync.core.model.ValidationViolation;
import com.heritagesync.core.model.VisitScope;
import com.heritagesync.core.reconcile.ComponentReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the integrity of a complete dataset before it is published.
 *
 * <p>The validator always scans every site and component and collects every violation; it
 * never stops at the first problem and never throws. The caller decides what to do with
 * the report: any {@link com.heritagesync.core.model.ViolationSeverity#FATAL FATAL} entry
 * blocks publication.
 *
 * <p><b>Rules:</b>
 * <table>
 *   <caption>Validation rules</caption>
 *   <tr><th>Rule</th><th>Severity</th></tr>
 *   <tr><td>{@value #MISSING_ID}</td><td>fatal</td></tr>
 *   <tr><td>{@value #LATITUDE_RANGE}, {@value #LONGITUDE_RANGE}</td><td>fatal</td></tr>
 *   <tr><td>{@value #NO_TRANSLATION_NAME}</td><td>fatal</td></tr>
 *   <tr><td>{@value #COMPONENT_COUNT_MISMATCH}</td><td>fatal</td></tr>
 *   <tr><td>{@value #COMPONENT_LATITUDE_RANGE}, {@value #COMPONENT_LONGITUDE_RANGE}</td><td>fatal</td></tr>
 *   <tr><td>{@value #COMPONENT_URI_FORMAT}</td><td>fatal</td></tr>
 *   <tr><td>{@value #COMPONENT_NAME_MISSING}</td><td>fatal</td></tr>
 *   <tr><td>{@value #DUPLICATE_COMPONENT_URI}, {@value #DUPLICATE_COMPONENT_ID}</td><td>fatal</td></tr>
 *   <tr><td>{@value #RESERVED_COMPONENT_ID}</td><td>fatal</td></tr>
 *   <tr><td>{@value #PSEUDO_COMPONENT}</td><td>fatal</td></tr>
 *   <tr><td>{@value #MISSING_TRANSLATION}</td><td>warning</td></tr>
 * </table>
 */
public class DatasetValidator {

    public static final String MISSING_ID = "missing-id";
    public static final String LATITUDE_RANGE = "latitude-range";
    public static final String LONGITUDE_RANGE = "longitude-range";
    public static final String NO_TRANSLATION_NAME = "no-translation-name";
    public static final String COMPONENT_COUNT_MISMATCH = "component-count-mismatch";
    public static final String COMPONENT_LATITUDE_RANGE = "component-latitude-range";
    public static final String COMPONENT_LONGITUDE_RANGE = "component-longitude-range";
    public static final String COMPONENT_URI_FORMAT = "component-uri-format";
    public static final String COMPONENT_NAME_MISSING = "component-name-missing";
    public static final String DUPLICATE_COMPONENT_URI = "duplicate-component-uri";
    public static final String DUPLICATE_COMPONENT_ID = "duplicate-component-id";
    public static final String RESERVED_COMPONENT_ID = "reserved-component-id";
    public static final String PSEUDO_COMPONENT = "pseudo-component";
    public static final String MISSING_TRANSLATION = "missing-translation";

    private static final Logger log = LoggerFactory.getLogger(DatasetValidator.class);

    private final List<String> locales;
    private final String primaryLocale;
    private final double tolerance;
    private final String componentUriPrefix;

    /**
     * Creates a validator.
     *
     * @param locales locales every site is expected to be translated into
     * @param primaryLocale locale in which every component must be named
     * @param tolerance pseudo-component tolerance in degrees
     * @param componentUriPrefix prefix every component URI must carry
     */
    public DatasetValidator(List<String> locales, String primaryLocale, double tolerance, String componentUriPrefix) {
        this.locales = List.copyOf(locales);
        this.primaryLocale = primaryLocale;
        this.tolerance = tolerance;
        this.componentUriPrefix = componentUriPrefix;
    }

    /**
     * Creates a validator from a (defaults-applied) configuration.
     *
     * @param config pipeline configuration
     * @return validator
     */
    public static DatasetValidator from(PipelineConfig config) {
        return new DatasetValidator(
            config.locales(),
            config.primaryLocale(),
            config.reconciliation().tolerance(),
            config.reconciliation().componentUriPrefix()
        );
    }

    /**
     * Validates a dataset.
     *
     * @param sites dataset to check
     * @return report holding every violation found
     */
    public ValidationReport validate(List<HeritageSite> sites) {
        List<ValidationViolation> violations = new ArrayList<>();
        Map<String, String> uriOwners = new HashMap<>();
        int componentsChecked = 0;

        for (HeritageSite site : sites) {
            checkSite(site, violations);
            for (ComponentSite component : site.components()) {
                componentsChecked++;
                checkComponent(site, component, violations);

                String previousOwner = uriOwners.putIfAbsent(component.wikidataUri(), site.id());
                if (previousOwner != null) {
                    violations.add(ValidationViolation.fatal(site.id(), component.componentId(), DUPLICATE_COMPONENT_URI,
                        "Component URI " + component.wikidataUri() + " already published under site " + previousOwner));
                }
            }
        }

        for (String componentId : new ComponentIndex(sites).duplicateComponentIds()) {
            violations.add(ValidationViolation.fatal("", componentId, DUPLICATE_COMPONENT_ID,
                "Component id " + componentId + " is used more than once"));
        }

        ValidationReport report = new ValidationReport(sites.size(), componentsChecked, violations);
        log.info("Validated {} sites and {} components: {} fatal, {} warnings",
            report.sitesChecked(), report.componentsChecked(), report.fatal().size(), report.warnings().size());
        for (ValidationViolation violation : report.violations()) {
            if (violation.isFatal()) {
                log.error("[{}] site {}: {}", violation.rule(), violation.siteId(), violation.message());
            } else {
                log.debug("[{}] site {}: {}", violation.rule(), violation.siteId(), violation.message());
            }
        }
        return report;
    }

    private void checkSite(HeritageSite site, List<ValidationViolation> violations) {
        String id = site.id() == null ? "" : site.id();
        if (id.isBlank() || site.idNumber() == null || site.idNumber().isBlank()) {
            violations.add(ValidationViolation.fatal(id, null, MISSING_ID, "Site has no id"));
        }
        if (!inRange(site.latitude(), 90)) {
            violations.add(ValidationViolation.fatal(id, null, LATITUDE_RANGE,
                "Latitude " + site.latitude() + " is outside [-90, 90]"));
        }
        if (!inRange(site.longitude(), 180)) {
            violations.add(ValidationViolation.fatal(id, null, LONGITUDE_RANGE,
                "Longitude " + site.longitude() + " is outside [-180, 180]"));
        }
        if (!site.hasAnyName()) {
            violations.add(ValidationViolation.fatal(id, null, NO_TRANSLATION_NAME,
                "Site has no translation with a name"));
        }
        for (String locale : locales) {
            SiteTranslation translation = site.translations().get(locale);
            if (translation == null || !translation.hasName()) {
                violations.add(ValidationViolation.warning(id, MISSING_TRANSLATION,
                    "No " + locale + " name"));
            }
        }

        int actual = site.components().size();
        if (site.componentCount() != actual || site.hasComponents() == (actual == 0)) {
            violations.add(ValidationViolation.fatal(id, null, COMPONENT_COUNT_MISMATCH,
                "hasComponents=" + site.hasComponents() + ", componentCount=" + site.componentCount()
                    + " but " + actual + " components present"));
        }
    }

    private void checkComponent(HeritageSite site, ComponentSite component, List<ValidationViolation> violations) {
        String id = site.id();
        String componentId = component.componentId();

        if (!inRange(component.latitude(), 90)) {
            violations.add(ValidationViolation.fatal(id, componentId, COMPONENT_LATITUDE_RANGE,
                "Component latitude " + component.latitude() + " is outside [-90, 90]"));
        }
        if (!inRange(component.longitude(), 180)) {
            violations.add(ValidationViolation.fatal(id, componentId, COMPONENT_LONGITUDE_RANGE,
                "Component longitude " + component.longitude() + " is outside [-180, 180]"));
        }
        if (!component.wikidataUri().startsWith(componentUriPrefix)) {
            violations.add(ValidationViolation.fatal(id, componentId, COMPONENT_URI_FORMAT,
                "Component URI " + component.wikidataUri() + " does not start with " + componentUriPrefix));
        }
        if (component.nameIn(primaryLocale).isBlank()) {
            violations.add(ValidationViolation.fatal(id, componentId, COMPONENT_NAME_MISSING,
                "Component has no " + primaryLocale + " name"));
        }
        if (VisitScope.isReserved(componentId)) {
            violations.add(ValidationViolation.fatal(id, componentId, RESERVED_COMPONENT_ID,
                "Component id uses the reserved prefix " + VisitScope.PROPERTY_PREFIX));
        }
        if (ComponentReconciler.coincides(site, component.latitude(), component.longitude(), tolerance)) {
            violations.add(ValidationViolation.fatal(id, componentId, PSEUDO_COMPONENT,
                "Component sits on the property's own point (" + component.latitude() + ", "
                    + component.longitude() + ")"));
        }
    }

    private static boolean inRange(double value, double limit) {
        return value >= -limit && value <= limit;
    }
}
