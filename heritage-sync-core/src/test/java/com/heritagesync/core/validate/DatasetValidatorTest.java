package com.heritagesync.core.validate;

import com.heritagesync.core.config.PipelineConfig;
import com.heritagesync.core.model.ComponentSite;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.model.SiteCategory;
import com.heritagesync.core.model.SiteTranslation;
import com.heritagesync.core.model.ValidationReport;
import com.heritagesync.core.model.ValidationViolation;
import com.heritagesync.core.model.ViolationSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.heritagesync.core.SiteFixtures.component;
import static com.heritagesync.core.SiteFixtures.site;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DatasetValidator}.
 */
class DatasetValidatorTest {

    private DatasetValidator validator;

    @BeforeEach
    void setUp() {
        validator = DatasetValidator.from(PipelineConfig.defaults());
    }

    @Test
    void validate_consistentDataset_hasNoViolations() {
        List<HeritageSite> sites = List.of(
            site("438", 40.4167, 116.0833).withComponents(List.of(component("Q1", "438", 40.3597, 116.02))),
            site("1133", 49.0, 22.5).withComponents(List.of())
        );

        ValidationReport report = validator.validate(sites);

        assertThat(report.violations()).isEmpty();
        assertThat(report.sitesChecked()).isEqualTo(2);
        assertThat(report.componentsChecked()).isEqualTo(1);
    }

    @Test
    void validate_latitudeOutOfRange_reportsFatalWithSiteId() {
        ValidationReport report = validator.validate(List.of(site("77", 95.0, 10.0)));

        assertThat(report.hasFatal()).isTrue();
        assertThat(report.fatal()).singleElement().satisfies(v -> {
            assertThat(v.siteId()).isEqualTo("77");
            assertThat(v.rule()).isEqualTo(DatasetValidator.LATITUDE_RANGE);
            assertThat(v.severity()).isEqualTo(ViolationSeverity.FATAL);
        });
    }

    @Test
    void validate_collectsAllViolationsInOnePass() {
        List<HeritageSite> sites = List.of(
            site("1", 95.0, 10.0),
            site("2", 10.0, 190.0),
            site("3", -91.0, -181.0)
        );

        ValidationReport report = validator.validate(sites);

        assertThat(report.fatal()).extracting(ValidationViolation::siteId, ValidationViolation::rule)
            .containsExactly(
                tuple("1", DatasetValidator.LATITUDE_RANGE),
                tuple("2", DatasetValidator.LONGITUDE_RANGE),
                tuple("3", DatasetValidator.LATITUDE_RANGE),
                tuple("3", DatasetValidator.LONGITUDE_RANGE));
    }

    @Test
    void validate_siteWithoutAnyName_isFatal() {
        HeritageSite unnamed = site("5", 1, 1).withTranslation("en", new SiteTranslation("", "", "", "", ""))
            .withTranslation("zh", new SiteTranslation(" ", "", "", "", ""));

        ValidationReport report = validator.validate(List.of(unnamed));

        assertThat(report.fatal()).extracting(ValidationViolation::rule)
            .containsExactly(DatasetValidator.NO_TRANSLATION_NAME);
        assertThat(report.warnings()).extracting(ValidationViolation::rule)
            .containsExactly(DatasetValidator.MISSING_TRANSLATION, DatasetValidator.MISSING_TRANSLATION);
    }

    @Test
    void validate_missingSecondaryTranslation_isWarningOnly() {
        HeritageSite enOnly = new HeritageSite("6", "6", "", 1, 1, "", List.of(), SiteCategory.CULTURAL, "", 0,
            "", false, "", false, 0, 0, "", "", Map.of("en", new SiteTranslation("Name", "", "", "", "")),
            false, 0, List.of());

        ValidationReport report = validator.validate(List.of(enOnly));

        assertThat(report.hasFatal()).isFalse();
        assertThat(report.warnings()).singleElement()
            .satisfies(v -> assertThat(v.message()).contains("zh"));
    }

    @Test
    void validate_blankId_isFatal() {
        HeritageSite noId = new HeritageSite("", "", "", 1, 1, "", List.of(), SiteCategory.CULTURAL, "", 0,
            "", false, "", false, 0, 0, "", "",
            Map.of("en", new SiteTranslation("Name", "", "", "", ""), "zh", new SiteTranslation("名", "", "", "", "")),
            false, 0, List.of());

        assertThat(validator.validate(List.of(noId)).fatal()).extracting(ValidationViolation::rule)
            .containsExactly(DatasetValidator.MISSING_ID);
    }

    @Test
    void validate_inconsistentComponentCount_isFatal() {
        HeritageSite base = site("8", 1, 1);
        HeritageSite inconsistent = new HeritageSite(base.id(), base.idNumber(), base.uniqueNumber(), 1, 1,
            base.region(), base.isoCodes(), base.category(), "", 0, "", false, "", false, 0, 0, "", "",
            base.translations(), true, 2, List.of(component("Q1", "8", 2, 2)));

        assertThat(validator.validate(List.of(inconsistent)).fatal()).extracting(ValidationViolation::rule)
            .containsExactly(DatasetValidator.COMPONENT_COUNT_MISMATCH);
    }

    @Test
    void validate_badComponents_reportsEachRule() {
        ComponentSite outOfRange = component("Q1", "9", 91, 181);
        ComponentSite foreignUri = new ComponentSite("Q2", "https://example.org/Q2", "9", 3, 3,
            Map.of("en", "Name"), null, null);
        ComponentSite unnamed = new ComponentSite("Q3", "http://www.wikidata.org/entity/Q3", "9", 4, 4,
            Map.of("zh", "名"), null, null);
        ComponentSite reserved = new ComponentSite("property:9", "http://www.wikidata.org/entity/property:9", "9",
            5, 5, Map.of("en", "Whole"), null, null);
        ComponentSite pseudo = component("Q5", "9", 1.00005, 1.00005);
        HeritageSite site = site("9", 1, 1).withComponents(List.of(outOfRange, foreignUri, unnamed, reserved, pseudo));

        ValidationReport report = validator.validate(List.of(site));

        assertThat(report.fatal()).extracting(ValidationViolation::componentId, ValidationViolation::rule)
            .containsExactly(
                tuple("Q1", DatasetValidator.COMPONENT_LATITUDE_RANGE),
                tuple("Q1", DatasetValidator.COMPONENT_LONGITUDE_RANGE),
                tuple("Q2", DatasetValidator.COMPONENT_URI_FORMAT),
                tuple("Q3", DatasetValidator.COMPONENT_NAME_MISSING),
                tuple("property:9", DatasetValidator.RESERVED_COMPONENT_ID),
                tuple("Q5", DatasetValidator.PSEUDO_COMPONENT));
    }

    @Test
    void validate_duplicatesAcrossSites_areFatal() {
        List<HeritageSite> sites = List.of(
            site("1", 1, 1).withComponents(List.of(component("Q1", "1", 2, 2))),
            site("2", 5, 5).withComponents(List.of(component("Q1", "2", 6, 6)))
        );

        ValidationReport report = validator.validate(sites);

        assertThat(report.fatal()).extracting(ValidationViolation::rule)
            .containsExactlyInAnyOrder(DatasetValidator.DUPLICATE_COMPONENT_URI, DatasetValidator.DUPLICATE_COMPONENT_ID);
    }
}
