package com.heritagesync.core.pipeline;

import com.heritagesync.core.config.PipelineConfig;
import com.heritagesync.core.exception.MissingInputFileException;
import com.heritagesync.core.exception.ValidationFailedException;
import com.heritagesync.core.model.ComponentSite;
import com.heritagesync.core.model.DiagnosticKind;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.model.ValidationViolation;
import com.heritagesync.core.publish.DatasetSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for {@link ReconciliationPipeline} against files on disk.
 */
class ReconciliationPipelineTest {

    private static final String EN = """
        <query>
          <row>
            <id_number>1133</id_number>
            <site>Ancient and Primeval Beech Forests</site>
            <short_description>&lt;p&gt;Beech&amp;nbsp;forests&lt;/p&gt;</short_description>
            <latitude>49.0</latitude>
            <longitude>22.5</longitude>
            <category>Natural</category>
            <region>Europe and North America</region>
            <iso_code>al,at,be</iso_code>
            <transboundary>1</transboundary>
          </row>
          <row>
            <id_number>438</id_number>
            <site>The Great Wall</site>
            <latitude>40.4167</latitude>
            <longitude>116.0833</longitude>
            <category>Cultural</category>
            <region>Asia and the Pacific</region>
            <iso_code>cn</iso_code>
          </row>
        </query>
        """;

    private static final String ZH = """
        <query>
          <row>
            <id_number>438</id_number>
            <site>长城</site>
            <latitude>40.4167</latitude>
            <longitude>116.0833</longitude>
            <category>Cultural</category>
          </row>
          <row>
            <id_number>1133</id_number>
            <site>喀尔巴阡山脉原始山毛榉林</site>
            <latitude>49.0</latitude>
            <longitude>22.5</longitude>
            <category>Natural</category>
          </row>
        </query>
        """;

    private static final String COMPONENTS = """
        [
          {"whs_id": "438", "component": "http://www.wikidata.org/entity/Q10", "componentLabel": "Great Wall",
           "lat": "40.4167", "lon": "116.0833", "source": "site_self"},
          {"whs_id": "438", "component": "http://www.wikidata.org/entity/Q29583927", "componentLabel": "Badaling",
           "lat": "", "lon": ""},
          {"whs_id": "438bis", "component": "http://www.wikidata.org/entity/Q29583927", "componentLabel": "Badaling",
           "lat": "40.3597", "lon": "116.0200"},
          {"whs_id": "1133ter-034", "component": "http://www.wikidata.org/entity/Q2", "componentLabel": "Uholka",
           "lat": "48.26", "lon": "23.62"},
          {"whs_id": "1133bis", "component": "http://www.wikidata.org/entity/Q3", "componentLabel": "Kalkalpen",
           "lat": "47.78", "lon": "14.36"}
        ]
        """;

    @TempDir
    Path projectDir;

    private ReconciliationPipeline pipeline;

    @BeforeEach
    void setUp() throws IOException {
        pipeline = new ReconciliationPipeline();
        Files.createDirectories(projectDir.resolve("data/raw"));
        writeRaw("whc-en.xml", EN);
        writeRaw("whc-zh.xml", ZH);
        writeRaw("multi-sites-data.json", COMPONENTS);
    }

    @Test
    void run_fullPipeline_publishesReconciledDatasetToBothLocations() throws IOException {
        // When
        PipelineResult result = pipeline.run(RunOptions.withDefaults(projectDir));

        // Then
        Path primary = projectDir.resolve("data/sites.json");
        Path secondary = projectDir.resolve("public/sites.json");
        assertThat(primary).exists();
        assertThat(Files.readAllBytes(secondary)).isEqualTo(Files.readAllBytes(primary));
        assertThat(result.published()).isPresent();

        List<HeritageSite> published = new DatasetSerializer().read(primary);
        assertThat(published).extracting(HeritageSite::id).containsExactly("438", "1133");

        HeritageSite greatWall = published.get(0);
        assertThat(greatWall.translations().get("en").name()).isEqualTo("The Great Wall");
        assertThat(greatWall.translations().get("zh").name()).isEqualTo("长城");
        assertThat(greatWall.componentCount()).isEqualTo(1);
        ComponentSite badaling = greatWall.components().get(0);
        assertThat(badaling.componentId()).isEqualTo("Q29583927");
        assertThat(badaling.latitude()).isEqualTo(40.3597);
        assertThat(badaling.name()).containsEntry("en", "Badaling").containsEntry("zh", "Badaling");

        HeritageSite beech = published.get(1);
        assertThat(beech.components()).extracting(ComponentSite::componentId).containsExactly("Q2", "Q3");
        assertThat(beech.transboundary()).isTrue();
        assertThat(beech.isoCodes()).containsExactly("al", "at", "be");
        assertThat(beech.translations().get("en").description()).isEqualTo("Beech forests");

        assertThat(result.reconciliation().pseudoComponentsFiltered()).isEqualTo(1);
        assertThat(result.reconciliation().duplicatesMerged()).isEqualTo(1);
        assertThat(result.diagnosticCounts())
            .containsEntry(DiagnosticKind.PSEUDO_COMPONENT_FILTERED, 1)
            .containsEntry(DiagnosticKind.DUPLICATE_COMPONENT_URI, 1);
        assertThat(result.statistics().totalComponents()).isEqualTo(3);
    }

    @Test
    void run_twiceOnSameInputs_producesByteIdenticalOutput() throws IOException {
        Path primary = projectDir.resolve("data/sites.json");

        pipeline.run(RunOptions.withDefaults(projectDir));
        byte[] first = Files.readAllBytes(primary);
        pipeline.run(RunOptions.withDefaults(projectDir));
        byte[] second = Files.readAllBytes(primary);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void run_withoutComponentSource_publishesSitesWithoutComponents() throws IOException {
        Files.delete(projectDir.resolve("data/raw/multi-sites-data.json"));

        PipelineResult result = pipeline.run(RunOptions.withDefaults(projectDir));

        assertThat(result.componentsReconciled()).isFalse();
        List<HeritageSite> published = new DatasetSerializer().read(projectDir.resolve("data/sites.json"));
        assertThat(published).hasSize(2)
            .allSatisfy(site -> {
                assertThat(site.componentCount()).isZero();
                assertThat(site.hasComponents()).isFalse();
                assertThat(site.components()).isEmpty();
            });
    }

    @Test
    void run_missingLocaleFile_failsWithoutWritingOutput() throws IOException {
        Files.delete(projectDir.resolve("data/raw/whc-zh.xml"));

        assertThatThrownBy(() -> pipeline.run(RunOptions.withDefaults(projectDir)))
            .isInstanceOf(MissingInputFileException.class)
            .hasMessageContaining("whc-zh.xml");

        assertThat(projectDir.resolve("data/sites.json")).doesNotExist();
        assertThat(projectDir.resolve("public/sites.json")).doesNotExist();
    }

    @Test
    void run_latitudeOutOfRange_abortsWithoutWritingOutput() throws IOException {
        writeRaw("whc-en.xml", EN.replace("<latitude>49.0</latitude>", "<latitude>95</latitude>"));
        writeRaw("whc-zh.xml", ZH.replace("<latitude>49.0</latitude>", "<latitude>95</latitude>"));

        assertThatThrownBy(() -> pipeline.run(RunOptions.withDefaults(projectDir)))
            .isInstanceOf(ValidationFailedException.class)
            .satisfies(e -> assertThat(((ValidationFailedException) e).getReport().fatal())
                .extracting(ValidationViolation::siteId)
                .contains("1133"));

        assertThat(projectDir.resolve("data/sites.json")).doesNotExist();
        assertThat(projectDir.resolve("public/sites.json")).doesNotExist();
    }

    @Test
    void run_invalidDataset_keepsPreviouslyPublishedFile() throws IOException {
        pipeline.run(RunOptions.withDefaults(projectDir));
        Path primary = projectDir.resolve("data/sites.json");
        byte[] before = Files.readAllBytes(primary);
        writeRaw("whc-en.xml", EN.replace("<latitude>40.4167</latitude>", "<latitude>-95</latitude>"));
        writeRaw("whc-zh.xml", ZH.replace("<latitude>40.4167</latitude>", "<latitude>-95</latitude>"));

        assertThatThrownBy(() -> pipeline.run(RunOptions.withDefaults(projectDir)))
            .isInstanceOf(ValidationFailedException.class);

        assertThat(Files.readAllBytes(primary)).isEqualTo(before);
    }

    @Test
    void run_malformedComponentRows_droppedWithoutBlockingPublication() throws IOException {
        // Given: one foreign URI, one blank label and one URI that derives an id already in use
        writeRaw("multi-sites-data.json", COMPONENTS.replace("\n]", """
          ,{"whs_id": "1133", "component": "https://example.org/Q4", "componentLabel": "Foreign",
           "lat": "48.1", "lon": "22.1"},
          {"whs_id": "1133", "component": "http://www.wikidata.org/entity/Q5", "componentLabel": " ",
           "lat": "48.2", "lon": "22.2"},
          {"whs_id": "1133", "component": "http://www.wikidata.org/entity/Q2/", "componentLabel": "Uholka again",
           "lat": "48.3", "lon": "22.3"}
        ]"""));

        // When
        PipelineResult result = pipeline.run(RunOptions.withDefaults(projectDir));

        // Then
        assertThat(result.validation().hasFatal()).isFalse();
        assertThat(projectDir.resolve("data/sites.json")).exists();
        assertThat(result.sites().get(1).components()).extracting(ComponentSite::componentId)
            .containsExactly("Q2", "Q3");
        assertThat(result.reconciliation().malformedRejected()).isEqualTo(3);
        assertThat(result.diagnosticCounts())
            .containsEntry(DiagnosticKind.INVALID_COMPONENT_URI, 1)
            .containsEntry(DiagnosticKind.MISSING_COMPONENT_NAME, 1)
            .containsEntry(DiagnosticKind.DUPLICATE_COMPONENT_ID, 1);
    }

    @Test
    void run_dryRun_writesNothing() {
        PipelineResult result = pipeline.run(new RunOptions(projectDir, PipelineConfig.defaults(), true));

        assertThat(result.published()).isEmpty();
        assertThat(result.sites()).hasSize(2);
        assertThat(projectDir.resolve("data/sites.json")).doesNotExist();
    }

    @Test
    void run_sequentialReadsAndCustomOutput_usesConfiguration() throws IOException {
        PipelineConfig config = new PipelineConfig(
            List.of("en"),
            null,
            new PipelineConfig.InputConfig(null, null, null, false),
            new PipelineConfig.OutputConfig("out/dataset.json", List.of()),
            null
        );

        PipelineResult result = pipeline.run(new RunOptions(projectDir, config, false));

        assertThat(projectDir.resolve("out/dataset.json")).exists();
        assertThat(projectDir.resolve("public/sites.json")).doesNotExist();
        assertThat(result.sites()).allSatisfy(site -> assertThat(site.translations()).containsOnlyKeys("en"));
    }

    private void writeRaw(String fileName, String content) throws IOException {
        Files.writeString(projectDir.resolve("data/raw").resolve(fileName), content);
    }
}
