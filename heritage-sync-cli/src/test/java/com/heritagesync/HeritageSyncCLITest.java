package com.heritagesync;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Command-line tests for {@link HeritageSyncCLI} and its subcommands.
 */
class HeritageSyncCLITest {

    private static final String EN = """
        <query>
          <row>
            <id_number>438</id_number>
            <site>The Great Wall</site>
            <latitude>40.4167</latitude>
            <longitude>116.0833</longitude>
            <category>Cultural</category>
            <region>Asia and the Pacific</region>
          </row>
          <row>
            <id_number>1133</id_number>
            <site>Ancient and Primeval Beech Forests</site>
            <latitude>49.0</latitude>
            <longitude>22.5</longitude>
            <category>Natural</category>
            <region>Europe and North America</region>
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
            <site>山毛榉林</site>
            <latitude>49.0</latitude>
            <longitude>22.5</longitude>
            <category>Natural</category>
          </row>
        </query>
        """;

    private static final String COMPONENTS = """
        [
          {"whs_id": "438bis", "component": "http://www.wikidata.org/entity/Q29583927",
           "componentLabel": "Badaling", "lat": "40.3597", "lon": "116.0200"}
        ]
        """;

    @TempDir
    Path projectDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() throws IOException {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));

        Path raw = Files.createDirectories(projectDir.resolve("data/raw"));
        Files.writeString(raw.resolve("whc-en.xml"), EN);
        Files.writeString(raw.resolve("whc-zh.xml"), ZH);
        Files.writeString(raw.resolve("multi-sites-data.json"), COMPONENTS);
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void noCommand_printsBanner() {
        int exitCode = execute();

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("HeritageSync").contains("heritagesync --help");
    }

    @Test
    void run_validProject_publishesAndExitsZero() {
        int exitCode = execute("-q", "run", projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(projectDir.resolve("data/sites.json")).exists();
        assertThat(projectDir.resolve("public/sites.json")).exists();
        assertThat(stdout()).contains("✓ Built 2 sites").contains("✓ Run complete");
    }

    @Test
    void run_dryRun_writesNothing() {
        int exitCode = execute("-q", "run", projectDir.toString(), "--dry-run");

        assertThat(exitCode).isZero();
        assertThat(projectDir.resolve("data/sites.json")).doesNotExist();
        assertThat(stdout()).contains("Dry-run mode");
    }

    @Test
    void run_outputOverride_writesToGivenFile() {
        Path output = projectDir.resolve("custom/sites.json");

        int exitCode = execute("-q", "run", projectDir.toString(), "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(output).exists();
        assertThat(projectDir.resolve("data/sites.json")).doesNotExist();
    }

    @Test
    void run_missingLocaleFile_exitsOne() throws IOException {
        Files.delete(projectDir.resolve("data/raw/whc-zh.xml"));

        int exitCode = execute("-q", "run", projectDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Missing input file").contains("whc-zh.xml");
        assertThat(projectDir.resolve("data/sites.json")).doesNotExist();
    }

    @Test
    void run_invalidLatitude_exitsOneWithoutOutput() throws IOException {
        Files.writeString(projectDir.resolve("data/raw/whc-en.xml"),
            EN.replace("<latitude>49.0</latitude>", "<latitude>95</latitude>"));

        int exitCode = execute("-q", "run", projectDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("latitude-range").contains("1133");
        assertThat(projectDir.resolve("data/sites.json")).doesNotExist();
        assertThat(projectDir.resolve("public/sites.json")).doesNotExist();
    }

    @Test
    void validate_publishedDataset_exitsZero() {
        execute("-q", "run", projectDir.toString());

        int exitCode = execute("-q", "validate", projectDir.resolve("data/sites.json").toString(),
            "-c", projectDir.resolve("heritagesync.yaml").toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("✓ Dataset is valid");
    }

    @Test
    void validate_corruptedDataset_exitsOne() throws IOException {
        execute("-q", "run", projectDir.toString());
        Path dataset = projectDir.resolve("data/sites.json");
        Files.writeString(dataset, Files.readString(dataset).replace("\"componentCount\": 1", "\"componentCount\": 5"));

        int exitCode = execute("-q", "validate", dataset.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("component-count-mismatch");
    }

    @Test
    void stats_publishedDataset_printsStatistics() {
        execute("-q", "run", projectDir.toString());

        int exitCode = execute("-q", "stats", projectDir.resolve("data/sites.json").toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Sites: 2").contains("Total components: 1");
    }

    @Test
    void lookup_componentAndPropertyKeys_resolveToProperty() {
        execute("-q", "run", projectDir.toString());
        String dataset = projectDir.resolve("data/sites.json").toString();

        assertThat(execute("-q", "lookup", dataset, "Q29583927")).isZero();
        assertThat(stdout()).contains("property 438 (The Great Wall)");

        assertThat(execute("-q", "lookup", dataset, "property:1133")).isZero();
        assertThat(stdout()).contains("property 1133");
    }

    @Test
    void lookup_unknownOrInvalidKey_exitsOne() {
        execute("-q", "run", projectDir.toString());
        String dataset = projectDir.resolve("data/sites.json").toString();

        assertThat(execute("-q", "lookup", dataset, "Q404")).isEqualTo(1);
        assertThat(execute("-q", "lookup", dataset, "property:")).isEqualTo(1);
        assertThat(stderr()).contains("No property found").contains("Invalid visit key");
    }

    private int execute(String... args) {
        return HeritageSyncCLI.createCommandLine().execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
