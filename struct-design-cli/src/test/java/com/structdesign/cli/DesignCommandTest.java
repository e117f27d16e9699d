package com.structdesign.cli;

import com.structdesign.StructDesignCLI;
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

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the {@code design} and {@code batch} commands.
 */
class DesignCommandTest {

    private static final String VALID_BEAM = """
        id: B1
        elementKind: beam
        geometry: {width: 300, height: 500, span: 6000, clearCover: 40}
        materials: {fc: 30, fy: 400}
        forces: {momentX: 120, shearX: 80}
        """;

    private static final String CRACKED_BEAM = """
        id: B2
        elementKind: beam
        geometry: {width: 300, height: 500, span: 6000, clearCover: 40}
        materials: {fc: 30, fy: 400}
        forces: {momentX: 180, shearX: 120}
        """;

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int run(String... args) {
        return StructDesignCLI.newCommandLine().execute(args);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }

    private String missingConfig() {
        return tempDir.resolve("none.yaml").toString();
    }

    @Test
    void design_validBeam_rendersToConsoleAndExitsZero() throws IOException {
        Path input = write("beam.yaml", VALID_BEAM);

        int exitCode = run("design", input.toString(), "-c", missingConfig(), "--no-color");

        assertThat(exitCode).isEqualTo(AbstractDesignCommand.EXIT_OK);
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("Designed 1 element(s): 1 valid, 0 invalid")
            .contains("4D16");
    }

    @Test
    void design_jsonRenderer_writesResultFile() throws IOException {
        Path input = write("beam.yaml", VALID_BEAM);
        Path outputDir = tempDir.resolve("results");

        int exitCode = run("design", input.toString(), "-c", missingConfig(), "-r", "json",
            "-o", outputDir.toString());

        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("design-results.json")).exists();
        assertThat(Files.readString(outputDir.resolve("design-results.json"))).contains("\"id\" : \"B1\"");
    }

    @Test
    void design_invalidDesign_exitsZeroByDefault() throws IOException {
        Path input = write("beam.yaml", CRACKED_BEAM);

        assertThat(run("design", input.toString(), "-c", missingConfig(), "--no-color")).isZero();
    }

    @Test
    void design_invalidDesignWithFailFlag_exitsTwo() throws IOException {
        Path input = write("beam.yaml", CRACKED_BEAM);

        int exitCode = run("design", input.toString(), "-c", missingConfig(), "--no-color", "--fail-on-invalid");

        assertThat(exitCode).isEqualTo(AbstractDesignCommand.EXIT_INVALID_DESIGN);
    }

    @Test
    void design_configRelaxingCrackLimit_makesDesignValid() throws IOException {
        Path input = write("beam.yaml", CRACKED_BEAM);
        Path config = write("structdesign.yaml", """
            serviceability:
              crackWidthLimit: 0.40
            """);

        int exitCode = run("design", input.toString(), "-c", config.toString(), "--no-color", "--fail-on-invalid");

        assertThat(exitCode).isZero();
    }

    @Test
    void design_malformedInput_reportsFieldAndExitsOne() throws IOException {
        Path input = write("bad.yaml", """
            elementKind: beam
            geometry: {width: 300, height: 0, clearCover: 40}
            materials: {fc: 30, fy: 400}
            """);

        int exitCode = run("design", input.toString(), "-c", missingConfig());

        assertThat(exitCode).isEqualTo(AbstractDesignCommand.EXIT_ERROR);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("✗ Invalid input in field 'geometry.height'");
    }

    @Test
    void design_missingFile_exitsOne() {
        int exitCode = run("design", tempDir.resolve("nope.yaml").toString(), "-c", missingConfig());

        assertThat(exitCode).isEqualTo(AbstractDesignCommand.EXIT_ERROR);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("✗ Design failed");
    }

    @Test
    void design_unknownRenderer_exitsOne() throws IOException {
        Path input = write("beam.yaml", VALID_BEAM);

        int exitCode = run("design", input.toString(), "-r", "pdf");

        assertThat(exitCode).isEqualTo(AbstractDesignCommand.EXIT_ERROR);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("✗ Unknown renderer: pdf");
    }

    @Test
    void batch_multipleFiles_designsAllElementsInOrder() throws IOException {
        Path first = write("a.yaml", VALID_BEAM);
        Path second = write("b.yaml", """
            - id: C1
              elementKind: column
              geometry: {width: 400, height: 400, span: 3500, clearCover: 40}
              materials: {fc: 30, fy: 400}
              forces: {axial: 1500, momentX: 40, shearX: 50}
            - id: S1
              elementKind: slab
              geometry: {width: 1000, height: 150, span: 4000, clearCover: 20}
              materials: {fc: 25, fy: 400}
              loads: {dead: 5, live: 2.5}
              forces: {momentX: 20, shearX: 30}
            """);

        int exitCode = run("batch", first.toString(), second.toString(), "-t", "3", "-c", missingConfig(),
            "--no-color", "--fail-on-invalid");

        String console = out.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(console).contains("Designed 3 element(s): 3 valid, 0 invalid");
        assertThat(console.indexOf("B1  ")).isLessThan(console.indexOf("C1  "));
        assertThat(console.indexOf("C1  ")).isLessThan(console.indexOf("S1  "));
    }

    @Test
    void batch_withoutFiles_isUsageError() {
        assertThat(run("batch")).isEqualTo(2);
    }

    @Test
    void findRenderer_isCaseInsensitive() {
        assertThat(AbstractDesignCommand.findRenderer("JSON")).isNotNull();
        assertThat(AbstractDesignCommand.findRenderer("pdf")).isNull();
    }
}
