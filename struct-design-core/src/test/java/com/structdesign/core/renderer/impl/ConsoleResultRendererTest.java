package com.structdesign.core.renderer.impl;

import com.structdesign.core.DesignFixtures;
import com.structdesign.core.design.DesignOrchestrator;
import com.structdesign.core.model.DesignForces;
import com.structdesign.core.model.DesignResult;
import com.structdesign.core.renderer.RenderContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleResultRenderer}.
 */
class ConsoleResultRendererTest {

    private static final Map<String, String> NO_COLORS = Map.of("console.colors", "false");

    private final DesignOrchestrator orchestrator = new DesignOrchestrator();
    private ConsoleResultRenderer renderer;
    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        renderer = new ConsoleResultRenderer();
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    private String output() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_validAndInvalidResults_printsSummaryAndVerdicts() {
        // Given
        DesignResult valid = orchestrator.design(DesignFixtures.beam(120, 80));
        DesignResult invalid = orchestrator.design(DesignFixtures.beam(180, 120));

        // When
        renderer.render(List.of(valid, invalid), new RenderContext(Path.of("output"), NO_COLORS));

        // Then
        String console = output();
        assertThat(console).contains("Designed 2 element(s): 1 valid, 1 invalid");
        assertThat(console).contains("B1  beam 300x500: 4D16, stirrups D8-");
        assertThat(console).contains("✓ VALID");
        assertThat(console).contains("✗ INVALID");
        assertThat(console).contains("cracking");
        assertThat(console).contains("fail");
        assertThat(console).contains("cost: IDR ");
    }

    @Test
    void render_withoutColors_emitsNoAnsiCodes() {
        DesignResult result = orchestrator.design(DesignFixtures.beam(120, 80));

        renderer.render(List.of(result), new RenderContext(Path.of("output"), NO_COLORS));

        assertThat(output()).doesNotContain("\u001B[");
    }

    @Test
    void render_withDefaultSettings_usesColors() {
        DesignResult result = orchestrator.design(DesignFixtures.beam(120, 80));

        renderer.render(List.of(result), new RenderContext(Path.of("output"), Map.of()));

        assertThat(output()).contains("\u001B[32m");
    }

    @Test
    void render_checksHidden_omitsCheckLines() {
        DesignResult result = orchestrator.design(DesignFixtures.beam(120, 80));

        renderer.render(List.of(result), new RenderContext(Path.of("output"),
            Map.of("console.colors", "false", "console.showChecks", "false")));

        assertThat(output()).doesNotContain("flexuralStrength").contains("cost:");
    }

    @Test
    void render_notes_arePrinted() {
        DesignResult result = orchestrator.design(DesignFixtures.beam(120, 80)
            .withForces(new DesignForces(120, 0, 80, 0, 0, 4)));

        renderer.render(List.of(result), new RenderContext(Path.of("output"), NO_COLORS));

        assertThat(output()).contains("  note: Torsion");
    }

    @Test
    void render_emptyResults_printsZeroCount() {
        renderer.render(List.of(), new RenderContext(Path.of("output"), NO_COLORS));

        assertThat(output()).contains("Designed 0 element(s): 0 valid, 0 invalid");
    }
}
