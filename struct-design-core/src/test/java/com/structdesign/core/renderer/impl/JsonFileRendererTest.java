package com.structdesign.core.renderer.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.structdesign.core.DesignFixtures;
import com.structdesign.core.design.DesignOrchestrator;
import com.structdesign.core.model.DesignResult;
import com.structdesign.core.renderer.RenderContext;
import com.structdesign.core.renderer.ResultRenderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link JsonFileRenderer}.
 */
class JsonFileRendererTest {

    @TempDir
    Path tempDir;

    private final DesignOrchestrator orchestrator = new DesignOrchestrator();
    private final JsonFileRenderer renderer = new JsonFileRenderer();

    @Test
    void getId_returnsJson() {
        assertThat(renderer.getId()).isEqualTo("json");
    }

    @Test
    void render_writesResultsAsJsonArray() throws IOException {
        // Given
        List<DesignResult> results = List.of(
            orchestrator.design(DesignFixtures.beam(180, 120)),
            orchestrator.design(DesignFixtures.column(1500, 40, 50)));
        Path outputDir = tempDir.resolve("out");

        // When
        renderer.render(results, new RenderContext(outputDir, Map.of()));

        // Then
        Path file = outputDir.resolve(JsonFileRenderer.DEFAULT_FILE_NAME);
        assertThat(file).exists();
        JsonNode root = new ObjectMapper().readTree(file.toFile());
        assertThat(root.isArray()).isTrue();
        assertThat(root).hasSize(2);

        JsonNode beam = root.get(0);
        assertThat(beam.get("id").asText()).isEqualTo("B1");
        assertThat(beam.get("isValid").asBoolean()).isFalse();
        assertThat(beam.has("valid")).isFalse();
        assertThat(beam.at("/element/kind").asText()).isEqualTo("beam");
        assertThat(beam.at("/flexure/mode").asText()).isEqualTo("singly_reinforced");
        assertThat(beam.at("/reinforcement/main/layout").asText()).isEqualTo("single_row");
        assertThat(beam.at("/checks/cracking/status").asText()).isEqualTo("fail");
        assertThat(beam.at("/shear/spacing/governing").asDouble()).isEqualTo(220.0);
        assertThat(beam.at("/reinforcement").has("compression")).isFalse();

        JsonNode column = root.get(1);
        assertThat(column.at("/flexure/mode").asText()).isEqualTo("axial");
        assertThat(column.at("/element").has("span")).isTrue();
        assertThat(column.at("/shear/spacing").has("fromDetailing")).isTrue();
    }

    @Test
    void render_customFileName_isHonoured() {
        renderer.render(List.of(orchestrator.design(DesignFixtures.slab(20, 30))),
            new RenderContext(tempDir, Map.of("json.fileName", "slabs.json")));

        assertThat(tempDir.resolve("slabs.json")).exists();
    }

    @Test
    void render_outputPathIsAFile_throwsIllegalState() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");

        assertThatThrownBy(() -> renderer.render(List.of(), new RenderContext(blocker, Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to write design results");
    }

    @Test
    void render_fileNameOutsideOutputDirectory_isRejected() {
        RenderContext context = new RenderContext(tempDir.resolve("out"), Map.of("json.fileName", "../escape.json"));

        assertThatThrownBy(() -> renderer.render(List.of(), context))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("json.fileName");
        assertThat(tempDir.resolve("escape.json")).doesNotExist();
    }

    @Test
    void serviceLoader_discoversBothRenderers() {
        List<String> ids = ServiceLoader.load(ResultRenderer.class).stream()
            .map(provider -> provider.get().getId())
            .toList();

        assertThat(ids).containsExactlyInAnyOrder("console", "json");
    }
}
