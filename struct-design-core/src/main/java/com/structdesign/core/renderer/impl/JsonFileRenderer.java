package com.structdesign.core.renderer.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.structdesign.core.model.DesignResult;
import com.structdesign.core.renderer.RenderContext;
import com.structdesign.core.renderer.ResultRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Renderer that writes the results as a JSON array to a file.
 *
 * <p><b>Configuration:</b>
 * <ul>
 *   <li>{@code outputDirectory} - Target directory (from RenderContext)</li>
 *   <li>{@code json.fileName} - File name (default: "design-results.json")</li>
 * </ul>
 */
public class JsonFileRenderer implements ResultRenderer {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileRenderer.class);

    static final String DEFAULT_FILE_NAME = "design-results.json";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public void render(List<DesignResult> results, RenderContext context) {
        Path target = context.outputFile(RenderContext.JSON_FILE_NAME, DEFAULT_FILE_NAME);
        logger.info("Writing {} design results to: {}", results.size(), target);

        try {
            Files.createDirectories(target.getParent());
            String json = JSON_MAPPER.writeValueAsString(results);
            Files.writeString(target, json);
            logger.info("Wrote file: {} ({} bytes)", target, json.length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write design results: " + target, e);
        }
    }
}
