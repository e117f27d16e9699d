package com.structdesign.core.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.structdesign.core.exception.InvalidDesignInputException;
import com.structdesign.core.model.DesignInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Reads design inputs from YAML ({@code .yaml}, {@code .yml}) or JSON files.
 *
 * <p>A file holds either one input document or a list of them.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<DesignInput> inputs = DesignInputReader.read(Paths.get("beams.yaml"));
 * }</pre>
 */
public final class DesignInputReader {

    private static final Logger log = LoggerFactory.getLogger(DesignInputReader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private DesignInputReader() {
        // Utility class
    }

    /**
     * Reads every input in a file.
     *
     * @param path YAML or JSON file
     * @return inputs in file order
     * @throws UncheckedIOException if the file cannot be read or parsed
     * @throws InvalidDesignInputException if an input violates a precondition
     */
    public static List<DesignInput> read(Path path) {
        ObjectMapper mapper = mapperFor(path);
        log.debug("Reading design input from: {}", path);
        try {
            JsonNode root = mapper.readTree(path.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new IOException("File is empty");
            }
            List<DesignInput> inputs = root.isArray()
                ? mapper.convertValue(root, new TypeReference<List<DesignInput>>() { })
                : List.of(mapper.treeToValue(root, DesignInput.class));
            log.info("Read {} design input(s) from: {}", inputs.size(), path);
            return inputs;
        } catch (IllegalArgumentException e) {
            throw unwrapInvalidInput(e, path);
        } catch (ValueInstantiationException e) {
            throw unwrapInvalidInput(e, path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read design input: " + path + " (" + e.getMessage() + ")", e);
        }
    }

    private static ObjectMapper mapperFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
    }

    /**
     * Surfaces a precondition violation raised inside a record constructor during binding.
     */
    private static RuntimeException unwrapInvalidInput(Exception e, Path path) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof InvalidDesignInputException) {
                return (InvalidDesignInputException) cause;
            }
        }
        if (e instanceof IllegalArgumentException) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                return new UncheckedIOException("Failed to read design input: " + path + " (" + cause.getMessage() + ")",
                    (IOException) cause);
            }
            return (IllegalArgumentException) e;
        }
        return new UncheckedIOException("Failed to read design input: " + path + " (" + e.getMessage() + ")",
            (IOException) e);
    }
}
