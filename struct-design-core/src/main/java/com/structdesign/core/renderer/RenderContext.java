package com.structdesign.core.renderer;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Where and how design results are rendered.
 *
 * <p>Settings are flat string pairs keyed by renderer, such as {@code console.colors=false} or
 * {@code json.fileName=frame.json}.
 *
 * @param outputDirectory directory file-based renderers write into
 * @param settings renderer settings
 */
public record RenderContext(
    Path outputDirectory,
    Map<String, String> settings
) {
    /** Whether the console renderer emits ANSI colors (default {@code true}). */
    public static final String CONSOLE_COLORS = "console.colors";

    /** Whether the console renderer lists every check (default {@code true}). */
    public static final String CONSOLE_SHOW_CHECKS = "console.showChecks";

    /** File name the JSON renderer writes, relative to the output directory. */
    public static final String JSON_FILE_NAME = "json.fileName";

    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Context for the command line: colors follow the terminal flag, everything else defaults.
     *
     * @param outputDirectory output directory
     * @param colors whether ANSI colors are wanted
     * @return render context
     */
    public static RenderContext of(Path outputDirectory, boolean colors) {
        return new RenderContext(outputDirectory, Map.of(CONSOLE_COLORS, String.valueOf(colors)));
    }

    public Optional<String> setting(String key) {
        return Optional.ofNullable(settings.get(key)).map(String::trim).filter(value -> !value.isEmpty());
    }

    /**
     * Reads an on/off setting.
     *
     * @param key setting key
     * @param defaultValue value when the setting is absent or blank
     * @return flag value
     * @throws IllegalArgumentException if the value is neither {@code true} nor {@code false}
     */
    public boolean flag(String key, boolean defaultValue) {
        return setting(key)
            .map(value -> switch (value.toLowerCase(Locale.ROOT)) {
                case "true" -> true;
                case "false" -> false;
                default -> throw new IllegalArgumentException(
                    "Setting '" + key + "' must be true or false, got: " + value);
            })
            .orElse(defaultValue);
    }

    /**
     * Resolves an output file against the output directory.
     *
     * @param key setting naming the file
     * @param defaultFileName file name when the setting is absent
     * @return output file path
     * @throws IllegalArgumentException if the configured name escapes the output directory
     */
    public Path outputFile(String key, String defaultFileName) {
        Path base = outputDirectory.toAbsolutePath().normalize();
        Path target = base.resolve(setting(key).orElse(defaultFileName)).normalize();
        if (!target.startsWith(base) || target.equals(base)) {
            throw new IllegalArgumentException("Setting '" + key + "' points outside " + outputDirectory);
        }
        return target;
    }
}
