package com.structdesign.cli;

import com.structdesign.core.config.ConfigLoader;
import com.structdesign.core.design.DesignOrchestrator;
import com.structdesign.core.exception.InvalidDesignInputException;
import com.structdesign.core.io.DesignInputReader;
import com.structdesign.core.model.DesignInput;
import com.structdesign.core.model.DesignResult;
import com.structdesign.core.renderer.RenderContext;
import com.structdesign.core.renderer.ResultRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Shared options and flow of the commands that design elements: load settings, read inputs,
 * design, render, and map the outcome to an exit code.
 */
abstract class AbstractDesignCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractDesignCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INVALID_DESIGN = 2;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: structdesign.yaml)"
    )
    Path configPath = Paths.get("structdesign.yaml");

    @Option(
        names = {"-r", "--renderer"},
        description = "Renderer ID: console or json (default: console)"
    )
    String rendererId = "console";

    @Option(
        names = {"-o", "--output"},
        description = "Output directory for file renderers (default: .)"
    )
    Path outputDirectory = Paths.get(".");

    @Option(
        names = {"--fail-on-invalid"},
        description = "Exit with code 2 when any design does not pass all checks"
    )
    boolean failOnInvalid;

    @Option(
        names = {"--no-color"},
        description = "Disable ANSI colors in console output"
    )
    boolean noColor;

    /**
     * Files holding the inputs to design.
     */
    protected abstract List<Path> inputFiles();

    /**
     * Designs the inputs.
     */
    protected abstract List<DesignResult> design(DesignOrchestrator orchestrator, List<DesignInput> inputs);

    @Override
    public Integer call() {
        try {
            ResultRenderer renderer = findRenderer(rendererId);
            if (renderer == null) {
                log.error("Unknown renderer: {}", rendererId);
                System.err.println("✗ Unknown renderer: " + rendererId + " (see 'structdesign list renderers')");
                return EXIT_ERROR;
            }

            DesignOrchestrator orchestrator = new DesignOrchestrator(ConfigLoader.load(configPath));

            List<DesignInput> inputs = new ArrayList<>();
            for (Path file : inputFiles()) {
                inputs.addAll(DesignInputReader.read(file));
            }
            log.info("Designing {} element(s)", inputs.size());

            List<DesignResult> results = design(orchestrator, inputs);

            renderer.render(results, RenderContext.of(outputDirectory, !noColor));

            long invalid = results.stream().filter(result -> !result.valid()).count();
            if (invalid > 0) {
                log.info("{} of {} design(s) did not pass all checks", invalid, results.size());
                if (failOnInvalid) {
                    return EXIT_INVALID_DESIGN;
                }
            }
            return EXIT_OK;

        } catch (InvalidDesignInputException e) {
            log.error("Invalid design input: {}", e.getMessage());
            System.err.println("✗ Invalid input in field '" + e.getField() + "': " + e.getMessage());
            return EXIT_ERROR;
        } catch (Exception e) {
            log.error("Design failed", e);
            System.err.println("✗ Design failed: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    static ResultRenderer findRenderer(String id) {
        for (ResultRenderer renderer : ServiceLoader.load(ResultRenderer.class)) {
            if (renderer.getId().equalsIgnoreCase(id)) {
                return renderer;
            }
        }
        return null;
    }
}
