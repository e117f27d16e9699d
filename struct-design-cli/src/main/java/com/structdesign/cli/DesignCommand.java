package com.structdesign.cli;

import com.structdesign.core.design.DesignOrchestrator;
import com.structdesign.core.model.DesignInput;
import com.structdesign.core.model.DesignResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;

/**
 * Command to design the elements of one input file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print a summary to the console
 * structdesign design beam.yaml
 *
 * # Write design-results.json to build/
 * structdesign design beams.json -r json -o build
 *
 * # Fail the build when a design does not pass
 * structdesign design beam.yaml --fail-on-invalid
 * }</pre>
 */
@Command(
    name = "design",
    description = "Design the elements of one YAML or JSON input file",
    mixinStandardHelpOptions = true
)
public class DesignCommand extends AbstractDesignCommand {

    @Parameters(index = "0", description = "Input file (.yaml, .yml or .json)")
    private Path inputFile;

    @Override
    protected List<Path> inputFiles() {
        return List.of(inputFile);
    }

    @Override
    protected List<DesignResult> design(DesignOrchestrator orchestrator, List<DesignInput> inputs) {
        return inputs.stream().map(orchestrator::design).toList();
    }
}
