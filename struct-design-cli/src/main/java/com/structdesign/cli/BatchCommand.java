package com.structdesign.cli;

import com.structdesign.core.design.DesignOrchestrator;
import com.structdesign.core.model.DesignInput;
import com.structdesign.core.model.DesignResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Command to design the elements of many input files on a fixed thread pool.
 *
 * <p>Results keep the order of the files and of the elements within each file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * structdesign batch level1.yaml level2.yaml -t 4 -r json -o build/design
 * }</pre>
 */
@Command(
    name = "batch",
    description = "Design the elements of many input files in parallel",
    mixinStandardHelpOptions = true
)
public class BatchCommand extends AbstractDesignCommand {

    private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);

    @Parameters(arity = "1..*", description = "Input files (.yaml, .yml or .json)")
    private List<Path> inputFiles;

    @Option(
        names = {"-t", "--threads"},
        description = "Worker threads (default: available processors)"
    )
    private int threads = Runtime.getRuntime().availableProcessors();

    @Override
    protected List<Path> inputFiles() {
        return inputFiles;
    }

    @Override
    protected List<DesignResult> design(DesignOrchestrator orchestrator, List<DesignInput> inputs) {
        int poolSize = Math.max(1, threads);
        log.debug("Designing {} element(s) on {} thread(s)", inputs.size(), poolSize);
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            return orchestrator.designAll(inputs, executor);
        } finally {
            executor.shutdownNow();
        }
    }
}
