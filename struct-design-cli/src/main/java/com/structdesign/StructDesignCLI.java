package com.structdesign;

import ch.qos.logback.classic.Level;
import com.structdesign.cli.BatchCommand;
import com.structdesign.cli.DesignCommand;
import com.structdesign.cli.ListCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main CLI entry point for StructDesign.
 *
 * <p>StructDesign designs reinforced concrete beams, columns and slabs: required steel, bar and
 * stirrup selection, capacity and serviceability checks, and a cost estimate.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code design} - Design the elements of one input file</li>
 *   <li>{@code batch} - Design the elements of many input files in parallel</li>
 *   <li>{@code list} - List the bar catalog or available renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Design one beam
 * structdesign design beam.yaml
 *
 * # Write JSON results for a set of files using 8 threads
 * structdesign batch floors/*.yaml -t 8 -r json -o build/design
 *
 * # Show the bar catalog
 * structdesign list bars
 * }</pre>
 */
@Command(
    name = "structdesign",
    mixinStandardHelpOptions = true,
    version = "StructDesign 1.0.0-SNAPSHOT",
    description = "Reinforced concrete member design engine",
    subcommands = {
        DesignCommand.class,
        BatchCommand.class,
        ListCommand.class
    }
)
public class StructDesignCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StructDesignCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("StructDesign - Reinforced Concrete Member Design");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'structdesign --help' to see available commands");
        System.out.println("Use 'structdesign <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Applies the global options before running the selected subcommand.
     */
    private int execute(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied to every subcommand.
     *
     * @return configured command line
     */
    public static CommandLine newCommandLine() {
        StructDesignCLI cli = new StructDesignCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::execute);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }
}
