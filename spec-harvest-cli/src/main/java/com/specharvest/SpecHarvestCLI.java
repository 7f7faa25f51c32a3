package com.specharvest;

import com.specharvest.cli.ConvertCommand;
import com.specharvest.cli.ExtractCommand;
import com.specharvest.cli.ListCommand;
import com.specharvest.cli.ParseCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for SpecHarvest.
 *
 * <p>SpecHarvest downloads 3GPP security assurance specifications and extracts their
 * requirements and test cases into structured XML, JSON or Markdown.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code extract} - Download, convert and extract configured specifications</li>
 *   <li>{@code parse} - Extract local .docx documents</li>
 *   <li>{@code convert} - Convert legacy .doc documents to .docx</li>
 *   <li>{@code list} - List specifications, renderers or writers</li>
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
 * # Harvest every configured specification
 * spec-harvest extract
 *
 * # Harvest two specifications as XML and JSON
 * spec-harvest extract 33.117 33.511 -f xml -f json
 *
 * # Parse a local document to the console
 * spec-harvest parse 33117-j20.docx -f markdown
 * }</pre>
 */
@Command(
    name = "spec-harvest",
    mixinStandardHelpOptions = true,
    version = "SpecHarvest 1.0.0-SNAPSHOT",
    description = "Extracts requirements and test cases from 3GPP specifications",
    subcommands = {
        ExtractCommand.class,
        ParseCommand.class,
        ConvertCommand.class,
        ListCommand.class
    }
)
public class SpecHarvestCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SpecHarvestCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("SpecHarvest - 3GPP requirement and test case extractor");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'spec-harvest --help' to see available commands");
        System.out.println("Use 'spec-harvest <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        SpecHarvestCLI cli = new SpecHarvestCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
