package com.codescore;

import ch.qos.logback.classic.Level;
import com.codescore.cli.AnalyzeCommand;
import com.codescore.cli.LanguagesCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for CodeScore.
 *
 * <p>CodeScore parses source files in fourteen languages, computes complexity, size,
 * duplication, structure, error-handling, documentation and naming metrics, and combines
 * them into a 0-100 quality score per file and per project.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze a project directory and print its scores</li>
 *   <li>{@code languages} - List supported languages and the parser serving each</li>
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
 * # Analyze the current directory
 * codescore analyze
 *
 * # Analyze with four workers and print JSON
 * codescore analyze ./service -j 4 --json
 *
 * # Show which parser serves each language
 * codescore languages
 * }</pre>
 */
@Command(
    name = "codescore",
    mixinStandardHelpOptions = true,
    version = "CodeScore 1.0.0-SNAPSHOT",
    description = "Source code quality scoring across fourteen languages",
    subcommands = {
        AnalyzeCommand.class,
        LanguagesCommand.class
    }
)
public class CodeScoreCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("CodeScore - Source Code Quality Scoring");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'codescore --help' to see available commands");
        System.out.println("Use 'codescore <command> --help' for command-specific help");
    }

    /**
     * Configures the Logback root level from the global options.
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
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @param cli root command instance
     * @return configured command line
     */
    public static CommandLine commandLine(CodeScoreCLI cli) {
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
        int exitCode = commandLine(new CodeScoreCLI()).execute(args);
        System.exit(exitCode);
    }
}
