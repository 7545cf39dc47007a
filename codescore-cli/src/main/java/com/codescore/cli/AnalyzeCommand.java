package com.codescore.cli;

import com.codescore.core.analyzer.ProgressListener;
import com.codescore.core.analyzer.ProjectAnalyzer;
import com.codescore.core.analyzer.SourceFile;
import com.codescore.core.config.ConfigLoader;
import com.codescore.core.config.RuntimeConfig;
import com.codescore.core.model.AggregatedMetric;
import com.codescore.core.model.FileAnalysisResult;
import com.codescore.core.model.ProjectAnalysisResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to analyze a project directory and report its quality scores.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load {@code codescore.yaml} (defaults if absent)</li>
 *   <li>Discover source files, skipping dependency and build directories</li>
 *   <li>Parse and score every file on the worker pool</li>
 *   <li>Print a plain-text summary or the full result as JSON</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Analyze current directory
 * codescore analyze
 *
 * # Analyze a directory with a custom config and eight workers
 * codescore analyze ./service -c ci/codescore.yaml -j 8
 *
 * # Machine-readable output
 * codescore analyze --json > report.json
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze source files and compute quality scores",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codescore.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--json"},
        description = "Print the full result as JSON"
    )
    private boolean json;

    @Option(
        names = {"--top"},
        description = "Number of lowest-scoring files to list (default: ${DEFAULT-VALUE})",
        defaultValue = "10"
    )
    private int top;

    @Option(
        names = {"-j", "--concurrency"},
        description = "Worker threads (overrides config)"
    )
    private Integer concurrency;

    private PrintStream out = System.out;

    @Override
    public Integer call() {
        try {
            if (!Files.isDirectory(projectPath)) {
                System.err.println("✗ Not a directory: " + projectPath.toAbsolutePath());
                return 2;
            }
            log.info("Starting analysis of: {}", projectPath.toAbsolutePath());

            RuntimeConfig config = loadConfiguration();
            List<SourceFile> files = new SourceDiscovery(config.exclude()).discover(projectPath);

            ProjectAnalyzer analyzer = new ProjectAnalyzer(config);
            ProjectAnalysisResult result = analyzer.analyze(
                projectPath.toAbsolutePath().normalize().toString(), files, progressListener());

            if (json) {
                printJson(result);
            } else {
                printSummary(result);
            }
            return 0;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("✗ Analysis interrupted");
            return 1;
        } catch (IOException e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads configuration, resolving a relative path against the project directory.
     */
    private RuntimeConfig loadConfiguration() {
        Path absoluteConfigPath = configPath.isAbsolute()
            ? configPath
            : projectPath.resolve(configPath);

        RuntimeConfig config = ConfigLoader.load(absoluteConfigPath);
        if (concurrency != null) {
            config = config.withConcurrency(concurrency);
        }
        log.debug("Using concurrency {} and weights {}", config.concurrency(), config.weights());
        return config;
    }

    private ProgressListener progressListener() {
        if (json) {
            return ProgressListener.NONE;
        }
        return (completed, total) -> log.debug("Analyzed {}/{} files", completed, total);
    }

    // ==================== Output ====================

    private void printJson(ProjectAnalysisResult result) throws JsonProcessingException {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        out.println(mapper.writeValueAsString(result));
    }

    private void printSummary(ProjectAnalysisResult result) {
        out.println("Project: " + result.projectPath());
        out.printf(Locale.ROOT, "Overall score: %.1f / 100%n", result.overallScore());
        out.printf(Locale.ROOT, "Files: %d analyzed, %d skipped, %d failed (of %d) in %d ms%n",
            result.analyzedFiles(), result.skippedFiles(), result.failedFiles(),
            result.totalFiles(), result.analysisTimeMillis());
        out.println();

        if (!result.aggregatedMetrics().isEmpty()) {
            out.println("Metrics:");
            out.printf(Locale.ROOT, "  %-24s %-14s %8s %8s %8s %8s%n",
                "Metric", "Category", "Average", "Median", "Min", "Max");
            for (AggregatedMetric metric : result.aggregatedMetrics()) {
                out.printf(Locale.ROOT, "  %-24s %-14s %8.1f %8.1f %8.1f %8.1f%n",
                    metric.name(), metric.category().id(), metric.average(),
                    metric.median(), metric.min(), metric.max());
            }
            out.println();
        }

        List<FileAnalysisResult> lowest = result.fileResults().stream()
            .sorted(Comparator.comparingDouble(FileAnalysisResult::score)
                .thenComparing(FileAnalysisResult::filePath))
            .limit(Math.max(0, top))
            .toList();
        if (!lowest.isEmpty()) {
            out.println("Lowest-scoring files:");
            for (FileAnalysisResult file : lowest) {
                out.printf(Locale.ROOT, "  %6.1f  %s (%s, %s parser)%n",
                    file.score(), file.filePath(),
                    file.parseResult().language().displayName(),
                    file.parseResult().tier().name().toLowerCase(Locale.ROOT));
            }
            out.println();
        }

        if (!result.statistics().topErrors().isEmpty()) {
            out.println("Errors:");
            result.statistics().topErrors().forEach(error -> out.println("  ✗ " + error));
        }
    }

    void setOut(PrintStream out) {
        this.out = out;
    }
}
