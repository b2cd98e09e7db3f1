package com.flagship.statement_importer.cli;

import com.flagship.statement_importer.config.ImporterSettings;
import com.flagship.statement_importer.importer.BatchAggregator;
import com.flagship.statement_importer.importer.BatchResult;
import com.flagship.statement_importer.importer.ImportEngine;
import com.flagship.statement_importer.importer.ImportResult;
import com.flagship.statement_importer.importer.ImportStatus;
import com.flagship.statement_importer.observability.JobContext;
import com.flagship.statement_importer.report.ImportReport;
import com.flagship.statement_importer.report.ReportGenerator;
import com.flagship.statement_importer.report.ReportWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * Command line entry: imports one or more statement files and writes the report.
 *
 * A single input is imported directly, several inputs (after glob expansion) as
 * a batch. The exit code is 1 when the final status is error, 0 otherwise.
 */
@Component
@Command(
        name = "statement-importer",
        description = "Imports parsed bank statements into the accounting ledger, each transaction at most once",
        mixinStandardHelpOptions = true,
        sortOptions = false
)
@Slf4j
public class ImportCommand implements Callable<Integer> {

    private static final String GLOB_CHARS = "*?[{";

    @Parameters(arity = "0..*", paramLabel = "FILE",
            description = "Statement files or glob patterns (default: vystup.abo)")
    private List<String> inputs = new ArrayList<>();

    @Option(names = {"-o", "--output"}, paramLabel = "PATH",
            description = "Report destination, '-' for standard output")
    private String output;

    @Option(names = {"-e", "--environment"}, paramLabel = "PATH",
            description = "Properties file with importer configuration (default: .env)")
    private String environment;

    private final ImportEngine importEngine;
    private final BatchAggregator batchAggregator;
    private final ReportGenerator reportGenerator;
    private final ReportWriter reportWriter;
    private final ImporterSettings settings;
    private final Clock clock;
    private final String defaultInput;
    private final String defaultOutput;

    public ImportCommand(ImportEngine importEngine,
                         BatchAggregator batchAggregator,
                         ReportGenerator reportGenerator,
                         ReportWriter reportWriter,
                         ImporterSettings settings,
                         Clock clock,
                         @Value("${importer.default-input:vystup.abo}") String defaultInput,
                         @Value("${importer.report.output:-}") String defaultOutput) {
        this.importEngine = importEngine;
        this.batchAggregator = batchAggregator;
        this.reportGenerator = reportGenerator;
        this.reportWriter = reportWriter;
        this.settings = settings;
        this.clock = clock;
        this.defaultInput = defaultInput;
        this.defaultOutput = defaultOutput;
    }

    String versionLine() {
        return settings.getApplicationName() + " " + settings.getApplicationVersion();
    }

    @Override
    public Integer call() {
        JobContext.setJobId(settings.getJobId());
        try {
            if (environment != null) {
                log.debug("Configuration imported from {}", environment);
            }

            List<String> patterns = inputs.isEmpty() ? List.of(defaultInput) : inputs;
            List<Path> files = expandInputs(patterns);

            ImportStatus status;
            ImportReport report;
            if (files.size() == 1) {
                ImportResult result = importSingle(files.get(0));
                status = result.getStatus();
                report = reportGenerator.generate(result);
            } else {
                BatchResult result = batchAggregator.importFiles(files);
                status = result.getStatus();
                report = reportGenerator.generate(result);
            }

            String target = output != null ? output : defaultOutput;
            if (!reportWriter.write(report, target)) {
                log.error("Report could not be written to {}", target);
            }

            return status == ImportStatus.ERROR ? 1 : 0;
        } finally {
            JobContext.clear();
        }
    }

    /**
     * Imports one file. An exception escaping the engine still yields an error result,
     * so a report is written as for a failed file in a batch.
     */
    private ImportResult importSingle(Path file) {
        try {
            return importEngine.importFile(file);
        } catch (RuntimeException e) {
            log.error("Import of {} aborted: {}", file, e.getMessage(), e);
            return ImportResult.fileError(file.toString(), ImportEngine.FATAL_ERROR_PREFIX + ImportEngine.describe(e),
                    0L, OffsetDateTime.now(clock));
        }
    }

    /**
     * Expands glob patterns. Patterns are kept in the given order; the matches of one
     * pattern are sorted by path. A plain path, or a pattern without matches, is passed
     * through unchanged so that it is reported as missing.
     */
    static List<Path> expandInputs(List<String> patterns) {
        List<Path> files = new ArrayList<>();
        for (String pattern : patterns) {
            if (!isGlob(pattern)) {
                files.add(Path.of(pattern));
                continue;
            }
            List<Path> matches = expandGlob(pattern);
            if (matches.isEmpty()) {
                log.warn("No files match {}", pattern);
                files.add(Path.of(pattern));
            } else {
                files.addAll(matches);
            }
        }
        return files;
    }

    static boolean isGlob(String pattern) {
        for (char c : pattern.toCharArray()) {
            if (GLOB_CHARS.indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static List<Path> expandGlob(String pattern) {
        int firstGlob = 0;
        while (GLOB_CHARS.indexOf(pattern.charAt(firstGlob)) < 0) {
            firstGlob++;
        }
        int lastSeparator = pattern.lastIndexOf('/', firstGlob);
        boolean relativeToWorkingDir = lastSeparator < 0;
        Path base = relativeToWorkingDir
                ? Path.of(".")
                : Path.of(lastSeparator == 0 ? "/" : pattern.substring(0, lastSeparator));
        if (!Files.isDirectory(base)) {
            return List.of();
        }

        int maxDepth = pattern.contains("**")
                ? Integer.MAX_VALUE
                : (int) pattern.substring(lastSeparator + 1).chars().filter(c -> c == '/').count() + 1;
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);

        try (Stream<Path> walk = Files.walk(base, maxDepth)) {
            return walk
                    .filter(Files::isRegularFile)
                    .map(path -> relativeToWorkingDir ? base.relativize(path) : path)
                    .filter(matcher::matches)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot expand " + pattern, e);
        }
    }
}
