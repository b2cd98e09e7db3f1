package com.flagship.statement_importer.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes report documents as JSON to a file or to standard output.
 *
 * File output goes through a temporary file in the target directory that is then
 * moved over the target, so readers never see a half-written report. Failures are
 * logged and reported through the return value only.
 */
@Component
@Slf4j
public class ReportWriter {

    public static final String STDOUT = "-";

    private final ObjectWriter writer;
    private final PrintStream console;

    @Autowired
    public ReportWriter(ObjectMapper objectMapper,
                        @Value("${importer.report.pretty:false}") boolean pretty) {
        this(objectMapper, pretty, System.out);
    }

    ReportWriter(ObjectMapper objectMapper, boolean pretty, PrintStream console) {
        this.writer = pretty ? objectMapper.writerWithDefaultPrettyPrinter() : objectMapper.writer();
        this.console = console;
    }

    /**
     * @param report the document to write
     * @param target file path, or "-" / blank for standard output
     * @return true if the whole report was written
     */
    public boolean write(ImportReport report, String target) {
        String json;
        try {
            json = writer.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize report: {}", e.getMessage(), e);
            return false;
        }

        if (target == null || target.isBlank() || STDOUT.equals(target)) {
            console.println(json);
            console.flush();
            return true;
        }

        Path destination = Path.of(target).toAbsolutePath();
        Path temporary = null;
        try {
            Path directory = destination.getParent();
            temporary = Files.createTempFile(directory, ".report-", ".tmp");
            Files.writeString(temporary, json, StandardCharsets.UTF_8);
            Files.move(temporary, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Report saved to: {}", destination);
            return true;
        } catch (IOException e) {
            log.error("Failed to save report to: {} ({})", destination, e.getMessage());
            deleteQuietly(temporary);
            return false;
        }
    }

    private void deleteQuietly(Path temporary) {
        if (temporary == null) {
            return;
        }
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException e) {
            log.warn("Could not remove temporary report file {}: {}", temporary, e.getMessage());
        }
    }
}
