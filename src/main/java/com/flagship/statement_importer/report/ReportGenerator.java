package com.flagship.statement_importer.report;

import com.flagship.statement_importer.importer.BatchResult;
import com.flagship.statement_importer.importer.FileSummary;
import com.flagship.statement_importer.importer.ImportResult;
import com.flagship.statement_importer.importer.ResultMetrics;
import com.flagship.statement_importer.importer.TransactionOutcome;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

/**
 * Renders import results into the report document.
 * Each outcome becomes one human-readable line; the line formats are read by
 * downstream tooling and must stay stable.
 */
@Component
public class ReportGenerator {

    private static final String UNKNOWN = "unknown";

    public ImportReport generate(ImportResult result) {
        return ImportReport.builder()
                .status(result.getStatus().getReportName())
                .timestamp(result.getTimestamp())
                .message(result.getMessage())
                .artifacts(ImportReport.Artifacts.builder()
                        .importedTransactions(render(result.getImportedTransactions(), ReportGenerator::importedLine))
                        .failedTransactions(render(result.getFailedTransactions(), ReportGenerator::failedLine))
                        .skippedTransactions(render(result.getSkippedTransactions(), ReportGenerator::skippedLine))
                        .build())
                .metrics(metrics(result.getMetrics()).build())
                .build();
    }

    public ImportReport generate(BatchResult result) {
        return ImportReport.builder()
                .status(result.getStatus().getReportName())
                .timestamp(result.getTimestamp())
                .message(result.getMessage())
                .artifacts(ImportReport.Artifacts.builder()
                        .importedTransactions(render(result.getImportedTransactions(), ReportGenerator::importedLine))
                        .failedTransactions(render(result.getFailedTransactions(), ReportGenerator::failedLine))
                        .skippedTransactions(render(result.getSkippedTransactions(), ReportGenerator::skippedLine))
                        .processedFiles(render(result.getProcessedFiles(), ReportGenerator::processedFileLine))
                        .failedFiles(render(result.getFailedFiles(), ReportGenerator::failedFileLine))
                        .build())
                .metrics(metrics(result.getMetrics())
                        .totalFiles(result.getTotalFiles())
                        .processedFiles(result.getProcessedFiles().size())
                        .failedFiles(result.getFailedFiles().size())
                        .build())
                .build();
    }

    static String importedLine(TransactionOutcome outcome) {
        return String.format("Transaction %s: %s on %s",
                orUnknown(outcome.getDocumentNumber()), amount(outcome.getAmount()), date(outcome.getDate()));
    }

    static String failedLine(TransactionOutcome outcome) {
        return String.format("Failed %s: %s", orUnknown(outcome.getDocumentNumber()), outcome.getReason());
    }

    static String skippedLine(TransactionOutcome outcome) {
        return String.format("Skipped %s: %s on %s - %s",
                orUnknown(outcome.getDocumentNumber()), amount(outcome.getAmount()), date(outcome.getDate()),
                outcome.getReason());
    }

    static String processedFileLine(FileSummary file) {
        return String.format("Processed %s: %d transactions (%s)",
                file.getFilePath(), file.getTransactionCount(), file.getStatus().getReportName());
    }

    static String failedFileLine(FileSummary file) {
        return String.format("Failed %s: %s", file.getFilePath(), file.getError());
    }

    private static ImportReport.Metrics.MetricsBuilder metrics(ResultMetrics metrics) {
        return ImportReport.Metrics.builder()
                .totalTransactions(metrics.getTotalTransactions())
                .importedCount(metrics.getImportedCount())
                .errorCount(metrics.getErrorCount())
                .skippedCount(metrics.getSkippedCount())
                .processingTimeSeconds(metrics.getProcessingTimeSeconds());
    }

    private static <T> List<String> render(List<T> items, Function<T, String> line) {
        return items.stream().map(line).toList();
    }

    private static String amount(BigDecimal amount) {
        return amount != null ? amount.toPlainString() : UNKNOWN;
    }

    private static String date(LocalDate date) {
        return date != null ? date.toString() : UNKNOWN;
    }

    private static String orUnknown(String value) {
        return value == null || value.isEmpty() ? UNKNOWN : value;
    }
}
