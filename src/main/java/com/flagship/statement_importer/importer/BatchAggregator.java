package com.flagship.statement_importer.importer;

import com.flagship.statement_importer.observability.ImportMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Runs the import engine over several statement files and consolidates the results.
 *
 * Files are imported one after another in the order given. A file whose own status
 * is ERROR counts as failed, anything else (WARNING included) as processed. An
 * exception escaping the engine fails that file only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchAggregator {

    private final ImportEngine importEngine;
    private final ImportMetrics importMetrics;
    private final Clock clock;

    public BatchResult importFiles(List<Path> files) {
        log.info("Starting batch import of {} files", files.size());

        BatchResult.BatchResultBuilder batch = BatchResult.builder().totalFiles(files.size());
        ResultMetrics metrics = ResultMetrics.EMPTY;
        int processedCount = 0;
        int failedCount = 0;

        for (Path file : files) {
            String filePath = file.toString();
            ImportResult result;
            try {
                result = importEngine.importFile(file);
            } catch (RuntimeException e) {
                log.error("Import of {} aborted: {}", filePath, e.getMessage(), e);
                failedCount++;
                batch.failedFile(FileSummary.failed(filePath, ImportEngine.describe(e)));
                importMetrics.recordBatchFile(false);
                continue;
            }

            metrics = metrics.plus(result.getMetrics());
            batch.importedTransactions(result.getImportedTransactions())
                    .failedTransactions(result.getFailedTransactions())
                    .skippedTransactions(result.getSkippedTransactions());

            if (result.getStatus() == ImportStatus.ERROR) {
                failedCount++;
                batch.failedFile(FileSummary.failed(filePath, result.getMessage()));
                importMetrics.recordBatchFile(false);
            } else {
                processedCount++;
                batch.processedFile(FileSummary.processed(filePath,
                        result.getMetrics().getTotalTransactions(), result.getStatus()));
                importMetrics.recordBatchFile(true);
            }
        }

        ImportStatus status = ImportStatus.classifyBatch(files.size(), failedCount);
        String message = summarize(status, files.size(), processedCount, failedCount, metrics);

        if (status == ImportStatus.ERROR) {
            log.error(message);
        } else {
            log.info(message);
        }

        return batch
                .status(status)
                .message(message)
                .metrics(metrics)
                .timestamp(OffsetDateTime.now(clock))
                .build();
    }

    static String summarize(ImportStatus status, int totalFiles, int processedCount, int failedCount,
                            ResultMetrics metrics) {
        return switch (status) {
            case ERROR -> totalFiles == 0
                    ? "Batch import failed: no input files"
                    : String.format("Batch import failed: %d of %d files failed", failedCount, totalFiles);
            case WARNING -> String.format(
                    "Batch import completed with issues: %d of %d files processed, %d imported, %d errors, %d skipped",
                    processedCount, totalFiles,
                    metrics.getImportedCount(), metrics.getErrorCount(), metrics.getSkippedCount());
            case SUCCESS -> String.format("Batch import successful: %d files processed, %d imported, %d skipped",
                    processedCount, metrics.getImportedCount(), metrics.getSkippedCount());
        };
    }
}
