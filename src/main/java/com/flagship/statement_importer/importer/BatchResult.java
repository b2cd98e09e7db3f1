package com.flagship.statement_importer.importer;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Consolidated result of importing several statement files.
 *
 * Invariant: metrics are the element-wise sum of the metrics of every file,
 * outcome lists are file-major and keep transaction order within a file.
 */
@Value
@Builder
public class BatchResult {
    ImportStatus status;
    String message;
    OffsetDateTime timestamp;
    ResultMetrics metrics;
    int totalFiles;
    @Singular
    List<FileSummary> processedFiles;
    @Singular
    List<FileSummary> failedFiles;
    @Singular
    List<TransactionOutcome> importedTransactions;
    @Singular
    List<TransactionOutcome> failedTransactions;
    @Singular
    List<TransactionOutcome> skippedTransactions;
}
