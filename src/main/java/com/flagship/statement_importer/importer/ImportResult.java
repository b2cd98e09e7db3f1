package com.flagship.statement_importer.importer;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Result of importing one statement file.
 * Outcome lists keep the order of the transactions in the file.
 */
@Value
@Builder
public class ImportResult {
    ImportStatus status;
    String message;
    OffsetDateTime timestamp;
    String filePath;
    ResultMetrics metrics;
    @Singular
    List<TransactionOutcome> importedTransactions;
    @Singular
    List<TransactionOutcome> failedTransactions;
    @Singular
    List<TransactionOutcome> skippedTransactions;

    /**
     * Result of a file that could not be imported at all.
     */
    public static ImportResult fileError(String filePath, String message, long processingTimeMillis,
                                         OffsetDateTime timestamp) {
        return ImportResult.builder()
                .status(ImportStatus.ERROR)
                .message(message)
                .filePath(filePath)
                .metrics(ResultMetrics.elapsedOnly(processingTimeMillis))
                .timestamp(timestamp)
                .build();
    }
}
