package com.flagship.statement_importer.importer;

import lombok.Value;

/**
 * Per-file line of a batch result.
 * Processed files carry their transaction count and status, failed files an error.
 */
@Value
public class FileSummary {
    String filePath;
    int transactionCount;
    ImportStatus status;
    String error;

    public static FileSummary processed(String filePath, int transactionCount, ImportStatus status) {
        return new FileSummary(filePath, transactionCount, status, null);
    }

    public static FileSummary failed(String filePath, String error) {
        return new FileSummary(filePath, 0, ImportStatus.ERROR, error);
    }
}
