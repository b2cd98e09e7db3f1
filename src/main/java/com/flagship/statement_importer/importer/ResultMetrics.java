package com.flagship.statement_importer.importer;

import lombok.Value;

/**
 * Counters of an import. All fields are additive across files.
 */
@Value
public class ResultMetrics {

    public static final ResultMetrics EMPTY = new ResultMetrics(0, 0, 0, 0, 0L);

    int totalTransactions;
    int importedCount;
    int errorCount;
    int skippedCount;
    long processingTimeMillis;

    public static ResultMetrics elapsedOnly(long processingTimeMillis) {
        return new ResultMetrics(0, 0, 0, 0, processingTimeMillis);
    }

    public ResultMetrics plus(ResultMetrics other) {
        return new ResultMetrics(
            totalTransactions + other.totalTransactions,
            importedCount + other.importedCount,
            errorCount + other.errorCount,
            skippedCount + other.skippedCount,
            processingTimeMillis + other.processingTimeMillis
        );
    }

    public double getProcessingTimeSeconds() {
        return processingTimeMillis / 1000.0;
    }
}
