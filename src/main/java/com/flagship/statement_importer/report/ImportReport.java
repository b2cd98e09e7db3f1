package com.flagship.statement_importer.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * The machine-readable report document.
 *
 * Artifact lists that are empty are left out of the JSON. File counters in the
 * metrics block appear for batch reports only.
 */
@Value
@Builder
@JsonPropertyOrder({"status", "timestamp", "message", "artifacts", "metrics"})
public class ImportReport {

    @JsonProperty("status")
    String status;

    @JsonProperty("timestamp")
    OffsetDateTime timestamp;

    @JsonProperty("message")
    String message;

    @JsonProperty("artifacts")
    Artifacts artifacts;

    @JsonProperty("metrics")
    Metrics metrics;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonPropertyOrder({"imported_transactions", "failed_transactions", "skipped_transactions",
            "processed_files", "failed_files"})
    public static class Artifacts {
        @JsonProperty("imported_transactions")
        List<String> importedTransactions;

        @JsonProperty("failed_transactions")
        List<String> failedTransactions;

        @JsonProperty("skipped_transactions")
        List<String> skippedTransactions;

        @JsonProperty("processed_files")
        List<String> processedFiles;

        @JsonProperty("failed_files")
        List<String> failedFiles;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"total_transactions", "imported_count", "error_count", "skipped_count",
            "processing_time_seconds", "total_files", "processed_files", "failed_files"})
    public static class Metrics {
        @JsonProperty("total_transactions")
        int totalTransactions;

        @JsonProperty("imported_count")
        int importedCount;

        @JsonProperty("error_count")
        int errorCount;

        @JsonProperty("skipped_count")
        int skippedCount;

        @JsonProperty("processing_time_seconds")
        double processingTimeSeconds;

        @JsonProperty("total_files")
        Integer totalFiles;

        @JsonProperty("processed_files")
        Integer processedFiles;

        @JsonProperty("failed_files")
        Integer failedFiles;
    }
}
