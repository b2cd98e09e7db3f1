package com.flagship.statement_importer.observability;

import com.flagship.statement_importer.importer.ImportStatus;
import com.flagship.statement_importer.importer.TransactionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer meters for statement imports.
 *
 * Metrics exposed:
 * - statement.transactions: counter tagged by outcome (imported, skipped, failed)
 * - statement.duplicate_check.failures: ledger lookups that could not be executed
 * - statement.file.duration: timer per imported file, tagged by status
 * - statement.batch.files: counter of batch files tagged by result (processed, failed)
 */
@Component
public class ImportMetrics {

    private final MeterRegistry registry;

    private final Counter duplicateCheckFailures;

    public ImportMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicateCheckFailures = Counter.builder("statement.duplicate_check.failures")
                .description("Ledger lookups that could not be executed")
                .register(registry);
    }

    public void recordOutcome(TransactionOutcome.Kind kind) {
        registry.counter("statement.transactions",
                "outcome", kind.name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    public void recordDuplicateCheckFailure() {
        duplicateCheckFailures.increment();
    }

    public void recordFile(ImportStatus status, Duration duration) {
        registry.timer("statement.file.duration",
                "status", status.getReportName()
        ).record(duration);
    }

    public void recordBatchFile(boolean processed) {
        registry.counter("statement.batch.files",
                "result", processed ? "processed" : "failed"
        ).increment();
    }
}
