package com.flagship.statement_importer.importer;

import com.flagship.statement_importer.ledger.DuplicateCheckException;
import com.flagship.statement_importer.ledger.DuplicateChecker;
import com.flagship.statement_importer.ledger.LedgerClient;
import com.flagship.statement_importer.ledger.LedgerClientFactory;
import com.flagship.statement_importer.ledger.LedgerMovement;
import com.flagship.statement_importer.ledger.TransactionMapper;
import com.flagship.statement_importer.observability.ImportMetrics;
import com.flagship.statement_importer.observability.JobContext;
import com.flagship.statement_importer.statement.ParsedStatement;
import com.flagship.statement_importer.statement.ParsedTransaction;
import com.flagship.statement_importer.statement.StatementParser;
import com.flagship.statement_importer.statement.TransactionIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Imports the transactions of one statement file into the ledger, at most once each.
 *
 * Per file:
 * 1. Missing file or unparseable content ends the import with ERROR
 * 2. Transactions are processed strictly in file order
 * 3. Each one is checked against the ledger, skipped if already present,
 *    otherwise mapped, submitted and confirmed
 * 4. Any failure of a single transaction is recorded and the loop moves on
 * 5. Status, message, timestamp and elapsed time are computed at the end
 *
 * The check-then-submit sequence is only safe with a single writer. Do not run
 * two imports against the same ledger at the same time, and do not parallelise
 * the transaction loop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportEngine {

    static final String DUPLICATE_REASON = "duplicate";
    static final String COMMIT_FAILED_REASON = "failed to commit";
    public static final String FATAL_ERROR_PREFIX = "Fatal error during import: ";

    private final StatementParser parser;
    private final DuplicateChecker duplicateChecker;
    private final TransactionMapper mapper;
    private final LedgerClientFactory clientFactory;
    private final ImportMetrics importMetrics;
    private final Clock clock;

    /**
     * Imports one statement file.
     *
     * @param file path of the statement
     * @return the result; never null, file-level problems are reported through its status
     */
    public ImportResult importFile(Path file) {
        Instant startedAt = clock.instant();
        String filePath = file.toString();
        JobContext.setStatementFile(filePath);
        try {
            log.info("Starting statement import from: {}", filePath);

            if (!Files.exists(file)) {
                return fileError(filePath, "Statement file not found: " + filePath, startedAt);
            }

            ParsedStatement statement;
            try {
                statement = parser.parse(file);
            } catch (RuntimeException e) {
                log.error("Cannot parse {}: {}", filePath, e.getMessage(), e);
                return fileError(filePath, FATAL_ERROR_PREFIX + describe(e), startedAt);
            }

            log.info("Parsed statement file with format {}: {} statements, {} transactions",
                    statement.getFormatVersion(),
                    statement.getStatementCount(),
                    statement.getTransactions().size());

            return importTransactions(filePath, statement, startedAt);
        } finally {
            JobContext.clearStatementFile();
        }
    }

    private ImportResult importTransactions(String filePath, ParsedStatement statement, Instant startedAt) {
        ImportResult.ImportResultBuilder result = ImportResult.builder().filePath(filePath);
        LedgerClient writer = clientFactory.newClient();

        int importedCount = 0;
        int errorCount = 0;
        int skippedCount = 0;

        for (ParsedTransaction transaction : statement.getTransactions()) {
            TransactionOutcome outcome = importTransaction(transaction, writer);
            importMetrics.recordOutcome(outcome.getKind());

            switch (outcome.getKind()) {
                case IMPORTED -> {
                    importedCount++;
                    result.importedTransaction(outcome);
                }
                case SKIPPED -> {
                    skippedCount++;
                    result.skippedTransaction(outcome);
                }
                case FAILED -> {
                    errorCount++;
                    result.failedTransaction(outcome);
                }
            }
        }

        ImportStatus status = ImportStatus.classify(importedCount, errorCount);
        String message = summarize(status, importedCount, errorCount, skippedCount);

        Instant finishedAt = clock.instant();
        Duration elapsed = Duration.between(startedAt, finishedAt);
        importMetrics.recordFile(status, elapsed);

        if (status == ImportStatus.ERROR) {
            log.error(message);
        } else {
            log.info(message);
        }

        return result
                .status(status)
                .message(message)
                .metrics(new ResultMetrics(
                        statement.getTransactions().size(),
                        importedCount,
                        errorCount,
                        skippedCount,
                        elapsed.toMillis()))
                .timestamp(OffsetDateTime.ofInstant(finishedAt, clock.getZone()))
                .build();
    }

    /**
     * Check, map, submit and confirm a single transaction. Never throws.
     */
    TransactionOutcome importTransaction(ParsedTransaction transaction, LedgerClient writer) {
        TransactionIdentity identity = TransactionIdentity.of(transaction);
        String documentNumber = transaction.getDocumentNumber();
        LocalDate date = null;

        try {
            date = mapper.resolveDate(transaction);

            if (isAlreadyImported(identity)) {
                log.info("Transaction already exists, skipping: {}", documentNumber);
                return TransactionOutcome.skipped(identity.getValue(), documentNumber,
                        transaction.getAmount(), date, DUPLICATE_REASON);
            }

            LedgerMovement movement = mapper.map(transaction);

            if (writer.submit(movement) && writer.confirm()) {
                log.info("Imported transaction: {} (Amount: {})", documentNumber, transaction.getAmount());
                return TransactionOutcome.imported(identity.getValue(), documentNumber,
                        transaction.getAmount(), date);
            }

            log.warn("Failed to import transaction: {}", documentNumber);
            return TransactionOutcome.failed(identity.getValue(), documentNumber,
                    transaction.getAmount(), date, COMMIT_FAILED_REASON);

        } catch (RuntimeException e) {
            log.error("Error importing transaction {}: {}", documentNumber, e.getMessage(), e);
            return TransactionOutcome.failed(identity.getValue(), documentNumber,
                    transaction.getAmount(), date, describe(e));
        }
    }

    private boolean isAlreadyImported(TransactionIdentity identity) {
        try {
            return duplicateChecker.exists(identity);
        } catch (DuplicateCheckException e) {
            importMetrics.recordDuplicateCheckFailure();
            throw e;
        }
    }

    private ImportResult fileError(String filePath, String message, Instant startedAt) {
        Instant finishedAt = clock.instant();
        Duration elapsed = Duration.between(startedAt, finishedAt);
        importMetrics.recordFile(ImportStatus.ERROR, elapsed);
        log.error(message);

        return ImportResult.fileError(filePath, message, elapsed.toMillis(),
                OffsetDateTime.ofInstant(finishedAt, clock.getZone()));
    }

    static String summarize(ImportStatus status, int importedCount, int errorCount, int skippedCount) {
        return switch (status) {
            case ERROR -> String.format("Import failed: %d errors, no transactions imported", errorCount);
            case WARNING -> String.format("Import completed with issues: %d imported, %d errors, %d skipped",
                    importedCount, errorCount, skippedCount);
            case SUCCESS -> String.format("Import successful: %d imported, %d skipped",
                    importedCount, skippedCount);
        };
    }

    public static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
