package com.flagship.statement_importer.importer;

import com.flagship.statement_importer.config.ImporterSettings;
import com.flagship.statement_importer.ledger.DuplicateChecker;
import com.flagship.statement_importer.ledger.InMemoryLedger;
import com.flagship.statement_importer.ledger.LedgerMovement;
import com.flagship.statement_importer.ledger.MovementDirection;
import com.flagship.statement_importer.ledger.TransactionMapper;
import com.flagship.statement_importer.observability.ImportMetrics;
import com.flagship.statement_importer.statement.ParsedStatement;
import com.flagship.statement_importer.statement.ParsedTransaction;
import com.flagship.statement_importer.statement.StatementParseException;
import com.flagship.statement_importer.statement.StatementParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the per-file import: idempotence, failure isolation and status rules.
 */
class ImportEngineTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-05-20T08:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private InMemoryLedger ledger;
    private SimpleMeterRegistry meterRegistry;
    private Path statementFile;
    private List<ParsedTransaction> transactions;

    @BeforeEach
    void setUp() throws IOException {
        ledger = new InMemoryLedger();
        meterRegistry = new SimpleMeterRegistry();
        statementFile = Files.writeString(tempDir.resolve("vystup.abo"), "statement");
        transactions = List.of();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private ImportEngine engine() {
        return engine(file -> ParsedStatement.of("ABO-GPC", 1, transactions));
    }

    private ImportEngine engine(StatementParser parser) {
        ImporterSettings settings = ImporterSettings.builder()
                .applicationName("statement-importer")
                .applicationVersion("0.1.0")
                .jobId("4711")
                .build();
        return new ImportEngine(
                parser,
                new DuplicateChecker(ledger),
                new TransactionMapper(settings, FIXED_CLOCK),
                ledger,
                new ImportMetrics(meterRegistry),
                FIXED_CLOCK);
    }

    private static ParsedTransaction transaction(String documentNumber, String amount) {
        return ParsedTransaction.builder()
                .documentNumber(documentNumber)
                .accountNumber("2000145399")
                .amount(amount != null ? new BigDecimal(amount) : null)
                .valuationDate(LocalDate.of(2024, 3, 1))
                .build();
    }

    @Test
    @DisplayName("New receipt is imported, the second run skips it as duplicate")
    void testReimportIsIdempotent() {
        printTestHeader("Re-import Is Idempotent");

        transactions = List.of(ParsedTransaction.builder()
                .documentNumber("000001")
                .accountNumber("2000145399")
                .amount(new BigDecimal("1000.50"))
                .valuationDate(LocalDate.of(2024, 3, 1))
                .variableSymbol("2024001")
                .build());

        ImportResult first = engine().importFile(statementFile);
        System.out.println("First run: " + first.getMessage());

        assertEquals(ImportStatus.SUCCESS, first.getStatus(), "First run should succeed");
        assertEquals("Import successful: 1 imported, 0 skipped", first.getMessage());
        assertEquals(1, first.getImportedTransactions().size());
        assertEquals(1, ledger.getMovements().size(), "One movement should be stored");

        LedgerMovement stored = ledger.getMovements().get(0);
        assertEquals(MovementDirection.RECEIPT, stored.getDirection());
        assertEquals(new BigDecimal("1000.50"), stored.getAmount());
        assertEquals(LocalDate.of(2024, 3, 1), stored.getPaymentDate());
        assertEquals("2024001", stored.getVariableSymbol());
        assertTrue(stored.getInternalNote().endsWith("#ABO_000001_2000145399#"));

        ImportResult second = engine().importFile(statementFile);
        System.out.println("Second run: " + second.getMessage());

        assertEquals(ImportStatus.SUCCESS, second.getStatus(), "Second run should still succeed");
        assertEquals("Import successful: 0 imported, 1 skipped", second.getMessage());
        assertEquals(1, ledger.getMovements().size(), "No second movement should be stored");

        TransactionOutcome skipped = second.getSkippedTransactions().get(0);
        assertEquals("ABO_000001_2000145399", skipped.getIdentity());
        assertEquals("duplicate", skipped.getReason());
        assertEquals(new ResultMetrics(1, 0, 0, 1, 0L), second.getMetrics());

        printSuccess("Transaction stored once across two runs");
    }

    @Test
    @DisplayName("Missing file ends with ERROR and empty metrics")
    void testMissingFile() {
        printTestHeader("Missing File");

        Path missing = tempDir.resolve("missing.abo");
        ImportResult result = engine().importFile(missing);

        assertEquals(ImportStatus.ERROR, result.getStatus());
        assertEquals("Statement file not found: " + missing, result.getMessage());
        assertEquals(ResultMetrics.EMPTY, result.getMetrics());
        assertEquals(missing.toString(), result.getFilePath());
        assertEquals(OffsetDateTime.parse("2024-05-20T08:00:00Z"), result.getTimestamp());
        assertEquals(0, ledger.getClientsCreated(), "Ledger should not be contacted");

        printSuccess("Missing file reported without touching the ledger");
    }

    @Test
    @DisplayName("Parser failure ends with ERROR and nothing is written")
    void testParseFailure() {
        printTestHeader("Parse Failure");

        ImportResult result = engine(file -> {
            throw new StatementParseException("Cannot parse statement " + file + ": unexpected end of input");
        }).importFile(statementFile);

        assertEquals(ImportStatus.ERROR, result.getStatus());
        assertTrue(result.getMessage().startsWith("Fatal error during import: Cannot parse statement"),
                "Message should carry the parser error");
        assertTrue(ledger.getMovements().isEmpty());

        printSuccess("Parse failure reported at file level");
    }

    @Test
    @DisplayName("Failed duplicate check fails the transaction and nothing is written for it")
    void testDuplicateCheckFailureIsNotTreatedAsNotFound() {
        printTestHeader("Duplicate Check Failure");

        transactions = List.of(transaction("000001", "10.00"), transaction("000002", "20.00"));
        ledger.failQueries();

        ImportResult result = engine().importFile(statementFile);

        assertEquals(ImportStatus.ERROR, result.getStatus());
        assertEquals("Import failed: 2 errors, no transactions imported", result.getMessage());
        assertEquals(2, result.getFailedTransactions().size(), "Loop should continue after the first failure");
        assertTrue(result.getFailedTransactions().get(0).getReason()
                .startsWith("Error fetching records for transaction check"));
        assertTrue(ledger.getMovements().isEmpty(), "Nothing should be written when the check fails");
        assertEquals(2.0, meterRegistry.counter("statement.duplicate_check.failures").count());

        printSuccess("Unverifiable transactions were not written");
    }

    @Test
    @DisplayName("Rejected commit fails the transaction")
    void testRejectedCommit() {
        printTestHeader("Rejected Commit");

        transactions = List.of(transaction("000001", "10.00"));
        ledger.rejectConfirms();

        ImportResult result = engine().importFile(statementFile);

        assertEquals(ImportStatus.ERROR, result.getStatus());
        assertEquals("failed to commit", result.getFailedTransactions().get(0).getReason());
        assertEquals(new ResultMetrics(1, 0, 1, 0, 0L), result.getMetrics());

        printSuccess("Rejected commit counted as error");
    }

    @Test
    @DisplayName("Exception on one transaction does not stop the others")
    void testExceptionIsIsolatedToOneTransaction() {
        printTestHeader("Exception Isolation");

        transactions = List.of(
                transaction("000001", "10.00"),
                transaction("000002", "-20.00"),
                transaction("000003", "30.00"));
        ledger.throwOnSubmit("#ABO_000002_2000145399#");

        ImportResult result = engine().importFile(statementFile);

        assertEquals(ImportStatus.WARNING, result.getStatus());
        assertEquals("Import completed with issues: 2 imported, 1 errors, 0 skipped", result.getMessage());
        assertEquals(List.of("000001", "000003"), result.getImportedTransactions().stream()
                .map(TransactionOutcome::getDocumentNumber).toList(), "File order should be preserved");

        TransactionOutcome failed = result.getFailedTransactions().get(0);
        assertEquals("000002", failed.getDocumentNumber());
        assertEquals("Ledger connection reset", failed.getReason());
        assertEquals(2, ledger.getMovements().size());

        printSuccess("Remaining transactions imported after a failure");
    }

    @Test
    @DisplayName("Transaction without amount is refused by the ledger and reported as failed")
    void testTransactionWithoutAmount() {
        printTestHeader("Transaction Without Amount");

        transactions = List.of(transaction("000001", null));
        ledger.rejectSubmits();

        ImportResult result = engine().importFile(statementFile);

        TransactionOutcome failed = result.getFailedTransactions().get(0);
        assertNull(failed.getAmount());
        assertEquals(LocalDate.of(2024, 3, 1), failed.getDate());
        assertEquals("failed to commit", failed.getReason());

        printSuccess("Missing amount reported as failure");
    }

    @Test
    @DisplayName("Mixed run keeps counts consistent with the transaction list")
    void testCountsAddUp() {
        printTestHeader("Counts Add Up");

        transactions = List.of(transaction("000001", "10.00"));
        engine().importFile(statementFile);

        transactions = List.of(
                transaction("000001", "10.00"),
                transaction("000002", "20.00"),
                transaction("000003", "30.00"));
        ledger.throwOnSubmit("#ABO_000003_2000145399#");

        ImportResult result = engine().importFile(statementFile);
        ResultMetrics metrics = result.getMetrics();

        assertEquals(3, metrics.getTotalTransactions());
        assertEquals(metrics.getTotalTransactions(),
                metrics.getImportedCount() + metrics.getErrorCount() + metrics.getSkippedCount());
        assertEquals(new ResultMetrics(3, 1, 1, 1, 0L), metrics);
        assertEquals(ImportStatus.WARNING, result.getStatus());
        assertEquals(1.0, meterRegistry.counter("statement.transactions", "outcome", "skipped").count());

        printSuccess("Imported, skipped and failed add up to the total");
    }

    @Test
    @DisplayName("Empty statement is a success")
    void testEmptyStatement() {
        ImportResult result = engine().importFile(statementFile);

        assertEquals(ImportStatus.SUCCESS, result.getStatus());
        assertEquals("Import successful: 0 imported, 0 skipped", result.getMessage());
        assertEquals(ResultMetrics.EMPTY, result.getMetrics());
    }

    @Test
    void testDescribeFallsBackToExceptionType() {
        assertEquals("boom", ImportEngine.describe(new IllegalStateException("boom")));
        assertEquals("NullPointerException", ImportEngine.describe(new NullPointerException()));
    }
}
