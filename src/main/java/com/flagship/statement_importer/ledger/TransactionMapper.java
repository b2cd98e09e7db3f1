package com.flagship.statement_importer.ledger;

import com.flagship.statement_importer.config.ImporterSettings;
import com.flagship.statement_importer.statement.ParsedTransaction;
import com.flagship.statement_importer.statement.TransactionIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates a parsed bank transaction into a ledger movement.
 *
 * Rules:
 * - direction is RECEIPT only for strictly positive amounts, the amount is sent unsigned
 * - payment and statement date: valuation date, then due date, then today
 * - description parts are joined in a fixed order with " | "
 * - the internal note carries the wrapped identity and must reach the ledger untouched
 * - optional blocks are left out rather than sent empty
 */
@Component
@RequiredArgsConstructor
public class TransactionMapper {

    static final String DESCRIPTION_SEPARATOR = " | ";
    static final String FALLBACK_DESCRIPTION = "Bank transaction from ABO import";

    private final ImporterSettings settings;
    private final Clock clock;

    public LedgerMovement map(ParsedTransaction transaction) {
        TransactionIdentity identity = TransactionIdentity.of(transaction);
        LocalDate date = resolveDate(transaction);
        BigDecimal amount = transaction.getAmount();

        return LedgerMovement.builder()
                .direction(directionOf(amount))
                .paymentDate(date)
                .statementDate(date)
                .text(describe(transaction))
                .internalNote(internalNote(identity))
                .amount(amount != null ? amount.abs() : null)
                .counterParty(counterParty(transaction))
                .variableSymbol(emptyToNull(transaction.getVariableSymbol()))
                .constantSymbol(emptyToNull(transaction.getConstantSymbol()))
                .specificSymbol(emptyToNull(transaction.getSpecificSymbol()))
                .targetAccountCode(emptyToNull(settings.getTargetAccountCode()))
                .build();
    }

    /**
     * Date the movement is booked on. Falls back to the current date when the
     * statement has neither a valuation nor a due date.
     */
    public LocalDate resolveDate(ParsedTransaction transaction) {
        if (transaction.getValuationDate() != null) {
            return transaction.getValuationDate();
        }
        if (transaction.getDueDate() != null) {
            return transaction.getDueDate();
        }
        return LocalDate.now(clock);
    }

    static MovementDirection directionOf(BigDecimal amount) {
        return amount != null && amount.signum() > 0 ? MovementDirection.RECEIPT : MovementDirection.EXPENSE;
    }

    String describe(ParsedTransaction transaction) {
        List<String> parts = new ArrayList<>(3);
        if (hasText(transaction.getAdditionalInfo())) {
            parts.add(transaction.getAdditionalInfo());
        }
        if (hasText(transaction.getCounterAccount())) {
            parts.add("Counter account: " + transaction.getCounterAccount());
        }
        if (hasText(transaction.getDataType())) {
            parts.add("Type: " + transaction.getDataType());
        }
        return parts.isEmpty() ? FALLBACK_DESCRIPTION : String.join(DESCRIPTION_SEPARATOR, parts);
    }

    String internalNote(TransactionIdentity identity) {
        return String.format("Automatic Import: %s %s job %s %s",
                TransactionIdentity.stripMarkers(settings.getApplicationName()),
                TransactionIdentity.stripMarkers(settings.getApplicationVersion()),
                hasText(settings.getJobId()) ? TransactionIdentity.stripMarkers(settings.getJobId()) : "n/a",
                identity.wrapped());
    }

    private CounterParty counterParty(ParsedTransaction transaction) {
        if (!hasText(transaction.getCounterAccount())) {
            return null;
        }
        String bankCode = hasText(transaction.getCounterBankCode())
                ? transaction.getCounterBankCode()
                : settings.getDefaultBankCode();
        String name = hasText(transaction.getAdditionalInfo()) ? transaction.getAdditionalInfo() : null;
        return new CounterParty(transaction.getCounterAccount(), bankCode, name);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    private static String emptyToNull(String value) {
        return hasText(value) ? value : null;
    }
}
