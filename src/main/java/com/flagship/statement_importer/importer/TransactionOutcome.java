package com.flagship.statement_importer.importer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * What happened to one transaction during an import.
 *
 * The reason is set for skipped and failed outcomes only.
 */
@Value
public class TransactionOutcome {
    Kind kind;
    String identity;
    String documentNumber;
    BigDecimal amount;
    LocalDate date;
    String reason;

    public enum Kind {
        IMPORTED,
        SKIPPED,
        FAILED
    }

    public static TransactionOutcome imported(String identity, String documentNumber,
                                              BigDecimal amount, LocalDate date) {
        return new TransactionOutcome(Kind.IMPORTED, identity, documentNumber, amount, date, null);
    }

    public static TransactionOutcome skipped(String identity, String documentNumber,
                                             BigDecimal amount, LocalDate date, String reason) {
        return new TransactionOutcome(Kind.SKIPPED, identity, documentNumber, amount, date, reason);
    }

    public static TransactionOutcome failed(String identity, String documentNumber,
                                            BigDecimal amount, LocalDate date, String reason) {
        return new TransactionOutcome(Kind.FAILED, identity, documentNumber, amount, date, reason);
    }
}
