package com.flagship.statement_importer.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A bank movement as submitted to the ledger.
 *
 * A new instance is built for every transaction. Optional parts are null when
 * they must be omitted; the ledger treats an omitted symbol differently from an
 * empty one, so empty strings are never stored here.
 */
@Value
@Builder
public class LedgerMovement {
    MovementDirection direction;
    LocalDate paymentDate;
    LocalDate statementDate;
    String text;
    String internalNote;
    BigDecimal amount;
    CounterParty counterParty;
    String variableSymbol;
    String constantSymbol;
    String specificSymbol;
    String targetAccountCode;
}
