package com.flagship.statement_importer.statement;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One bank transaction as produced by the statement parser.
 *
 * Optional fields are null when the statement does not carry them.
 * The amount is signed: positive amounts are inbound payments.
 */
@Value
@Builder
public class ParsedTransaction {
    String documentNumber;
    String accountNumber;
    String counterAccount;
    String counterBankCode;
    BigDecimal amount;
    LocalDate valuationDate;
    LocalDate dueDate;
    String variableSymbol;
    String constantSymbol;
    String specificSymbol;
    String additionalInfo;
    String dataType;
}
