package com.flagship.statement_importer.statement;

import lombok.Value;

import java.util.List;

/**
 * Output of the statement parser for a single file.
 * Transactions are kept in the order they appear in the file.
 */
@Value
public class ParsedStatement {
    String formatVersion;
    int statementCount;
    List<ParsedTransaction> transactions;

    public static ParsedStatement of(String formatVersion, int statementCount,
                                     List<ParsedTransaction> transactions) {
        return new ParsedStatement(formatVersion, statementCount, List.copyOf(transactions));
    }
}
