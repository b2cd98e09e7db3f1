package com.flagship.statement_importer.statement;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads statements that were already parsed by the external ABO parser and
 * exported as JSON.
 *
 * Expected document:
 * <pre>
 * {
 *   "format_version": "...",
 *   "statement_count": 1,
 *   "transactions": [ { "document_number": "...", "amount": 1000.50, ... } ]
 * }
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonStatementParser implements StatementParser {

    private final ObjectMapper objectMapper;

    @Override
    public ParsedStatement parse(Path file) {
        StatementDocument document;
        try (InputStream in = Files.newInputStream(file)) {
            document = objectMapper.readValue(in, StatementDocument.class);
        } catch (IOException e) {
            throw new StatementParseException("Cannot parse statement " + file + ": " + e.getMessage(), e);
        }
        if (document == null || document.getTransactions() == null) {
            throw new StatementParseException("Statement " + file + " contains no transaction list");
        }

        List<ParsedTransaction> transactions = new ArrayList<>(document.getTransactions().size());
        for (TransactionRecord record : document.getTransactions()) {
            if (record == null) {
                throw new StatementParseException("Statement " + file + " contains an empty transaction entry");
            }
            transactions.add(record.toTransaction());
        }

        log.debug("Read {} transactions from {}", transactions.size(), file);
        return ParsedStatement.of(document.getFormatVersion(), document.getStatementCount(), transactions);
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class StatementDocument {
        @JsonProperty("format_version")
        private String formatVersion;

        @JsonProperty("statement_count")
        private int statementCount;

        @JsonProperty("transactions")
        private List<TransactionRecord> transactions;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TransactionRecord {
        @JsonProperty("document_number")
        private String documentNumber;

        @JsonProperty("account_number")
        private String accountNumber;

        @JsonProperty("counter_account")
        private String counterAccount;

        @JsonProperty("counter_bank_code")
        private String counterBankCode;

        @JsonProperty("amount")
        private BigDecimal amount;

        @JsonProperty("valuation_date")
        private LocalDate valuationDate;

        @JsonProperty("due_date")
        private LocalDate dueDate;

        @JsonProperty("variable_symbol")
        private String variableSymbol;

        @JsonProperty("constant_symbol")
        private String constantSymbol;

        @JsonProperty("specific_symbol")
        private String specificSymbol;

        @JsonProperty("additional_info")
        private String additionalInfo;

        @JsonProperty("data_type")
        private String dataType;

        ParsedTransaction toTransaction() {
            return ParsedTransaction.builder()
                    .documentNumber(documentNumber)
                    .accountNumber(accountNumber)
                    .counterAccount(counterAccount)
                    .counterBankCode(counterBankCode)
                    .amount(amount)
                    .valuationDate(valuationDate)
                    .dueDate(dueDate)
                    .variableSymbol(variableSymbol)
                    .constantSymbol(constantSymbol)
                    .specificSymbol(specificSymbol)
                    .additionalInfo(additionalInfo)
                    .dataType(dataType)
                    .build();
        }
    }
}
