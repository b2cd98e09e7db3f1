package com.flagship.statement_importer.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@RequiredArgsConstructor
public class JdbcLedgerClientFactory implements LedgerClientFactory {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    @Override
    public LedgerClient newClient() {
        return new JdbcLedgerClient(jdbcTemplate, transactionTemplate);
    }
}
