package com.flagship.statement_importer.ledger;

/**
 * Creates independent ledger clients. Each call returns a client with no staged state.
 */
@FunctionalInterface
public interface LedgerClientFactory {

    LedgerClient newClient();
}
