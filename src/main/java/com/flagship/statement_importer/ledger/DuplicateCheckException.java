package com.flagship.statement_importer.ledger;

/**
 * The ledger could not tell whether a transaction was already imported.
 * Never to be read as "not found".
 */
public class DuplicateCheckException extends RuntimeException {

    public DuplicateCheckException(String message) {
        super(message);
    }
}
