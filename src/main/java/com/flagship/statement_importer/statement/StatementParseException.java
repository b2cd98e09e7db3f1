package com.flagship.statement_importer.statement;

/**
 * Raised when a statement file cannot be parsed. Fatal for that file only.
 */
public class StatementParseException extends RuntimeException {

    public StatementParseException(String message) {
        super(message);
    }

    public StatementParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
