package com.flagship.statement_importer.ledger;

/**
 * Direction of a bank movement in the ledger.
 * The amount sent to the ledger is always positive, the direction carries the sign.
 */
public enum MovementDirection {
    RECEIPT("receipt"),
    EXPENSE("expense");

    private final String ledgerName;

    MovementDirection(String ledgerName) {
        this.ledgerName = ledgerName;
    }

    public String getLedgerName() {
        return ledgerName;
    }
}
