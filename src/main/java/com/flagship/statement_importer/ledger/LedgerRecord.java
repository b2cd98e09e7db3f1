package com.flagship.statement_importer.ledger;

import lombok.Value;

/**
 * A movement already stored in the ledger, as returned by a listing.
 */
@Value
public class LedgerRecord {
    long id;
    String internalNote;
}
