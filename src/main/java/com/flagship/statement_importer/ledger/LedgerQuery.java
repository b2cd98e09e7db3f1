package com.flagship.statement_importer.ledger;

import lombok.Value;

/**
 * Prepared listing of ledger movements whose internal note contains a fragment.
 * The label only identifies the query in logs.
 */
@Value
public class LedgerQuery {
    String noteFragment;
    String label;
}
