package com.flagship.statement_importer.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Connection to the accounting ledger.
 *
 * Instances hold state between {@link #submit} and {@link #confirm} and are not
 * shared between threads. Obtain them from a {@link LedgerClientFactory}.
 */
public interface LedgerClient {

    /**
     * Prepares a listing of movements whose internal note contains the fragment.
     */
    LedgerQuery query(String noteFragment, String label);

    /**
     * Executes a listing.
     *
     * @return the matching records, possibly none; an empty Optional when the
     *         query could not be executed at all
     */
    Optional<List<LedgerRecord>> list(LedgerQuery query);

    /**
     * Stages a movement for the next {@link #confirm()}.
     *
     * @return false if the ledger refuses the movement
     */
    boolean submit(LedgerMovement movement);

    /**
     * Commits the staged movement. Staged state is cleared whatever the outcome.
     *
     * @return false if nothing could be committed
     */
    boolean confirm();
}
