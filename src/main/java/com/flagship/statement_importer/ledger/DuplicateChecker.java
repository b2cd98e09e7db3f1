package com.flagship.statement_importer.ledger;

import com.flagship.statement_importer.statement.TransactionIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Tells whether a transaction identity has already been recorded in the ledger.
 *
 * Every lookup runs on its own freshly created client, so a lookup can never
 * touch a movement that is staged on the client used for writing.
 *
 * The ledger is searched for notes containing {@code #identity#}. The markers keep
 * {@code ABO_1_2} from matching a stored {@code ABO_11_2}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DuplicateChecker {

    private final LedgerClientFactory clientFactory;

    /**
     * @return true if a movement carrying this identity exists
     * @throws DuplicateCheckException if the ledger query could not be executed
     */
    public boolean exists(TransactionIdentity identity) {
        LedgerClient checker = clientFactory.newClient();
        LedgerQuery query = checker.query(identity.wrapped(), "TransactionID: " + identity);

        List<LedgerRecord> found = checker.list(query)
                .orElseThrow(() -> new DuplicateCheckException(
                        "Error fetching records for transaction check: " + identity));

        boolean present = found.stream().anyMatch(record -> identity.isCarriedBy(record.getInternalNote()));
        if (present) {
            log.debug("Identity {} already present in ledger ({} matching records)", identity, found.size());
        }
        return present;
    }
}
