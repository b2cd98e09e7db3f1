package com.flagship.statement_importer.ledger;

import lombok.Value;

/**
 * Counter-party block of a movement. The name is optional.
 */
@Value
public class CounterParty {
    String accountNumber;
    String bankCode;
    String name;
}
