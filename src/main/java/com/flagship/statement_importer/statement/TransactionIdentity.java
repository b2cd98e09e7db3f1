package com.flagship.statement_importer.statement;

import lombok.Value;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Idempotency key of a bank transaction.
 *
 * The identity is derived from the document number and the account number only,
 * so the same statement line always yields the same key. It is persisted inside the
 * ledger's internal note wrapped in '#' markers, which lets it be found again with a
 * substring filter and extracted from arbitrary note text.
 *
 * Missing fields are rendered as empty strings. Such identities are degenerate
 * (e.g. "ABO__") but still deterministic.
 */
@Value
public class TransactionIdentity {

    private static final String PREFIX = "ABO_";
    private static final char MARKER = '#';
    private static final Pattern WRAPPED = Pattern.compile("#(" + PREFIX + "[^#]*)#");

    String value;

    public static TransactionIdentity of(ParsedTransaction transaction) {
        return of(transaction.getDocumentNumber(), transaction.getAccountNumber());
    }

    public static TransactionIdentity of(String documentNumber, String accountNumber) {
        return new TransactionIdentity(PREFIX + nullToEmpty(documentNumber) + "_" + nullToEmpty(accountNumber));
    }

    /**
     * Extracts the identity carried by a ledger note, if there is one.
     * Only the first wrapped token that starts with the identity prefix is considered.
     */
    public static Optional<TransactionIdentity> fromNote(String note) {
        if (note == null || note.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = WRAPPED.matcher(note);
        if (matcher.find()) {
            return Optional.of(new TransactionIdentity(matcher.group(1)));
        }
        return Optional.empty();
    }

    /**
     * Removes the '#' marker from free text written next to a wrapped identity.
     */
    public static String stripMarkers(String text) {
        return text == null ? null : text.replace(String.valueOf(MARKER), "");
    }

    /**
     * The form stored in the ledger note: {@code #<identity>#}.
     */
    public String wrapped() {
        return MARKER + value + MARKER;
    }

    /**
     * Whether the given note contains this identity in its wrapped form.
     */
    public boolean isCarriedBy(String note) {
        return note != null && note.contains(wrapped());
    }

    @Override
    public String toString() {
        return value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
