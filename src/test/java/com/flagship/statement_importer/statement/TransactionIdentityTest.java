package com.flagship.statement_importer.statement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TransactionIdentityTest {

    @Test
    @DisplayName("Identity is built from document and account number")
    void testIdentityFormat() {
        ParsedTransaction transaction = ParsedTransaction.builder()
                .documentNumber("000123")
                .accountNumber("19-2000145399")
                .amount(new BigDecimal("10.00"))
                .build();

        TransactionIdentity identity = TransactionIdentity.of(transaction);

        assertEquals("ABO_000123_19-2000145399", identity.getValue());
        assertEquals("#ABO_000123_19-2000145399#", identity.wrapped());
        assertEquals("ABO_000123_19-2000145399", identity.toString());
    }

    @Test
    @DisplayName("Identity is stable and ignores every other field")
    void testDeterminism() {
        ParsedTransaction first = ParsedTransaction.builder()
                .documentNumber("42").accountNumber("1001").amount(BigDecimal.ONE).additionalInfo("a")
                .build();
        ParsedTransaction second = ParsedTransaction.builder()
                .documentNumber("42").accountNumber("1001").amount(BigDecimal.TEN).additionalInfo("b")
                .build();

        assertEquals(TransactionIdentity.of(first), TransactionIdentity.of(first));
        assertEquals(TransactionIdentity.of(first), TransactionIdentity.of(second));
    }

    @Test
    @DisplayName("Different document or account number gives a different identity")
    void testDistinctIdentities() {
        assertNotEquals(TransactionIdentity.of("1", "2"), TransactionIdentity.of("11", "2"));
        assertNotEquals(TransactionIdentity.of("1", "2"), TransactionIdentity.of("1", "3"));
    }

    @Test
    @DisplayName("Missing fields give a degenerate but deterministic identity")
    void testMissingFields() {
        TransactionIdentity identity = TransactionIdentity.of(ParsedTransaction.builder().build());

        assertEquals("ABO__", identity.getValue());
        assertEquals(identity, TransactionIdentity.of(null, null));
    }

    @Test
    @DisplayName("Identity is recovered from a note and only matches its own wrapped form")
    void testNoteRoundTrip() {
        TransactionIdentity identity = TransactionIdentity.of("1", "2");
        String note = "Automatic Import: statement-importer 0.1.0 job 77 " + identity.wrapped();

        assertEquals(Optional.of(identity), TransactionIdentity.fromNote(note));
        assertTrue(identity.isCarriedBy(note));
        assertFalse(identity.isCarriedBy("Automatic Import: x 1 job n/a #ABO_11_2#"));
        assertFalse(identity.isCarriedBy(null));
    }

    @Test
    @DisplayName("Marker characters elsewhere in the note do not hide the identity")
    void testNoteWithStrayMarkers() {
        TransactionIdentity identity = TransactionIdentity.of("000001", "2000145399");

        assertEquals(Optional.of(identity), TransactionIdentity.fromNote(
                "Automatic Import: statement-importer 0.1.0 job #42 #ABO_000001_2000145399#"));
        assertEquals(Optional.of(identity), TransactionIdentity.fromNote(
                "#manual# correction of #ABO_000001_2000145399#"));
        assertEquals("job 42", TransactionIdentity.stripMarkers("job #42#"));
    }

    @Test
    @DisplayName("Notes without a wrapped token carry no identity")
    void testNoteWithoutIdentity() {
        assertTrue(TransactionIdentity.fromNote(null).isEmpty());
        assertTrue(TransactionIdentity.fromNote("").isEmpty());
        assertTrue(TransactionIdentity.fromNote("manual entry").isEmpty());
        assertTrue(TransactionIdentity.fromNote("half # marker").isEmpty());
        assertTrue(TransactionIdentity.fromNote("#manual entry#").isEmpty());
    }
}
