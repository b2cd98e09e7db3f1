package com.flagship.statement_importer.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.util.List;
import java.util.Optional;

/**
 * Ledger client backed by the {@code bank_movements} table.
 *
 * A movement is staged by {@link #submit} and written by {@link #confirm} inside
 * a single database transaction. Not thread-safe; one instance per writer.
 */
@Slf4j
public class JdbcLedgerClient implements LedgerClient {

    private static final char LIKE_ESCAPE = '!';

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    private LedgerMovement staged;

    public JdbcLedgerClient(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public LedgerQuery query(String noteFragment, String label) {
        return new LedgerQuery(noteFragment, label);
    }

    @Override
    public Optional<List<LedgerRecord>> list(LedgerQuery query) {
        try {
            List<LedgerRecord> records = jdbcTemplate.query(
                "SELECT id, int_note FROM bank_movements WHERE int_note LIKE ? ESCAPE '!' ORDER BY id",
                ledgerRecordRowMapper(),
                "%" + escapeLike(query.getNoteFragment()) + "%"
            );
            log.debug("Query [{}] returned {} records", query.getLabel(), records.size());
            return Optional.of(records);
        } catch (DataAccessException e) {
            log.error("Query [{}] failed: {}", query.getLabel(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean submit(LedgerMovement movement) {
        if (movement.getAmount() == null) {
            log.warn("Refusing movement without amount: {}", movement.getInternalNote());
            return false;
        }
        if (movement.getDirection() == null || movement.getPaymentDate() == null) {
            log.warn("Refusing incomplete movement: {}", movement.getInternalNote());
            return false;
        }
        staged = movement;
        return true;
    }

    @Override
    public boolean confirm() {
        LedgerMovement movement = staged;
        staged = null;
        if (movement == null) {
            return false;
        }
        Integer inserted = transactionTemplate.execute(status -> insert(movement));
        return inserted != null && inserted == 1;
    }

    private int insert(LedgerMovement movement) {
        CounterParty counterParty = movement.getCounterParty();
        return jdbcTemplate.update(
            "INSERT INTO bank_movements (direction, date_payment, date_statement, description, int_note, amount, " +
            "counter_account, counter_bank_code, counter_name, sym_var, sym_const, sym_spec, account_code) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            movement.getDirection().getLedgerName(),
            Date.valueOf(movement.getPaymentDate()),
            movement.getStatementDate() != null ? Date.valueOf(movement.getStatementDate()) : null,
            movement.getText(),
            movement.getInternalNote(),
            movement.getAmount(),
            counterParty != null ? counterParty.getAccountNumber() : null,
            counterParty != null ? counterParty.getBankCode() : null,
            counterParty != null ? counterParty.getName() : null,
            movement.getVariableSymbol(),
            movement.getConstantSymbol(),
            movement.getSpecificSymbol(),
            movement.getTargetAccountCode()
        );
    }

    static String escapeLike(String fragment) {
        StringBuilder escaped = new StringBuilder(fragment.length() + 8);
        for (char c : fragment.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private RowMapper<LedgerRecord> ledgerRecordRowMapper() {
        return (rs, rowNum) -> new LedgerRecord(
            rs.getLong("id"),
            rs.getString("int_note")
        );
    }
}
