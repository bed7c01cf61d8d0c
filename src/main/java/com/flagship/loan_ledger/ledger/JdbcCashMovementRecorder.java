package com.flagship.loan_ledger.ledger;

import com.flagship.loan_ledger.loan.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Posts loan cash movements to the {@code cash_transactions} table.
 *
 * Runs inside the caller's transaction, so a loan payment and its cash
 * movement commit or roll back together.
 */
@Service
@Slf4j
public class JdbcCashMovementRecorder implements CashMovementRecorder {

    private final JdbcTemplate jdbcTemplate;

    public JdbcCashMovementRecorder(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public FundsCheck checkFunds(Account account, BigDecimal amount) {
        return FundsCheck.of(account, amount);
    }

    @Override
    @Transactional
    public UUID postTransaction(CashMovement movement) {
        validateAccountExists(movement);

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO cash_transactions (id, tenant_id, account_id, txn_date, amount, description, " +
            "loan_id, loan_payment_id, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            transactionId,
            movement.getTenantId(),
            movement.getAccountId(),
            movement.getDate(),
            movement.getAmount(),
            movement.getDescription(),
            movement.getLoanId(),
            movement.getLoanPaymentId()
        );
        log.info("Posted cash transaction {} on account {}: amount={}",
            transactionId, movement.getAccountId(), movement.getAmount());
        return transactionId;
    }

    @Override
    @Transactional
    public int removeForLoanPayment(UUID loanPaymentId) {
        int removed = jdbcTemplate.update("DELETE FROM cash_transactions WHERE loan_payment_id = ?", loanPaymentId);
        log.debug("Removed {} cash transaction(s) for loan payment {}", removed, loanPaymentId);
        return removed;
    }

    @Override
    public Optional<CashMovement> findDisbursement(UUID loanId) {
        List<CashMovement> movements = jdbcTemplate.query(
            "SELECT tenant_id, account_id, amount, txn_date, description, loan_id FROM cash_transactions " +
            "WHERE loan_id = ? AND loan_payment_id IS NULL",
            (rs, rowNum) -> CashMovement.disbursement(
                UUID.fromString(rs.getString("tenant_id")),
                UUID.fromString(rs.getString("account_id")),
                rs.getBigDecimal("amount"),
                rs.getDate("txn_date").toLocalDate(),
                rs.getString("description"),
                UUID.fromString(rs.getString("loan_id"))
            ),
            loanId
        );
        return movements.stream().findFirst();
    }

    @Override
    @Transactional
    public int removeDisbursement(UUID loanId) {
        int removed = jdbcTemplate.update(
            "DELETE FROM cash_transactions WHERE loan_id = ? AND loan_payment_id IS NULL", loanId);
        log.debug("Removed {} disbursement transaction(s) for loan {}", removed, loanId);
        return removed;
    }

    private void validateAccountExists(CashMovement movement) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE id = ? AND tenant_id = ?",
            Integer.class,
            movement.getAccountId(),
            movement.getTenantId()
        );
        if (count == null || count == 0) {
            throw ResourceNotFoundException.account(movement.getAccountId());
        }
    }
}
