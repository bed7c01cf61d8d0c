package com.flagship.loan_ledger.ledger;

import com.flagship.loan_ledger.loan.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Cash accounts owned by a tenant.
 *
 * Balances are derived, not stored: opening balance plus the sum of every
 * cash transaction posted to the account.
 */
@Service
@Slf4j
public class AccountService {

    private static final String SELECT_ACCOUNT =
        "SELECT a.id, a.tenant_id, a.name, a.account_type, a.credit_limit, " +
        "       a.opening_balance + COALESCE((SELECT SUM(t.amount) FROM cash_transactions t " +
        "                                     WHERE t.account_id = a.id), 0) AS balance " +
        "FROM accounts a ";

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public UUID createAccount(UUID tenantId, String name, Account.AccountType accountType,
                              BigDecimal creditLimit, BigDecimal openingBalance) {
        if (accountType == Account.AccountType.CREDIT && creditLimit != null && creditLimit.signum() < 0) {
            throw new IllegalArgumentException("Credit limit must not be negative");
        }
        UUID accountId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO accounts (id, tenant_id, name, account_type, credit_limit, opening_balance, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            accountId,
            tenantId,
            name,
            accountType.name(),
            creditLimit != null ? creditLimit : BigDecimal.ZERO,
            openingBalance != null ? openingBalance : BigDecimal.ZERO
        );
        log.info("Created {} account {} for tenant {}", accountType, accountId, tenantId);
        return accountId;
    }

    public Optional<Account> findById(UUID accountId) {
        List<Account> accounts = jdbcTemplate.query(SELECT_ACCOUNT + "WHERE a.id = ?", accountRowMapper(), accountId);
        return accounts.stream().findFirst();
    }

    /**
     * Loads an account and checks it belongs to the tenant.
     *
     * @throws ResourceNotFoundException if missing or owned by another tenant
     */
    public Account getForTenant(UUID tenantId, UUID accountId) {
        return findById(accountId)
            .filter(account -> account.getTenantId().equals(tenantId))
            .orElseThrow(() -> ResourceNotFoundException.account(accountId));
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("tenant_id")),
            rs.getString("name"),
            Account.AccountType.valueOf(rs.getString("account_type")),
            rs.getBigDecimal("credit_limit"),
            rs.getBigDecimal("balance")
        );
    }
}
