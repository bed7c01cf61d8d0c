package com.flagship.loan_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A tenant's cash account as seen by the loan engine.
 * {@code balance} is derived from the opening balance and the posted cash
 * movements at read time; it is not a stored column.
 */
@Value
public class Account {
    UUID id;
    UUID tenantId;
    String name;
    AccountType accountType;
    BigDecimal creditLimit;
    BigDecimal balance;

    public enum AccountType {
        BANK,
        CASH,
        CREDIT
    }

    public boolean isCredit() {
        return accountType == AccountType.CREDIT;
    }

    /**
     * Same account with the given amount added back, e.g. a payment that is
     * about to be replaced.
     */
    public Account withBalanceAdjustedBy(BigDecimal amount) {
        return new Account(id, tenantId, name, accountType, creditLimit, balance.add(amount));
    }
}
