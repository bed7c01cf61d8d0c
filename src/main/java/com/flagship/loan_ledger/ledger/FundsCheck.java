package com.flagship.loan_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of checking whether an account can cover an outgoing amount.
 *
 * Credit accounts may spend up to their limit: available = creditLimit + balance
 * (the balance is negative while owing). Bank and cash accounts may not go
 * negative: available = balance.
 */
@Value
public class FundsCheck {
    boolean hasFunds;
    BigDecimal available;
    String availableLabel;

    public static FundsCheck of(Account account, BigDecimal amount) {
        if (account.isCredit()) {
            BigDecimal limit = account.getCreditLimit() != null ? account.getCreditLimit() : BigDecimal.ZERO;
            BigDecimal available = limit.add(account.getBalance());
            return new FundsCheck(available.compareTo(amount) >= 0, available, "Available credit");
        }
        BigDecimal available = account.getBalance();
        return new FundsCheck(available.compareTo(amount) >= 0, available, "Available");
    }
}
