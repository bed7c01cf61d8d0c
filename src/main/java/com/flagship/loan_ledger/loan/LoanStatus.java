package com.flagship.loan_ledger.loan;

import java.math.BigDecimal;

/**
 * Loan status derived from the projected remaining balance. Never stored.
 */
public enum LoanStatus {
    ACTIVE,
    PAID_OFF;

    public static LoanStatus fromRemainingBalance(BigDecimal remainingBalance) {
        return remainingBalance.signum() > 0 ? ACTIVE : PAID_OFF;
    }
}
