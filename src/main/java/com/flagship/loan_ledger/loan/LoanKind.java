package com.flagship.loan_ledger.loan;

import java.math.BigDecimal;

/**
 * Direction of a loan from the tenant's point of view.
 *
 * Only the cash movements depend on the kind. The amortization and balance
 * math is the same for both.
 */
public enum LoanKind {
    /**
     * Money borrowed. Disbursement adds cash, repayments remove it.
     */
    PAYABLE,

    /**
     * Money lent. Disbursement removes cash, repayments add it.
     */
    RECEIVABLE;

    /**
     * Signed cash effect of paying out or receiving the principal.
     */
    public BigDecimal disbursementCashEffect(BigDecimal principal) {
        return this == PAYABLE ? principal : principal.negate();
    }

    /**
     * Signed cash effect of a repayment.
     */
    public BigDecimal repaymentCashEffect(BigDecimal total) {
        return this == PAYABLE ? total.negate() : total;
    }

    /**
     * Whether a repayment takes money out of the selected cash account.
     */
    public boolean repaymentDrawsCash() {
        return this == PAYABLE;
    }
}
