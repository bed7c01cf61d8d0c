package com.flagship.loan_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A signed cash movement on one account: positive adds cash, negative removes it.
 * The offsetting side is the loan itself, whose balance is projected from
 * its payments.
 */
@Value
public class CashMovement {
    UUID tenantId;
    UUID accountId;
    BigDecimal amount;
    LocalDate date;
    String description;
    UUID loanId;
    UUID loanPaymentId;

    private CashMovement(UUID tenantId, UUID accountId, BigDecimal amount, LocalDate date,
                         String description, UUID loanId, UUID loanPaymentId) {
        this.tenantId = Objects.requireNonNull(tenantId);
        this.accountId = Objects.requireNonNull(accountId);
        this.amount = Objects.requireNonNull(amount);
        if (amount.signum() == 0) {
            throw new IllegalArgumentException("Cash movement amount must not be zero");
        }
        this.date = Objects.requireNonNull(date);
        this.description = description;
        this.loanId = loanId;
        this.loanPaymentId = loanPaymentId;
    }

    public static CashMovement disbursement(UUID tenantId, UUID accountId, BigDecimal amount, LocalDate date,
                                            String description, UUID loanId) {
        return new CashMovement(tenantId, accountId, amount, date, description, loanId, null);
    }

    public static CashMovement repayment(UUID tenantId, UUID accountId, BigDecimal amount, LocalDate date,
                                         String description, UUID loanId, UUID loanPaymentId) {
        return new CashMovement(tenantId, accountId, amount, date, description, loanId,
            Objects.requireNonNull(loanPaymentId));
    }
}
