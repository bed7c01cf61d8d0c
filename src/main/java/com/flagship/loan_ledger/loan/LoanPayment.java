package com.flagship.loan_ledger.loan;

import com.flagship.loan_ledger.loan.engine.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A recorded repayment against a loan.
 *
 * Invariant: principalAmount + interestAmount == totalAmount within one cent.
 * Payments may be appended, edited or deleted in any order; nothing here
 * stores a running balance.
 */
@Value
@Builder(toBuilder = true)
public class LoanPayment {
    UUID id;
    UUID loanId;
    UUID tenantId;
    UUID accountId;
    LocalDate paymentDate;
    BigDecimal totalAmount;
    BigDecimal principalAmount;
    BigDecimal interestAmount;
    String notes;
    Instant createdAt;

    public boolean isSplitConsistent() {
        return Money.withinEpsilon(principalAmount.add(interestAmount), totalAmount);
    }
}
