package com.flagship.loan_ledger.loan.engine;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Principal/interest split of a single payment.
 * {@code custom} is true when the caller supplied the split instead of the engine.
 */
@Value
public class PaymentAllocation {
    BigDecimal totalAmount;
    BigDecimal principalAmount;
    BigDecimal interestAmount;
    boolean custom;

    public static PaymentAllocation none() {
        return new PaymentAllocation(Money.ZERO, Money.ZERO, Money.ZERO, false);
    }
}
