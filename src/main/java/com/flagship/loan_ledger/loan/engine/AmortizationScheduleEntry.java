package com.flagship.loan_ledger.loan.engine;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row of a projected amortization schedule. Derived, never persisted.
 */
@Value
public class AmortizationScheduleEntry {
    int paymentNumber;
    LocalDate paymentDate;
    BigDecimal paymentAmount;
    BigDecimal principalAmount;
    BigDecimal interestAmount;
    BigDecimal remainingBalanceAfter;
}
