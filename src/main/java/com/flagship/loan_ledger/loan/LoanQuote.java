package com.flagship.loan_ledger.loan;

import com.flagship.loan_ledger.loan.engine.AmortizationScheduleEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Calculated payment and projected schedule for a set of loan terms.
 */
@Value
public class LoanQuote {
    BigDecimal paymentAmount;
    PaymentFrequency frequency;
    List<AmortizationScheduleEntry> schedule;

    public BigDecimal getTotalInterest() {
        return schedule.stream()
            .map(AmortizationScheduleEntry::getInterestAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
