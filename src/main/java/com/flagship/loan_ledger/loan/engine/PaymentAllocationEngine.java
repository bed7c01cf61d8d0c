package com.flagship.loan_ledger.loan.engine;

import com.flagship.loan_ledger.loan.exception.LoanValidationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Splits an ad-hoc payment into principal and interest.
 *
 * Interest is one period's accrual on the outstanding balance and is capped
 * at the payment itself; the rest goes to principal. Callers may bypass the
 * computed split entirely with {@link #custom}.
 */
@Service
public class PaymentAllocationEngine {

    public PaymentAllocation allocate(BigDecimal outstandingBalance, BigDecimal annualRate,
                                      BigDecimal proposedTotal, int periodsPerYearForInterest) {
        LoanTermsValidator.requirePositivePayment(proposedTotal);
        LoanTermsValidator.requireNonNegativeBalance(outstandingBalance);
        LoanTermsValidator.requireValidRate(annualRate);
        if (periodsPerYearForInterest < 1) {
            throw new IllegalArgumentException(
                "Periods per year for interest must be at least 1, was " + periodsPerYearForInterest);
        }

        BigDecimal periodicRate = Money.periodicRate(annualRate, periodsPerYearForInterest);
        BigDecimal accrued = Money.round(outstandingBalance.multiply(periodicRate, Money.MATH_CONTEXT));
        BigDecimal interest = Money.min(accrued, proposedTotal);
        BigDecimal principal = Money.round(proposedTotal.subtract(interest));

        return new PaymentAllocation(proposedTotal, principal, interest, false);
    }

    /**
     * Accepts a caller-supplied split as is. Only the amounts themselves are
     * checked, not whether they match the computed allocation.
     */
    public PaymentAllocation custom(BigDecimal principal, BigDecimal interest) {
        if (principal == null || interest == null || principal.signum() < 0 || interest.signum() < 0) {
            throw LoanValidationException.invalidPayment(
                "Custom split amounts must be non-negative, was principal=" + principal + ", interest=" + interest);
        }
        BigDecimal total = principal.add(interest);
        LoanTermsValidator.requirePositivePayment(total);
        return new PaymentAllocation(total, principal, interest, true);
    }
}
