package com.flagship.loan_ledger.loan.engine;

import com.flagship.loan_ledger.loan.PaymentFrequency;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Level periodic payment for an amortizing loan (standard annuity formula).
 *
 * payment = principal * r / (1 - (1 + r)^-n), with r the periodic rate and
 * n the number of periods. A zero rate divides the principal evenly.
 */
@Service
public class PaymentAmountCalculator {

    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    /**
     * @return the periodic payment rounded to cents
     * @throws com.flagship.loan_ledger.loan.exception.LoanValidationException for an invalid principal, rate or term
     */
    public BigDecimal compute(BigDecimal principal, BigDecimal annualRate, int termMonths,
                              PaymentFrequency frequency) {
        LoanTermsValidator.requireValidTerms(principal, annualRate, termMonths);
        Objects.requireNonNull(frequency, "frequency");

        int periods = totalPeriods(termMonths, frequency);
        BigDecimal periodicRate = Money.periodicRate(annualRate, frequency.periodsPerYear());
        return Money.round(rawPayment(principal, periodicRate, periods));
    }

    /**
     * Number of payments over the term: round(termMonths / 12 * periodsPerYear), at least 1.
     */
    public int totalPeriods(int termMonths, PaymentFrequency frequency) {
        LoanTermsValidator.requireValidTerm(termMonths);
        int periods = BigDecimal.valueOf((long) termMonths * frequency.periodsPerYear())
            .divide(MONTHS_PER_YEAR, 0, RoundingMode.HALF_UP)
            .intValueExact();
        return Math.max(1, periods);
    }

    private BigDecimal rawPayment(BigDecimal principal, BigDecimal periodicRate, int periods) {
        if (periodicRate.signum() == 0) {
            return principal.divide(BigDecimal.valueOf(periods), Money.MATH_CONTEXT);
        }
        // (1 + r)^-n rewritten as f / (f - 1) with f = (1 + r)^n to stay in exact powers
        BigDecimal growth = BigDecimal.ONE.add(periodicRate).pow(periods, Money.MATH_CONTEXT);
        return principal.multiply(periodicRate, Money.MATH_CONTEXT)
            .multiply(growth, Money.MATH_CONTEXT)
            .divide(growth.subtract(BigDecimal.ONE), Money.MATH_CONTEXT);
    }
}
