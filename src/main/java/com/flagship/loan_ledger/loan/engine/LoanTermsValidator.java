package com.flagship.loan_ledger.loan.engine;

import com.flagship.loan_ledger.loan.exception.LoanValidationException;

import java.math.BigDecimal;

/**
 * Input checks shared by the calculators. Each method throws before any
 * arithmetic is attempted.
 */
public final class LoanTermsValidator {

    public static final int RATE_SCALE = 6;

    private LoanTermsValidator() {
        // Utility class
    }

    public static void requireValidTerms(BigDecimal principal, BigDecimal annualRate, int termMonths) {
        requirePositivePrincipal(principal);
        requireValidRate(annualRate);
        requireValidTerm(termMonths);
    }

    public static void requirePositivePrincipal(BigDecimal principal) {
        if (principal == null || principal.signum() <= 0) {
            throw LoanValidationException.invalidPrincipal("Principal must be greater than 0, was " + principal);
        }
    }

    public static void requireValidRate(BigDecimal annualRate) {
        if (annualRate == null || annualRate.signum() < 0 || annualRate.compareTo(BigDecimal.ONE) > 0) {
            throw LoanValidationException.invalidRate(
                "Annual interest rate must be a fraction between 0 and 1, was " + annualRate);
        }
        // Stored as NUMERIC(9, 6)
        if (annualRate.stripTrailingZeros().scale() > RATE_SCALE) {
            throw LoanValidationException.invalidRate(
                "Annual interest rate allows at most " + RATE_SCALE + " decimal places, was " + annualRate);
        }
    }

    public static void requireValidTerm(int termMonths) {
        if (termMonths < 1) {
            throw LoanValidationException.invalidTerm("Term must be at least 1 month, was " + termMonths);
        }
    }

    public static void requirePositivePayment(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw LoanValidationException.invalidPayment("Payment amount must be greater than 0, was " + amount);
        }
    }

    public static void requireNonNegativeBalance(BigDecimal outstandingBalance) {
        if (outstandingBalance == null || outstandingBalance.signum() < 0) {
            throw LoanValidationException.invalidPrincipal(
                "Outstanding balance must not be negative, was " + outstandingBalance);
        }
    }
}
