package com.flagship.loan_ledger.loan.engine;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Currency arithmetic shared by the loan calculators.
 * Amounts are rounded half-up to the currency minor unit (2 decimal places).
 */
public final class Money {

    public static final int SCALE = 2;
    public static final MathContext MATH_CONTEXT = MathContext.DECIMAL128;
    public static final BigDecimal EPSILON = new BigDecimal("0.01");
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {
        // Utility class
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static boolean withinEpsilon(BigDecimal a, BigDecimal b) {
        return a.subtract(b).abs().compareTo(EPSILON) <= 0;
    }

    public static BigDecimal periodicRate(BigDecimal annualRate, int periodsPerYear) {
        return annualRate.divide(BigDecimal.valueOf(periodsPerYear), MATH_CONTEXT);
    }
}
