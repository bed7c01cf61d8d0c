package com.flagship.loan_ledger.loan.exception;

import lombok.Getter;

/**
 * Thrown by the pure loan calculators before any computation happens.
 * Validation is all-or-nothing: no partial result is ever produced.
 */
@Getter
public class LoanValidationException extends IllegalArgumentException {

    private final LoanErrorCode code;

    public LoanValidationException(LoanErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static LoanValidationException invalidPrincipal(String message) {
        return new LoanValidationException(LoanErrorCode.INVALID_PRINCIPAL, message);
    }

    public static LoanValidationException invalidRate(String message) {
        return new LoanValidationException(LoanErrorCode.INVALID_RATE, message);
    }

    public static LoanValidationException invalidTerm(String message) {
        return new LoanValidationException(LoanErrorCode.INVALID_TERM, message);
    }

    public static LoanValidationException invalidPayment(String message) {
        return new LoanValidationException(LoanErrorCode.INVALID_PAYMENT, message);
    }
}
