package com.flagship.loan_ledger.loan.exception;

/**
 * Error kinds surfaced to callers of the loan engine and its collaborators.
 *
 * The name is returned verbatim in the "error" field of API responses so
 * clients can react to the kind, not to a generic failure.
 */
public enum LoanErrorCode {
    INVALID_PRINCIPAL,
    INVALID_RATE,
    INVALID_TERM,
    INVALID_PAYMENT,
    NOT_FOUND,
    INSUFFICIENT_FUNDS
}
