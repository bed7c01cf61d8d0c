package com.flagship.loan_ledger.loan.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * A loan, loan payment or cash account is missing at the persistence boundary.
 * Records owned by another tenant are reported the same way.
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final UUID resourceId;

    public ResourceNotFoundException(String resourceType, UUID resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException loan(UUID loanId) {
        return new ResourceNotFoundException("Loan", loanId);
    }

    public static ResourceNotFoundException payment(UUID paymentId) {
        return new ResourceNotFoundException("Loan payment", paymentId);
    }

    public static ResourceNotFoundException account(UUID accountId) {
        return new ResourceNotFoundException("Account", accountId);
    }
}
