package com.flagship.loan_ledger.loan.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Raised when a cash account cannot cover an outgoing loan movement.
 * Carries the amount that was available so the caller can show it.
 */
@Getter
public class InsufficientFundsException extends RuntimeException {

    private final UUID accountId;
    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientFundsException(UUID accountId, String accountName, String availableLabel,
                                      BigDecimal requested, BigDecimal available) {
        super(String.format("Insufficient funds in %s. %s: %s", accountName, availableLabel, available));
        this.accountId = accountId;
        this.requested = requested;
        this.available = available;
    }
}
