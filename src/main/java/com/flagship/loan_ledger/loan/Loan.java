package com.flagship.loan_ledger.loan;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Loan domain object.
 *
 * There is no remaining-balance field: the balance is always
 * projected from the payment history by {@code BalanceProjector}.
 * {@code suggestedPaymentAmount} is an advisory cache of the calculated
 * periodic payment and is never used for balance math.
 */
@Value
@Builder(toBuilder = true)
public class Loan {
    UUID id;
    UUID tenantId;
    UUID contactId;
    LoanKind kind;
    String name;
    BigDecimal principalAmount;
    BigDecimal annualInterestRate;
    int termMonths;
    PaymentFrequency paymentFrequency;
    LocalDate startDate;
    BigDecimal suggestedPaymentAmount;
    String notes;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Loans without a payment frequency are tracked as a lump balance only.
     */
    public boolean hasSchedule() {
        return paymentFrequency != null;
    }

    public Optional<PaymentFrequency> frequency() {
        return Optional.ofNullable(paymentFrequency);
    }

    public boolean belongsTo(UUID tenant) {
        return tenantId != null && tenantId.equals(tenant);
    }
}
