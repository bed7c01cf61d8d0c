package com.flagship.loan_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loan_ledger.loan.Loan;
import com.flagship.loan_ledger.loan.LoanKind;
import com.flagship.loan_ledger.loan.PaymentFrequency;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class LoanResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tenant_id")
    UUID tenantId;

    @JsonProperty("contact_id")
    UUID contactId;

    @JsonProperty("kind")
    LoanKind kind;

    @JsonProperty("name")
    String name;

    @JsonProperty("principal_amount")
    BigDecimal principalAmount;

    @JsonProperty("annual_interest_rate")
    BigDecimal annualInterestRate;

    @JsonProperty("term_months")
    int termMonths;

    @JsonProperty("payment_frequency")
    PaymentFrequency paymentFrequency;

    @JsonProperty("start_date")
    LocalDate startDate;

    /**
     * Advisory only; see the summary for authoritative balances.
     */
    @JsonProperty("suggested_payment_amount")
    BigDecimal suggestedPaymentAmount;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static LoanResponse from(Loan loan) {
        return LoanResponse.builder()
            .id(loan.getId())
            .tenantId(loan.getTenantId())
            .contactId(loan.getContactId())
            .kind(loan.getKind())
            .name(loan.getName())
            .principalAmount(loan.getPrincipalAmount())
            .annualInterestRate(loan.getAnnualInterestRate())
            .termMonths(loan.getTermMonths())
            .paymentFrequency(loan.getPaymentFrequency())
            .startDate(loan.getStartDate())
            .suggestedPaymentAmount(loan.getSuggestedPaymentAmount())
            .notes(loan.getNotes())
            .createdAt(loan.getCreatedAt())
            .updatedAt(loan.getUpdatedAt())
            .build();
    }
}
