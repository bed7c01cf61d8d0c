package com.flagship.loan_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loan_ledger.loan.LoanPayment;
import com.flagship.loan_ledger.loan.engine.ProjectedPayment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoanPaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("principal_amount")
    BigDecimal principalAmount;

    @JsonProperty("interest_amount")
    BigDecimal interestAmount;

    @JsonProperty("notes")
    String notes;

    /**
     * Loan balance right after this payment, projected from the history.
     */
    @JsonProperty("balance_after")
    BigDecimal balanceAfter;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LoanPaymentResponse from(LoanPayment payment) {
        return builderFor(payment).build();
    }

    public static LoanPaymentResponse from(ProjectedPayment projected) {
        return builderFor(projected.getPayment())
            .balanceAfter(projected.getBalanceAfter())
            .build();
    }

    private static LoanPaymentResponseBuilder builderFor(LoanPayment payment) {
        return LoanPaymentResponse.builder()
            .id(payment.getId())
            .loanId(payment.getLoanId())
            .accountId(payment.getAccountId())
            .paymentDate(payment.getPaymentDate())
            .totalAmount(payment.getTotalAmount())
            .principalAmount(payment.getPrincipalAmount())
            .interestAmount(payment.getInterestAmount())
            .notes(payment.getNotes())
            .createdAt(payment.getCreatedAt());
    }
}
