package com.flagship.loan_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loan_ledger.loan.PaymentFrequency;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Full replacement of a loan's editable fields. Kind and tenant never change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateLoanRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    private String name;

    @JsonProperty("contact_id")
    private UUID contactId;

    @NotNull(message = "Principal amount is required")
    @JsonProperty("principal_amount")
    private BigDecimal principalAmount;

    @NotNull(message = "Annual interest rate is required")
    @JsonProperty("annual_interest_rate")
    private BigDecimal annualInterestRate;

    @NotNull(message = "Term is required")
    @JsonProperty("term_months")
    private Integer termMonths;

    @JsonProperty("payment_frequency")
    private PaymentFrequency paymentFrequency;

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    private LocalDate startDate;

    @JsonProperty("notes")
    private String notes;
}
