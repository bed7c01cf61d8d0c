package com.flagship.loan_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loan_ledger.loan.PaymentFrequency;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Terms of a loan that has not been saved yet.
 * Ranges are checked by the calculators so the error kind reaches the client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanQuoteRequest {

    @NotNull(message = "Principal amount is required")
    @JsonProperty("principal_amount")
    private BigDecimal principalAmount;

    @NotNull(message = "Annual interest rate is required")
    @JsonProperty("annual_interest_rate")
    private BigDecimal annualInterestRate;

    @NotNull(message = "Term is required")
    @JsonProperty("term_months")
    private Integer termMonths;

    @NotNull(message = "Payment frequency is required")
    @JsonProperty("payment_frequency")
    private PaymentFrequency paymentFrequency;

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    private LocalDate startDate;
}
