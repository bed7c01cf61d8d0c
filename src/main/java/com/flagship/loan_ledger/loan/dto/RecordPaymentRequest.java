package com.flagship.loan_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Request DTO for recording or editing a loan payment.
 *
 * Without custom_split the engine splits total_amount against the current
 * balance. With custom_split, principal_amount and interest_amount are
 * required and must add up to total_amount.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordPaymentRequest {

    @NotNull(message = "Account is required")
    @JsonProperty("account_id")
    private UUID accountId;

    @NotNull(message = "Payment date is required")
    @JsonProperty("payment_date")
    private LocalDate paymentDate;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonProperty("custom_split")
    private boolean customSplit;

    @JsonProperty("principal_amount")
    private BigDecimal principalAmount;

    @JsonProperty("interest_amount")
    private BigDecimal interestAmount;

    @JsonProperty("notes")
    private String notes;

    public AllocationRequest toAllocationRequest() {
        return new AllocationRequest(totalAmount, customSplit, principalAmount, interestAmount);
    }
}
