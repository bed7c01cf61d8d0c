package com.flagship.loan_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Asks for the principal/interest split of a proposed payment.
 * With custom_split the caller's principal and interest are used as given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocationRequest {

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonProperty("custom_split")
    private boolean customSplit;

    @JsonProperty("principal_amount")
    private BigDecimal principalAmount;

    @JsonProperty("interest_amount")
    private BigDecimal interestAmount;
}
