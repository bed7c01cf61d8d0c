package com.flagship.loan_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loan_ledger.loan.engine.PaymentAllocation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class AllocationResponse {

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("principal_amount")
    BigDecimal principalAmount;

    @JsonProperty("interest_amount")
    BigDecimal interestAmount;

    @JsonProperty("custom_split")
    boolean customSplit;

    public static AllocationResponse from(PaymentAllocation allocation) {
        return AllocationResponse.builder()
            .totalAmount(allocation.getTotalAmount())
            .principalAmount(allocation.getPrincipalAmount())
            .interestAmount(allocation.getInterestAmount())
            .customSplit(allocation.isCustom())
            .build();
    }
}
