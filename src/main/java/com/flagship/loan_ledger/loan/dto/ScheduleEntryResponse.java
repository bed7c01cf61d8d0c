package com.flagship.loan_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loan_ledger.loan.engine.AmortizationScheduleEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class ScheduleEntryResponse {

    @JsonProperty("payment_number")
    int paymentNumber;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @JsonProperty("payment_amount")
    BigDecimal paymentAmount;

    @JsonProperty("principal_amount")
    BigDecimal principalAmount;

    @JsonProperty("interest_amount")
    BigDecimal interestAmount;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    public static ScheduleEntryResponse from(AmortizationScheduleEntry entry) {
        return ScheduleEntryResponse.builder()
            .paymentNumber(entry.getPaymentNumber())
            .paymentDate(entry.getPaymentDate())
            .paymentAmount(entry.getPaymentAmount())
            .principalAmount(entry.getPrincipalAmount())
            .interestAmount(entry.getInterestAmount())
            .remainingBalance(entry.getRemainingBalanceAfter())
            .build();
    }

    public static List<ScheduleEntryResponse> fromAll(List<AmortizationScheduleEntry> entries) {
        return entries.stream().map(ScheduleEntryResponse::from).toList();
    }
}
