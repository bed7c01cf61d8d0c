package com.flagship.loan_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loan_ledger.loan.LoanQuote;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class LoanQuoteResponse {

    @JsonProperty("payment_amount")
    BigDecimal paymentAmount;

    @JsonProperty("payment_frequency")
    String paymentFrequency;

    @JsonProperty("total_periods")
    int totalPeriods;

    @JsonProperty("total_interest")
    BigDecimal totalInterest;

    @JsonProperty("schedule")
    List<ScheduleEntryResponse> schedule;

    public static LoanQuoteResponse from(LoanQuote quote) {
        return LoanQuoteResponse.builder()
            .paymentAmount(quote.getPaymentAmount())
            .paymentFrequency(quote.getFrequency().displayName())
            .totalPeriods(quote.getSchedule().size())
            .totalInterest(quote.getTotalInterest())
            .schedule(ScheduleEntryResponse.fromAll(quote.getSchedule()))
            .build();
    }
}
