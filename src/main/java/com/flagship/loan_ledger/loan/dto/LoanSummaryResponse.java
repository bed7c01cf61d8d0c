package com.flagship.loan_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loan_ledger.loan.LoanStatus;
import com.flagship.loan_ledger.loan.LoanSummary;
import com.flagship.loan_ledger.loan.engine.BalanceProjection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Loan details with the figures projected from its payment history.
 * Payments are listed newest first.
 */
@Value
@Builder
public class LoanSummaryResponse {

    @JsonProperty("loan")
    LoanResponse loan;

    @JsonProperty("status")
    LoanStatus status;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    @JsonProperty("total_principal_paid")
    BigDecimal totalPrincipalPaid;

    @JsonProperty("total_interest_paid")
    BigDecimal totalInterestPaid;

    @JsonProperty("progress_percent")
    BigDecimal progressPercent;

    @JsonProperty("payments")
    List<LoanPaymentResponse> payments;

    public static LoanSummaryResponse from(LoanSummary summary) {
        BalanceProjection projection = summary.getProjection();
        return LoanSummaryResponse.builder()
            .loan(LoanResponse.from(summary.getLoan()))
            .status(projection.getStatus())
            .remainingBalance(projection.getRemainingBalance())
            .totalPrincipalPaid(projection.getTotalPrincipalPaid())
            .totalInterestPaid(projection.getTotalInterestPaid())
            .progressPercent(projection.getProgressPercent())
            .payments(projection.newestFirst().stream().map(LoanPaymentResponse::from).toList())
            .build();
    }
}
