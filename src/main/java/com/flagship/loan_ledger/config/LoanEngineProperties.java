package com.flagship.loan_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the loan engine, bound from the {@code loan.*} properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "loan")
public class LoanEngineProperties {

    private Allocation allocation = new Allocation();

    @Getter
    @Setter
    public static class Allocation {

        /**
         * Divisor of the annual rate when splitting an ad-hoc payment.
         * 12 accrues interest monthly whatever the payment cadence.
         */
        private int periodsPerYearForInterest = 12;

        /**
         * When true, the suggested next payment accrues interest per the
         * loan's own payment frequency instead of periodsPerYearForInterest.
         */
        private boolean useFrequencyForSuggestion = true;
    }
}
