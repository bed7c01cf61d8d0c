package com.flagship.loan_ledger.loan.engine;

import com.flagship.loan_ledger.config.LoanEngineProperties;
import com.flagship.loan_ledger.loan.Loan;
import com.flagship.loan_ledger.loan.LoanPayment;
import com.flagship.loan_ledger.loan.PaymentFrequency;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Proposes the next amount due on a loan.
 *
 * - paid off: nothing is due
 * - no payment frequency: the whole remaining balance, all principal
 * - scheduled: the regular payment split against the projected balance, with
 *   the principal capped at what is still owed (a short final payment)
 */
@Service
@RequiredArgsConstructor
public class NextPaymentSuggester {

    private final BalanceProjector balanceProjector;
    private final PaymentAllocationEngine allocationEngine;
    private final PaymentAmountCalculator paymentAmountCalculator;
    private final LoanEngineProperties properties;

    public PaymentAllocation suggestNextPayment(Loan loan, Collection<LoanPayment> payments) {
        BigDecimal remaining = balanceProjector.project(loan, payments).getRemainingBalance();
        if (remaining.signum() == 0) {
            return PaymentAllocation.none();
        }
        if (!loan.hasSchedule()) {
            return new PaymentAllocation(remaining, remaining, Money.ZERO, false);
        }

        PaymentFrequency frequency = loan.getPaymentFrequency();
        BigDecimal regularPayment = regularPayment(loan, frequency);
        int periodsPerYear = properties.getAllocation().isUseFrequencyForSuggestion()
            ? frequency.periodsPerYear()
            : properties.getAllocation().getPeriodsPerYearForInterest();

        PaymentAllocation split = allocationEngine.allocate(
            remaining, loan.getAnnualInterestRate(), regularPayment, periodsPerYear);
        if (split.getPrincipalAmount().compareTo(remaining) <= 0) {
            return split;
        }
        return new PaymentAllocation(
            Money.round(remaining.add(split.getInterestAmount())),
            remaining,
            split.getInterestAmount(),
            false
        );
    }

    private BigDecimal regularPayment(Loan loan, PaymentFrequency frequency) {
        BigDecimal cached = loan.getSuggestedPaymentAmount();
        if (cached != null && cached.signum() > 0) {
            return cached;
        }
        return paymentAmountCalculator.compute(
            loan.getPrincipalAmount(), loan.getAnnualInterestRate(), loan.getTermMonths(), frequency);
    }
}
