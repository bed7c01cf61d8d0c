package com.flagship.loan_ledger.loan.engine;

import com.flagship.loan_ledger.loan.PaymentFrequency;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builds the full projected schedule for a set of loan terms.
 *
 * Guarantees:
 * - exactly {@code totalPeriods} entries
 * - the principal column sums to the original principal
 * - the last entry leaves a remaining balance of zero
 *
 * Rounding residue is absorbed by the final period, whose principal portion
 * is forced to the balance still outstanding.
 */
@Service
@RequiredArgsConstructor
public class AmortizationScheduleGenerator {

    private final PaymentAmountCalculator paymentAmountCalculator;

    public List<AmortizationScheduleEntry> generate(BigDecimal principal, BigDecimal annualRate, int termMonths,
                                                    LocalDate startDate, PaymentFrequency frequency) {
        BigDecimal payment = paymentAmountCalculator.compute(principal, annualRate, termMonths, frequency);
        Objects.requireNonNull(startDate, "startDate");

        int periods = paymentAmountCalculator.totalPeriods(termMonths, frequency);
        BigDecimal periodicRate = Money.periodicRate(annualRate, frequency.periodsPerYear());

        List<AmortizationScheduleEntry> schedule = new ArrayList<>(periods);
        BigDecimal balance = principal;

        for (int i = 1; i <= periods; i++) {
            BigDecimal interest = Money.round(balance.multiply(periodicRate, Money.MATH_CONTEXT));
            BigDecimal principalPortion;
            if (i == periods) {
                principalPortion = balance;
            } else {
                // Never negative and never more than what is still owed
                principalPortion = Money.min(Money.max(payment.subtract(interest), BigDecimal.ZERO), balance);
            }
            balance = Money.max(BigDecimal.ZERO, balance.subtract(principalPortion));

            schedule.add(new AmortizationScheduleEntry(
                i,
                frequency.dueDate(startDate, i),
                principalPortion.add(interest),
                principalPortion,
                interest,
                balance
            ));
        }

        return Collections.unmodifiableList(schedule);
    }
}
