package com.flagship.loan_ledger.loan.engine;

import com.flagship.loan_ledger.loan.PaymentFrequency;
import com.flagship.loan_ledger.loan.exception.LoanErrorCode;
import com.flagship.loan_ledger.loan.exception.LoanValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class AmortizationScheduleGeneratorTest {

    private final PaymentAmountCalculator calculator = new PaymentAmountCalculator();
    private final AmortizationScheduleGenerator generator = new AmortizationScheduleGenerator(calculator);

    @Test
    @DisplayName("Zero-rate loan pays equal principal slices with no interest")
    void testZeroRateSchedule() {
        List<AmortizationScheduleEntry> schedule = generator.generate(
            new BigDecimal("1200"), BigDecimal.ZERO, 12, LocalDate.of(2024, 1, 15), PaymentFrequency.MONTHLY);

        assertEquals(12, schedule.size());
        for (AmortizationScheduleEntry entry : schedule) {
            assertEquals(0, entry.getPrincipalAmount().compareTo(new BigDecimal("100.00")));
            assertEquals(0, entry.getInterestAmount().signum());
        }
        assertEquals(0, schedule.get(11).getRemainingBalanceAfter().signum());
    }

    @Test
    @DisplayName("Final period absorbs the rounding residue")
    void testFinalPeriodAbsorbsResidue() {
        List<AmortizationScheduleEntry> schedule = generator.generate(
            new BigDecimal("200"), BigDecimal.ZERO, 3, LocalDate.of(2024, 1, 1), PaymentFrequency.MONTHLY);

        assertEquals(new BigDecimal("66.67"), schedule.get(0).getPrincipalAmount());
        assertEquals(new BigDecimal("66.67"), schedule.get(1).getPrincipalAmount());
        assertEquals(0, schedule.get(2).getPrincipalAmount().compareTo(new BigDecimal("66.66")));
        assertEquals(0, schedule.get(2).getRemainingBalanceAfter().signum());
    }

    @Test
    @DisplayName("First period of a 6% loan accrues half a percent")
    void testFirstPeriodSplit() {
        List<AmortizationScheduleEntry> schedule = generator.generate(
            new BigDecimal("10000"), new BigDecimal("0.06"), 24, LocalDate.of(2024, 1, 1), PaymentFrequency.MONTHLY);

        AmortizationScheduleEntry first = schedule.get(0);
        assertEquals(1, first.getPaymentNumber());
        assertEquals(new BigDecimal("443.21"), first.getPaymentAmount());
        assertEquals(new BigDecimal("50.00"), first.getInterestAmount());
        assertEquals(new BigDecimal("393.21"), first.getPrincipalAmount());
        assertEquals(0, first.getRemainingBalanceAfter().compareTo(new BigDecimal("9606.79")));
    }

    @Test
    @DisplayName("Monthly dates keep the start day of month")
    void testMonthlyDates() {
        List<AmortizationScheduleEntry> schedule = generator.generate(
            new BigDecimal("1200"), new BigDecimal("0.05"), 12, LocalDate.of(2024, 1, 15), PaymentFrequency.MONTHLY);

        assertEquals(LocalDate.of(2024, 2, 15), schedule.get(0).getPaymentDate());
        assertEquals(LocalDate.of(2024, 6, 15), schedule.get(4).getPaymentDate());
        assertEquals(LocalDate.of(2025, 1, 15), schedule.get(11).getPaymentDate());
    }

    @Test
    @DisplayName("Month-end start falls back to the last day of shorter months")
    void testMonthEndDates() {
        List<AmortizationScheduleEntry> schedule = generator.generate(
            new BigDecimal("900"), BigDecimal.ZERO, 3, LocalDate.of(2024, 1, 31), PaymentFrequency.MONTHLY);

        assertEquals(LocalDate.of(2024, 2, 29), schedule.get(0).getPaymentDate());
        assertEquals(LocalDate.of(2024, 3, 31), schedule.get(1).getPaymentDate());
        assertEquals(LocalDate.of(2024, 4, 30), schedule.get(2).getPaymentDate());
    }

    @Test
    @DisplayName("Weekly and quarterly dates step from the start date")
    void testOtherFrequencyDates() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        List<AmortizationScheduleEntry> weekly = generator.generate(
            new BigDecimal("520"), BigDecimal.ZERO, 12, start, PaymentFrequency.WEEKLY);
        List<AmortizationScheduleEntry> quarterly = generator.generate(
            new BigDecimal("400"), BigDecimal.ZERO, 12, start, PaymentFrequency.QUARTERLY);

        assertEquals(52, weekly.size());
        assertEquals(LocalDate.of(2024, 1, 8), weekly.get(0).getPaymentDate());
        assertEquals(LocalDate.of(2024, 12, 30), weekly.get(51).getPaymentDate());
        assertEquals(4, quarterly.size());
        assertEquals(LocalDate.of(2024, 4, 1), quarterly.get(0).getPaymentDate());
        assertEquals(LocalDate.of(2025, 1, 1), quarterly.get(3).getPaymentDate());
    }

    @Test
    @DisplayName("Returned schedule cannot be modified")
    void testUnmodifiable() {
        List<AmortizationScheduleEntry> schedule = generator.generate(
            new BigDecimal("100"), BigDecimal.ZERO, 1, LocalDate.of(2024, 1, 1), PaymentFrequency.MONTHLY);

        assertThrows(UnsupportedOperationException.class, () -> schedule.remove(0));
    }

    @Test
    @DisplayName("Invalid terms are rejected before anything is generated")
    void testInvalidTerms() {
        LoanValidationException exception = assertThrows(LoanValidationException.class,
            () -> generator.generate(new BigDecimal("1000"), new BigDecimal("1.5"), 12,
                LocalDate.of(2024, 1, 1), PaymentFrequency.MONTHLY));

        assertEquals(LoanErrorCode.INVALID_RATE, exception.getCode());
    }

    @Test
    @DisplayName("Random terms: length, conservation of principal and full amortization")
    void testScheduleProperties() {
        Random random = new Random(42);
        PaymentFrequency[] frequencies = PaymentFrequency.values();

        for (int run = 0; run < 250; run++) {
            // mix cent and sub-cent principals
            BigDecimal principal = BigDecimal.valueOf(1 + random.nextInt(1_000_000_00), random.nextBoolean() ? 2 : 4);
            BigDecimal rate = BigDecimal.valueOf(random.nextInt(500_001), 6).setScale(6, RoundingMode.HALF_UP);
            int term = 1 + random.nextInt(360);
            PaymentFrequency frequency = frequencies[random.nextInt(frequencies.length)];
            String terms = principal + " @ " + rate + " for " + term + "m " + frequency;

            List<AmortizationScheduleEntry> schedule = generator.generate(
                principal, rate, term, LocalDate.of(2024, 3, 10), frequency);

            assertEquals(calculator.totalPeriods(term, frequency), schedule.size(), terms);

            BigDecimal principalSum = BigDecimal.ZERO;
            for (AmortizationScheduleEntry entry : schedule) {
                assertTrue(entry.getPrincipalAmount().signum() >= 0, terms);
                assertTrue(entry.getInterestAmount().signum() >= 0, terms);
                assertTrue(entry.getRemainingBalanceAfter().signum() >= 0, terms);
                assertEquals(0, entry.getPaymentAmount()
                    .compareTo(entry.getPrincipalAmount().add(entry.getInterestAmount())), terms);
                principalSum = principalSum.add(entry.getPrincipalAmount());
            }

            assertEquals(0, principalSum.compareTo(principal), terms + " summed to " + principalSum);
            assertEquals(0, schedule.get(schedule.size() - 1).getRemainingBalanceAfter().signum(), terms);
        }
    }
}
