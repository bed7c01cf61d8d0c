package com.flagship.loan_ledger.loan;

import java.time.LocalDate;

/**
 * How often a scheduled loan payment falls due.
 *
 * Dates are stepped on the calendar from the loan's start date, so a monthly
 * schedule that starts on the 15th stays on the 15th, and one that starts on
 * the 31st falls on the last day of shorter months.
 */
public enum PaymentFrequency {
    WEEKLY(52, "Weekly"),
    BIWEEKLY(26, "Bi-weekly"),
    MONTHLY(12, "Monthly"),
    QUARTERLY(4, "Quarterly"),
    ANNUALLY(1, "Annually");

    private final int periodsPerYear;
    private final String displayName;

    PaymentFrequency(int periodsPerYear, String displayName) {
        this.periodsPerYear = periodsPerYear;
        this.displayName = displayName;
    }

    public int periodsPerYear() {
        return periodsPerYear;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Returns the due date of the given period, counted from {@code start}.
     * Period 0 is the start date itself.
     */
    public LocalDate dueDate(LocalDate start, int period) {
        return switch (this) {
            case WEEKLY -> start.plusWeeks(period);
            case BIWEEKLY -> start.plusWeeks(2L * period);
            case MONTHLY -> start.plusMonths(period);
            case QUARTERLY -> start.plusMonths(3L * period);
            case ANNUALLY -> start.plusYears(period);
        };
    }
}
