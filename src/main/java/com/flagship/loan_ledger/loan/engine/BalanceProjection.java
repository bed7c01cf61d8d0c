package com.flagship.loan_ledger.loan.engine;

import com.flagship.loan_ledger.loan.LoanStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Current loan figures replayed from the full payment history.
 * {@code payments} is in application order (oldest first).
 */
@Value
public class BalanceProjection {
    BigDecimal principalAmount;
    BigDecimal remainingBalance;
    BigDecimal totalPrincipalPaid;
    BigDecimal totalInterestPaid;
    List<ProjectedPayment> payments;

    public LoanStatus getStatus() {
        return LoanStatus.fromRemainingBalance(remainingBalance);
    }

    /**
     * Share of the principal already repaid, 0 to 100.
     */
    public BigDecimal getProgressPercent() {
        return principalAmount.subtract(remainingBalance)
            .multiply(BigDecimal.valueOf(100))
            .divide(principalAmount, 2, RoundingMode.HALF_UP);
    }

    public List<ProjectedPayment> newestFirst() {
        List<ProjectedPayment> reversed = new ArrayList<>(payments);
        Collections.reverse(reversed);
        return reversed;
    }
}
