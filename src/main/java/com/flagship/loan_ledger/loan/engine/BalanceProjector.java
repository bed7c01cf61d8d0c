package com.flagship.loan_ledger.loan.engine;

import com.flagship.loan_ledger.loan.Loan;
import com.flagship.loan_ledger.loan.LoanPayment;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * The single source of truth for a loan's outstanding balance.
 *
 * The balance is replayed from the principal and the complete payment
 * history on every call; no stored balance is read. Payments are applied in
 * payment-date order, with creation time and then id as tie-breakers, so the
 * result depends only on the content of the history and not on the order the
 * caller supplies it in.
 *
 * The running balance is clamped at zero after every payment. Overpayments
 * therefore never leave a negative balance behind that a later edit could
 * resurrect.
 *
 * Stateless: safe to call repeatedly and from any thread.
 */
@Service
public class BalanceProjector {

    static final Comparator<LoanPayment> APPLICATION_ORDER = Comparator
        .comparing(LoanPayment::getPaymentDate)
        .thenComparing(LoanPayment::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
        .thenComparing(LoanPayment::getId, Comparator.nullsLast(Comparator.<UUID>naturalOrder()));

    public BalanceProjection project(Loan loan, Collection<LoanPayment> payments) {
        Objects.requireNonNull(loan, "loan");
        return project(loan.getPrincipalAmount(), payments);
    }

    public BalanceProjection project(BigDecimal principalAmount, Collection<LoanPayment> payments) {
        LoanTermsValidator.requirePositivePrincipal(principalAmount);

        List<LoanPayment> ordered = new ArrayList<>(payments);
        ordered.sort(APPLICATION_ORDER);

        BigDecimal balance = principalAmount;
        BigDecimal totalPrincipal = BigDecimal.ZERO;
        BigDecimal totalInterest = BigDecimal.ZERO;
        List<ProjectedPayment> projected = new ArrayList<>(ordered.size());

        for (LoanPayment payment : ordered) {
            balance = Money.max(BigDecimal.ZERO, balance.subtract(payment.getPrincipalAmount()));
            totalPrincipal = totalPrincipal.add(payment.getPrincipalAmount());
            totalInterest = totalInterest.add(payment.getInterestAmount());
            projected.add(new ProjectedPayment(payment, balance));
        }

        return new BalanceProjection(
            principalAmount,
            balance,
            totalPrincipal,
            totalInterest,
            List.copyOf(projected)
        );
    }
}
