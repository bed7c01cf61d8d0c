package com.flagship.loan_ledger.loan;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary for loans and their payments.
 */
public interface LoanStore {

    Loan createLoan(Loan loan);

    Loan updateLoan(Loan loan);

    Optional<Loan> getLoan(UUID loanId);

    List<Loan> listLoans(UUID tenantId);

    /**
     * Payments of a loan in any order.
     */
    List<LoanPayment> listPayments(UUID loanId);

    Optional<LoanPayment> getPayment(UUID paymentId);

    LoanPayment createPayment(LoanPayment payment);

    LoanPayment updatePayment(LoanPayment payment);

    void deletePayment(UUID paymentId);
}
