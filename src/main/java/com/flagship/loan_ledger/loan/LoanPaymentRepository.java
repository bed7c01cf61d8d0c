package com.flagship.loan_ledger.loan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LoanPaymentRepository extends JpaRepository<LoanPaymentEntity, UUID> {

    /**
     * All payments of a loan, in no particular order. Callers that need the
     * application order get it from the balance projector.
     */
    List<LoanPaymentEntity> findByLoanId(UUID loanId);
}
