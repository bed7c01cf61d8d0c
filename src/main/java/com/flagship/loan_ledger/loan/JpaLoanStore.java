package com.flagship.loan_ledger.loan;

import com.flagship.loan_ledger.loan.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the loan domain objects and their JPA entities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaLoanStore implements LoanStore {

    private final LoanRepository loanRepository;
    private final LoanPaymentRepository paymentRepository;

    @Override
    @Transactional
    public Loan createLoan(Loan loan) {
        LoanEntity saved = loanRepository.saveAndFlush(LoanEntity.fromDomain(loan));
        log.debug("Saved loan {}", saved.getId());
        return saved.toDomain();
    }

    @Override
    @Transactional
    public Loan updateLoan(Loan loan) {
        LoanEntity existing = loanRepository.findById(loan.getId())
            .orElseThrow(() -> ResourceNotFoundException.loan(loan.getId()));
        existing.updateFromDomain(loan);
        LoanEntity updated = loanRepository.saveAndFlush(existing);
        log.debug("Updated loan {}", updated.getId());
        return updated.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Loan> getLoan(UUID loanId) {
        return loanRepository.findById(loanId).map(LoanEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Loan> listLoans(UUID tenantId) {
        return loanRepository.findByTenantIdOrderByNameAsc(tenantId).stream()
            .map(LoanEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<LoanPayment> listPayments(UUID loanId) {
        return paymentRepository.findByLoanId(loanId).stream()
            .map(LoanPaymentEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LoanPayment> getPayment(UUID paymentId) {
        return paymentRepository.findById(paymentId).map(LoanPaymentEntity::toDomain);
    }

    @Override
    @Transactional
    public LoanPayment createPayment(LoanPayment payment) {
        LoanPaymentEntity saved = paymentRepository.saveAndFlush(LoanPaymentEntity.fromDomain(payment));
        log.debug("Saved loan payment {} for loan {}", saved.getId(), saved.getLoanId());
        return saved.toDomain();
    }

    @Override
    @Transactional
    public LoanPayment updatePayment(LoanPayment payment) {
        LoanPaymentEntity existing = paymentRepository.findById(payment.getId())
            .orElseThrow(() -> ResourceNotFoundException.payment(payment.getId()));
        existing.updateFromDomain(payment);
        LoanPaymentEntity updated = paymentRepository.saveAndFlush(existing);
        log.debug("Updated loan payment {}", updated.getId());
        return updated.toDomain();
    }

    @Override
    @Transactional
    public void deletePayment(UUID paymentId) {
        if (!paymentRepository.existsById(paymentId)) {
            throw ResourceNotFoundException.payment(paymentId);
        }
        paymentRepository.deleteById(paymentId);
        log.debug("Deleted loan payment {}", paymentId);
    }
}
