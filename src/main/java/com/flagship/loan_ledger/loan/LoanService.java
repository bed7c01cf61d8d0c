package com.flagship.loan_ledger.loan;

import com.flagship.loan_ledger.config.LoanEngineProperties;
import com.flagship.loan_ledger.ledger.Account;
import com.flagship.loan_ledger.ledger.AccountService;
import com.flagship.loan_ledger.ledger.CashMovement;
import com.flagship.loan_ledger.ledger.CashMovementRecorder;
import com.flagship.loan_ledger.ledger.FundsCheck;
import com.flagship.loan_ledger.loan.dto.AllocationRequest;
import com.flagship.loan_ledger.loan.dto.CreateLoanRequest;
import com.flagship.loan_ledger.loan.dto.RecordPaymentRequest;
import com.flagship.loan_ledger.loan.dto.UpdateLoanRequest;
import com.flagship.loan_ledger.loan.engine.AmortizationScheduleEntry;
import com.flagship.loan_ledger.loan.engine.AmortizationScheduleGenerator;
import com.flagship.loan_ledger.loan.engine.BalanceProjection;
import com.flagship.loan_ledger.loan.engine.BalanceProjector;
import com.flagship.loan_ledger.loan.engine.LoanTermsValidator;
import com.flagship.loan_ledger.loan.engine.Money;
import com.flagship.loan_ledger.loan.engine.NextPaymentSuggester;
import com.flagship.loan_ledger.loan.engine.PaymentAllocation;
import com.flagship.loan_ledger.loan.engine.PaymentAllocationEngine;
import com.flagship.loan_ledger.loan.engine.PaymentAmountCalculator;
import com.flagship.loan_ledger.loan.exception.InsufficientFundsException;
import com.flagship.loan_ledger.loan.exception.LoanValidationException;
import com.flagship.loan_ledger.loan.exception.ResourceNotFoundException;
import com.flagship.loan_ledger.observability.CorrelationContext;
import com.flagship.loan_ledger.observability.LoanMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Application service for loans and their payments.
 *
 * Every figure shown to callers is recomputed from the payment history via
 * {@link BalanceProjector}; nothing here maintains a stored balance.
 *
 * Recording, editing and deleting a payment touch both the loan store and
 * the cash ledger. Each runs in a single transaction, so a failure in either
 * leaves neither applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanService {

    private final LoanStore loanStore;
    private final AccountService accountService;
    private final CashMovementRecorder cashMovementRecorder;
    private final PaymentAmountCalculator paymentAmountCalculator;
    private final AmortizationScheduleGenerator scheduleGenerator;
    private final PaymentAllocationEngine allocationEngine;
    private final BalanceProjector balanceProjector;
    private final NextPaymentSuggester nextPaymentSuggester;
    private final LoanEngineProperties properties;
    private final LoanMetrics loanMetrics;

    /**
     * Payment amount and projected schedule for terms that are not saved yet.
     */
    public LoanQuote quote(BigDecimal principal, BigDecimal annualRate, int termMonths,
                           PaymentFrequency frequency, LocalDate startDate) {
        BigDecimal payment = paymentAmountCalculator.compute(principal, annualRate, termMonths, frequency);
        List<AmortizationScheduleEntry> schedule =
            scheduleGenerator.generate(principal, annualRate, termMonths, startDate, frequency);
        return new LoanQuote(payment, frequency, schedule);
    }

    @Transactional
    public Loan createLoan(UUID tenantId, CreateLoanRequest request) {
        LoanTermsValidator.requireValidTerms(
            request.getPrincipalAmount(), request.getAnnualInterestRate(), request.getTermMonths());

        Loan loan = Loan.builder()
            .id(UUID.randomUUID())
            .tenantId(tenantId)
            .contactId(request.getContactId())
            .kind(request.getKind())
            .name(request.getName())
            .principalAmount(request.getPrincipalAmount())
            .annualInterestRate(request.getAnnualInterestRate())
            .termMonths(request.getTermMonths())
            .paymentFrequency(request.getPaymentFrequency())
            .startDate(request.getStartDate())
            .suggestedPaymentAmount(suggestedPayment(request.getPrincipalAmount(),
                request.getAnnualInterestRate(), request.getTermMonths(), request.getPaymentFrequency()))
            .notes(request.getNotes())
            .build();

        Loan saved = loanStore.createLoan(loan);
        putLoanContext(tenantId, saved.getId());

        if (request.getDisbursementAccountId() != null) {
            disburse(saved, request.getDisbursementAccountId());
        }

        loanMetrics.recordLoanCreated(saved.getKind().name());
        log.info("Loan created: kind={}, principal={}, frequency={}, suggestedPayment={}",
            saved.getKind(), saved.getPrincipalAmount(), saved.getPaymentFrequency(),
            saved.getSuggestedPaymentAmount());
        return saved;
    }

    /**
     * Replaces the editable fields of a loan and recomputes its advisory payment.
     * A disbursement already posted follows a changed principal or start date.
     *
     * @throws LoanValidationException with INVALID_PRINCIPAL if the new principal
     *         is below the principal already repaid
     */
    @Transactional
    public Loan updateLoan(UUID tenantId, UUID loanId, UpdateLoanRequest request) {
        Loan loan = getLoan(tenantId, loanId);
        LoanTermsValidator.requireValidTerms(
            request.getPrincipalAmount(), request.getAnnualInterestRate(), request.getTermMonths());

        BalanceProjection projection = balanceProjector.project(loan, loanStore.listPayments(loanId));
        if (request.getPrincipalAmount().compareTo(projection.getTotalPrincipalPaid()) < 0) {
            throw LoanValidationException.invalidPrincipal(String.format(
                "Principal %s is below the %s already repaid on this loan",
                request.getPrincipalAmount(), projection.getTotalPrincipalPaid()));
        }

        Loan edited = loan.toBuilder()
            .contactId(request.getContactId())
            .name(request.getName())
            .principalAmount(request.getPrincipalAmount())
            .annualInterestRate(request.getAnnualInterestRate())
            .termMonths(request.getTermMonths())
            .paymentFrequency(request.getPaymentFrequency())
            .startDate(request.getStartDate())
            .suggestedPaymentAmount(suggestedPayment(request.getPrincipalAmount(),
                request.getAnnualInterestRate(), request.getTermMonths(), request.getPaymentFrequency()))
            .notes(request.getNotes())
            .build();

        Loan updated = loanStore.updateLoan(edited);
        if (updated.getPrincipalAmount().compareTo(loan.getPrincipalAmount()) != 0
                || !updated.getStartDate().equals(loan.getStartDate())) {
            redisburse(updated);
        }
        log.info("Loan updated: principal={}, rate={}, term={}, frequency={}",
            updated.getPrincipalAmount(), updated.getAnnualInterestRate(), updated.getTermMonths(),
            updated.getPaymentFrequency());
        return updated;
    }

    /**
     * @throws ResourceNotFoundException if the loan is missing or owned by another tenant
     */
    public Loan getLoan(UUID tenantId, UUID loanId) {
        putLoanContext(tenantId, loanId);
        return loanStore.getLoan(loanId)
            .filter(loan -> loan.belongsTo(tenantId))
            .orElseThrow(() -> ResourceNotFoundException.loan(loanId));
    }

    public LoanSummary getSummary(UUID tenantId, UUID loanId) {
        Loan loan = getLoan(tenantId, loanId);
        return summarize(loan);
    }

    public List<LoanSummary> listSummaries(UUID tenantId) {
        return loanStore.listLoans(tenantId).stream()
            .map(this::summarize)
            .toList();
    }

    /**
     * Projected schedule of a loan, empty when it has no payment frequency.
     */
    public List<AmortizationScheduleEntry> getSchedule(UUID tenantId, UUID loanId) {
        Loan loan = getLoan(tenantId, loanId);
        if (!loan.hasSchedule()) {
            return List.of();
        }
        return scheduleGenerator.generate(loan.getPrincipalAmount(), loan.getAnnualInterestRate(),
            loan.getTermMonths(), loan.getStartDate(), loan.getPaymentFrequency());
    }

    public PaymentAllocation suggestNextPayment(UUID tenantId, UUID loanId) {
        Loan loan = getLoan(tenantId, loanId);
        return nextPaymentSuggester.suggestNextPayment(loan, loanStore.listPayments(loanId));
    }

    /**
     * Split a proposed payment against the current balance without recording it.
     */
    public PaymentAllocation previewAllocation(UUID tenantId, UUID loanId, AllocationRequest request) {
        Loan loan = getLoan(tenantId, loanId);
        BigDecimal remaining = balanceProjector.project(loan, loanStore.listPayments(loanId)).getRemainingBalance();
        return resolveSplit(loan, remaining, request);
    }

    @Transactional
    public LoanPayment recordPayment(UUID tenantId, UUID loanId, RecordPaymentRequest request) {
        Loan loan = getLoan(tenantId, loanId);

        try {
            BigDecimal remaining = balanceProjector.project(loan, loanStore.listPayments(loanId))
                .getRemainingBalance();
            PaymentAllocation split = resolveSplit(loan, remaining, request.toAllocationRequest());

            Account account = accountService.getForTenant(tenantId, request.getAccountId());
            if (loan.getKind().repaymentDrawsCash()) {
                requireFunds(account, split.getTotalAmount());
            }

            LoanPayment saved = loanStore.createPayment(LoanPayment.builder()
                .id(UUID.randomUUID())
                .loanId(loanId)
                .tenantId(tenantId)
                .accountId(account.getId())
                .paymentDate(request.getPaymentDate())
                .totalAmount(split.getTotalAmount())
                .principalAmount(split.getPrincipalAmount())
                .interestAmount(split.getInterestAmount())
                .notes(request.getNotes())
                .build());

            postRepayment(loan, saved);

            loanMetrics.recordPaymentRecorded(loan.getKind().name(), split.isCustom());
            log.info("Loan payment recorded: paymentId={}, total={}, principal={}, interest={}",
                saved.getId(), saved.getTotalAmount(), saved.getPrincipalAmount(), saved.getInterestAmount());
            return saved;

        } catch (LoanValidationException e) {
            loanMetrics.recordPaymentRejected(e.getCode().name());
            throw e;
        } catch (InsufficientFundsException e) {
            loanMetrics.recordPaymentRejected("INSUFFICIENT_FUNDS");
            throw e;
        }
    }

    /**
     * Edits a payment and rewrites its cash movement.
     *
     * An automatic split is computed against the balance as it stands without
     * the payment being edited. When the payment stays on the same account,
     * its original amount counts as available again for the funds check.
     */
    @Transactional
    public LoanPayment updatePayment(UUID tenantId, UUID loanId, UUID paymentId, RecordPaymentRequest request) {
        Loan loan = getLoan(tenantId, loanId);
        LoanPayment existing = getPaymentOfLoan(loanId, paymentId);

        try {
            List<LoanPayment> others = loanStore.listPayments(loanId).stream()
                .filter(payment -> !payment.getId().equals(paymentId))
                .toList();
            BigDecimal remaining = balanceProjector.project(loan, others).getRemainingBalance();
            PaymentAllocation split = resolveSplit(loan, remaining, request.toAllocationRequest());

            Account account = accountService.getForTenant(tenantId, request.getAccountId());
            if (loan.getKind().repaymentDrawsCash()) {
                Account effective = account.getId().equals(existing.getAccountId())
                    ? account.withBalanceAdjustedBy(existing.getTotalAmount())
                    : account;
                requireFunds(effective, split.getTotalAmount());
            }

            LoanPayment updated = loanStore.updatePayment(existing.toBuilder()
                .accountId(account.getId())
                .paymentDate(request.getPaymentDate())
                .totalAmount(split.getTotalAmount())
                .principalAmount(split.getPrincipalAmount())
                .interestAmount(split.getInterestAmount())
                .notes(request.getNotes())
                .build());

            cashMovementRecorder.removeForLoanPayment(paymentId);
            postRepayment(loan, updated);

            log.info("Loan payment updated: paymentId={}, total={}, principal={}, interest={}",
                paymentId, updated.getTotalAmount(), updated.getPrincipalAmount(), updated.getInterestAmount());
            return updated;

        } catch (LoanValidationException e) {
            loanMetrics.recordPaymentRejected(e.getCode().name());
            throw e;
        } catch (InsufficientFundsException e) {
            loanMetrics.recordPaymentRejected("INSUFFICIENT_FUNDS");
            throw e;
        }
    }

    /**
     * Deletes a payment together with its cash movement.
     */
    @Transactional
    public void deletePayment(UUID tenantId, UUID loanId, UUID paymentId) {
        getLoan(tenantId, loanId);
        getPaymentOfLoan(loanId, paymentId);

        int removed = cashMovementRecorder.removeForLoanPayment(paymentId);
        loanStore.deletePayment(paymentId);

        loanMetrics.incrementPaymentsDeleted();
        log.info("Loan payment deleted: paymentId={}, cashTransactionsRemoved={}", paymentId, removed);
    }

    private LoanSummary summarize(Loan loan) {
        List<LoanPayment> payments = loanStore.listPayments(loan.getId());
        BalanceProjection projection = loanMetrics.timeProjection(() -> balanceProjector.project(loan, payments));
        return new LoanSummary(loan, projection);
    }

    private LoanPayment getPaymentOfLoan(UUID loanId, UUID paymentId) {
        return loanStore.getPayment(paymentId)
            .filter(payment -> payment.getLoanId().equals(loanId))
            .orElseThrow(() -> ResourceNotFoundException.payment(paymentId));
    }

    private PaymentAllocation resolveSplit(Loan loan, BigDecimal outstanding, AllocationRequest request) {
        if (!request.isCustomSplit()) {
            return allocationEngine.allocate(outstanding, loan.getAnnualInterestRate(), request.getTotalAmount(),
                properties.getAllocation().getPeriodsPerYearForInterest());
        }

        PaymentAllocation split = allocationEngine.custom(request.getPrincipalAmount(), request.getInterestAmount());
        BigDecimal total = request.getTotalAmount();
        if (total == null) {
            return split;
        }
        if (!Money.withinEpsilon(total, split.getTotalAmount())) {
            throw LoanValidationException.invalidPayment(String.format(
                "Principal %s and interest %s do not add up to the total %s",
                split.getPrincipalAmount(), split.getInterestAmount(), total));
        }
        return new PaymentAllocation(total, split.getPrincipalAmount(), split.getInterestAmount(), true);
    }

    private BigDecimal suggestedPayment(BigDecimal principal, BigDecimal annualRate, int termMonths,
                                        PaymentFrequency frequency) {
        if (frequency == null) {
            return null;
        }
        return paymentAmountCalculator.compute(principal, annualRate, termMonths, frequency);
    }

    private void disburse(Loan loan, UUID accountId) {
        Account account = accountService.getForTenant(loan.getTenantId(), accountId);
        BigDecimal cashEffect = loan.getKind().disbursementCashEffect(loan.getPrincipalAmount());
        if (cashEffect.signum() < 0) {
            requireFunds(account, loan.getPrincipalAmount());
        }
        cashMovementRecorder.postTransaction(CashMovement.disbursement(
            loan.getTenantId(),
            account.getId(),
            cashEffect,
            loan.getStartDate(),
            "Loan disbursement: " + loan.getName(),
            loan.getId()
        ));
        log.info("Loan disbursed through account {}: amount={}", account.getId(), cashEffect);
    }

    /**
     * Reposts an existing disbursement at the loan's current principal and
     * start date. The old movement is removed first so a receivable's funds
     * check sees the account without it.
     */
    private void redisburse(Loan loan) {
        cashMovementRecorder.findDisbursement(loan.getId()).ifPresent(previous -> {
            cashMovementRecorder.removeDisbursement(loan.getId());
            log.info("Reposting disbursement for loan {}: previous amount={}, date={}",
                loan.getId(), previous.getAmount(), previous.getDate());
            disburse(loan, previous.getAccountId());
        });
    }

    private void postRepayment(Loan loan, LoanPayment payment) {
        cashMovementRecorder.postTransaction(CashMovement.repayment(
            loan.getTenantId(),
            payment.getAccountId(),
            loan.getKind().repaymentCashEffect(payment.getTotalAmount()),
            payment.getPaymentDate(),
            "Loan payment: " + loan.getName(),
            loan.getId(),
            payment.getId()
        ));
    }

    private void requireFunds(Account account, BigDecimal amount) {
        FundsCheck check = cashMovementRecorder.checkFunds(account, amount);
        if (!check.isHasFunds()) {
            log.warn("Insufficient funds on account {}: requested={}, available={}",
                account.getId(), amount, check.getAvailable());
            throw new InsufficientFundsException(account.getId(), account.getName(), check.getAvailableLabel(),
                amount, check.getAvailable());
        }
    }

    private void putLoanContext(UUID tenantId, UUID loanId) {
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId.toString());
        MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loanId.toString());
    }
}
