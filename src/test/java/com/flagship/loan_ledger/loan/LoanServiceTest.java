package com.flagship.loan_ledger.loan;

import com.flagship.loan_ledger.config.LoanEngineProperties;
import com.flagship.loan_ledger.ledger.Account;
import com.flagship.loan_ledger.ledger.AccountService;
import com.flagship.loan_ledger.ledger.CashMovement;
import com.flagship.loan_ledger.ledger.CashMovementRecorder;
import com.flagship.loan_ledger.ledger.FundsCheck;
import com.flagship.loan_ledger.loan.dto.CreateLoanRequest;
import com.flagship.loan_ledger.loan.dto.RecordPaymentRequest;
import com.flagship.loan_ledger.loan.dto.UpdateLoanRequest;
import com.flagship.loan_ledger.loan.engine.AmortizationScheduleGenerator;
import com.flagship.loan_ledger.loan.engine.BalanceProjector;
import com.flagship.loan_ledger.loan.engine.NextPaymentSuggester;
import com.flagship.loan_ledger.loan.engine.PaymentAllocationEngine;
import com.flagship.loan_ledger.loan.engine.PaymentAmountCalculator;
import com.flagship.loan_ledger.loan.exception.InsufficientFundsException;
import com.flagship.loan_ledger.loan.exception.LoanErrorCode;
import com.flagship.loan_ledger.loan.exception.LoanValidationException;
import com.flagship.loan_ledger.loan.exception.ResourceNotFoundException;
import com.flagship.loan_ledger.observability.LoanMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Payment bookkeeping against mocked persistence: splits, funds checks and
 * the cash movements that go with them.
 */
@ExtendWith(MockitoExtension.class)
class LoanServiceTest {

    private static final UUID TENANT_ID = UUID.randomUUID();
    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Mock
    private LoanStore loanStore;

    @Mock
    private AccountService accountService;

    @Mock
    private CashMovementRecorder cashMovementRecorder;

    private SimpleMeterRegistry meterRegistry;
    private LoanService loanService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        LoanEngineProperties properties = new LoanEngineProperties();
        PaymentAmountCalculator calculator = new PaymentAmountCalculator();
        BalanceProjector projector = new BalanceProjector();
        PaymentAllocationEngine allocationEngine = new PaymentAllocationEngine();

        loanService = new LoanService(
            loanStore,
            accountService,
            cashMovementRecorder,
            calculator,
            new AmortizationScheduleGenerator(calculator),
            allocationEngine,
            projector,
            new NextPaymentSuggester(projector, allocationEngine, calculator, properties),
            properties,
            new LoanMetrics(meterRegistry)
        );
    }

    @Test
    @DisplayName("Auto split payment is stored and posted as an outflow for a payable loan")
    void testRecordPaymentPayable() {
        Loan loan = loan(LoanKind.PAYABLE);
        Account account = account("1000.00");
        stubLoan(loan, List.of());
        when(accountService.getForTenant(TENANT_ID, account.getId())).thenReturn(account);
        stubFundsCheck();
        when(loanStore.createPayment(any())).thenAnswer(invocation -> invocation.getArgument(0));

        LoanPayment payment = loanService.recordPayment(TENANT_ID, loan.getId(),
            paymentRequest(account.getId(), "443.21"));

        assertEquals(new BigDecimal("393.21"), payment.getPrincipalAmount());
        assertEquals(new BigDecimal("50.00"), payment.getInterestAmount());
        assertTrue(payment.isSplitConsistent());

        ArgumentCaptor<CashMovement> movement = ArgumentCaptor.forClass(CashMovement.class);
        verify(cashMovementRecorder).postTransaction(movement.capture());
        assertEquals(0, movement.getValue().getAmount().compareTo(new BigDecimal("-443.21")));
        assertEquals(payment.getId(), movement.getValue().getLoanPaymentId());
        assertEquals(account.getId(), movement.getValue().getAccountId());

        assertEquals(1.0, meterRegistry.get("loan.payments.recorded")
            .tag("kind", "PAYABLE").tag("split", "auto").counter().count());
    }

    @Test
    @DisplayName("Receivable repayment adds cash and skips the funds check")
    void testRecordPaymentReceivable() {
        Loan loan = loan(LoanKind.RECEIVABLE);
        Account account = account("0.00");
        stubLoan(loan, List.of());
        when(accountService.getForTenant(TENANT_ID, account.getId())).thenReturn(account);
        when(loanStore.createPayment(any())).thenAnswer(invocation -> invocation.getArgument(0));

        loanService.recordPayment(TENANT_ID, loan.getId(), paymentRequest(account.getId(), "443.21"));

        ArgumentCaptor<CashMovement> movement = ArgumentCaptor.forClass(CashMovement.class);
        verify(cashMovementRecorder).postTransaction(movement.capture());
        assertEquals(0, movement.getValue().getAmount().compareTo(new BigDecimal("443.21")));
        verify(cashMovementRecorder, never()).checkFunds(any(), any());
    }

    @Test
    @DisplayName("Payment larger than the account can cover is rejected and nothing is written")
    void testRecordPaymentInsufficientFunds() {
        Loan loan = loan(LoanKind.PAYABLE);
        Account account = account("100.00");
        stubLoan(loan, List.of());
        when(accountService.getForTenant(TENANT_ID, account.getId())).thenReturn(account);
        stubFundsCheck();

        InsufficientFundsException exception = assertThrows(InsufficientFundsException.class,
            () -> loanService.recordPayment(TENANT_ID, loan.getId(), paymentRequest(account.getId(), "443.21")));

        assertEquals(0, exception.getAvailable().compareTo(new BigDecimal("100.00")));
        verify(loanStore, never()).createPayment(any());
        verify(cashMovementRecorder, never()).postTransaction(any());
        assertEquals(1.0, meterRegistry.get("loan.payments.rejected")
            .tag("reason", "INSUFFICIENT_FUNDS").counter().count());
    }

    @Test
    @DisplayName("Custom split that does not add up to the total is rejected")
    void testCustomSplitMismatch() {
        Loan loan = loan(LoanKind.PAYABLE);
        stubLoan(loan, List.of());
        RecordPaymentRequest request = RecordPaymentRequest.builder()
            .accountId(UUID.randomUUID())
            .paymentDate(START.plusMonths(1))
            .totalAmount(new BigDecimal("100.00"))
            .customSplit(true)
            .principalAmount(new BigDecimal("80.00"))
            .interestAmount(new BigDecimal("10.00"))
            .build();

        LoanValidationException exception = assertThrows(LoanValidationException.class,
            () -> loanService.recordPayment(TENANT_ID, loan.getId(), request));

        assertEquals(LoanErrorCode.INVALID_PAYMENT, exception.getCode());
        verify(loanStore, never()).createPayment(any());
    }

    @Test
    @DisplayName("Editing a payment on the same account counts its old amount as available")
    void testUpdatePaymentSameAccountAddsBack() {
        Loan loan = loan(LoanKind.PAYABLE);
        Account account = account("56.79");
        LoanPayment existing = payment(loan, account.getId(), "393.21", "50.00");
        stubLoan(loan, List.of(existing));
        when(loanStore.getPayment(existing.getId())).thenReturn(Optional.of(existing));
        when(accountService.getForTenant(TENANT_ID, account.getId())).thenReturn(account);
        stubFundsCheck();
        when(loanStore.updatePayment(any())).thenAnswer(invocation -> invocation.getArgument(0));

        LoanPayment updated = loanService.updatePayment(TENANT_ID, loan.getId(), existing.getId(),
            paymentRequest(account.getId(), "450.00"));

        // split against the balance without the payment being edited
        assertEquals(new BigDecimal("50.00"), updated.getInterestAmount());
        assertEquals(new BigDecimal("400.00"), updated.getPrincipalAmount());

        InOrder order = inOrder(cashMovementRecorder);
        order.verify(cashMovementRecorder).removeForLoanPayment(existing.getId());
        order.verify(cashMovementRecorder).postTransaction(any());
    }

    @Test
    @DisplayName("Moving a payment to another account gets no add-back")
    void testUpdatePaymentOtherAccount() {
        Loan loan = loan(LoanKind.PAYABLE);
        LoanPayment existing = payment(loan, UUID.randomUUID(), "393.21", "50.00");
        Account other = account("56.79");
        stubLoan(loan, List.of(existing));
        when(loanStore.getPayment(existing.getId())).thenReturn(Optional.of(existing));
        when(accountService.getForTenant(TENANT_ID, other.getId())).thenReturn(other);
        stubFundsCheck();

        assertThrows(InsufficientFundsException.class, () -> loanService.updatePayment(
            TENANT_ID, loan.getId(), existing.getId(), paymentRequest(other.getId(), "450.00")));

        verify(loanStore, never()).updatePayment(any());
        verify(cashMovementRecorder, never()).removeForLoanPayment(any());
    }

    @Test
    @DisplayName("Deleting a payment removes its cash movement first")
    void testDeletePayment() {
        Loan loan = loan(LoanKind.PAYABLE);
        LoanPayment existing = payment(loan, UUID.randomUUID(), "393.21", "50.00");
        when(loanStore.getLoan(loan.getId())).thenReturn(Optional.of(loan));
        when(loanStore.getPayment(existing.getId())).thenReturn(Optional.of(existing));

        loanService.deletePayment(TENANT_ID, loan.getId(), existing.getId());

        InOrder order = inOrder(cashMovementRecorder, loanStore);
        order.verify(cashMovementRecorder).removeForLoanPayment(existing.getId());
        order.verify(loanStore).deletePayment(existing.getId());
        assertEquals(1.0, meterRegistry.get("loan.payments.deleted").counter().count());
    }

    @Test
    @DisplayName("Payment of another loan is not found")
    void testDeletePaymentOfOtherLoan() {
        Loan loan = loan(LoanKind.PAYABLE);
        LoanPayment foreign = payment(loan(LoanKind.PAYABLE), UUID.randomUUID(), "10.00", "0.00");
        when(loanStore.getLoan(loan.getId())).thenReturn(Optional.of(loan));
        when(loanStore.getPayment(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThrows(ResourceNotFoundException.class,
            () -> loanService.deletePayment(TENANT_ID, loan.getId(), foreign.getId()));
        verify(loanStore, never()).deletePayment(any());
    }

    @Test
    @DisplayName("Loan of another tenant is reported as not found")
    void testTenantIsolation() {
        Loan loan = loan(LoanKind.PAYABLE);
        when(loanStore.getLoan(loan.getId())).thenReturn(Optional.of(loan));

        ResourceNotFoundException exception = assertThrows(ResourceNotFoundException.class,
            () -> loanService.getLoan(UUID.randomUUID(), loan.getId()));

        assertEquals("Loan", exception.getResourceType());
    }

    @Test
    @DisplayName("Principal cannot be edited below what has already been repaid")
    void testUpdateLoanPrincipalBelowRepaid() {
        Loan loan = loan(LoanKind.PAYABLE);
        stubLoan(loan, List.of(payment(loan, UUID.randomUUID(), "3000.00", "50.00")));
        UpdateLoanRequest request = UpdateLoanRequest.builder()
            .name(loan.getName())
            .principalAmount(new BigDecimal("2500.00"))
            .annualInterestRate(loan.getAnnualInterestRate())
            .termMonths(24)
            .paymentFrequency(PaymentFrequency.MONTHLY)
            .startDate(START)
            .build();

        LoanValidationException exception = assertThrows(LoanValidationException.class,
            () -> loanService.updateLoan(TENANT_ID, loan.getId(), request));

        assertEquals(LoanErrorCode.INVALID_PRINCIPAL, exception.getCode());
        verify(loanStore, never()).updateLoan(any());
    }

    @Test
    @DisplayName("Editing principal and start date reposts the disbursement to match")
    void testUpdateLoanRepostsDisbursement() {
        Loan loan = loan(LoanKind.PAYABLE);
        Account account = account("10000.00");
        stubLoan(loan, List.of());
        when(loanStore.updateLoan(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(cashMovementRecorder.findDisbursement(loan.getId())).thenReturn(Optional.of(
            disbursementOf(loan, account.getId(), "10000.00")));
        when(accountService.getForTenant(TENANT_ID, account.getId())).thenReturn(account);

        Loan updated = loanService.updateLoan(TENANT_ID, loan.getId(),
            editRequest(loan, "6000.00", START.plusMonths(2)));

        assertEquals(0, updated.getPrincipalAmount().compareTo(new BigDecimal("6000.00")));
        ArgumentCaptor<CashMovement> movement = ArgumentCaptor.forClass(CashMovement.class);
        InOrder order = inOrder(cashMovementRecorder);
        order.verify(cashMovementRecorder).removeDisbursement(loan.getId());
        order.verify(cashMovementRecorder).postTransaction(movement.capture());
        assertEquals(0, movement.getValue().getAmount().compareTo(new BigDecimal("6000.00")));
        assertEquals(LocalDate.of(2024, 3, 1), movement.getValue().getDate());
        assertEquals(account.getId(), movement.getValue().getAccountId());
        assertNull(movement.getValue().getLoanPaymentId());
    }

    @Test
    @DisplayName("Raising a receivable's principal beyond the account's funds is rejected")
    void testUpdateReceivableRedisbursementInsufficientFunds() {
        Loan loan = loan(LoanKind.RECEIVABLE);
        Account account = account("1000.00");
        stubLoan(loan, List.of());
        when(loanStore.updateLoan(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(cashMovementRecorder.findDisbursement(loan.getId())).thenReturn(Optional.of(
            disbursementOf(loan, account.getId(), "-10000.00")));
        when(accountService.getForTenant(TENANT_ID, account.getId())).thenReturn(account);
        stubFundsCheck();

        assertThrows(InsufficientFundsException.class, () -> loanService.updateLoan(TENANT_ID, loan.getId(),
            editRequest(loan, "12000.00", START)));

        verify(cashMovementRecorder, never()).postTransaction(any());
    }

    @Test
    @DisplayName("Editing only descriptive fields leaves the cash ledger alone")
    void testUpdateLoanNameOnly() {
        Loan loan = loan(LoanKind.PAYABLE);
        stubLoan(loan, List.of());
        when(loanStore.updateLoan(any())).thenAnswer(invocation -> invocation.getArgument(0));
        UpdateLoanRequest request = editRequest(loan, "10000.00", START);
        request.setName("Renamed loan");

        Loan updated = loanService.updateLoan(TENANT_ID, loan.getId(), request);

        assertEquals("Renamed loan", updated.getName());
        verify(cashMovementRecorder, never()).findDisbursement(any());
        verify(cashMovementRecorder, never()).postTransaction(any());
    }

    @Test
    @DisplayName("Rate finer than the stored precision is rejected before anything is saved")
    void testCreateLoanRateTooPrecise() {
        CreateLoanRequest request = CreateLoanRequest.builder()
            .kind(LoanKind.PAYABLE)
            .name("Equipment loan")
            .principalAmount(new BigDecimal("10000.00"))
            .annualInterestRate(new BigDecimal("0.0612345"))
            .termMonths(24)
            .paymentFrequency(PaymentFrequency.MONTHLY)
            .startDate(START)
            .build();

        LoanValidationException exception = assertThrows(LoanValidationException.class,
            () -> loanService.createLoan(TENANT_ID, request));

        assertEquals(LoanErrorCode.INVALID_RATE, exception.getCode());
        verify(loanStore, never()).createLoan(any());
    }

    @Test
    @DisplayName("Loan without a frequency carries no suggested payment")
    void testCreateLumpLoan() {
        when(loanStore.createLoan(any())).thenAnswer(invocation -> invocation.getArgument(0));
        CreateLoanRequest request = CreateLoanRequest.builder()
            .kind(LoanKind.RECEIVABLE)
            .name("Advance to supplier")
            .principalAmount(new BigDecimal("2500.00"))
            .annualInterestRate(BigDecimal.ZERO)
            .termMonths(6)
            .startDate(START)
            .build();

        Loan loan = loanService.createLoan(TENANT_ID, request);

        assertNull(loan.getSuggestedPaymentAmount());
        assertFalse(loan.hasSchedule());
        assertEquals(TENANT_ID, loan.getTenantId());
        verify(cashMovementRecorder, never()).postTransaction(any());
    }

    @Test
    @DisplayName("Payable loan disbursed into an account adds the principal to it")
    void testCreateLoanWithDisbursement() {
        Account account = account("0.00");
        when(loanStore.createLoan(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(accountService.getForTenant(TENANT_ID, account.getId())).thenReturn(account);
        CreateLoanRequest request = CreateLoanRequest.builder()
            .kind(LoanKind.PAYABLE)
            .name("Equipment loan")
            .principalAmount(new BigDecimal("10000.00"))
            .annualInterestRate(new BigDecimal("0.06"))
            .termMonths(24)
            .paymentFrequency(PaymentFrequency.MONTHLY)
            .startDate(START)
            .disbursementAccountId(account.getId())
            .build();

        Loan loan = loanService.createLoan(TENANT_ID, request);

        assertEquals(new BigDecimal("443.21"), loan.getSuggestedPaymentAmount());
        ArgumentCaptor<CashMovement> movement = ArgumentCaptor.forClass(CashMovement.class);
        verify(cashMovementRecorder).postTransaction(movement.capture());
        assertEquals(0, movement.getValue().getAmount().compareTo(new BigDecimal("10000.00")));
        assertEquals(START, movement.getValue().getDate());
        assertNull(movement.getValue().getLoanPaymentId());
    }

    private static UpdateLoanRequest editRequest(Loan loan, String principal, LocalDate startDate) {
        return UpdateLoanRequest.builder()
            .name(loan.getName())
            .principalAmount(new BigDecimal(principal))
            .annualInterestRate(loan.getAnnualInterestRate())
            .termMonths(loan.getTermMonths())
            .paymentFrequency(loan.getPaymentFrequency())
            .startDate(startDate)
            .build();
    }

    private static CashMovement disbursementOf(Loan loan, UUID accountId, String amount) {
        return CashMovement.disbursement(TENANT_ID, accountId, new BigDecimal(amount), loan.getStartDate(),
            "Loan disbursement: " + loan.getName(), loan.getId());
    }

    private void stubLoan(Loan loan, List<LoanPayment> payments) {
        when(loanStore.getLoan(loan.getId())).thenReturn(Optional.of(loan));
        when(loanStore.listPayments(loan.getId())).thenReturn(payments);
    }

    private void stubFundsCheck() {
        when(cashMovementRecorder.checkFunds(any(), any())).thenAnswer(invocation ->
            FundsCheck.of(invocation.getArgument(0), invocation.getArgument(1)));
    }

    private static RecordPaymentRequest paymentRequest(UUID accountId, String total) {
        return RecordPaymentRequest.builder()
            .accountId(accountId)
            .paymentDate(START.plusMonths(1))
            .totalAmount(new BigDecimal(total))
            .build();
    }

    private static Loan loan(LoanKind kind) {
        return Loan.builder()
            .id(UUID.randomUUID())
            .tenantId(TENANT_ID)
            .kind(kind)
            .name("Equipment loan")
            .principalAmount(new BigDecimal("10000.00"))
            .annualInterestRate(new BigDecimal("0.06"))
            .termMonths(24)
            .paymentFrequency(PaymentFrequency.MONTHLY)
            .startDate(START)
            .suggestedPaymentAmount(new BigDecimal("443.21"))
            .build();
    }

    private static Account account(String balance) {
        return new Account(UUID.randomUUID(), TENANT_ID, "Checking", Account.AccountType.BANK,
            BigDecimal.ZERO, new BigDecimal(balance));
    }

    private static LoanPayment payment(Loan loan, UUID accountId, String principal, String interest) {
        BigDecimal principalAmount = new BigDecimal(principal);
        BigDecimal interestAmount = new BigDecimal(interest);
        return LoanPayment.builder()
            .id(UUID.randomUUID())
            .loanId(loan.getId())
            .tenantId(TENANT_ID)
            .accountId(accountId)
            .paymentDate(START.plusMonths(1))
            .principalAmount(principalAmount)
            .interestAmount(interestAmount)
            .totalAmount(principalAmount.add(interestAmount))
            .build();
    }
}
