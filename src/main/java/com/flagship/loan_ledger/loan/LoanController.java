package com.flagship.loan_ledger.loan;

import com.flagship.loan_ledger.loan.dto.AllocationRequest;
import com.flagship.loan_ledger.loan.dto.AllocationResponse;
import com.flagship.loan_ledger.loan.dto.CreateLoanRequest;
import com.flagship.loan_ledger.loan.dto.LoanPaymentResponse;
import com.flagship.loan_ledger.loan.dto.LoanQuoteRequest;
import com.flagship.loan_ledger.loan.dto.LoanQuoteResponse;
import com.flagship.loan_ledger.loan.dto.LoanResponse;
import com.flagship.loan_ledger.loan.dto.LoanSummaryResponse;
import com.flagship.loan_ledger.loan.dto.RecordPaymentRequest;
import com.flagship.loan_ledger.loan.dto.ScheduleEntryResponse;
import com.flagship.loan_ledger.loan.dto.UpdateLoanRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for loans, their schedules and their payments.
 *
 * Every request is scoped to the tenant in the X-Tenant-ID header; loans of
 * other tenants answer 404.
 */
@RestController
@RequestMapping("/api/loans")
@RequiredArgsConstructor
@Slf4j
public class LoanController {

    static final String TENANT_HEADER = "X-Tenant-ID";

    private final LoanService loanService;

    @PostMapping("/quote")
    public ResponseEntity<LoanQuoteResponse> quote(@Valid @RequestBody LoanQuoteRequest request) {
        LoanQuote quote = loanService.quote(
            request.getPrincipalAmount(),
            request.getAnnualInterestRate(),
            request.getTermMonths(),
            request.getPaymentFrequency(),
            request.getStartDate()
        );
        return ResponseEntity.ok(LoanQuoteResponse.from(quote));
    }

    @PostMapping
    public ResponseEntity<LoanResponse> createLoan(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @Valid @RequestBody CreateLoanRequest request) {

        log.info("Received loan creation request: kind={}, principal={}", request.getKind(),
            request.getPrincipalAmount());
        Loan loan = loanService.createLoan(tenantId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(LoanResponse.from(loan));
    }

    @GetMapping
    public ResponseEntity<List<LoanSummaryResponse>> listLoans(@RequestHeader(TENANT_HEADER) UUID tenantId) {
        return ResponseEntity.ok(loanService.listSummaries(tenantId).stream()
            .map(LoanSummaryResponse::from)
            .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<LoanSummaryResponse> getLoan(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID loanId) {
        return ResponseEntity.ok(LoanSummaryResponse.from(loanService.getSummary(tenantId, loanId)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<LoanResponse> updateLoan(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID loanId,
            @Valid @RequestBody UpdateLoanRequest request) {
        return ResponseEntity.ok(LoanResponse.from(loanService.updateLoan(tenantId, loanId, request)));
    }

    @GetMapping("/{id}/schedule")
    public ResponseEntity<List<ScheduleEntryResponse>> getSchedule(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID loanId) {
        return ResponseEntity.ok(ScheduleEntryResponse.fromAll(loanService.getSchedule(tenantId, loanId)));
    }

    @GetMapping("/{id}/payments/suggestion")
    public ResponseEntity<AllocationResponse> suggestNextPayment(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID loanId) {
        return ResponseEntity.ok(AllocationResponse.from(loanService.suggestNextPayment(tenantId, loanId)));
    }

    @PostMapping("/{id}/payments/allocation")
    public ResponseEntity<AllocationResponse> previewAllocation(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID loanId,
            @RequestBody AllocationRequest request) {
        return ResponseEntity.ok(AllocationResponse.from(loanService.previewAllocation(tenantId, loanId, request)));
    }

    @PostMapping("/{id}/payments")
    public ResponseEntity<LoanPaymentResponse> recordPayment(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID loanId,
            @Valid @RequestBody RecordPaymentRequest request) {

        log.info("Received loan payment: total={}, customSplit={}", request.getTotalAmount(),
            request.isCustomSplit());
        LoanPayment payment = loanService.recordPayment(tenantId, loanId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(LoanPaymentResponse.from(payment));
    }

    @PutMapping("/{id}/payments/{paymentId}")
    public ResponseEntity<LoanPaymentResponse> updatePayment(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID loanId,
            @PathVariable("paymentId") UUID paymentId,
            @Valid @RequestBody RecordPaymentRequest request) {
        LoanPayment payment = loanService.updatePayment(tenantId, loanId, paymentId, request);
        return ResponseEntity.ok(LoanPaymentResponse.from(payment));
    }

    @DeleteMapping("/{id}/payments/{paymentId}")
    public ResponseEntity<Void> deletePayment(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID loanId,
            @PathVariable("paymentId") UUID paymentId) {
        loanService.deletePayment(tenantId, loanId, paymentId);
        return ResponseEntity.noContent().build();
    }
}
