package com.flagship.loan_ledger.loan;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for recorded loan payments. Stores the split only, never a
 * running balance.
 */
@Entity
@Table(
    name = "loan_payments",
    indexes = {
        @Index(name = "idx_loan_payments_loan_id", columnList = "loan_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanPaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "loan_id", nullable = false, updatable = false)
    private UUID loanId;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(name = "payment_date", nullable = false)
    private LocalDate paymentDate;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalAmount;

    @Column(name = "principal_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal principalAmount;

    @Column(name = "interest_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal interestAmount;

    @Column
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static LoanPaymentEntity fromDomain(LoanPayment payment) {
        return new LoanPaymentEntity(
            payment.getId(),
            payment.getLoanId(),
            payment.getTenantId(),
            payment.getAccountId(),
            payment.getPaymentDate(),
            payment.getTotalAmount(),
            payment.getPrincipalAmount(),
            payment.getInterestAmount(),
            payment.getNotes(),
            null // createdAt - set by @PrePersist
        );
    }

    public LoanPayment toDomain() {
        return LoanPayment.builder()
            .id(id)
            .loanId(loanId)
            .tenantId(tenantId)
            .accountId(accountId)
            .paymentDate(paymentDate)
            .totalAmount(totalAmount)
            .principalAmount(principalAmount)
            .interestAmount(interestAmount)
            .notes(notes)
            .createdAt(createdAt)
            .build();
    }

    void updateFromDomain(LoanPayment payment) {
        this.accountId = payment.getAccountId();
        this.paymentDate = payment.getPaymentDate();
        this.totalAmount = payment.getTotalAmount();
        this.principalAmount = payment.getPrincipalAmount();
        this.interestAmount = payment.getInterestAmount();
        this.notes = payment.getNotes();
    }
}
