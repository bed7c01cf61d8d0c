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
 * JPA entity for loans.
 *
 * No setters: edits go through {@link #updateFromDomain(Loan)}. There is no
 * remaining_balance column; balances are projected from loan_payments.
 */
@Entity
@Table(
    name = "loans",
    indexes = {
        @Index(name = "idx_loans_tenant_id", columnList = "tenant_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "contact_id")
    private UUID contactId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private LoanKind kind;

    @Column(nullable = false)
    private String name;

    @Column(name = "principal_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal principalAmount;

    @Column(name = "annual_interest_rate", nullable = false, precision = 9, scale = 6)
    private BigDecimal annualInterestRate;

    @Column(name = "term_months", nullable = false)
    private int termMonths;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_frequency", length = 16)
    private PaymentFrequency paymentFrequency;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "suggested_payment_amount", precision = 19, scale = 4)
    private BigDecimal suggestedPaymentAmount;

    @Column
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static LoanEntity fromDomain(Loan loan) {
        return new LoanEntity(
            loan.getId(),
            loan.getTenantId(),
            loan.getContactId(),
            loan.getKind(),
            loan.getName(),
            loan.getPrincipalAmount(),
            loan.getAnnualInterestRate(),
            loan.getTermMonths(),
            loan.getPaymentFrequency(),
            loan.getStartDate(),
            loan.getSuggestedPaymentAmount(),
            loan.getNotes(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Loan toDomain() {
        return Loan.builder()
            .id(id)
            .tenantId(tenantId)
            .contactId(contactId)
            .kind(kind)
            .name(name)
            .principalAmount(principalAmount)
            .annualInterestRate(annualInterestRate)
            .termMonths(termMonths)
            .paymentFrequency(paymentFrequency)
            .startDate(startDate)
            .suggestedPaymentAmount(suggestedPaymentAmount)
            .notes(notes)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the editable fields. Id, tenant and kind are fixed at creation.
     */
    void updateFromDomain(Loan loan) {
        this.contactId = loan.getContactId();
        this.name = loan.getName();
        this.principalAmount = loan.getPrincipalAmount();
        this.annualInterestRate = loan.getAnnualInterestRate();
        this.termMonths = loan.getTermMonths();
        this.paymentFrequency = loan.getPaymentFrequency();
        this.startDate = loan.getStartDate();
        this.suggestedPaymentAmount = loan.getSuggestedPaymentAmount();
        this.notes = loan.getNotes();
    }
}
