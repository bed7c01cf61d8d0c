package com.flagship.loan_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Micrometer meters for loan operations.
 *
 * - loan.created{kind}
 * - loan.payments.recorded{kind,split}
 * - loan.payments.rejected{reason}
 * - loan.payments.deleted
 * - loan.projection.duration
 */
@Component
public class LoanMetrics {

    private final MeterRegistry registry;
    private final Counter paymentsDeleted;
    private final Timer projectionTimer;

    public LoanMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.paymentsDeleted = Counter.builder("loan.payments.deleted")
                .description("Number of loan payments deleted")
                .register(registry);

        this.projectionTimer = Timer.builder("loan.projection.duration")
                .description("Time taken to replay a loan's payment history")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordLoanCreated(String kind) {
        registry.counter("loan.created", "kind", sanitizeTag(kind)).increment();
    }

    public void recordPaymentRecorded(String kind, boolean customSplit) {
        registry.counter("loan.payments.recorded",
                "kind", sanitizeTag(kind),
                "split", customSplit ? "custom" : "auto"
        ).increment();
    }

    public void recordPaymentRejected(String reason) {
        registry.counter("loan.payments.rejected", "reason", sanitizeTag(reason)).increment();
    }

    public void incrementPaymentsDeleted() {
        paymentsDeleted.increment();
    }

    public <T> T timeProjection(Supplier<T> projection) {
        return projectionTimer.record(projection);
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
