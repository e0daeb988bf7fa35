package com.flagship.bookkeeping.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for bookkeeping operations.
 *
 * Metrics exposed:
 * - ledger.transactions: postings, edits and deletions, tagged by operation and outcome
 * - ledger.transactions.latency: time spent in each ledger operation
 * - ledger.documents.posted: business documents, tagged by type and outcome
 * - ledger.fixed_expenses.runs: recurring charge executions, tagged by outcome
 * - ledger.reports.duration: statement generation time, tagged by report type
 * - ledger.snapshots.lookup: monthly snapshot cache hits and misses
 * - ledger.balances.corrected: accounts fixed by balance reconciliation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter balancesCorrected;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.balancesCorrected = Counter.builder("ledger.balances.corrected")
                .description("Number of cached account balances corrected by reconciliation")
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordTransaction(String operation, String outcome) {
        registry.counter("ledger.transactions",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordTransactionLatency(String operation, long durationMs) {
        registry.timer("ledger.transactions.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordBalancesCorrected(int count) {
        balancesCorrected.increment(count);
    }

    // ==================== Documents & recurring charges ====================

    public void recordDocumentPosted(String documentType, String outcome) {
        registry.counter("ledger.documents.posted",
                "type", sanitizeTag(documentType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordFixedExpenseRun(String outcome) {
        registry.counter("ledger.fixed_expenses.runs",
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    // ==================== Reports ====================

    /**
     * Times a statement generation.
     */
    public <T> T timeReport(String reportType, Supplier<T> operation) {
        return Timer.builder("ledger.reports.duration")
                .description("Time taken to generate a financial statement")
                .tag("report", sanitizeTag(reportType))
                .register(registry)
                .record(operation);
    }

    public void recordSnapshotLookup(boolean hit) {
        registry.counter("ledger.snapshots.lookup", "result", hit ? "hit" : "miss").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
