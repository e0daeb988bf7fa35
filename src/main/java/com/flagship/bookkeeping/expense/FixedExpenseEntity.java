package com.flagship.bookkeeping.expense;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for a recurring monthly charge.
 *
 * lastRunMonth is the only guard against charging twice in a month,
 * so it changes only through {@link #markRun}.
 */
@Entity
@Table(name = "fixed_expenses")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FixedExpenseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal amount;

    @Column(name = "expense_account_id", nullable = false)
    private UUID expenseAccountId;

    @Column(name = "primary_account_id")
    private UUID primaryAccountId;

    @Column(name = "fallback_account_id")
    private UUID fallbackAccountId;

    @Column(name = "day_of_month", nullable = false)
    private int dayOfMonth;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "last_run_month")
    private LocalDate lastRunMonth;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static FixedExpenseEntity create(FixedExpenseRequest request, Instant now) {
        FixedExpenseEntity entity = new FixedExpenseEntity();
        entity.createdAt = now;
        entity.applyUpdate(request, now);
        return entity;
    }

    void applyUpdate(FixedExpenseRequest request, Instant now) {
        this.name = request.getName();
        this.amount = request.getAmount();
        this.expenseAccountId = request.getExpenseAccountId();
        this.primaryAccountId = request.getPrimaryAccountId();
        this.fallbackAccountId = request.getFallbackAccountId();
        this.dayOfMonth = request.getDayOfMonth();
        this.active = request.isActive();
        this.updatedAt = now;
    }

    void markRun(LocalDate runDate, Instant now) {
        this.lastRunMonth = runDate.withDayOfMonth(1);
        this.lastRunAt = now;
        this.updatedAt = now;
    }

    public FixedExpense toDomain() {
        return new FixedExpense(
            id,
            name,
            amount,
            expenseAccountId,
            primaryAccountId,
            fallbackAccountId,
            dayOfMonth,
            active,
            lastRunMonth,
            lastRunAt,
            createdAt,
            updatedAt
        );
    }
}
