package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.amount.AmountCodec;
import com.flagship.bookkeeping.amount.Fraction;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for one signed leg of a transaction.
 *
 * The amount is stored as valueNum / valueDenom (debit positive, credit negative).
 */
@Entity
@Table(
    name = "splits",
    indexes = {
        @Index(name = "idx_splits_transaction", columnList = "transaction_id"),
        @Index(name = "idx_splits_account", columnList = "account_id"),
        @Index(name = "idx_splits_cashflow_type", columnList = "cashflow_type_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SplitEntity {

    public static final String NOT_RECONCILED = "n";

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "transaction_id", nullable = false, updatable = false)
    @Getter(AccessLevel.NONE)
    private TransactionEntity transaction;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "split_index", nullable = false)
    private int splitIndex;

    @Column(length = 500)
    private String memo;

    @Column(name = "reconcile_state", nullable = false, length = 1)
    private String reconcileState;

    @Column(name = "reconcile_date")
    private LocalDate reconcileDate;

    @Column(name = "value_num", nullable = false)
    private Long valueNum;

    @Column(name = "value_denom", nullable = false)
    private Long valueDenom;

    @Column(name = "cashflow_type_id")
    private Long cashflowTypeId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static SplitEntity create(int splitIndex, UUID accountId, Fraction value, String memo,
                              Long cashflowTypeId, Instant now) {
        SplitEntity split = new SplitEntity();
        split.id = UUID.randomUUID();
        split.splitIndex = splitIndex;
        split.accountId = accountId;
        split.valueNum = value.getNumerator();
        split.valueDenom = value.getDenominator();
        split.memo = memo;
        split.reconcileState = NOT_RECONCILED;
        split.cashflowTypeId = cashflowTypeId;
        split.createdAt = now;
        return split;
    }

    void attachTo(TransactionEntity owner) {
        this.transaction = owner;
    }

    public UUID getTransactionId() {
        return transaction.getId();
    }

    public BigDecimal getAmount() {
        return AmountCodec.fromFraction(valueNum, valueDenom);
    }
}
