package com.flagship.bookkeeping.ledger;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for a ledger transaction.
 *
 * The transaction exclusively owns its splits: they are persisted and removed with it,
 * and replacing the split set orphans the old rows.
 */
@Entity
@Table(
    name = "transactions",
    indexes = @Index(name = "idx_transactions_post_date", columnList = "post_date")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(length = 50)
    private String num;

    @Column(name = "post_date", nullable = false)
    private LocalDate postDate;

    @Column(name = "enter_date", nullable = false, updatable = false)
    private Instant enterDate;

    @Column(length = 500)
    private String description;

    @Column(name = "business_type", length = 50)
    private String businessType;

    @Column(name = "reference_no", length = 100)
    private String referenceNo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "transaction", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("splitIndex ASC")
    @Getter(AccessLevel.NONE)
    private List<SplitEntity> splits = new ArrayList<>();

    private TransactionEntity(UUID id, Instant now) {
        this.id = id;
        this.enterDate = now;
        this.createdAt = now;
        this.updatedAt = now;
    }

    static TransactionEntity create(TransactionRequest request, Instant now) {
        TransactionEntity entity = new TransactionEntity(UUID.randomUUID(), now);
        entity.applyHeader(request, now);
        return entity;
    }

    void applyHeader(TransactionRequest request, Instant now) {
        this.num = request.getNum();
        this.postDate = request.getPostDate();
        this.description = request.getDescription();
        this.businessType = request.getBusinessType();
        this.referenceNo = request.getReferenceNo();
        this.updatedAt = now;
    }

    void replaceSplits(List<SplitEntity> newSplits) {
        splits.clear();
        for (SplitEntity split : newSplits) {
            split.attachTo(this);
            splits.add(split);
        }
    }

    public List<SplitEntity> getSplits() {
        return Collections.unmodifiableList(splits);
    }
}
