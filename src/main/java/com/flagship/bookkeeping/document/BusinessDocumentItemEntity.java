package com.flagship.bookkeeping.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "business_document_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BusinessDocumentItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "document_id", nullable = false, updatable = false)
    @Getter(AccessLevel.NONE)
    private BusinessDocumentEntity document;

    @Column(name = "line_no", nullable = false)
    private int lineNo;

    @Column(length = 500)
    private String description;

    @Column(length = 500)
    private String memo;

    @Column(name = "debit_account_id", nullable = false)
    private UUID debitAccountId;

    @Column(name = "credit_account_id", nullable = false)
    private UUID creditAccountId;

    @Column(precision = 18, scale = 4)
    private BigDecimal quantity;

    @Column(name = "unit_price", precision = 18, scale = 4)
    private BigDecimal unitPrice;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal amount;

    @Column(name = "cashflow_type_id")
    private Long cashflowTypeId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static BusinessDocumentItemEntity from(BusinessDocumentRequest.Item item, int lineNo, Long cashflowTypeId) {
        BusinessDocumentItemEntity entity = new BusinessDocumentItemEntity();
        entity.lineNo = lineNo;
        entity.description = item.getDescription();
        entity.memo = item.getMemo();
        entity.debitAccountId = item.getDebitAccountId();
        entity.creditAccountId = item.getCreditAccountId();
        entity.quantity = item.getQuantity();
        entity.unitPrice = item.getUnitPrice();
        entity.amount = item.getAmount();
        entity.cashflowTypeId = cashflowTypeId;
        return entity;
    }

    void attachTo(BusinessDocumentEntity owner) {
        this.document = owner;
    }

    BusinessDocumentItem toDomain() {
        return new BusinessDocumentItem(
            id,
            lineNo,
            description,
            memo,
            debitAccountId,
            creditAccountId,
            quantity,
            unitPrice,
            amount,
            cashflowTypeId
        );
    }
}
