package com.flagship.bookkeeping.document;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for a posted business document.
 *
 * Key design principles:
 * - No @Setter: a posted document is immutable
 * - transactionId is a back-reference to the generated ledger transaction and is set once at creation
 * - (docType, docNo) is unique, so two concurrent postings cannot both take the same number
 */
@Entity
@Table(
    name = "business_documents",
    uniqueConstraints = @UniqueConstraint(name = "uk_business_documents_type_no", columnNames = {"doc_type", "doc_no"}),
    indexes = @Index(name = "idx_business_documents_type_date", columnList = "doc_type, doc_date")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BusinessDocumentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "doc_type", nullable = false, length = 30, updatable = false)
    private BusinessDocumentType docType;

    @Column(name = "doc_no", nullable = false, length = 50, updatable = false)
    private String docNo;

    @Column(name = "doc_date", nullable = false)
    private LocalDate docDate;

    @Column(name = "partner_name", length = 200)
    private String partnerName;

    @Column(name = "reference_no", length = 100)
    private String referenceNo;

    @Column(length = 500)
    private String description;

    @Column(nullable = false, length = 10)
    private String currency;

    @Column(name = "total_amount", nullable = false, precision = 18, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BusinessDocumentStatus status;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "document", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNo ASC")
    private List<BusinessDocumentItemEntity> items = new ArrayList<>();

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static BusinessDocumentEntity posted(BusinessDocumentType docType,
                                         String docNo,
                                         BusinessDocumentRequest request,
                                         String currency,
                                         BigDecimal totalAmount,
                                         UUID transactionId,
                                         Instant now) {
        BusinessDocumentEntity entity = new BusinessDocumentEntity();
        entity.docType = docType;
        entity.docNo = docNo;
        entity.docDate = request.getDocDate();
        entity.partnerName = request.getPartnerName();
        entity.referenceNo = request.getReferenceNo();
        entity.description = request.getDescription();
        entity.currency = currency;
        entity.totalAmount = totalAmount;
        entity.status = BusinessDocumentStatus.POSTED;
        entity.transactionId = transactionId;
        entity.createdAt = now;
        return entity;
    }

    void addItem(BusinessDocumentItemEntity item) {
        item.attachTo(this);
        items.add(item);
    }

    public BusinessDocument toDomain() {
        return new BusinessDocument(
            id,
            docType,
            docNo,
            docDate,
            partnerName,
            referenceNo,
            description,
            currency,
            totalAmount,
            status,
            transactionId,
            createdAt,
            updatedAt,
            items.stream().map(BusinessDocumentItemEntity::toDomain).toList()
        );
    }
}
