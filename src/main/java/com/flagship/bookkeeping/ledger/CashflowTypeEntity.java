package com.flagship.bookkeeping.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "cashflow_types")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CashflowTypeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 10)
    private String code;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 50)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(name = "flow_type", nullable = false, length = 20)
    private FlowCategory flowType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private CashflowDirection direction;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static CashflowTypeEntity create(CashflowTypeRequest request) {
        CashflowTypeEntity entity = new CashflowTypeEntity();
        entity.code = request.getCode();
        entity.name = request.getName();
        entity.category = request.getCategory();
        entity.flowType = request.getFlowType();
        entity.direction = request.getDirection();
        entity.active = request.isActive();
        entity.sortOrder = request.getSortOrder();
        return entity;
    }

    void setActive(boolean active) {
        this.active = active;
    }

    public CashflowType toDomain() {
        return new CashflowType(id, code, name, category, flowType, direction, active, sortOrder);
    }
}
