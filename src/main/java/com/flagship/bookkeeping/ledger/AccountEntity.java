package com.flagship.bookkeeping.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for a chart-of-accounts node.
 *
 * Key design principles:
 * - No @Setter: fields change only through the named mutators below
 * - The parent is a plain id reference into the same table, never an object graph
 * - currentBalance is debit-positive and changes only through {@link #applyBalanceDelta},
 *   which is package-private so only the ledger can call it
 */
@Entity
@Table(
    name = "accounts",
    indexes = @Index(name = "idx_accounts_parent", columnList = "parent_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, length = 200)
    private String name;

    @Column(name = "account_type", nullable = false, length = 50)
    private String accountType;

    @Column(name = "parent_id")
    private UUID parentId;

    @Column(length = 50)
    private String code;

    @Column(length = 2000)
    private String description;

    @Column(nullable = false)
    private boolean hidden;

    @Column(nullable = false)
    private boolean placeholder;

    @Column(name = "is_cash", nullable = false)
    private boolean cash;

    @Column(name = "current_balance", nullable = false, precision = 18, scale = 6)
    private BigDecimal currentBalance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static AccountEntity create(AccountRequest request, Instant now) {
        return new AccountEntity(
            UUID.randomUUID(),
            request.getName(),
            request.getAccountType(),
            request.getParentId(),
            request.getCode(),
            request.getDescription(),
            Boolean.TRUE.equals(request.getHidden()),
            Boolean.TRUE.equals(request.getPlaceholder()),
            Boolean.TRUE.equals(request.getCash()),
            BigDecimal.ZERO,
            now,
            now
        );
    }

    /**
     * Applies the non-null fields of the request. Validation happens in {@link AccountService}.
     */
    void applyUpdate(AccountRequest request, Instant now) {
        if (request.getName() != null) {
            this.name = request.getName();
        }
        if (request.isClearParent()) {
            this.parentId = null;
        } else if (request.getParentId() != null) {
            this.parentId = request.getParentId();
        }
        if (request.getAccountType() != null) {
            this.accountType = request.getAccountType();
        }
        if (request.getCode() != null) {
            this.code = request.getCode();
        }
        if (request.getDescription() != null) {
            this.description = request.getDescription();
        }
        if (request.getHidden() != null) {
            this.hidden = request.getHidden();
        }
        if (request.getPlaceholder() != null) {
            this.placeholder = request.getPlaceholder();
        }
        if (request.getCash() != null) {
            this.cash = request.getCash();
        }
        this.updatedAt = now;
    }

    void applyBalanceDelta(BigDecimal delta, Instant now) {
        BigDecimal current = currentBalance != null ? currentBalance : BigDecimal.ZERO;
        this.currentBalance = current.add(delta);
        this.updatedAt = now;
    }

    void resetBalance(BigDecimal derivedBalance, Instant now) {
        this.currentBalance = derivedBalance;
        this.updatedAt = now;
    }

    public Account toDomain() {
        return new Account(
            id,
            name,
            accountType,
            parentId,
            code,
            description,
            hidden,
            placeholder,
            cash,
            currentBalance,
            createdAt,
            updatedAt
        );
    }
}
