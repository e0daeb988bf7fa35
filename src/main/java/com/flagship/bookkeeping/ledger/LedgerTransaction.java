package com.flagship.bookkeeping.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A posted transaction with its splits, as returned to callers.
 * Account names on the splits are denormalized for display only.
 */
@Value
public class LedgerTransaction {
    UUID id;
    String num;
    LocalDate postDate;
    Instant enterDate;
    String description;
    String businessType;
    String referenceNo;
    Instant createdAt;
    Instant updatedAt;
    List<LedgerSplit> splits;

    public BigDecimal getDebitTotal() {
        return splits.stream()
            .map(LedgerSplit::getAmount)
            .filter(amount -> amount.signum() > 0)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCreditTotal() {
        return splits.stream()
            .map(LedgerSplit::getAmount)
            .filter(amount -> amount.signum() < 0)
            .map(BigDecimal::negate)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
