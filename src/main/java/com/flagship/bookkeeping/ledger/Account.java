package com.flagship.bookkeeping.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a chart-of-accounts node.
 *
 * accountType is kept as the raw string the account was created with;
 * the report generator decides which statement section it belongs to.
 */
@Value
public class Account {
    UUID id;
    String name;
    String accountType;
    UUID parentId;
    String code;
    String description;
    boolean hidden;
    boolean placeholder;
    boolean cash;
    BigDecimal currentBalance;
    Instant createdAt;
    Instant updatedAt;
}
