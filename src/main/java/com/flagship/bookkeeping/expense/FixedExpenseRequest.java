package com.flagship.bookkeeping.expense;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Full definition of a recurring charge. Used for both create and update;
 * an update replaces every field.
 */
@Value
@Builder
public class FixedExpenseRequest {
    String name;
    BigDecimal amount;
    UUID expenseAccountId;
    UUID primaryAccountId;
    UUID fallbackAccountId;
    @Builder.Default
    int dayOfMonth = 1;
    @Builder.Default
    boolean active = true;
}
