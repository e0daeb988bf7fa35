package com.flagship.bookkeeping.expense;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class FixedExpense {
    Long id;
    String name;
    BigDecimal amount;
    UUID expenseAccountId;
    UUID primaryAccountId;
    UUID fallbackAccountId;
    int dayOfMonth;
    boolean active;
    LocalDate lastRunMonth;
    Instant lastRunAt;
    Instant createdAt;
    Instant updatedAt;
}
