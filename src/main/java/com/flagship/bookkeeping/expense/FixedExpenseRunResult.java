package com.flagship.bookkeeping.expense;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one recurring charge run. transactionId is null when nothing was posted;
 * the warnings then say why.
 */
@Value
public class FixedExpenseRunResult {
    Long expenseId;
    String expenseName;
    UUID transactionId;
    List<String> warnings;

    public boolean isPosted() {
        return transactionId != null;
    }

    static FixedExpenseRunResult skipped(FixedExpenseEntity expense, List<String> warnings) {
        return new FixedExpenseRunResult(expense.getId(), expense.getName(), null, List.copyOf(warnings));
    }
}
