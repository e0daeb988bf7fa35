package com.flagship.bookkeeping.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Request object for posting or replacing a ledger transaction.
 *
 * Invariant (checked by {@link LedgerService}): at least two splits whose
 * signed amounts sum to exactly zero.
 */
@Value
@Builder
public class TransactionRequest {
    String num;
    LocalDate postDate;
    String description;
    String businessType;
    String referenceNo;
    @Singular
    List<SplitLine> splits;

    /**
     * One signed leg: positive amounts debit the account, negative amounts credit it.
     */
    @Value
    public static class SplitLine {
        UUID accountId;
        BigDecimal amount;
        String memo;
        Long cashflowTypeId;

        public static SplitLine of(UUID accountId, BigDecimal amount, String memo) {
            return new SplitLine(accountId, amount, memo, null);
        }

        public static SplitLine of(UUID accountId, BigDecimal amount, String memo, Long cashflowTypeId) {
            return new SplitLine(accountId, amount, memo, cashflowTypeId);
        }

        public static SplitLine debit(UUID accountId, BigDecimal amount, String memo) {
            return new SplitLine(accountId, amount.abs(), memo, null);
        }

        public static SplitLine credit(UUID accountId, BigDecimal amount, String memo) {
            return new SplitLine(accountId, amount.abs().negate(), memo, null);
        }
    }
}
