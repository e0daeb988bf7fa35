package com.flagship.bookkeeping.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Cached balance of an account next to the balance derived from its splits.
 */
@Value
public class AccountBalance {
    UUID accountId;
    String accountName;
    String accountType;
    BigDecimal cachedBalance;
    BigDecimal derivedBalance;

    public boolean isDrifted() {
        return cachedBalance.compareTo(derivedBalance) != 0;
    }
}
