package com.flagship.bookkeeping.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Sum of split numerators for one account and one denominator.
 * Summing per denominator keeps the aggregation exact.
 */
@Value
public class AccountFractionSum {
    UUID accountId;
    Long denominator;
    Long numeratorSum;
}
