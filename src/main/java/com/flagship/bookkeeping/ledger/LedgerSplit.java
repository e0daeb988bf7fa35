package com.flagship.bookkeeping.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class LedgerSplit {
    UUID id;
    UUID transactionId;
    UUID accountId;
    String accountName;
    BigDecimal amount;
    long valueNum;
    long valueDenom;
    String memo;
    String reconcileState;
    Long cashflowTypeId;
}
