package com.flagship.bookkeeping.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Flattened transaction/split row with joined account and cash-flow type names.
 */
@Value
public class TransactionDetail {
    UUID transactionId;
    String transactionNum;
    LocalDate postDate;
    String description;
    String businessType;
    String referenceNo;
    UUID splitId;
    UUID accountId;
    String accountName;
    String accountType;
    BigDecimal amount;
    String memo;
    Long cashflowTypeId;
    String cashflowTypeName;
}
