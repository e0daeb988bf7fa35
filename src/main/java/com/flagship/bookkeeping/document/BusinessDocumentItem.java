package com.flagship.bookkeeping.document;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class BusinessDocumentItem {
    Long id;
    int lineNo;
    String description;
    String memo;
    UUID debitAccountId;
    UUID creditAccountId;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal amount;
    Long cashflowTypeId;
}
