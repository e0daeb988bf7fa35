package com.flagship.bookkeeping.ledger;

import lombok.Value;

/**
 * Classification attached to cash/bank splits so the cash-flow statement can group them.
 */
@Value
public class CashflowType {
    Long id;
    String code;
    String name;
    String category;
    FlowCategory flowType;
    CashflowDirection direction;
    boolean active;
    int sortOrder;
}
