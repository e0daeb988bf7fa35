package com.flagship.bookkeeping.ledger;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CashflowTypeRequest {
    String code;
    String name;
    String category;
    FlowCategory flowType;
    CashflowDirection direction;
    @Builder.Default
    boolean active = true;
    @Builder.Default
    int sortOrder = 100;
}
