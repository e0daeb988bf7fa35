package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.ledger.CashflowDirection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class CashflowLine {
    Long cashflowTypeId;
    String code;
    String name;
    CashflowDirection direction;
    BigDecimal amount;
}
