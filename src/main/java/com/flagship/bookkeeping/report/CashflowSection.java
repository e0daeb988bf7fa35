package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.ledger.FlowCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Cash movements of one activity category. net = inflow - outflow.
 */
@Value
@Builder
@Jacksonized
public class CashflowSection {
    FlowCategory category;
    List<CashflowLine> lines;
    BigDecimal inflow;
    BigDecimal outflow;
    BigDecimal net;
}
