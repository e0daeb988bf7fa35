package com.flagship.bookkeeping.report;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class CashflowStatement {
    LocalDate startDate;
    LocalDate endDate;
    CashflowSection operating;
    CashflowSection investing;
    CashflowSection financing;
    BigDecimal totalNet;
}
