package com.flagship.bookkeeping.report;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Revenue and expense flows posted within [startDate, endDate].
 */
@Value
@Builder
@Jacksonized
public class IncomeStatement {
    LocalDate startDate;
    LocalDate endDate;
    List<ReportLine> revenues;
    List<ReportLine> expenses;
    BigDecimal revenueTotal;
    BigDecimal expenseTotal;
    BigDecimal netIncome;
}
