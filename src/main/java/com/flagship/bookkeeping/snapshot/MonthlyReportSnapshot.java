package com.flagship.bookkeeping.snapshot;

import com.flagship.bookkeeping.report.BalanceSheet;
import com.flagship.bookkeeping.report.CashflowStatement;
import com.flagship.bookkeeping.report.IncomeStatement;
import lombok.Value;

import java.time.LocalDate;

/**
 * The three statements of one closed month.
 *
 * fromCache tells whether they were rehydrated from stored payloads or generated by this call.
 */
@Value
public class MonthlyReportSnapshot {
    LocalDate month;
    BalanceSheet balanceSheet;
    IncomeStatement incomeStatement;
    CashflowStatement cashflowStatement;
    boolean fromCache;
}
