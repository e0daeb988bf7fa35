package com.flagship.bookkeeping.snapshot;

public enum ReportType {
    BALANCE_SHEET,
    INCOME_STATEMENT,
    CASHFLOW_STATEMENT
}
