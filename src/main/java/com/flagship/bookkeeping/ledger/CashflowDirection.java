package com.flagship.bookkeeping.ledger;

public enum CashflowDirection {
    INFLOW,
    OUTFLOW
}
