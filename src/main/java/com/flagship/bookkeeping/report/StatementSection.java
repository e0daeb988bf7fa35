package com.flagship.bookkeeping.report;

/**
 * Statement bucket an account type rolls up into.
 */
public enum StatementSection {
    ASSET,
    LIABILITY,
    EQUITY,
    REVENUE,
    EXPENSE;

    /**
     * Liability, equity and revenue balances are credit-normal (negative in the ledger)
     * and are negated for reporting.
     */
    public boolean isCreditNormal() {
        return this == LIABILITY || this == EQUITY || this == REVENUE;
    }
}
