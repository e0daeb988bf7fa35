package com.flagship.bookkeeping.report;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/**
 * Maps raw account-type strings to statement sections, case-insensitively.
 * Unknown types are unclassified and left out of every statement.
 */
public final class AccountClassifier {

    private static final Map<String, StatementSection> SECTIONS = Map.ofEntries(
        entry("ASSET", StatementSection.ASSET),
        entry("CURRENT_ASSET", StatementSection.ASSET),
        entry("FIXED_ASSET", StatementSection.ASSET),
        entry("NON_CURRENT_ASSET", StatementSection.ASSET),
        entry("CASH", StatementSection.ASSET),
        entry("BANK", StatementSection.ASSET),
        entry("RECEIVABLE", StatementSection.ASSET),
        entry("INVENTORY", StatementSection.ASSET),
        entry("LIABILITY", StatementSection.LIABILITY),
        entry("CURRENT_LIABILITY", StatementSection.LIABILITY),
        entry("NON_CURRENT_LIABILITY", StatementSection.LIABILITY),
        entry("PAYABLE", StatementSection.LIABILITY),
        entry("EQUITY", StatementSection.EQUITY),
        entry("CAPITAL", StatementSection.EQUITY),
        entry("RETAINED_EARNINGS", StatementSection.EQUITY),
        entry("INCOME", StatementSection.REVENUE),
        entry("REVENUE", StatementSection.REVENUE),
        entry("SALES", StatementSection.REVENUE),
        entry("EXPENSE", StatementSection.EXPENSE),
        entry("COST", StatementSection.EXPENSE),
        entry("OPERATING_EXPENSE", StatementSection.EXPENSE),
        entry("COGS", StatementSection.EXPENSE)
    );

    private AccountClassifier() {
    }

    public static Optional<StatementSection> classify(String accountType) {
        if (accountType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(SECTIONS.get(accountType.trim().toUpperCase(Locale.ROOT)));
    }
}
