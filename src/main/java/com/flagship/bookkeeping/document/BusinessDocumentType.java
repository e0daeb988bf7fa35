package com.flagship.bookkeeping.document;

/**
 * Kinds of business document, each with its document-number prefix and a
 * human-readable label used as the default transaction description.
 */
public enum BusinessDocumentType {
    SALE("XS", "Sales document"),
    PURCHASE("CG", "Purchase document"),
    EXPENSE("FY", "Expense document"),
    CASHFLOW("SF", "Cash receipt/payment document");

    private final String prefix;
    private final String label;

    BusinessDocumentType(String prefix, String label) {
        this.prefix = prefix;
        this.label = label;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getLabel() {
        return label;
    }
}
