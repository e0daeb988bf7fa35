package com.flagship.bookkeeping.report;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One account row of a balance sheet or income statement, or a subtotal row
 * following a parent account. Amounts are reporting-positive.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ReportLine {
    UUID accountId;
    String code;
    String name;
    String accountType;
    UUID parentId;
    BigDecimal amount;
    boolean placeholder;
    boolean subtotal;
}
