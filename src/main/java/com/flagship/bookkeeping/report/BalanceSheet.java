package com.flagship.bookkeeping.report;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Point-in-time statement of assets, liabilities and equity.
 *
 * Net income up to the report date is not posted to any equity account, so it is
 * carried separately and added to equity for the balance check.
 */
@Value
@Builder
@Jacksonized
public class BalanceSheet {
    LocalDate reportDate;
    List<ReportLine> assets;
    List<ReportLine> liabilities;
    List<ReportLine> equity;
    BigDecimal assetTotal;
    BigDecimal liabilityTotal;
    BigDecimal equityTotal;
    BigDecimal netIncome;
    BigDecimal equityWithIncome;
    BigDecimal totalLiabilityEquity;
    boolean balanced;
}
