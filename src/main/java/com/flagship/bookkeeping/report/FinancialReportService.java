package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.exception.ValidationException;
import com.flagship.bookkeeping.ledger.Account;
import com.flagship.bookkeeping.ledger.AccountService;
import com.flagship.bookkeeping.ledger.CashflowDirection;
import com.flagship.bookkeeping.ledger.FlowCategory;
import com.flagship.bookkeeping.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Derives the balance sheet, income statement and cash-flow statement from the ledger.
 *
 * Every statement is recomputed from splits; cached account balances are never read here.
 * Hidden accounts and accounts with an unclassified type are left out.
 */
@Service
@Slf4j
public class FinancialReportService {

    private final AccountService accountService;
    private final ReportQueryRepository reportQueryRepository;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;
    private final BigDecimal balanceTolerance;

    public FinancialReportService(AccountService accountService,
                                  ReportQueryRepository reportQueryRepository,
                                  LedgerMetrics ledgerMetrics,
                                  Clock clock,
                                  @Value("${bookkeeping.reports.balance-tolerance:0.01}") BigDecimal balanceTolerance) {
        this.accountService = accountService;
        this.reportQueryRepository = reportQueryRepository;
        this.ledgerMetrics = ledgerMetrics;
        this.clock = clock;
        this.balanceTolerance = balanceTolerance;
    }

    // ==================== Balance sheet ====================

    @Transactional(readOnly = true)
    public BalanceSheet balanceSheet() {
        return balanceSheet(LocalDate.now(clock));
    }

    /**
     * Balances as of the end of reportDate.
     *
     * Liabilities and equity are shown reporting-positive. Net income up to the date
     * (revenue minus expense) is added to equity before checking
     * assets == liabilities + equity within the configured tolerance. An imbalance
     * is reported through the balanced flag, never thrown.
     */
    @Transactional(readOnly = true)
    public BalanceSheet balanceSheet(LocalDate reportDate) {
        LocalDate date = reportDate != null ? reportDate : LocalDate.now(clock);
        return ledgerMetrics.timeReport("balance_sheet", () -> {
            Map<StatementSection, List<ReportLine>> sections =
                classify(accountService.listAccounts(false), reportQueryRepository.balancesAsOf(date));

            BigDecimal assetTotal = total(sections.get(StatementSection.ASSET));
            BigDecimal liabilityTotal = total(sections.get(StatementSection.LIABILITY));
            BigDecimal equityTotal = total(sections.get(StatementSection.EQUITY));
            BigDecimal netIncome = total(sections.get(StatementSection.REVENUE))
                .subtract(total(sections.get(StatementSection.EXPENSE)));
            BigDecimal equityWithIncome = equityTotal.add(netIncome);
            BigDecimal totalLiabilityEquity = liabilityTotal.add(equityWithIncome);
            boolean balanced = assetTotal.subtract(totalLiabilityEquity).abs().compareTo(balanceTolerance) < 0;

            if (!balanced) {
                log.warn("Balance sheet does not balance: date={}, assets={}, liabilitiesAndEquity={}",
                        date, assetTotal.toPlainString(), totalLiabilityEquity.toPlainString());
            }

            return BalanceSheet.builder()
                .reportDate(date)
                .assets(HierarchyAggregator.withSubtotals(sections.get(StatementSection.ASSET)))
                .liabilities(HierarchyAggregator.withSubtotals(sections.get(StatementSection.LIABILITY)))
                .equity(HierarchyAggregator.withSubtotals(sections.get(StatementSection.EQUITY)))
                .assetTotal(assetTotal)
                .liabilityTotal(liabilityTotal)
                .equityTotal(equityTotal)
                .netIncome(netIncome)
                .equityWithIncome(equityWithIncome)
                .totalLiabilityEquity(totalLiabilityEquity)
                .balanced(balanced)
                .build();
        });
    }

    // ==================== Income statement ====================

    /**
     * Year to date: 1 January of the current year through today.
     */
    @Transactional(readOnly = true)
    public IncomeStatement incomeStatement() {
        return incomeStatement(null, null);
    }

    /**
     * Revenue and expense flows posted within [startDate, endDate].
     * A null end means today; a null start means 1 January of the end date's year.
     */
    @Transactional(readOnly = true)
    public IncomeStatement incomeStatement(LocalDate startDate, LocalDate endDate) {
        LocalDate end = endDate != null ? endDate : LocalDate.now(clock);
        LocalDate start = startDate != null ? startDate : end.withDayOfYear(1);
        validateRange(start, end);

        return ledgerMetrics.timeReport("income_statement", () -> {
            Map<StatementSection, List<ReportLine>> sections =
                classify(accountService.listAccounts(false), reportQueryRepository.movementsBetween(start, end));

            BigDecimal revenueTotal = total(sections.get(StatementSection.REVENUE));
            BigDecimal expenseTotal = total(sections.get(StatementSection.EXPENSE));

            return IncomeStatement.builder()
                .startDate(start)
                .endDate(end)
                .revenues(HierarchyAggregator.withSubtotals(sections.get(StatementSection.REVENUE)))
                .expenses(HierarchyAggregator.withSubtotals(sections.get(StatementSection.EXPENSE)))
                .revenueTotal(revenueTotal)
                .expenseTotal(expenseTotal)
                .netIncome(revenueTotal.subtract(expenseTotal))
                .build();
        });
    }

    // ==================== Cash-flow statement ====================

    @Transactional(readOnly = true)
    public CashflowStatement cashflowStatement() {
        return cashflowStatement(null, null);
    }

    /**
     * Cash movements within [startDate, endDate] grouped by activity category.
     *
     * Each cash-flow type contributes the absolute value of the net of the splits
     * tagged with it; its direction decides whether that counts as inflow or outflow.
     * Deactivated types still count when splits in the range reference them.
     */
    @Transactional(readOnly = true)
    public CashflowStatement cashflowStatement(LocalDate startDate, LocalDate endDate) {
        LocalDate end = endDate != null ? endDate : LocalDate.now(clock);
        LocalDate start = startDate != null ? startDate : end.withDayOfYear(1);
        validateRange(start, end);

        return ledgerMetrics.timeReport("cashflow_statement", () -> {
            Map<FlowCategory, List<CashflowLine>> linesByCategory = new EnumMap<>(FlowCategory.class);
            for (FlowCategory category : FlowCategory.values()) {
                linesByCategory.put(category, new ArrayList<>());
            }
            for (ReportQueryRepository.CashflowTypeTotal total : reportQueryRepository.cashflowTotalsBetween(start, end)) {
                linesByCategory.get(total.getFlowType()).add(CashflowLine.builder()
                    .cashflowTypeId(total.getId())
                    .code(total.getCode())
                    .name(total.getName())
                    .direction(total.getDirection())
                    .amount(total.getAmount())
                    .build());
            }

            CashflowSection operating = section(FlowCategory.OPERATING, linesByCategory.get(FlowCategory.OPERATING));
            CashflowSection investing = section(FlowCategory.INVESTING, linesByCategory.get(FlowCategory.INVESTING));
            CashflowSection financing = section(FlowCategory.FINANCING, linesByCategory.get(FlowCategory.FINANCING));

            return CashflowStatement.builder()
                .startDate(start)
                .endDate(end)
                .operating(operating)
                .investing(investing)
                .financing(financing)
                .totalNet(operating.getNet().add(investing.getNet()).add(financing.getNet()))
                .build();
        });
    }

    // ==================== Helpers ====================

    private static Map<StatementSection, List<ReportLine>> classify(List<Account> accounts, Map<UUID, BigDecimal> amounts) {
        Map<StatementSection, List<ReportLine>> sections = new EnumMap<>(StatementSection.class);
        for (StatementSection section : StatementSection.values()) {
            sections.put(section, new ArrayList<>());
        }
        for (Account account : accounts) {
            AccountClassifier.classify(account.getAccountType()).ifPresent(section -> {
                BigDecimal signed = amounts.getOrDefault(account.getId(), BigDecimal.ZERO);
                sections.get(section).add(ReportLine.builder()
                    .accountId(account.getId())
                    .code(account.getCode())
                    .name(account.getName())
                    .accountType(account.getAccountType())
                    .parentId(account.getParentId())
                    .amount(section.isCreditNormal() ? signed.negate() : signed)
                    .placeholder(account.isPlaceholder())
                    .build());
            });
        }
        return sections;
    }

    private static BigDecimal total(List<ReportLine> lines) {
        return lines.stream()
            .filter(line -> !line.isSubtotal())
            .map(ReportLine::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static CashflowSection section(FlowCategory category, List<CashflowLine> lines) {
        BigDecimal inflow = sumByDirection(lines, CashflowDirection.INFLOW);
        BigDecimal outflow = sumByDirection(lines, CashflowDirection.OUTFLOW);
        return CashflowSection.builder()
            .category(category)
            .lines(List.copyOf(lines))
            .inflow(inflow)
            .outflow(outflow)
            .net(inflow.subtract(outflow))
            .build();
    }

    private static BigDecimal sumByDirection(List<CashflowLine> lines, CashflowDirection direction) {
        return lines.stream()
            .filter(line -> line.getDirection() == direction)
            .map(CashflowLine::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static void validateRange(LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new ValidationException("Report start date " + start + " is after end date " + end);
        }
    }
}
