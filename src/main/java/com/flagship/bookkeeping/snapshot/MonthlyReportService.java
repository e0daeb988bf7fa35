package com.flagship.bookkeeping.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bookkeeping.observability.LedgerMetrics;
import com.flagship.bookkeeping.report.BalanceSheet;
import com.flagship.bookkeeping.report.CashflowStatement;
import com.flagship.bookkeeping.report.FinancialReportService;
import com.flagship.bookkeeping.report.IncomeStatement;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cache of the statements for the previous full calendar month.
 *
 * A month is either cached completely (all three statement types) or regenerated
 * completely. Cached rows are never updated; regeneration deletes the month's rows
 * and inserts a fresh set. Older months are pruned down to the configured number
 * of retained months, the default of one making this a single-slot cache.
 */
@Service
@Slf4j
public class MonthlyReportService {

    public static final String REPORT_MONTH_MDC_KEY = "reportMonth";

    private final MonthlyReportRepository repository;
    private final FinancialReportService financialReportService;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;
    private final int retainedMonths;

    public MonthlyReportService(MonthlyReportRepository repository,
                                FinancialReportService financialReportService,
                                ObjectMapper objectMapper,
                                LedgerMetrics ledgerMetrics,
                                Clock clock,
                                @Value("${bookkeeping.reports.snapshot.retained-months:1}") int retainedMonths) {
        this.repository = repository;
        this.financialReportService = financialReportService;
        this.objectMapper = objectMapper;
        this.ledgerMetrics = ledgerMetrics;
        this.clock = clock;
        this.retainedMonths = Math.max(1, retainedMonths);
    }

    @Transactional
    public MonthlyReportSnapshot getOrCreateMonthlySnapshot() {
        return getOrCreateMonthlySnapshot(LocalDate.now(clock));
    }

    /**
     * Statements of the month before today's month, from cache when complete.
     *
     * The balance sheet is taken at the last day of that month; the income and
     * cash-flow statements cover the whole month.
     */
    @Transactional
    public MonthlyReportSnapshot getOrCreateMonthlySnapshot(LocalDate today) {
        YearMonth target = YearMonth.from(today != null ? today : LocalDate.now(clock)).minusMonths(1);
        LocalDate month = target.atDay(1);
        MDC.put(REPORT_MONTH_MDC_KEY, target.toString());
        try {
            Optional<MonthlyReportSnapshot> cached = loadCached(month);
            if (cached.isPresent()) {
                ledgerMetrics.recordSnapshotLookup(true);
                log.debug("Monthly report snapshot served from cache");
                return cached.get();
            }
            ledgerMetrics.recordSnapshotLookup(false);

            LocalDate monthEnd = target.atEndOfMonth();
            BalanceSheet balanceSheet = financialReportService.balanceSheet(monthEnd);
            IncomeStatement incomeStatement = financialReportService.incomeStatement(month, monthEnd);
            CashflowStatement cashflowStatement = financialReportService.cashflowStatement(month, monthEnd);

            repository.deleteByReportMonthIn(List.of(month));
            Instant now = clock.instant();
            repository.saveAll(List.of(
                MonthlyReportEntity.create(month, ReportType.BALANCE_SHEET, write(balanceSheet), now),
                MonthlyReportEntity.create(month, ReportType.INCOME_STATEMENT, write(incomeStatement), now),
                MonthlyReportEntity.create(month, ReportType.CASHFLOW_STATEMENT, write(cashflowStatement), now)
            ));
            applyRetention(month);

            log.info("Generated monthly report snapshot: balanced={}, netIncome={}",
                    balanceSheet.isBalanced(), incomeStatement.getNetIncome().toPlainString());
            return new MonthlyReportSnapshot(month, balanceSheet, incomeStatement, cashflowStatement, false);

        } finally {
            MDC.remove(REPORT_MONTH_MDC_KEY);
        }
    }

    /**
     * Months that currently have cached rows, most recent first.
     */
    @Transactional(readOnly = true)
    public List<LocalDate> getCachedMonths() {
        return repository.findCachedMonths();
    }

    @Transactional(readOnly = true)
    public Optional<LocalDate> getCachedMonth() {
        return repository.findCachedMonths().stream().findFirst();
    }

    private Optional<MonthlyReportSnapshot> loadCached(LocalDate month) {
        Map<ReportType, String> payloads = new EnumMap<>(ReportType.class);
        for (MonthlyReportEntity row : repository.findByReportMonth(month)) {
            payloads.put(row.getReportType(), row.getPayload());
        }
        if (payloads.size() < ReportType.values().length) {
            return Optional.empty();
        }
        try {
            return Optional.of(new MonthlyReportSnapshot(
                month,
                objectMapper.readValue(payloads.get(ReportType.BALANCE_SHEET), BalanceSheet.class),
                objectMapper.readValue(payloads.get(ReportType.INCOME_STATEMENT), IncomeStatement.class),
                objectMapper.readValue(payloads.get(ReportType.CASHFLOW_STATEMENT), CashflowStatement.class),
                true
            ));
        } catch (JsonProcessingException e) {
            log.warn("Cached monthly report payload is unreadable, regenerating: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void applyRetention(LocalDate keptMonth) {
        List<LocalDate> expired = new ArrayList<>();
        int kept = 1;
        for (LocalDate cachedMonth : repository.findCachedMonths()) {
            if (cachedMonth.equals(keptMonth)) {
                continue;
            }
            if (kept < retainedMonths) {
                kept++;
            } else {
                expired.add(cachedMonth);
            }
        }
        if (!expired.isEmpty()) {
            int deleted = repository.deleteByReportMonthIn(expired);
            log.info("Pruned cached report months: months={}, rows={}", expired, deleted);
        }
    }

    private String write(Object statement) {
        try {
            return objectMapper.writeValueAsString(statement);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + statement.getClass().getSimpleName(), e);
        }
    }
}
