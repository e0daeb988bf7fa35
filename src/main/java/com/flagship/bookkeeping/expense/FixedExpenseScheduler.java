package com.flagship.bookkeeping.expense;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Runs due fixed expenses on a cron schedule.
 *
 * Disable with bookkeeping.fixed-expenses.scheduler.enabled=false, e.g. when
 * several instances share one database and only one should post charges.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "bookkeeping.fixed-expenses.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class FixedExpenseScheduler {

    private final FixedExpenseService fixedExpenseService;
    private final Clock clock;

    @Scheduled(cron = "${bookkeeping.fixed-expenses.cron:0 0 6 * * *}")
    public void runDueExpenses() {
        LocalDate today = LocalDate.now(clock);
        log.debug("Scheduled fixed expense run: date={}", today);
        List<FixedExpenseRunResult> results = fixedExpenseService.executeAllDue(today);
        results.stream()
            .filter(result -> !result.getWarnings().isEmpty())
            .forEach(result -> log.warn("Fixed expense {} finished with warnings: {}",
                    result.getExpenseName(), result.getWarnings()));
    }
}
