package com.flagship.bookkeeping.expense;

import com.flagship.bookkeeping.exception.NotFoundException;
import com.flagship.bookkeeping.ledger.Account;
import com.flagship.bookkeeping.ledger.AccountService;
import com.flagship.bookkeeping.ledger.LedgerService;
import com.flagship.bookkeeping.ledger.LedgerTransaction;
import com.flagship.bookkeeping.ledger.TransactionRequest;
import com.flagship.bookkeeping.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Posts one run of a recurring charge.
 *
 * Kept apart from {@link FixedExpenseService} so a batch can open a fresh
 * unit of work per charge through the Spring proxy: one failing charge
 * rolls back alone and the rest of the batch still commits.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FixedExpenseExecutor {

    public static final String FIXED_EXPENSE_ID_MDC_KEY = "fixedExpenseId";

    static final String BUSINESS_TYPE = "FIXED_EXPENSE";

    private final FixedExpenseRepository repository;
    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    /**
     * Runs one charge in its own unit of work. Used by the batch, which has already checked it is due.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FixedExpenseRunResult executeIsolated(Long expenseId, LocalDate runDate) {
        FixedExpenseEntity expense = repository.findByIdForUpdate(expenseId)
            .orElseThrow(() -> new NotFoundException("Fixed expense", expenseId));
        return run(expense, runDate, true);
    }

    /**
     * Runs a charge inside the caller's unit of work.
     */
    public FixedExpenseRunResult run(FixedExpenseEntity expense, LocalDate runDate, boolean force) {
        MDC.put(FIXED_EXPENSE_ID_MDC_KEY, String.valueOf(expense.getId()));
        try {
            List<String> warnings = new ArrayList<>();
            if (!expense.isActive()) {
                warnings.add("Fixed expense is inactive; not executed.");
                return skipped(expense, warnings);
            }
            if (!force && !FixedExpenseSchedule.isDue(expense.getLastRunMonth(), expense.getDayOfMonth(), runDate)) {
                LocalDate dueDate = FixedExpenseSchedule.dueDate(expense.getDayOfMonth(), YearMonth.from(runDate));
                warnings.add(expense.getLastRunMonth() != null && expense.getLastRunMonth().equals(runDate.withDayOfMonth(1))
                    ? "Already executed for " + YearMonth.from(runDate) + "; not executed."
                    : "Not due until " + dueDate + "; not executed.");
                return skipped(expense, warnings);
            }
            BigDecimal amount = expense.getAmount();
            if (amount == null || amount.signum() <= 0) {
                warnings.add("Amount must be greater than zero; not executed.");
                return skipped(expense, warnings);
            }

            Optional<UUID> fundingAccount = selectFundingAccount(expense, amount, warnings);
            if (fundingAccount.isEmpty()) {
                warnings.add("No usable funding account is configured; not executed.");
                return skipped(expense, warnings);
            }

            String memo = expense.getName() + " automatic charge";
            LedgerTransaction transaction = ledgerService.postTransaction(TransactionRequest.builder()
                .postDate(runDate)
                .description(YearMonth.from(runDate) + " " + expense.getName() + " fixed expense")
                .businessType(BUSINESS_TYPE)
                .split(TransactionRequest.SplitLine.debit(expense.getExpenseAccountId(), amount, memo))
                .split(TransactionRequest.SplitLine.credit(fundingAccount.get(), amount, memo))
                .build());

            expense.markRun(runDate, clock.instant());
            ledgerMetrics.recordFixedExpenseRun(warnings.isEmpty() ? "posted" : "posted_with_warnings");
            log.info("Executed fixed expense: name={}, amount={}, fundingAccount={}, transactionId={}, warnings={}",
                    expense.getName(), amount.toPlainString(), fundingAccount.get(), transaction.getId(), warnings.size());
            return new FixedExpenseRunResult(expense.getId(), expense.getName(), transaction.getId(), List.copyOf(warnings));

        } finally {
            MDC.remove(FIXED_EXPENSE_ID_MDC_KEY);
        }
    }

    /**
     * Primary if it covers the amount, otherwise the fallback. Insufficient funds never
     * block the charge; they only produce warnings, and the paying balance may go negative.
     */
    private Optional<UUID> selectFundingAccount(FixedExpenseEntity expense, BigDecimal amount, List<String> warnings) {
        Optional<Account> primary = Optional.ofNullable(expense.getPrimaryAccountId()).flatMap(accountService::getAccount);
        Optional<Account> fallback = Optional.ofNullable(expense.getFallbackAccountId()).flatMap(accountService::getAccount);

        if (primary.isPresent() && balanceOf(primary.get()).compareTo(amount) >= 0) {
            return primary.map(Account::getId);
        }

        if (primary.isPresent()) {
            warnings.add(String.format("Primary account %s has insufficient balance (%s)%s",
                primary.get().getName(), balanceOf(primary.get()).toPlainString(),
                fallback.isPresent() ? "; using fallback account." : "."));
        } else {
            warnings.add("No primary funding account is configured.");
        }

        if (fallback.isPresent()) {
            if (balanceOf(fallback.get()).compareTo(amount) < 0) {
                warnings.add(String.format(
                    "Fallback account %s also has insufficient balance (%s); its balance may go negative.",
                    fallback.get().getName(), balanceOf(fallback.get()).toPlainString()));
            }
            return fallback.map(Account::getId);
        }

        if (primary.isPresent()) {
            warnings.add("No fallback account is configured; charging the primary account anyway.");
        }
        return primary.map(Account::getId);
    }

    private FixedExpenseRunResult skipped(FixedExpenseEntity expense, List<String> warnings) {
        ledgerMetrics.recordFixedExpenseRun("skipped");
        log.info("Fixed expense not executed: name={}, reason={}", expense.getName(), warnings.get(warnings.size() - 1));
        return FixedExpenseRunResult.skipped(expense, warnings);
    }

    private static BigDecimal balanceOf(Account account) {
        return account.getCurrentBalance() != null ? account.getCurrentBalance() : BigDecimal.ZERO;
    }
}
