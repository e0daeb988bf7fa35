package com.flagship.bookkeeping.expense;

import com.flagship.bookkeeping.exception.NotFoundException;
import com.flagship.bookkeeping.exception.ValidationException;
import com.flagship.bookkeeping.ledger.AccountService;
import com.flagship.bookkeeping.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Recurring monthly charges: definitions, due-date checks and execution.
 *
 * A charge runs at most once per calendar month. The month of the last successful
 * run is stamped on the definition and checked before every non-forced run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FixedExpenseService {

    static final int MAX_DAY_OF_MONTH = 28;
    static final int AMOUNT_SCALE = 2;

    private final FixedExpenseRepository repository;
    private final FixedExpenseExecutor executor;
    private final AccountService accountService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<FixedExpense> listFixedExpenses() {
        return repository.findAllByOrderByDayOfMonthAscIdAsc().stream()
            .map(FixedExpenseEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<FixedExpense> getFixedExpense(Long expenseId) {
        return repository.findById(expenseId).map(FixedExpenseEntity::toDomain);
    }

    @Transactional
    public FixedExpense createFixedExpense(FixedExpenseRequest request) {
        validate(request);
        FixedExpenseEntity saved = repository.save(FixedExpenseEntity.create(request, clock.instant()));
        log.info("Created fixed expense: id={}, name={}, amount={}, dayOfMonth={}",
                saved.getId(), saved.getName(), saved.getAmount().toPlainString(), saved.getDayOfMonth());
        return saved.toDomain();
    }

    @Transactional
    public FixedExpense updateFixedExpense(Long expenseId, FixedExpenseRequest request) {
        FixedExpenseEntity expense = repository.findById(expenseId)
            .orElseThrow(() -> new NotFoundException("Fixed expense", expenseId));
        validate(request);
        expense.applyUpdate(request, clock.instant());
        log.info("Updated fixed expense: id={}, name={}", expenseId, expense.getName());
        return expense.toDomain();
    }

    @Transactional
    public void deleteFixedExpense(Long expenseId) {
        FixedExpenseEntity expense = repository.findById(expenseId)
            .orElseThrow(() -> new NotFoundException("Fixed expense", expenseId));
        repository.delete(expense);
        log.info("Deleted fixed expense: id={}, name={}", expenseId, expense.getName());
    }

    public boolean isDue(FixedExpense expense, LocalDate asOf) {
        return FixedExpenseSchedule.isDue(expense.getLastRunMonth(), expense.getDayOfMonth(), asOf);
    }

    /**
     * Runs one charge now.
     *
     * @param force skip the due-date check; inactive charges and non-positive amounts still short-circuit
     */
    @Transactional
    public FixedExpenseRunResult execute(Long expenseId, LocalDate runDate, boolean force) {
        FixedExpenseEntity expense = repository.findByIdForUpdate(expenseId)
            .orElseThrow(() -> new NotFoundException("Fixed expense", expenseId));
        return executor.run(expense, runDate != null ? runDate : LocalDate.now(clock), force);
    }

    /**
     * Runs every active charge that is due on runDate, one unit of work per charge.
     *
     * A failure is reported as a warning on that charge's result and does not stop the batch.
     */
    public List<FixedExpenseRunResult> executeAllDue(LocalDate runDate) {
        LocalDate effectiveDate = runDate != null ? runDate : LocalDate.now(clock);
        List<FixedExpense> due = listFixedExpenses().stream()
            .filter(FixedExpense::isActive)
            .filter(expense -> isDue(expense, effectiveDate))
            .toList();

        List<FixedExpenseRunResult> results = new ArrayList<>(due.size());
        for (FixedExpense expense : due) {
            try {
                results.add(executor.executeIsolated(expense.getId(), effectiveDate));
            } catch (RuntimeException e) {
                ledgerMetrics.recordFixedExpenseRun("failed");
                log.error("Fixed expense run failed: id={}, name={}", expense.getId(), expense.getName(), e);
                results.add(new FixedExpenseRunResult(expense.getId(), expense.getName(), null,
                    List.of("Execution failed: " + e.getMessage())));
            }
        }

        log.info("Fixed expense batch finished: runDate={}, due={}, posted={}",
                effectiveDate, due.size(), results.stream().filter(FixedExpenseRunResult::isPosted).count());
        return results;
    }

    private void validate(FixedExpenseRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Fixed expense name is required");
        }
        if (request.getAmount() == null || request.getAmount().signum() <= 0) {
            throw new ValidationException("Fixed expense amount must be greater than zero");
        }
        if (request.getAmount().stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new ValidationException("Fixed expense amount " + request.getAmount().toPlainString()
                + " has more than " + AMOUNT_SCALE + " decimal places");
        }
        if (request.getDayOfMonth() < 1 || request.getDayOfMonth() > MAX_DAY_OF_MONTH) {
            throw new ValidationException(
                "Fixed expense day of month must be between 1 and " + MAX_DAY_OF_MONTH + ", got " + request.getDayOfMonth());
        }
        if (request.getExpenseAccountId() == null) {
            throw new ValidationException("Fixed expense requires an expense account");
        }
        if (request.getPrimaryAccountId() == null) {
            throw new ValidationException("Fixed expense requires a primary funding account");
        }
        Set<UUID> referenced = new LinkedHashSet<>();
        referenced.add(request.getExpenseAccountId());
        referenced.add(request.getPrimaryAccountId());
        if (request.getFallbackAccountId() != null) {
            referenced.add(request.getFallbackAccountId());
        }
        accountService.requireAccounts(referenced);
    }
}
