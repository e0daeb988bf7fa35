package com.flagship.bookkeeping.expense;

import com.flagship.bookkeeping.TestDatabase;
import com.flagship.bookkeeping.exception.NotFoundException;
import com.flagship.bookkeeping.exception.ValidationException;
import com.flagship.bookkeeping.ledger.AccountRequest;
import com.flagship.bookkeeping.ledger.AccountService;
import com.flagship.bookkeeping.ledger.LedgerService;
import com.flagship.bookkeeping.ledger.LedgerTransaction;
import com.flagship.bookkeeping.ledger.TransactionRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class FixedExpenseServiceTest {

    private static final LocalDate MARCH_10 = LocalDate.of(2024, 3, 10);

    @Autowired
    private FixedExpenseService fixedExpenseService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID rentId;
    private UUID bankId;
    private UUID cashId;
    private UUID capitalId;

    @BeforeEach
    void setUp() {
        TestDatabase.clean(jdbcTemplate);
        rentId = createAccount("Rent", "EXPENSE");
        bankId = createAccount("Bank", "BANK");
        cashId = createAccount("Cash", "CASH");
        capitalId = createAccount("Capital", "EQUITY");
    }

    @Test
    @DisplayName("Definitions are validated before they are stored")
    void testValidation() {
        assertThrows(ValidationException.class, () -> fixedExpenseService.createFixedExpense(
            rent("3000.00", 29).build()));
        assertThrows(ValidationException.class, () -> fixedExpenseService.createFixedExpense(
            rent("3000.00", 0).build()));
        assertThrows(ValidationException.class, () -> fixedExpenseService.createFixedExpense(
            rent("0", 5).build()));
        assertThrows(ValidationException.class, () -> fixedExpenseService.createFixedExpense(
            rent("3000.005", 5).build()));
        assertThrows(ValidationException.class, () -> fixedExpenseService.createFixedExpense(
            rent("3000.00", 5).name(" ").build()));
        assertThrows(ValidationException.class, () -> fixedExpenseService.createFixedExpense(
            rent("3000.00", 5).expenseAccountId(null).build()));
        assertThrows(ValidationException.class, () -> fixedExpenseService.createFixedExpense(
            rent("3000.00", 5).primaryAccountId(null).build()));

        UUID unknown = UUID.randomUUID();
        ValidationException exception = assertThrows(ValidationException.class, () ->
            fixedExpenseService.createFixedExpense(rent("3000.00", 5).fallbackAccountId(unknown).build()));
        assertTrue(exception.getMessage().contains(unknown.toString()));

        assertTrue(fixedExpenseService.listFixedExpenses().isEmpty());
    }

    @Test
    @DisplayName("Due charge posts once and is not due again in the same month")
    void testExecuteOncePerMonth() {
        fund(bankId, "5000.00");
        FixedExpense expense = fixedExpenseService.createFixedExpense(rent("3000.00", 5).build());
        assertTrue(fixedExpenseService.isDue(expense, MARCH_10));

        FixedExpenseRunResult result = fixedExpenseService.execute(expense.getId(), MARCH_10, false);

        assertTrue(result.isPosted());
        assertTrue(result.getWarnings().isEmpty());
        LedgerTransaction transaction = ledgerService.getTransaction(result.getTransactionId()).orElseThrow();
        assertEquals("2024-03 Rent fixed expense", transaction.getDescription());
        assertEquals(FixedExpenseExecutor.BUSINESS_TYPE, transaction.getBusinessType());
        assertEquals(MARCH_10, transaction.getPostDate());
        assertBalance(rentId, "3000.00");
        assertBalance(bankId, "2000.00");

        FixedExpense reloaded = fixedExpenseService.getFixedExpense(expense.getId()).orElseThrow();
        assertEquals(LocalDate.of(2024, 3, 1), reloaded.getLastRunMonth());
        assertNotNull(reloaded.getLastRunAt());
        assertFalse(fixedExpenseService.isDue(reloaded, MARCH_10.plusDays(5)));
        assertTrue(fixedExpenseService.isDue(reloaded, LocalDate.of(2024, 4, 5)));

        FixedExpenseRunResult second = fixedExpenseService.execute(expense.getId(), MARCH_10.plusDays(5), false);
        assertFalse(second.isPosted());
        assertEquals(List.of("Already executed for 2024-03; not executed."), second.getWarnings());
        assertBalance(bankId, "2000.00");
    }

    @Test
    @DisplayName("Charge before its day is not executed unless forced")
    void testNotYetDue() {
        fund(bankId, "5000.00");
        FixedExpense expense = fixedExpenseService.createFixedExpense(rent("3000.00", 20).build());

        FixedExpenseRunResult early = fixedExpenseService.execute(expense.getId(), MARCH_10, false);
        assertFalse(early.isPosted());
        assertEquals(List.of("Not due until 2024-03-20; not executed."), early.getWarnings());

        FixedExpenseRunResult forced = fixedExpenseService.execute(expense.getId(), MARCH_10, true);
        assertTrue(forced.isPosted());
        assertBalance(bankId, "2000.00");
    }

    @Test
    @DisplayName("Short primary account falls back to the fallback account with warnings")
    void testFallbackWhenPrimaryShort() {
        fund(bankId, "1000.00");
        FixedExpense expense = fixedExpenseService.createFixedExpense(
            rent("3000.00", 5).fallbackAccountId(cashId).build());

        FixedExpenseRunResult result = fixedExpenseService.execute(expense.getId(), MARCH_10, false);

        assertTrue(result.isPosted());
        assertEquals(2, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).startsWith("Primary account Bank has insufficient balance"));
        assertTrue(result.getWarnings().get(1).startsWith("Fallback account Cash also has insufficient balance"));
        assertBalance(bankId, "1000.00");
        assertBalance(cashId, "-3000.00");
        assertBalance(rentId, "3000.00");
    }

    @Test
    @DisplayName("Sufficient fallback is used without a second warning")
    void testFallbackCovers() {
        fund(cashId, "4000.00");
        FixedExpense expense = fixedExpenseService.createFixedExpense(
            rent("3000.00", 5).fallbackAccountId(cashId).build());

        FixedExpenseRunResult result = fixedExpenseService.execute(expense.getId(), MARCH_10, false);

        assertTrue(result.isPosted());
        assertEquals(1, result.getWarnings().size());
        assertBalance(cashId, "1000.00");
        assertBalance(bankId, "0");
    }

    @Test
    @DisplayName("Short primary without a fallback is still charged")
    void testPrimaryChargedWithoutFallback() {
        FixedExpense expense = fixedExpenseService.createFixedExpense(rent("3000.00", 5).build());

        FixedExpenseRunResult result = fixedExpenseService.execute(expense.getId(), MARCH_10, false);

        assertTrue(result.isPosted());
        assertEquals(2, result.getWarnings().size());
        assertEquals("No fallback account is configured; charging the primary account anyway.",
            result.getWarnings().get(1));
        assertBalance(bankId, "-3000.00");
    }

    @Test
    @DisplayName("Inactive charge is never executed, not even forced")
    void testInactive() {
        fund(bankId, "5000.00");
        FixedExpense expense = fixedExpenseService.createFixedExpense(rent("3000.00", 5).active(false).build());

        FixedExpenseRunResult result = fixedExpenseService.execute(expense.getId(), MARCH_10, true);

        assertFalse(result.isPosted());
        assertEquals(List.of("Fixed expense is inactive; not executed."), result.getWarnings());
        assertBalance(bankId, "5000.00");
        assertTrue(fixedExpenseService.executeAllDue(MARCH_10).isEmpty());
    }

    @Test
    @DisplayName("Batch runs only active charges that are due, and each once per month")
    void testExecuteAllDue() {
        fund(bankId, "10000.00");
        FixedExpense rent = fixedExpenseService.createFixedExpense(rent("3000.00", 1).build());
        FixedExpense internet = fixedExpenseService.createFixedExpense(rent("200.00", 10).name("Internet").build());
        fixedExpenseService.createFixedExpense(rent("500.00", 25).name("Cleaning").build());
        fixedExpenseService.createFixedExpense(rent("100.00", 1).name("Old lease").active(false).build());

        List<FixedExpenseRunResult> results = fixedExpenseService.executeAllDue(MARCH_10);

        assertEquals(2, results.size());
        assertEquals(rent.getId(), results.get(0).getExpenseId());
        assertEquals(internet.getId(), results.get(1).getExpenseId());
        assertTrue(results.stream().allMatch(FixedExpenseRunResult::isPosted));
        assertBalance(bankId, "6800.00");

        assertTrue(fixedExpenseService.executeAllDue(MARCH_10.plusDays(1)).isEmpty());
        assertEquals(1, fixedExpenseService.executeAllDue(LocalDate.of(2024, 3, 25)).size());
        assertBalance(bankId, "6300.00");
    }

    @Test
    @DisplayName("Definitions can be updated and deleted")
    void testUpdateAndDelete() {
        FixedExpense expense = fixedExpenseService.createFixedExpense(rent("3000.00", 5).build());

        FixedExpense updated = fixedExpenseService.updateFixedExpense(expense.getId(),
            rent("3200.00", 7).name("Office rent").fallbackAccountId(cashId).build());

        assertEquals("Office rent", updated.getName());
        assertEquals(0, new BigDecimal("3200.00").compareTo(updated.getAmount()));
        assertEquals(7, updated.getDayOfMonth());
        assertEquals(cashId, updated.getFallbackAccountId());

        assertThrows(ValidationException.class, () ->
            fixedExpenseService.updateFixedExpense(expense.getId(), rent("3200.00", 31).build()));
        assertThrows(NotFoundException.class, () ->
            fixedExpenseService.updateFixedExpense(-1L, rent("3200.00", 7).build()));

        fixedExpenseService.deleteFixedExpense(expense.getId());
        assertTrue(fixedExpenseService.getFixedExpense(expense.getId()).isEmpty());
        assertThrows(NotFoundException.class, () -> fixedExpenseService.deleteFixedExpense(expense.getId()));
        assertThrows(NotFoundException.class, () -> fixedExpenseService.execute(expense.getId(), MARCH_10, true));
    }

    private FixedExpenseRequest.FixedExpenseRequestBuilder rent(String amount, int dayOfMonth) {
        return FixedExpenseRequest.builder()
            .name("Rent")
            .amount(new BigDecimal(amount))
            .expenseAccountId(rentId)
            .primaryAccountId(bankId)
            .dayOfMonth(dayOfMonth);
    }

    private void fund(UUID accountId, String amount) {
        ledgerService.postTransaction(TransactionRequest.builder()
            .postDate(LocalDate.of(2024, 1, 2))
            .description("Owner contribution")
            .split(TransactionRequest.SplitLine.debit(accountId, new BigDecimal(amount), null))
            .split(TransactionRequest.SplitLine.credit(capitalId, new BigDecimal(amount), null))
            .build());
    }

    private UUID createAccount(String name, String type) {
        return accountService.createAccount(AccountRequest.builder()
            .name(name)
            .accountType(type)
            .build()).getId();
    }

    private void assertBalance(UUID accountId, String expected) {
        BigDecimal actual = accountService.getAccount(accountId).orElseThrow().getCurrentBalance();
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            "Expected balance " + expected + " but was " + actual);
    }
}
