package com.flagship.bookkeeping.expense;

import com.flagship.bookkeeping.TestDatabase;
import com.flagship.bookkeeping.ledger.AccountRequest;
import com.flagship.bookkeeping.ledger.AccountService;
import com.flagship.bookkeeping.ledger.LedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;

/**
 * One charge failing mid-batch must roll back alone: the others still post and
 * the failed one stays due for the next run.
 */
@SpringBootTest
@ActiveProfiles("test")
class FixedExpenseBatchFailureTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2024, 3, 10);

    @Autowired
    private FixedExpenseService fixedExpenseService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @SpyBean
    private LedgerService ledgerService;

    private UUID expenseAccountId;
    private UUID bankId;

    @BeforeEach
    void setUp() {
        TestDatabase.clean(jdbcTemplate);
        expenseAccountId = accountService.createAccount(AccountRequest.builder()
            .name("Office costs").accountType("EXPENSE").build()).getId();
        bankId = accountService.createAccount(AccountRequest.builder()
            .name("Bank").accountType("BANK").build()).getId();
    }

    @Test
    @DisplayName("Failure of one charge does not stop or roll back the others")
    void testFailureIsolated() {
        FixedExpense rent = create("Rent", "3000.00", 1);
        FixedExpense broken = create("Broken lease", "700.00", 2);
        FixedExpense internet = create("Internet", "200.00", 3);

        doThrow(new IllegalStateException("Ledger unavailable"))
            .when(ledgerService).postTransaction(argThat(request ->
                request != null && request.getDescription() != null && request.getDescription().contains("Broken lease")));

        List<FixedExpenseRunResult> results = fixedExpenseService.executeAllDue(RUN_DATE);

        assertEquals(3, results.size());
        assertTrue(results.get(0).isPosted());
        assertFalse(results.get(1).isPosted());
        assertEquals(broken.getId(), results.get(1).getExpenseId());
        assertEquals(List.of("Execution failed: Ledger unavailable"), results.get(1).getWarnings());
        assertTrue(results.get(2).isPosted());

        assertEquals(0, new BigDecimal("-3200.00").compareTo(
            accountService.getAccount(bankId).orElseThrow().getCurrentBalance()));
        assertNotNull(fixedExpenseService.getFixedExpense(rent.getId()).orElseThrow().getLastRunMonth());
        assertNotNull(fixedExpenseService.getFixedExpense(internet.getId()).orElseThrow().getLastRunMonth());
        assertNull(fixedExpenseService.getFixedExpense(broken.getId()).orElseThrow().getLastRunMonth());
    }

    private FixedExpense create(String name, String amount, int dayOfMonth) {
        return fixedExpenseService.createFixedExpense(FixedExpenseRequest.builder()
            .name(name)
            .amount(new BigDecimal(amount))
            .expenseAccountId(expenseAccountId)
            .primaryAccountId(bankId)
            .dayOfMonth(dayOfMonth)
            .build());
    }
}
