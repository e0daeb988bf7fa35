package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent postings against the same accounts on a real PostgreSQL, where
 * the row locks taken on accounts actually serialize the balance updates.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerConcurrencyTest {

    private static final int THREADS = 10;

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("bookkeeping_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("bookkeeping.fixed-expenses.scheduler.enabled", () -> "false");
    }

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID cashId;
    private UUID salesId;

    @BeforeEach
    void setUp() {
        TestDatabase.clean(jdbcTemplate);
        cashId = accountService.createAccount(AccountRequest.builder().name("Cash").accountType("CASH").build()).getId();
        salesId = accountService.createAccount(AccountRequest.builder().name("Sales").accountType("REVENUE").build()).getId();
    }

    @Test
    @DisplayName("Concurrent postings to the same accounts lose no balance update")
    void testConcurrentPostings() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LedgerTransaction>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < THREADS; i++) {
                int sequence = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return ledgerService.postTransaction(TransactionRequest.builder()
                        .postDate(LocalDate.of(2024, 3, 10))
                        .description("Concurrent sale " + sequence)
                        .split(TransactionRequest.SplitLine.debit(cashId, new BigDecimal("10.00"), null))
                        .split(TransactionRequest.SplitLine.credit(salesId, new BigDecimal("10.00"), null))
                        .build());
                }));
            }
            start.countDown();
            for (Future<LedgerTransaction> future : futures) {
                assertNotNull(future.get(30, TimeUnit.SECONDS).getId());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, new BigDecimal("100.00").compareTo(
            accountService.getAccount(cashId).orElseThrow().getCurrentBalance()));
        assertEquals(0, new BigDecimal("-100.00").compareTo(
            accountService.getAccount(salesId).orElseThrow().getCurrentBalance()));
        assertTrue(accountService.listAccountBalances().stream().noneMatch(AccountBalance::isDrifted));
        assertEquals(THREADS, ledgerService.listTransactions(50).size());
    }
}
