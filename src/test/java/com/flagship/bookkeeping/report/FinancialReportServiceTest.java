package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.TestDatabase;
import com.flagship.bookkeeping.document.BusinessDocumentRequest;
import com.flagship.bookkeeping.document.BusinessDocumentService;
import com.flagship.bookkeeping.document.BusinessDocumentType;
import com.flagship.bookkeeping.exception.ValidationException;
import com.flagship.bookkeeping.ledger.AccountRequest;
import com.flagship.bookkeeping.ledger.AccountService;
import com.flagship.bookkeeping.ledger.CashflowDirection;
import com.flagship.bookkeeping.ledger.CashflowTypeRequest;
import com.flagship.bookkeeping.ledger.CashflowTypeService;
import com.flagship.bookkeeping.ledger.FlowCategory;
import com.flagship.bookkeeping.ledger.LedgerService;
import com.flagship.bookkeeping.ledger.TransactionRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
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

/**
 * Statements derived from a small, fully known ledger.
 *
 * Base ledger: capital 250 and a loan of 200 in January, a cash sale of 80 and
 * rent of 30 in February, so at the end of February cash is 500 and net income 50.
 */
@SpringBootTest
@ActiveProfiles("test")
class FinancialReportServiceTest {

    private static final LocalDate END_OF_FEBRUARY = LocalDate.of(2024, 2, 29);

    @Autowired
    private FinancialReportService reportService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private CashflowTypeService cashflowTypeService;

    @Autowired
    private BusinessDocumentService documentService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID cashId;
    private UUID capitalId;
    private UUID loanId;
    private UUID salesId;
    private UUID rentId;

    @BeforeEach
    void setUp() {
        TestDatabase.clean(jdbcTemplate);
        cashId = createAccount(AccountRequest.builder().name("Cash").accountType("CASH").cash(true));
        capitalId = createAccount(AccountRequest.builder().name("Capital").accountType("EQUITY"));
        loanId = createAccount(AccountRequest.builder().name("Bank loan").accountType("LIABILITY"));
        salesId = createAccount(AccountRequest.builder().name("Sales").accountType("REVENUE"));
        rentId = createAccount(AccountRequest.builder().name("Rent").accountType("EXPENSE"));
    }

    @Nested
    @DisplayName("Balance sheet")
    class BalanceSheetTests {

        @BeforeEach
        void postBaseLedger() {
            post(LocalDate.of(2024, 1, 5), cashId, capitalId, "250.00");
            post(LocalDate.of(2024, 1, 20), cashId, loanId, "200.00");
            post(LocalDate.of(2024, 2, 10), cashId, salesId, "80.00");
            post(LocalDate.of(2024, 2, 20), rentId, cashId, "30.00");
        }

        @Test
        @DisplayName("Assets equal liabilities plus equity plus net income")
        void testBalanced() {
            BalanceSheet sheet = reportService.balanceSheet(END_OF_FEBRUARY);

            assertEquals(END_OF_FEBRUARY, sheet.getReportDate());
            assertAmount("500.00", sheet.getAssetTotal());
            assertAmount("200.00", sheet.getLiabilityTotal());
            assertAmount("250.00", sheet.getEquityTotal());
            assertAmount("50.00", sheet.getNetIncome());
            assertAmount("300.00", sheet.getEquityWithIncome());
            assertAmount("500.00", sheet.getTotalLiabilityEquity());
            assertTrue(sheet.isBalanced());

            assertEquals(1, sheet.getAssets().size());
            assertEquals("Cash", sheet.getAssets().get(0).getName());
            assertAmount("200.00", sheet.getLiabilities().get(0).getAmount());
        }

        @Test
        @DisplayName("Postings after the report date are not included")
        void testAsOfDate() {
            post(LocalDate.of(2024, 3, 3), cashId, salesId, "1000.00");

            BalanceSheet january = reportService.balanceSheet(LocalDate.of(2024, 1, 31));
            assertAmount("450.00", january.getAssetTotal());
            assertAmount("0", january.getNetIncome());
            assertTrue(january.isBalanced());

            assertAmount("500.00", reportService.balanceSheet(END_OF_FEBRUARY).getAssetTotal());
        }

        @Test
        @DisplayName("Unclassified account makes the sheet report an imbalance instead of failing")
        void testImbalanceReported() {
            UUID miscId = createAccount(AccountRequest.builder().name("Suspense").accountType("MISC"));
            post(LocalDate.of(2024, 2, 25), cashId, miscId, "40.00");

            BalanceSheet sheet = reportService.balanceSheet(END_OF_FEBRUARY);

            assertAmount("540.00", sheet.getAssetTotal());
            assertAmount("500.00", sheet.getTotalLiabilityEquity());
            assertFalse(sheet.isBalanced());
            assertTrue(sheet.getLiabilities().stream().noneMatch(line -> line.getAccountId().equals(miscId)));
            assertTrue(sheet.getEquity().stream().noneMatch(line -> line.getAccountId().equals(miscId)));
        }

        @Test
        @DisplayName("Hidden accounts are left out of the statements")
        void testHiddenExcluded() {
            accountService.updateAccount(rentId, AccountRequest.builder().hidden(true).build());

            IncomeStatement statement = reportService.incomeStatement(LocalDate.of(2024, 2, 1), END_OF_FEBRUARY);

            assertTrue(statement.getExpenses().isEmpty());
            assertAmount("80.00", statement.getNetIncome());
        }

        @Test
        @DisplayName("Income statement covers only the requested period")
        void testIncomeStatementPeriods() {
            IncomeStatement february = reportService.incomeStatement(LocalDate.of(2024, 2, 1), END_OF_FEBRUARY);
            assertAmount("80.00", february.getRevenueTotal());
            assertAmount("30.00", february.getExpenseTotal());
            assertAmount("50.00", february.getNetIncome());

            IncomeStatement january = reportService.incomeStatement(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
            assertAmount("0", january.getRevenueTotal());
            assertAmount("0", january.getNetIncome());
        }

        @Test
        @DisplayName("Missing start date defaults to the first of January of the end date's year")
        void testDefaultStartDate() {
            IncomeStatement statement = reportService.incomeStatement(null, END_OF_FEBRUARY);

            assertEquals(LocalDate.of(2024, 1, 1), statement.getStartDate());
            assertAmount("50.00", statement.getNetIncome());
        }
    }

    @Test
    @DisplayName("Start date after end date is rejected")
    void testInvalidRange() {
        LocalDate start = LocalDate.of(2024, 3, 1);
        LocalDate end = LocalDate.of(2024, 2, 1);

        assertThrows(ValidationException.class, () -> reportService.incomeStatement(start, end));
        assertThrows(ValidationException.class, () -> reportService.cashflowStatement(start, end));
    }

    @Test
    @DisplayName("Parent account gets a subtotal of its children that totals do not double count")
    void testHierarchySubtotals() {
        UUID operatingId = createAccount(AccountRequest.builder().name("Operating expenses").code("6000").accountType("EXPENSE").placeholder(true));
        UUID officeRentId = createAccount(AccountRequest.builder().name("Office rent").code("6001").accountType("EXPENSE").parentId(operatingId));
        UUID powerId = createAccount(AccountRequest.builder().name("Power").code("6002").accountType("EXPENSE").parentId(operatingId));
        post(LocalDate.of(2024, 2, 5), officeRentId, cashId, "30.00");
        post(LocalDate.of(2024, 2, 6), powerId, cashId, "20.00");

        IncomeStatement statement = reportService.incomeStatement(LocalDate.of(2024, 2, 1), END_OF_FEBRUARY);

        List<ReportLine> expenses = statement.getExpenses();
        List<String> names = expenses.stream().map(ReportLine::getName).toList();
        assertEquals(List.of("Rent", "Operating expenses", "Operating expenses subtotal", "Office rent", "Power"), names);
        assertTrue(expenses.get(2).isSubtotal());
        assertAmount("50.00", expenses.get(2).getAmount());
        assertEquals("6001", expenses.get(3).getCode());
        assertAmount("50.00", statement.getExpenseTotal());
    }

    @Test
    @DisplayName("Cash-flow statement groups tagged cash movements by activity and direction")
    void testCashflowStatement() {
        Long operatingIn = createCashflowType("OP_IN", FlowCategory.OPERATING, CashflowDirection.INFLOW);
        Long operatingOut = createCashflowType("OP_OUT", FlowCategory.OPERATING, CashflowDirection.OUTFLOW);
        Long financingIn = createCashflowType("FIN_IN", FlowCategory.FINANCING, CashflowDirection.INFLOW);

        postDocument(BusinessDocumentType.SALE, cashId, salesId, "300.00", operatingIn);
        postDocument(BusinessDocumentType.EXPENSE, rentId, cashId, "120.00", operatingOut);
        postDocument(BusinessDocumentType.CASHFLOW, cashId, loanId, "1000.00", financingIn);
        cashflowTypeService.setActive(financingIn, false);

        CashflowStatement statement = reportService.cashflowStatement(LocalDate.of(2024, 2, 1), END_OF_FEBRUARY);

        assertAmount("300.00", statement.getOperating().getInflow());
        assertAmount("120.00", statement.getOperating().getOutflow());
        assertAmount("180.00", statement.getOperating().getNet());
        assertEquals(2, statement.getOperating().getLines().size());
        assertAmount("0", statement.getInvesting().getNet());
        assertTrue(statement.getInvesting().getLines().isEmpty());
        assertAmount("1000.00", statement.getFinancing().getNet());
        assertAmount("1180.00", statement.getTotalNet());

        CashflowStatement march = reportService.cashflowStatement(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));
        assertAmount("0", march.getTotalNet());
    }

    @Test
    @DisplayName("Refund tagged with the same type reduces that type's inflow")
    void testRefundNetsWithinType() {
        Long operatingIn = createCashflowType("OP_IN", FlowCategory.OPERATING, CashflowDirection.INFLOW);

        postDocument(BusinessDocumentType.SALE, cashId, salesId, "100.00", operatingIn);
        postDocument(BusinessDocumentType.SALE, salesId, cashId, "30.00", operatingIn);

        CashflowStatement statement = reportService.cashflowStatement(LocalDate.of(2024, 2, 1), END_OF_FEBRUARY);

        assertEquals(1, statement.getOperating().getLines().size());
        assertAmount("70.00", statement.getOperating().getLines().get(0).getAmount());
        assertAmount("70.00", statement.getOperating().getInflow());
        assertAmount("70.00", statement.getTotalNet());
    }

    @Test
    @DisplayName("Transfer between two cash accounts leaves the cash-flow statement unchanged")
    void testCashToCashTransferNetsToZero() {
        UUID bankId = createAccount(AccountRequest.builder().name("Bank").accountType("BANK").cash(true));
        Long operatingIn = createCashflowType("OP_IN", FlowCategory.OPERATING, CashflowDirection.INFLOW);
        Long transfers = createCashflowType("XFER", FlowCategory.OPERATING, CashflowDirection.OUTFLOW);

        postDocument(BusinessDocumentType.SALE, cashId, salesId, "800.00", operatingIn);
        postDocument(BusinessDocumentType.CASHFLOW, bankId, cashId, "500.00", transfers);

        CashflowStatement statement = reportService.cashflowStatement(LocalDate.of(2024, 2, 1), END_OF_FEBRUARY);

        assertAmount("800.00", statement.getOperating().getInflow());
        assertAmount("0", statement.getOperating().getOutflow());
        assertAmount("800.00", statement.getTotalNet());
        assertAmount("800.00", reportService.balanceSheet(END_OF_FEBRUARY).getAssetTotal());
    }

    private void post(LocalDate date, UUID debitId, UUID creditId, String amount) {
        ledgerService.postTransaction(TransactionRequest.builder()
            .postDate(date)
            .description("Test posting")
            .split(TransactionRequest.SplitLine.debit(debitId, new BigDecimal(amount), null))
            .split(TransactionRequest.SplitLine.credit(creditId, new BigDecimal(amount), null))
            .build());
    }

    private void postDocument(BusinessDocumentType type, UUID debitId, UUID creditId, String amount, Long cashflowTypeId) {
        documentService.postBusinessDocument(BusinessDocumentRequest.builder()
            .docDate(LocalDate.of(2024, 2, 15))
            .cashflowTypeId(cashflowTypeId)
            .item(BusinessDocumentRequest.Item.builder()
                .debitAccountId(debitId)
                .creditAccountId(creditId)
                .amount(new BigDecimal(amount))
                .build())
            .build(), type);
    }

    private Long createCashflowType(String code, FlowCategory category, CashflowDirection direction) {
        return cashflowTypeService.createCashflowType(CashflowTypeRequest.builder()
            .code(code)
            .name(code)
            .flowType(category)
            .direction(direction)
            .build()).getId();
    }

    private UUID createAccount(AccountRequest.AccountRequestBuilder builder) {
        return accountService.createAccount(builder.build()).getId();
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "Expected " + expected + " but was " + actual);
    }
}
