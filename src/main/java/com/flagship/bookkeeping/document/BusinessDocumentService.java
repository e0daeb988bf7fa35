package com.flagship.bookkeeping.document;

import com.flagship.bookkeeping.exception.ValidationException;
import com.flagship.bookkeeping.ledger.Account;
import com.flagship.bookkeeping.ledger.AccountService;
import com.flagship.bookkeeping.ledger.CashflowTypeService;
import com.flagship.bookkeeping.ledger.LedgerService;
import com.flagship.bookkeeping.ledger.LedgerTransaction;
import com.flagship.bookkeeping.ledger.TransactionRequest;
import com.flagship.bookkeeping.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Turns business documents (sales, purchases, expenses, cash receipts and payments)
 * into balanced ledger transactions.
 *
 * Each item becomes one debit split and one credit split of the same amount, so the
 * generated transaction always balances. The document and its transaction are written
 * in the same unit of work.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BusinessDocumentService {

    public static final String DOCUMENT_NO_MDC_KEY = "documentNo";

    // document and item amounts are stored with two decimals
    static final int AMOUNT_SCALE = 2;

    private static final DateTimeFormatter DOC_NO_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final BusinessDocumentRepository documentRepository;
    private final AccountService accountService;
    private final CashflowTypeService cashflowTypeService;
    private final LedgerService ledgerService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    @Value("${bookkeeping.default-currency:CNY}")
    private String defaultCurrency;

    @Value("${bookkeeping.transactions.default-limit:50}")
    private int defaultLimit;

    /**
     * Posts a business document and the transaction it generates.
     *
     * @param request document header and items
     * @param docType kind of document, which decides the number prefix and default description
     * @return the stored document with its transaction back-reference
     * @throws ValidationException if an item is invalid, an account or cash-flow type is unknown,
     *                             a cash account has no cash-flow type, or the given number is taken
     */
    @Transactional
    public BusinessDocument postBusinessDocument(BusinessDocumentRequest request, BusinessDocumentType docType) {
        try {
            validate(request, docType);

            Map<UUID, Account> accounts = accountService.requireAccounts(collectAccountIds(request));
            cashflowTypeService.ensureExist(collectCashflowTypeIds(request));

            String docNo = resolveDocNo(request, docType);
            MDC.put(DOCUMENT_NO_MDC_KEY, docNo);

            TransactionRequest transactionRequest = TransactionRequest.builder()
                .num(docNo)
                .postDate(request.getDocDate())
                .description(hasText(request.getDescription()) ? request.getDescription() : docType.getLabel())
                .businessType(docType.name())
                .referenceNo(request.getReferenceNo())
                .splits(buildSplits(request, docType, accounts))
                .build();
            LedgerTransaction transaction = ledgerService.postTransaction(transactionRequest);

            BusinessDocumentEntity document = BusinessDocumentEntity.posted(
                docType,
                docNo,
                request,
                hasText(request.getCurrency()) ? request.getCurrency() : defaultCurrency,
                totalAmount(request),
                transaction.getId(),
                clock.instant()
            );
            List<BusinessDocumentRequest.Item> items = request.getItems();
            for (int i = 0; i < items.size(); i++) {
                BusinessDocumentRequest.Item item = items.get(i);
                int lineNo = item.getLineNo() != null ? item.getLineNo() : i + 1;
                document.addItem(BusinessDocumentItemEntity.from(item, lineNo, effectiveCashflowTypeId(request, item)));
            }
            BusinessDocumentEntity saved = documentRepository.save(document);

            ledgerMetrics.recordDocumentPosted(docType.name(), "success");
            log.info("Posted business document: type={}, items={}, total={}, transactionId={}",
                    docType, items.size(), saved.getTotalAmount().toPlainString(), transaction.getId());
            return saved.toDomain();

        } catch (RuntimeException e) {
            ledgerMetrics.recordDocumentPosted(docType != null ? docType.name() : null, "rejected");
            log.warn("Business document rejected: type={}, reason={}", docType, e.getMessage());
            throw e;
        } finally {
            MDC.remove(DOCUMENT_NO_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Optional<BusinessDocument> getDocument(Long documentId) {
        return documentRepository.findById(documentId).map(BusinessDocumentEntity::toDomain);
    }

    /**
     * Latest documents first, optionally restricted to one type.
     */
    @Transactional(readOnly = true)
    public List<BusinessDocument> listDocuments(BusinessDocumentType docType, int limit) {
        PageRequest page = PageRequest.of(0, limit > 0 ? limit : defaultLimit);
        List<BusinessDocumentEntity> documents = docType != null
            ? documentRepository.findByDocTypeOrderByDocDateDescIdDesc(docType, page)
            : documentRepository.findAllByOrderByDocDateDescIdDesc(page);
        return documents.stream().map(BusinessDocumentEntity::toDomain).toList();
    }

    /**
     * Next free number of the form PREFIX-yyyyMMdd-NNN.
     *
     * The sequence starts at the count of same-type documents on that date plus one and
     * skips numbers that are already taken, which happens once a document of the day has
     * been deleted from the database. Concurrent callers can still compute the same
     * number; the unique constraint rejects the second insert.
     */
    String generateDocNo(BusinessDocumentType docType, LocalDate docDate) {
        long sequence = documentRepository.countByDocTypeAndDocDate(docType, docDate) + 1;
        String candidate = formatDocNo(docType, docDate, sequence);
        while (documentRepository.existsByDocTypeAndDocNo(docType, candidate)) {
            sequence++;
            candidate = formatDocNo(docType, docDate, sequence);
        }
        return candidate;
    }

    private String resolveDocNo(BusinessDocumentRequest request, BusinessDocumentType docType) {
        if (!hasText(request.getDocNo())) {
            return generateDocNo(docType, request.getDocDate());
        }
        String docNo = request.getDocNo().trim();
        if (documentRepository.existsByDocTypeAndDocNo(docType, docNo)) {
            throw new ValidationException("Document number '" + docNo + "' already exists for " + docType);
        }
        return docNo;
    }

    private static String formatDocNo(BusinessDocumentType docType, LocalDate docDate, long sequence) {
        return String.format("%s-%s-%03d", docType.getPrefix(), DOC_NO_DATE.format(docDate), sequence);
    }

    private static void validate(BusinessDocumentRequest request, BusinessDocumentType docType) {
        if (docType == null) {
            throw new ValidationException("Document type is required");
        }
        if (request == null) {
            throw new ValidationException("Document request is required");
        }
        if (request.getDocDate() == null) {
            throw new ValidationException("Document date is required");
        }
        List<BusinessDocumentRequest.Item> items = request.getItems();
        if (items == null || items.isEmpty()) {
            throw new ValidationException("Business document requires at least one item");
        }
        for (int i = 0; i < items.size(); i++) {
            BusinessDocumentRequest.Item item = items.get(i);
            String line = "Item #" + (i + 1);
            if (item.getDebitAccountId() == null) {
                throw new ValidationException(line + " has no debit account");
            }
            if (item.getCreditAccountId() == null) {
                throw new ValidationException(line + " has no credit account");
            }
            if (item.getAmount() == null || item.getAmount().signum() <= 0) {
                throw new ValidationException(line + " amount must be greater than zero");
            }
            if (item.getAmount().stripTrailingZeros().scale() > AMOUNT_SCALE) {
                throw new ValidationException(
                    line + " amount " + item.getAmount().toPlainString() + " has more than " + AMOUNT_SCALE + " decimal places");
            }
        }
    }

    private static List<TransactionRequest.SplitLine> buildSplits(BusinessDocumentRequest request,
                                                                  BusinessDocumentType docType,
                                                                  Map<UUID, Account> accounts) {
        return request.getItems().stream()
            .flatMap(item -> {
                String memo = hasText(item.getMemo()) ? item.getMemo()
                    : hasText(request.getDescription()) ? request.getDescription()
                    : docType.getLabel();
                Long cashflowTypeId = effectiveCashflowTypeId(request, item);
                Account debit = accounts.get(item.getDebitAccountId());
                Account credit = accounts.get(item.getCreditAccountId());
                return Stream.of(
                    TransactionRequest.SplitLine.of(debit.getId(), item.getAmount(), memo,
                        cashSideCashflowType(debit, cashflowTypeId)),
                    TransactionRequest.SplitLine.of(credit.getId(), item.getAmount().negate(), memo,
                        cashSideCashflowType(credit, cashflowTypeId))
                );
            })
            .toList();
    }

    /**
     * Only the cash side of a movement carries the cash-flow type, so the statement
     * never counts the counter-account of the same movement.
     */
    private static Long cashSideCashflowType(Account account, Long cashflowTypeId) {
        if (!account.isCash()) {
            return null;
        }
        if (cashflowTypeId == null) {
            throw new ValidationException("Cash account '" + account.getName() + "' requires a cash-flow type");
        }
        return cashflowTypeId;
    }

    private static Long effectiveCashflowTypeId(BusinessDocumentRequest request, BusinessDocumentRequest.Item item) {
        return item.getCashflowTypeId() != null ? item.getCashflowTypeId() : request.getCashflowTypeId();
    }

    private static Set<UUID> collectAccountIds(BusinessDocumentRequest request) {
        Set<UUID> ids = new HashSet<>();
        for (BusinessDocumentRequest.Item item : request.getItems()) {
            ids.add(item.getDebitAccountId());
            ids.add(item.getCreditAccountId());
        }
        return ids;
    }

    private static Set<Long> collectCashflowTypeIds(BusinessDocumentRequest request) {
        Set<Long> ids = new HashSet<>();
        if (request.getCashflowTypeId() != null) {
            ids.add(request.getCashflowTypeId());
        }
        for (BusinessDocumentRequest.Item item : request.getItems()) {
            if (item.getCashflowTypeId() != null) {
                ids.add(item.getCashflowTypeId());
            }
        }
        return ids;
    }

    private static BigDecimal totalAmount(BusinessDocumentRequest request) {
        return request.getItems().stream()
            .map(BusinessDocumentRequest.Item::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
