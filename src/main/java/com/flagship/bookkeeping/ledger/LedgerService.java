package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.amount.AmountCodec;
import com.flagship.bookkeeping.amount.Fraction;
import com.flagship.bookkeeping.exception.NotFoundException;
import com.flagship.bookkeeping.exception.ValidationException;
import com.flagship.bookkeeping.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for posting, editing and deleting ledger transactions.
 *
 * This service enforces the core invariants:
 * 1. Every transaction has at least two splits whose signed amounts sum to exactly zero
 * 2. Each account's cached balance equals the sum of its split amounts
 * 3. Splits and balance changes are written in one unit of work, so callers
 *    never observe one without the other
 *
 * Balance changes are computed as a per-account delta map and applied to the
 * account rows, which are locked for the duration of the transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";

    private final TransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final CashflowTypeService cashflowTypeService;
    private final JdbcTemplate jdbcTemplate;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    @Value("${bookkeeping.transactions.default-limit:50}")
    private int defaultLimit;

    /**
     * Posts a new balanced transaction and updates the balances of every account it touches.
     *
     * @param request transaction header and splits
     * @return the posted transaction
     * @throws ValidationException if the splits do not balance, fewer than two are given,
     *                             or a referenced account or cash-flow type does not exist
     */
    @Transactional
    public LedgerTransaction postTransaction(TransactionRequest request) {
        long startTime = System.currentTimeMillis();
        try {
            List<PreparedSplit> prepared = prepareSplits(request);
            Map<UUID, AccountEntity> accounts = lockAccounts(accountIdsOf(prepared));

            Instant now = clock.instant();
            TransactionEntity transaction = TransactionEntity.create(request, now);
            MDC.put(TRANSACTION_ID_MDC_KEY, transaction.getId().toString());

            transaction.replaceSplits(toSplitEntities(prepared, now));
            transactionRepository.save(transaction);
            applyBalanceDeltas(deltasOf(transaction.getSplits(), false), accounts, now);

            ledgerMetrics.recordTransaction("post", "success");
            log.info("Posted transaction: num={}, postDate={}, splits={}",
                    transaction.getNum(), transaction.getPostDate(), prepared.size());
            return toDomain(transaction, accounts);

        } catch (RuntimeException e) {
            ledgerMetrics.recordTransaction("post", "rejected");
            log.warn("Transaction posting rejected: {}", e.getMessage());
            throw e;
        } finally {
            ledgerMetrics.recordTransactionLatency("post", System.currentTimeMillis() - startTime);
            MDC.remove(TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Replaces the header and split set of an existing transaction.
     *
     * Balances are adjusted in two phases inside the same unit of work:
     * the old splits' deltas are reversed, the split set is replaced, and the
     * new splits' deltas are applied. Accounts present in only one version are
     * therefore still adjusted correctly.
     *
     * @throws NotFoundException   if the transaction does not exist
     * @throws ValidationException if the new splits are invalid or the transaction backs a business document
     */
    @Transactional
    public LedgerTransaction updateTransaction(UUID transactionId, TransactionRequest request) {
        long startTime = System.currentTimeMillis();
        MDC.put(TRANSACTION_ID_MDC_KEY, String.valueOf(transactionId));
        try {
            TransactionEntity transaction = transactionRepository.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new NotFoundException("Transaction", transactionId));
            ensureNotBackingDocument(transactionId);

            List<PreparedSplit> prepared = prepareSplits(request);
            Set<UUID> touched = new HashSet<>(accountIdsOf(prepared));
            transaction.getSplits().forEach(split -> touched.add(split.getAccountId()));
            Map<UUID, AccountEntity> accounts = lockAccounts(touched);

            Instant now = clock.instant();
            applyBalanceDeltas(deltasOf(transaction.getSplits(), true), accounts, now);

            transaction.applyHeader(request, now);
            transaction.replaceSplits(toSplitEntities(prepared, now));
            transactionRepository.save(transaction);

            applyBalanceDeltas(deltasOf(transaction.getSplits(), false), accounts, now);

            ledgerMetrics.recordTransaction("update", "success");
            log.info("Updated transaction: splits={}", prepared.size());
            return toDomain(transaction, accounts);

        } catch (RuntimeException e) {
            ledgerMetrics.recordTransaction("update", "rejected");
            log.warn("Transaction update rejected: {}", e.getMessage());
            throw e;
        } finally {
            ledgerMetrics.recordTransactionLatency("update", System.currentTimeMillis() - startTime);
            MDC.remove(TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Reverts the balance effect of a transaction, then removes it with its splits.
     *
     * @throws NotFoundException if the transaction does not exist
     */
    @Transactional
    public void deleteTransaction(UUID transactionId) {
        MDC.put(TRANSACTION_ID_MDC_KEY, String.valueOf(transactionId));
        try {
            TransactionEntity transaction = transactionRepository.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new NotFoundException("Transaction", transactionId));
            ensureNotBackingDocument(transactionId);

            Set<UUID> touched = transaction.getSplits().stream()
                .map(SplitEntity::getAccountId)
                .collect(Collectors.toSet());
            Map<UUID, AccountEntity> accounts = lockAccounts(touched);

            applyBalanceDeltas(deltasOf(transaction.getSplits(), true), accounts, clock.instant());
            transactionRepository.delete(transaction);

            ledgerMetrics.recordTransaction("delete", "success");
            log.info("Deleted transaction and reverted {} account balance(s)", touched.size());

        } catch (RuntimeException e) {
            ledgerMetrics.recordTransaction("delete", "rejected");
            throw e;
        } finally {
            MDC.remove(TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Most recent transactions first (post date, then creation time).
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> listTransactions(int limit) {
        int effectiveLimit = limit > 0 ? limit : defaultLimit;
        List<TransactionEntity> transactions = transactionRepository.findRecent(PageRequest.of(0, effectiveLimit));
        Map<UUID, AccountEntity> accounts = loadAccounts(transactions.stream()
            .flatMap(tx -> tx.getSplits().stream())
            .map(SplitEntity::getAccountId)
            .collect(Collectors.toSet()));
        return transactions.stream()
            .map(tx -> toDomain(tx, accounts))
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> getTransaction(UUID transactionId) {
        return transactionRepository.findById(transactionId)
            .map(tx -> toDomain(tx, loadAccounts(tx.getSplits().stream()
                .map(SplitEntity::getAccountId)
                .collect(Collectors.toSet()))));
    }

    /**
     * Flattened split rows joined with account and cash-flow type names.
     * Read-only; never a source of truth for balances.
     *
     * @param transactionId restricts the rows to one transaction when not null
     * @param limit maximum number of rows
     */
    @Transactional(readOnly = true)
    public List<TransactionDetail> listTransactionDetails(UUID transactionId, int limit) {
        int effectiveLimit = limit > 0 ? limit : defaultLimit;
        String sql =
            "SELECT t.id AS transaction_id, t.num, t.post_date, t.description, t.business_type, t.reference_no, " +
            "       s.id AS split_id, s.account_id, a.name AS account_name, a.account_type, " +
            "       s.value_num, s.value_denom, s.memo, s.cashflow_type_id, c.name AS cashflow_type_name " +
            "FROM transactions t " +
            "JOIN splits s ON s.transaction_id = t.id " +
            "JOIN accounts a ON a.id = s.account_id " +
            "LEFT JOIN cashflow_types c ON c.id = s.cashflow_type_id ";
        if (transactionId != null) {
            return jdbcTemplate.query(
                sql + "WHERE t.id = ? ORDER BY s.split_index LIMIT ?",
                transactionDetailRowMapper(),
                transactionId,
                effectiveLimit
            );
        }
        return jdbcTemplate.query(
            sql + "ORDER BY t.post_date DESC, t.created_at DESC, t.id, s.split_index LIMIT ?",
            transactionDetailRowMapper(),
            effectiveLimit
        );
    }

    // ==================== Validation ====================

    private List<PreparedSplit> prepareSplits(TransactionRequest request) {
        if (request == null) {
            throw new ValidationException("Transaction request is required");
        }
        if (request.getPostDate() == null) {
            throw new ValidationException("Transaction post date is required");
        }
        List<TransactionRequest.SplitLine> lines = request.getSplits() != null ? request.getSplits() : List.of();
        if (lines.size() < 2) {
            throw new ValidationException(
                "Double-entry transaction requires at least two splits, got " + lines.size());
        }

        List<PreparedSplit> prepared = new ArrayList<>(lines.size());
        BigDecimal total = BigDecimal.ZERO;
        for (int i = 0; i < lines.size(); i++) {
            TransactionRequest.SplitLine line = lines.get(i);
            if (line.getAccountId() == null) {
                throw new ValidationException("Split #" + (i + 1) + " has no account");
            }
            if (line.getAmount() == null) {
                throw new ValidationException("Split #" + (i + 1) + " has no amount");
            }
            // balance is checked on the stored (rounded) value so the cached balances stay exact
            Fraction value;
            try {
                value = AmountCodec.toFraction(line.getAmount());
            } catch (ArithmeticException e) {
                throw new ValidationException(
                    "Split #" + (i + 1) + " amount " + line.getAmount().toPlainString() + " is out of range");
            }
            total = total.add(AmountCodec.fromFraction(value));
            prepared.add(new PreparedSplit(i, line.getAccountId(), value, line.getMemo(), line.getCashflowTypeId()));
        }

        if (total.signum() != 0) {
            throw new ValidationException(
                String.format("Transaction is not balanced: splits sum to %s, expected 0", total.toPlainString()));
        }

        cashflowTypeService.ensureExist(prepared.stream()
            .map(PreparedSplit::getCashflowTypeId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet()));
        return prepared;
    }

    private void ensureNotBackingDocument(UUID transactionId) {
        if (transactionRepository.isBackedByBusinessDocument(transactionId)) {
            throw new ValidationException(
                "Transaction " + transactionId + " was generated by a posted business document and cannot be changed");
        }
    }

    // ==================== Balance deltas ====================

    private Map<UUID, AccountEntity> lockAccounts(Collection<UUID> accountIds) {
        Map<UUID, AccountEntity> accounts = accountRepository.findAllByIdForUpdate(accountIds).stream()
            .collect(Collectors.toMap(AccountEntity::getId, Function.identity()));
        Set<String> missing = new TreeSet<>();
        for (UUID id : accountIds) {
            if (!accounts.containsKey(id)) {
                missing.add(id.toString());
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException("Accounts not found: " + String.join(", ", missing));
        }
        return accounts;
    }

    private Map<UUID, AccountEntity> loadAccounts(Collection<UUID> accountIds) {
        return accountRepository.findAllById(accountIds).stream()
            .collect(Collectors.toMap(AccountEntity::getId, Function.identity()));
    }

    private static Map<UUID, BigDecimal> deltasOf(List<SplitEntity> splits, boolean reverse) {
        Map<UUID, BigDecimal> deltas = new LinkedHashMap<>();
        for (SplitEntity split : splits) {
            BigDecimal amount = reverse ? split.getAmount().negate() : split.getAmount();
            deltas.merge(split.getAccountId(), amount, BigDecimal::add);
        }
        return deltas;
    }

    private static void applyBalanceDeltas(Map<UUID, BigDecimal> deltas,
                                           Map<UUID, AccountEntity> accounts,
                                           Instant now) {
        deltas.forEach((accountId, delta) -> {
            AccountEntity account = accounts.get(accountId);
            if (account == null) {
                throw new ValidationException("Account " + accountId + " not found, cannot update balance");
            }
            account.applyBalanceDelta(delta, now);
        });
    }

    private static Set<UUID> accountIdsOf(List<PreparedSplit> prepared) {
        return prepared.stream().map(PreparedSplit::getAccountId).collect(Collectors.toSet());
    }

    private static List<SplitEntity> toSplitEntities(List<PreparedSplit> prepared, Instant now) {
        return prepared.stream()
            .map(split -> SplitEntity.create(split.getIndex(), split.getAccountId(), split.getValue(),
                    split.getMemo(), split.getCashflowTypeId(), now))
            .toList();
    }

    // ==================== Mapping ====================

    private static LedgerTransaction toDomain(TransactionEntity transaction, Map<UUID, AccountEntity> accounts) {
        List<LedgerSplit> splits = transaction.getSplits().stream()
            .map(split -> new LedgerSplit(
                split.getId(),
                transaction.getId(),
                split.getAccountId(),
                Optional.ofNullable(accounts.get(split.getAccountId())).map(AccountEntity::getName).orElse(null),
                split.getAmount(),
                split.getValueNum(),
                split.getValueDenom(),
                split.getMemo(),
                split.getReconcileState(),
                split.getCashflowTypeId()))
            .toList();
        return new LedgerTransaction(
            transaction.getId(),
            transaction.getNum(),
            transaction.getPostDate(),
            transaction.getEnterDate(),
            transaction.getDescription(),
            transaction.getBusinessType(),
            transaction.getReferenceNo(),
            transaction.getCreatedAt(),
            transaction.getUpdatedAt(),
            splits
        );
    }

    private RowMapper<TransactionDetail> transactionDetailRowMapper() {
        return (rs, rowNum) -> {
            long cashflowTypeId = rs.getLong("cashflow_type_id");
            Long cashflowType = rs.wasNull() ? null : cashflowTypeId;
            return new TransactionDetail(
                UUID.fromString(rs.getString("transaction_id")),
                rs.getString("num"),
                rs.getObject("post_date", java.time.LocalDate.class),
                rs.getString("description"),
                rs.getString("business_type"),
                rs.getString("reference_no"),
                UUID.fromString(rs.getString("split_id")),
                UUID.fromString(rs.getString("account_id")),
                rs.getString("account_name"),
                rs.getString("account_type"),
                AmountCodec.fromFraction(rs.getLong("value_num"), rs.getLong("value_denom")),
                rs.getString("memo"),
                cashflowType,
                rs.getString("cashflow_type_name")
            );
        };
    }

    @lombok.Value
    private static class PreparedSplit {
        int index;
        UUID accountId;
        Fraction value;
        String memo;
        Long cashflowTypeId;
    }
}
