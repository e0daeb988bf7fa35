package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.exception.NotFoundException;
import com.flagship.bookkeeping.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Chart of accounts.
 *
 * Accounts form a forest through parentId. The registry never changes a balance;
 * only {@link LedgerService} and {@link BalanceReconciliationService} do.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private static final Comparator<Account> CHART_ORDER = Comparator
        .comparing(Account::getCode, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
        .thenComparing(Account::getName);

    private final AccountRepository accountRepository;
    private final SplitRepository splitRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Account> listAccounts(boolean includeHidden) {
        List<AccountEntity> entities = includeHidden
            ? accountRepository.findAll()
            : accountRepository.findByHiddenFalse();
        return entities.stream()
            .map(AccountEntity::toDomain)
            .sorted(CHART_ORDER)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<Account> getAccount(UUID accountId) {
        return accountRepository.findById(accountId).map(AccountEntity::toDomain);
    }

    /**
     * Creates an account with a zero balance.
     *
     * @throws ValidationException if name or type is missing, the name is taken,
     *                             or the parent does not exist
     */
    @Transactional
    public Account createAccount(AccountRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Account name is required");
        }
        if (request.getAccountType() == null || request.getAccountType().isBlank()) {
            throw new ValidationException("Account type is required");
        }
        if (accountRepository.existsByName(request.getName())) {
            throw new ValidationException("Account name '" + request.getName() + "' already exists");
        }
        if (request.getParentId() != null && !accountRepository.existsById(request.getParentId())) {
            throw new ValidationException("Parent account not found: " + request.getParentId());
        }

        AccountEntity saved = accountRepository.save(AccountEntity.create(request, clock.instant()));
        log.info("Created account: id={}, name={}, type={}, parentId={}",
                saved.getId(), saved.getName(), saved.getAccountType(), saved.getParentId());
        return saved.toDomain();
    }

    /**
     * Applies a partial update.
     *
     * A new parent must exist, must not be the account itself and must not
     * sit below it in the hierarchy.
     */
    @Transactional
    public Account updateAccount(UUID accountId, AccountRequest request) {
        AccountEntity account = accountRepository.findById(accountId)
            .orElseThrow(() -> new NotFoundException("Account", accountId));

        if (request.getName() != null) {
            if (request.getName().isBlank()) {
                throw new ValidationException("Account name must not be blank");
            }
            if (accountRepository.existsByNameAndIdNot(request.getName(), accountId)) {
                throw new ValidationException("Account name '" + request.getName() + "' already exists");
            }
        }
        if (request.getAccountType() != null && request.getAccountType().isBlank()) {
            throw new ValidationException("Account type must not be blank");
        }
        if (!request.isClearParent() && request.getParentId() != null) {
            validateNewParent(accountId, request.getParentId());
        }

        account.applyUpdate(request, clock.instant());
        log.info("Updated account: id={}, name={}, parentId={}",
                account.getId(), account.getName(), account.getParentId());
        return account.toDomain();
    }

    /**
     * Deletes an account that has no children, no splits and a zero balance.
     */
    @Transactional
    public void deleteAccount(UUID accountId) {
        AccountEntity account = accountRepository.findById(accountId)
            .orElseThrow(() -> new NotFoundException("Account", accountId));

        List<AccountEntity> children = accountRepository.findByParentId(accountId);
        if (!children.isEmpty()) {
            String names = children.stream()
                .map(AccountEntity::getName)
                .sorted()
                .collect(Collectors.joining(", "));
            throw new ValidationException(
                "Account '" + account.getName() + "' has child accounts and cannot be deleted: " + names);
        }
        if (account.getCurrentBalance() != null && account.getCurrentBalance().signum() != 0) {
            throw new ValidationException(
                "Account '" + account.getName() + "' has a non-zero balance ("
                    + account.getCurrentBalance().toPlainString() + ") and cannot be deleted");
        }
        if (splitRepository.existsByAccountId(accountId)) {
            throw new ValidationException(
                "Account '" + account.getName() + "' is referenced by transactions and cannot be deleted");
        }

        accountRepository.delete(account);
        log.info("Deleted account: id={}, name={}", accountId, account.getName());
    }

    /**
     * Cached balance of every account next to the balance derived from split history.
     */
    @Transactional(readOnly = true)
    public List<AccountBalance> listAccountBalances() {
        Map<UUID, BigDecimal> derived = splitRepository.derivedBalances();
        return accountRepository.findAll().stream()
            .map(AccountEntity::toDomain)
            .sorted(CHART_ORDER)
            .map(account -> new AccountBalance(
                account.getId(),
                account.getName(),
                account.getAccountType(),
                account.getCurrentBalance(),
                derived.getOrDefault(account.getId(), BigDecimal.ZERO)))
            .toList();
    }

    /**
     * Resolves every id or fails with one error naming all the missing ones.
     */
    @Transactional(readOnly = true)
    public Map<UUID, Account> requireAccounts(Collection<UUID> accountIds) {
        Map<UUID, Account> found = accountRepository.findAllById(new HashSet<>(accountIds)).stream()
            .map(AccountEntity::toDomain)
            .collect(Collectors.toMap(Account::getId, Function.identity()));
        Set<String> missing = new TreeSet<>();
        for (UUID id : accountIds) {
            if (!found.containsKey(id)) {
                missing.add(String.valueOf(id));
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException("Accounts not found: " + String.join(", ", missing));
        }
        return found;
    }

    private void validateNewParent(UUID accountId, UUID parentId) {
        if (parentId.equals(accountId)) {
            throw new ValidationException("Account cannot be its own parent");
        }
        AccountEntity parent = accountRepository.findById(parentId)
            .orElseThrow(() -> new ValidationException("Parent account not found: " + parentId));

        Set<UUID> visited = new HashSet<>();
        UUID ancestorId = parent.getParentId();
        while (ancestorId != null && visited.add(ancestorId)) {
            if (ancestorId.equals(accountId)) {
                throw new ValidationException(
                    "Parent '" + parent.getName() + "' is a descendant of this account; the hierarchy would form a cycle");
            }
            ancestorId = accountRepository.findById(ancestorId)
                .map(AccountEntity::getParentId)
                .orElse(null);
        }
    }
}
