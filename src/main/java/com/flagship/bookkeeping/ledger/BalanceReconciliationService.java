package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Rebuilds cached account balances from split history.
 *
 * Postings keep the cache exact, so in a healthy ledger this corrects nothing.
 * It exists for repair after direct database edits or an imported dataset.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceReconciliationService {

    private final AccountRepository accountRepository;
    private final SplitRepository splitRepository;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    /**
     * Locks every account, recomputes its balance from splits and overwrites drifted values.
     *
     * @return the accounts whose cached balance was corrected, with the old and new values
     */
    @Transactional
    public List<AccountBalance> recalculateBalances() {
        List<AccountEntity> accounts = accountRepository.findAllForUpdate();
        Map<UUID, BigDecimal> derived = splitRepository.derivedBalances();
        Instant now = clock.instant();

        List<AccountBalance> corrected = new ArrayList<>();
        for (AccountEntity account : accounts) {
            BigDecimal cached = account.getCurrentBalance() != null ? account.getCurrentBalance() : BigDecimal.ZERO;
            BigDecimal expected = derived.getOrDefault(account.getId(), BigDecimal.ZERO);
            if (cached.compareTo(expected) != 0) {
                log.warn("Balance drift corrected: account={}, cached={}, derived={}",
                        account.getName(), cached.toPlainString(), expected.toPlainString());
                account.resetBalance(expected, now);
                corrected.add(new AccountBalance(
                    account.getId(), account.getName(), account.getAccountType(), cached, expected));
            }
        }

        ledgerMetrics.recordBalancesCorrected(corrected.size());
        log.info("Balance reconciliation finished: accounts={}, corrected={}", accounts.size(), corrected.size());
        return corrected;
    }
}
