package com.flagship.bookkeeping.observability;

import com.flagship.bookkeeping.ledger.AccountBalance;
import com.flagship.bookkeeping.ledger.AccountRepository;
import com.flagship.bookkeeping.ledger.AccountService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Health indicator for ledger consistency.
 *
 * Down if the cached balances do not sum to zero (some posting did not balance)
 * or any account's cached balance differs from the sum of its splits.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private final AccountRepository accountRepository;
    private final AccountService accountService;

    public LedgerHealthIndicator(AccountRepository accountRepository, AccountService accountService) {
        this.accountRepository = accountRepository;
        this.accountService = accountService;
    }

    @Override
    public Health health() {
        try {
            BigDecimal trialBalance = accountRepository.sumCurrentBalances();
            long driftedAccounts = accountService.listAccountBalances().stream()
                    .filter(AccountBalance::isDrifted)
                    .count();

            Health.Builder builder = trialBalance.signum() == 0 && driftedAccounts == 0
                    ? Health.up()
                    : Health.down();

            return builder
                    .withDetail("trialBalance", trialBalance.toPlainString())
                    .withDetail("driftedAccounts", driftedAccounts)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
