package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.amount.AmountCodec;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
public interface SplitRepository extends JpaRepository<SplitEntity, UUID> {

    boolean existsByAccountId(UUID accountId);

    @Query("SELECT new com.flagship.bookkeeping.ledger.AccountFractionSum(s.accountId, s.valueDenom, SUM(s.valueNum)) " +
           "FROM SplitEntity s GROUP BY s.accountId, s.valueDenom")
    List<AccountFractionSum> sumByAccountAndDenominator();

    /**
     * Balance of every account that has splits, derived from split history alone.
     */
    default Map<UUID, BigDecimal> derivedBalances() {
        Map<UUID, BigDecimal> balances = new HashMap<>();
        for (AccountFractionSum sum : sumByAccountAndDenominator()) {
            BigDecimal amount = AmountCodec.fromFraction(sum.getNumeratorSum(), sum.getDenominator());
            balances.merge(sum.getAccountId(), amount, BigDecimal::add);
        }
        return balances;
    }
}
