package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.amount.AmountCodec;
import com.flagship.bookkeeping.ledger.CashflowDirection;
import com.flagship.bookkeeping.ledger.FlowCategory;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregate queries behind the financial statements.
 *
 * Numerators are summed per denominator in SQL and converted through {@link AmountCodec}
 * afterwards, so no amount ever passes through floating point.
 */
@Repository
@RequiredArgsConstructor
public class ReportQueryRepository {

    private static final String ACCOUNT_SUMS =
        "SELECT s.account_id, s.value_denom, SUM(s.value_num) AS num_sum " +
        "FROM splits s JOIN transactions t ON t.id = s.transaction_id ";

    private final JdbcTemplate jdbcTemplate;

    /**
     * Signed balance per account over all splits posted on or before the date.
     */
    public Map<UUID, BigDecimal> balancesAsOf(LocalDate date) {
        return toAccountAmounts(jdbcTemplate.query(
            ACCOUNT_SUMS + "WHERE t.post_date <= ? GROUP BY s.account_id, s.value_denom",
            ACCOUNT_SUM_ROW_MAPPER,
            date
        ));
    }

    /**
     * Signed movement per account over splits posted within [start, end].
     */
    public Map<UUID, BigDecimal> movementsBetween(LocalDate start, LocalDate end) {
        return toAccountAmounts(jdbcTemplate.query(
            ACCOUNT_SUMS + "WHERE t.post_date >= ? AND t.post_date <= ? GROUP BY s.account_id, s.value_denom",
            ACCOUNT_SUM_ROW_MAPPER,
            start,
            end
        ));
    }

    /**
     * Net cash movement per cash-flow type within [start, end], in type sort order.
     *
     * Signed split amounts are summed per type and only the type total is made absolute,
     * so a refund reduces its type and a transfer between two tagged cash accounts nets
     * to zero. Types without splits in the range are absent.
     */
    public List<CashflowTypeTotal> cashflowTotalsBetween(LocalDate start, LocalDate end) {
        List<CashflowTypeSum> rows = jdbcTemplate.query(
            "SELECT c.id, c.code, c.name, c.flow_type, c.direction, c.sort_order, " +
            "       s.value_denom, SUM(s.value_num) AS num_sum " +
            "FROM splits s " +
            "JOIN transactions t ON t.id = s.transaction_id " +
            "JOIN cashflow_types c ON c.id = s.cashflow_type_id " +
            "WHERE t.post_date >= ? AND t.post_date <= ? " +
            "GROUP BY c.id, c.code, c.name, c.flow_type, c.direction, c.sort_order, s.value_denom " +
            "ORDER BY c.sort_order, c.id",
            CASHFLOW_SUM_ROW_MAPPER,
            start,
            end
        );

        Map<Long, CashflowTypeTotal> totals = new LinkedHashMap<>();
        for (CashflowTypeSum row : rows) {
            BigDecimal amount = AmountCodec.fromFraction(row.getNumeratorSum(), row.getDenominator());
            totals.merge(row.getId(),
                new CashflowTypeTotal(row.getId(), row.getCode(), row.getName(), row.getFlowType(), row.getDirection(), amount),
                (existing, added) -> existing.plus(added.getAmount()));
        }
        return totals.values().stream()
            .map(CashflowTypeTotal::absolute)
            .toList();
    }

    private static Map<UUID, BigDecimal> toAccountAmounts(List<AccountSum> rows) {
        Map<UUID, BigDecimal> amounts = new HashMap<>();
        for (AccountSum row : rows) {
            amounts.merge(row.getAccountId(),
                AmountCodec.fromFraction(row.getNumeratorSum(), row.getDenominator()),
                BigDecimal::add);
        }
        return amounts;
    }

    private static final RowMapper<AccountSum> ACCOUNT_SUM_ROW_MAPPER = (rs, rowNum) -> new AccountSum(
        UUID.fromString(rs.getString("account_id")),
        rs.getLong("value_denom"),
        rs.getLong("num_sum")
    );

    private static final RowMapper<CashflowTypeSum> CASHFLOW_SUM_ROW_MAPPER = (rs, rowNum) -> new CashflowTypeSum(
        rs.getLong("id"),
        rs.getString("code"),
        rs.getString("name"),
        FlowCategory.valueOf(rs.getString("flow_type")),
        CashflowDirection.valueOf(rs.getString("direction")),
        rs.getLong("value_denom"),
        rs.getLong("num_sum")
    );

    @Value
    private static class AccountSum {
        UUID accountId;
        long denominator;
        long numeratorSum;
    }

    @Value
    private static class CashflowTypeSum {
        long id;
        String code;
        String name;
        FlowCategory flowType;
        CashflowDirection direction;
        long denominator;
        long numeratorSum;
    }

    /**
     * Period total of one cash-flow type.
     */
    @Value
    public static class CashflowTypeTotal {
        Long id;
        String code;
        String name;
        FlowCategory flowType;
        CashflowDirection direction;
        BigDecimal amount;

        CashflowTypeTotal plus(BigDecimal more) {
            return new CashflowTypeTotal(id, code, name, flowType, direction, amount.add(more));
        }

        CashflowTypeTotal absolute() {
            return new CashflowTypeTotal(id, code, name, flowType, direction, amount.abs());
        }
    }
}
