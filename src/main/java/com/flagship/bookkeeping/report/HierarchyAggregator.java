package com.flagship.bookkeeping.report;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Adds roll-up rows to a statement section.
 *
 * After each parent whose direct children are also in the section, a subtotal row
 * holding the sum of those children is inserted. Only one level is summed: a
 * grandchild counts toward its own parent's subtotal, not the grandparent's.
 * Zero subtotals are not emitted.
 */
public final class HierarchyAggregator {

    static final String SUBTOTAL_SUFFIX = " subtotal";

    private HierarchyAggregator() {
    }

    public static List<ReportLine> withSubtotals(List<ReportLine> lines) {
        Map<UUID, ReportLine> present = new LinkedHashMap<>();
        for (ReportLine line : lines) {
            if (!line.isSubtotal() && line.getAccountId() != null) {
                present.put(line.getAccountId(), line);
            }
        }

        Map<UUID, BigDecimal> childTotals = new LinkedHashMap<>();
        for (ReportLine line : present.values()) {
            if (line.getParentId() != null && present.containsKey(line.getParentId())) {
                childTotals.merge(line.getParentId(), line.getAmount(), BigDecimal::add);
            }
        }

        List<ReportLine> aggregated = new ArrayList<>(lines.size() + childTotals.size());
        for (ReportLine line : lines) {
            aggregated.add(line);
            BigDecimal total = line.isSubtotal() ? null : childTotals.remove(line.getAccountId());
            if (total != null && total.signum() != 0) {
                aggregated.add(ReportLine.builder()
                    .accountId(line.getAccountId())
                    .name(line.getName() + SUBTOTAL_SUFFIX)
                    .accountType(line.getAccountType())
                    .parentId(line.getAccountId())
                    .amount(total)
                    .placeholder(true)
                    .subtotal(true)
                    .build());
            }
        }
        return aggregated;
    }
}
