package com.flagship.bookkeeping.expense;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Due-date rules for monthly charges.
 *
 * A charge is due once per calendar month, on its configured day clamped to the
 * length of the month, and stays due until it has run in that month.
 */
public final class FixedExpenseSchedule {

    private FixedExpenseSchedule() {
    }

    public static LocalDate dueDate(int dayOfMonth, YearMonth month) {
        int day = Math.min(Math.max(dayOfMonth, 1), month.lengthOfMonth());
        return month.atDay(day);
    }

    /**
     * @param lastRunMonth first day of the month the charge last ran in, or null
     */
    public static boolean isDue(LocalDate lastRunMonth, int dayOfMonth, LocalDate asOf) {
        YearMonth month = YearMonth.from(asOf);
        if (month.atDay(1).equals(lastRunMonth)) {
            return false;
        }
        return !asOf.isBefore(dueDate(dayOfMonth, month));
    }
}
