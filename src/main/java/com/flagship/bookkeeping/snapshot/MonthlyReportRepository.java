package com.flagship.bookkeeping.snapshot;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface MonthlyReportRepository extends JpaRepository<MonthlyReportEntity, Long> {

    List<MonthlyReportEntity> findByReportMonth(LocalDate reportMonth);

    @Query("SELECT DISTINCT r.reportMonth FROM MonthlyReportEntity r ORDER BY r.reportMonth DESC")
    List<LocalDate> findCachedMonths();

    /**
     * Bulk delete, executed immediately so a following insert of the same month
     * does not collide with the unique constraint.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM MonthlyReportEntity r WHERE r.reportMonth IN :months")
    int deleteByReportMonthIn(@Param("months") Collection<LocalDate> months);
}
