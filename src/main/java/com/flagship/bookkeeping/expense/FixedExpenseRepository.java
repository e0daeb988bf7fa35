package com.flagship.bookkeeping.expense;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FixedExpenseRepository extends JpaRepository<FixedExpenseEntity, Long> {

    List<FixedExpenseEntity> findAllByOrderByDayOfMonthAscIdAsc();

    /**
     * Locks the expense row so two runs of the same charge serialize on lastRunMonth.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM FixedExpenseEntity e WHERE e.id = :id")
    Optional<FixedExpenseEntity> findByIdForUpdate(@Param("id") Long id);
}
