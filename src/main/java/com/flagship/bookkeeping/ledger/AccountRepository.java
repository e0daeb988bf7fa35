package com.flagship.bookkeeping.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, UUID id);

    List<AccountEntity> findByParentId(UUID parentId);

    List<AccountEntity> findByHiddenFalse();

    /**
     * Locks the given account rows for the rest of the current transaction.
     * Rows are locked in id order so two postings touching the same accounts
     * cannot deadlock each other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AccountEntity a WHERE a.id IN :ids ORDER BY a.id")
    List<AccountEntity> findAllByIdForUpdate(@Param("ids") Collection<UUID> ids);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AccountEntity a ORDER BY a.id")
    List<AccountEntity> findAllForUpdate();

    /**
     * Trial balance over cached balances. Zero whenever every posting balanced.
     */
    @Query("SELECT COALESCE(SUM(a.currentBalance), 0) FROM AccountEntity a")
    BigDecimal sumCurrentBalances();
}
