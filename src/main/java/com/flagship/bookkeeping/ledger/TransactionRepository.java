package com.flagship.bookkeeping.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    @Query("SELECT t FROM TransactionEntity t ORDER BY t.postDate DESC, t.createdAt DESC")
    List<TransactionEntity> findRecent(Pageable pageable);

    /**
     * Loads a transaction and locks its row, so concurrent edits of the
     * same transaction cannot both revert the original deltas.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TransactionEntity t WHERE t.id = :id")
    Optional<TransactionEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT CASE WHEN COUNT(d) > 0 THEN true ELSE false END " +
           "FROM BusinessDocumentEntity d WHERE d.transactionId = :id")
    boolean isBackedByBusinessDocument(@Param("id") UUID transactionId);
}
