package com.flagship.bookkeeping.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CashflowTypeRepository extends JpaRepository<CashflowTypeEntity, Long> {

    boolean existsByCode(String code);

    List<CashflowTypeEntity> findAllByOrderBySortOrderAscIdAsc();

    List<CashflowTypeEntity> findByActiveTrueOrderBySortOrderAscIdAsc();
}
