package com.flagship.bookkeeping.document;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface BusinessDocumentRepository extends JpaRepository<BusinessDocumentEntity, Long> {

    long countByDocTypeAndDocDate(BusinessDocumentType docType, LocalDate docDate);

    boolean existsByDocTypeAndDocNo(BusinessDocumentType docType, String docNo);

    List<BusinessDocumentEntity> findAllByOrderByDocDateDescIdDesc(Pageable pageable);

    List<BusinessDocumentEntity> findByDocTypeOrderByDocDateDescIdDesc(BusinessDocumentType docType, Pageable pageable);
}
