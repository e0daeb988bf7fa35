package com.flagship.bookkeeping.document;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class BusinessDocument {
    Long id;
    BusinessDocumentType docType;
    String docNo;
    LocalDate docDate;
    String partnerName;
    String referenceNo;
    String description;
    String currency;
    BigDecimal totalAmount;
    BusinessDocumentStatus status;
    UUID transactionId;
    Instant createdAt;
    Instant updatedAt;
    List<BusinessDocumentItem> items;
}
