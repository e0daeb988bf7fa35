package com.flagship.bookkeeping.document;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Request for posting a business document.
 *
 * docNo is generated when blank. cashflowTypeId is the document-level default
 * for items that do not carry their own.
 */
@Value
@Builder
public class BusinessDocumentRequest {
    String docNo;
    LocalDate docDate;
    String partnerName;
    String referenceNo;
    String description;
    String currency;
    Long cashflowTypeId;
    @Singular
    List<Item> items;

    /**
     * One document line: amount is debited to debitAccountId and credited to creditAccountId.
     */
    @Value
    @Builder
    public static class Item {
        Integer lineNo;
        String description;
        String memo;
        UUID debitAccountId;
        UUID creditAccountId;
        BigDecimal quantity;
        BigDecimal unitPrice;
        BigDecimal amount;
        Long cashflowTypeId;
    }
}
