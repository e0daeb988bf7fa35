package com.flagship.bookkeeping.document;

public enum BusinessDocumentStatus {
    POSTED
}
