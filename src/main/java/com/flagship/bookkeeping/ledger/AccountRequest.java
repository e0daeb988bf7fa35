package com.flagship.bookkeeping.ledger;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Fields for creating or updating an account.
 *
 * On update only non-null fields are applied. Because a null parentId means
 * "leave unchanged", detaching from a parent is requested with clearParent.
 */
@Value
@Builder(toBuilder = true)
public class AccountRequest {
    String name;
    String accountType;
    String code;
    UUID parentId;
    boolean clearParent;
    String description;
    Boolean hidden;
    Boolean placeholder;
    Boolean cash;
}
