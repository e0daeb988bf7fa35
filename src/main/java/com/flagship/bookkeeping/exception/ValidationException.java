package com.flagship.bookkeeping.exception;

/**
 * Caller input violates a bookkeeping invariant.
 *
 * Duplicate names, unbalanced splits, missing referenced entities and
 * non-positive amounts all end up here. The message is meant to be shown
 * to the caller verbatim, and nothing has been committed when it is thrown.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
