package com.flagship.bookkeeping.exception;

/**
 * An identifier did not resolve to a stored entity.
 * Kept apart from {@link ValidationException} so callers can map it to a different status.
 */
public class NotFoundException extends RuntimeException {

    private final String entityType;
    private final Object entityId;

    public NotFoundException(String entityType, Object entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public Object getEntityId() {
        return entityId;
    }
}
