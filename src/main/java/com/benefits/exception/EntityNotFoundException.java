package com.benefits.exception;

/**
 * Exception thrown when the persistence collaborator cannot find a requested entity.
 */
public class EntityNotFoundException extends BenefitsException {

    public EntityNotFoundException(String entityType, String id) {
        super(entityType + " not found: " + id);
    }

    public EntityNotFoundException(String message) {
        super(message);
    }
}
