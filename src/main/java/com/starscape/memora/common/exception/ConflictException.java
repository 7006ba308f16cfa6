package com.starscape.memora.common.exception;

/**
 * Thrown when a write would violate a per-user uniqueness rule
 * (duplicate bookmark URL, tag name, collection name or account email).
 */
public class ConflictException extends RuntimeException {
    
    private final String field;
    
    public ConflictException(String field, String message) {
        super(message);
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
