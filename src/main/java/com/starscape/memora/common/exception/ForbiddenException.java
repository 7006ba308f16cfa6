package com.starscape.memora.common.exception;

/**
 * Thrown when an operation is not allowed on a protected resource,
 * such as renaming or deleting a system collection.
 */
public class ForbiddenException extends RuntimeException {
    
    private final String field;
    
    public ForbiddenException(String field, String message) {
        super(message);
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
