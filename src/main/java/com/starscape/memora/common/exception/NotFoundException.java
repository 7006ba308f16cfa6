package com.starscape.memora.common.exception;

/**
 * Thrown when a resource does not exist or is not owned by the caller.
 * The two cases are deliberately indistinguishable to clients.
 */
public class NotFoundException extends RuntimeException {
    
    private final String field;
    
    public NotFoundException(String field, String message) {
        super(message);
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
