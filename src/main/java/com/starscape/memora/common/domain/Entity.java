package com.starscape.memora.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base type for persistent domain objects.
 * Identity is defined by {@link #getId()}; subclasses own the mapped id field.
 */
public abstract class Entity<ID extends Serializable> {
    
    protected Entity() {
        // JPA constructor
    }
    
    protected Entity(ID id) {
        Objects.requireNonNull(id, "Entity ID cannot be null");
    }
    
    public abstract ID getId();
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity<?> that = (Entity<?>) o;
        return getId() != null && getId().equals(that.getId());
    }
    
    @Override
    public int hashCode() {
        return Objects.hashCode(getId());
    }
}
