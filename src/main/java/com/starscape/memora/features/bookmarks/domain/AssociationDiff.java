package com.starscape.memora.features.bookmarks.domain;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Difference between the current and desired link sets of one bookmark association.
 * Applying it removes {@code toRemove} and inserts {@code toAdd}; links present in both are untouched.
 */
public record AssociationDiff(
    Set<String> toAdd,
    Set<String> toRemove
) {
    
    public static AssociationDiff between(Set<String> current, Set<String> desired) {
        Set<String> toAdd = new LinkedHashSet<>(desired);
        toAdd.removeAll(current);
        Set<String> toRemove = new LinkedHashSet<>(current);
        toRemove.removeAll(desired);
        return new AssociationDiff(Set.copyOf(toAdd), Set.copyOf(toRemove));
    }
    
    public boolean isEmpty() {
        return toAdd.isEmpty() && toRemove.isEmpty();
    }
}
