package com.vidnyan.rva.domain.semantics;

import java.util.HashSet;
import java.util.Set;

/**
 * Identities already expanded during one top-level classification.
 * <p>
 * Call-scoped, not path-scoped: once a type is visited anywhere in the call tree,
 * later occurrences are not re-inspected. Create one per top-level call and discard it after.
 * Not thread-safe.
 */
public final class CycleGuard {

    private final Set<Object> visited = new HashSet<>();

    /**
     * @return true if the identity was not seen before in this call
     */
    public boolean add(Object identity) {
        return visited.add(identity);
    }

    public boolean contains(Object identity) {
        return visited.contains(identity);
    }

    public int size() {
        return visited.size();
    }
}
