package com.age.mcp.graph;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifies one logical execution scope (a worker, a request scheduler, a test) that owns
 * its own engine. Two contexts are equal when their ids are equal.
 *
 * <p>Engines are never shared between contexts; pass the same context to every
 * {@link ConnectionLifecycleManager} call that should reuse a pool.</p>
 */
public final class ExecutionContext {

    private final String id;

    private ExecutionContext(String id) {
        this.id = id;
    }

    /**
     * Context with a caller-chosen, stable id.
     */
    public static ExecutionContext named(String id) {
        Objects.requireNonNull(id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        return new ExecutionContext(id);
    }

    /**
     * Context with a fresh random id.
     */
    public static ExecutionContext create() {
        return new ExecutionContext("ctx-" + UUID.randomUUID());
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((ExecutionContext) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
