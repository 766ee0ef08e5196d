package com.age.mcp.graph;

/**
 * Per-context lifecycle state of a {@link ConnectionLifecycleManager}.
 * Disposing returns a context to {@link #UNINITIALIZED}.
 */
public enum LifecycleState {
    UNINITIALIZED,
    ENGINE_READY,
    SESSION_FACTORY_READY
}
