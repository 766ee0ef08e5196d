package com.age.mcp.graph;

import java.util.Objects;

/**
 * The engine cached for one execution context and, once built, its session factory.
 *
 * @param engine         the live engine
 * @param sessionFactory factory bound to {@code engine}, or null until first requested
 */
public record CachedEngineHandle(GraphEngine engine, SessionFactory sessionFactory) {

    public CachedEngineHandle {
        Objects.requireNonNull(engine, "engine is required");
    }

    public static CachedEngineHandle of(GraphEngine engine) {
        return new CachedEngineHandle(engine, null);
    }

    public CachedEngineHandle withSessionFactory(SessionFactory factory) {
        return new CachedEngineHandle(engine, factory);
    }

    public LifecycleState state() {
        return sessionFactory != null ? LifecycleState.SESSION_FACTORY_READY : LifecycleState.ENGINE_READY;
    }
}
