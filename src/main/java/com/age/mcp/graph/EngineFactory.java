package com.age.mcp.graph;

/**
 * Builds a {@link GraphEngine} from settings. Implementations must not perform I/O.
 */
@FunctionalInterface
public interface EngineFactory {

    GraphEngine create(ConnectionSettings settings);

    /**
     * Factory for the HikariCP-backed engine.
     */
    static EngineFactory hikari() {
        return HikariGraphEngine::new;
    }
}
