package com.age.mcp.graph;

import com.age.mcp.cache.LruCache;
import com.age.mcp.logging.LogContext;
import com.age.mcp.metrics.MetricsService;
import com.age.mcp.metrics.NoOpMetricsService;
import com.age.mcp.metrics.TransactionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lazily builds, caches and disposes one engine and session factory per
 * {@link ExecutionContext} for a single {@link ConnectionSettings} target.
 *
 * <p>Per context the state moves {@code UNINITIALIZED -> ENGINE_READY -> SESSION_FACTORY_READY};
 * {@link #dispose(ExecutionContext)} returns it to {@code UNINITIALIZED}. Contexts never share
 * an engine. The registry holds at most {@code maxContexts} contexts; when it is full the
 * least recently used context loses its engine, which is closed.</p>
 *
 * <p>All registry access happens under one lock, so concurrent first calls for the same
 * context build exactly one engine. Engines are closed outside the lock.</p>
 *
 * <pre>
 * ConnectionLifecycleManager manager = new ConnectionLifecycleManager(settings);
 * ExecutionContext ctx = ExecutionContext.named("worker-1");
 * List&lt;GraphRecord&gt; cities = manager.scopedTransaction(ctx, IsolationLevel.READ_COMMITTED,
 *         session -&gt; session.cypher("geo", "MATCH (c:City) RETURN c", "c"));
 * manager.dispose(ctx);
 * </pre>
 */
public class ConnectionLifecycleManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycleManager.class);

    public static final int DEFAULT_MAX_CONTEXTS = LruCache.DEFAULT_MAX_SIZE;

    static final String REASON_DISPOSE = "dispose";
    static final String REASON_EVICTED = "evicted";
    static final String REASON_SHUTDOWN = "shutdown";

    private final ConnectionSettings settings;
    private final EngineFactory engineFactory;
    private final MetricsService metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final LruCache<ExecutionContext, CachedEngineHandle> registry;
    // filled by the registry eviction listener, drained before the lock is released
    private final Map<ExecutionContext, CachedEngineHandle> pendingEvictions = new LinkedHashMap<>();

    public ConnectionLifecycleManager(ConnectionSettings settings) {
        this(settings, EngineFactory.hikari(), new NoOpMetricsService(), DEFAULT_MAX_CONTEXTS);
    }

    public ConnectionLifecycleManager(ConnectionSettings settings, EngineFactory engineFactory,
                                      MetricsService metrics, int maxContexts) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.registry = new LruCache<>(maxContexts, pendingEvictions::put);
    }

    /**
     * Returns the engine of {@code ctx}, building it on first use.
     * Repeated calls with the same context return the same instance until it is disposed.
     *
     * @throws ValidationException if the settings cannot produce an engine
     * @throws ResourceException   if the engine factory fails
     */
    public GraphEngine acquireEngine(ExecutionContext ctx) {
        Objects.requireNonNull(ctx, "ctx is required");
        CachedEngineHandle handle;
        Map<ExecutionContext, CachedEngineHandle> evicted;
        lock.lock();
        try {
            handle = handleFor(ctx);
            evicted = drainEvictions();
        } finally {
            lock.unlock();
        }
        closeEvicted(evicted);
        return handle.engine();
    }

    /**
     * Returns the session factory of {@code ctx}, building the engine and the factory
     * on first use.
     *
     * @throws ValidationException if the settings cannot produce an engine
     * @throws ResourceException   if the engine factory fails
     */
    public SessionFactory acquireSessionFactory(ExecutionContext ctx) {
        Objects.requireNonNull(ctx, "ctx is required");
        CachedEngineHandle handle;
        Map<ExecutionContext, CachedEngineHandle> evicted;
        lock.lock();
        try {
            handle = handleFor(ctx);
            if (handle.sessionFactory() == null) {
                handle = handle.withSessionFactory(new SessionFactory(handle.engine(), metrics));
                registry.put(ctx, handle);
                log.debug("session_factory.created context={} connection={}", ctx, settings.getName());
            }
            evicted = drainEvictions();
        } finally {
            lock.unlock();
        }
        closeEvicted(evicted);
        return handle.sessionFactory();
    }

    /**
     * Runs {@code callback} in a transaction using the context's default isolation.
     *
     * @see #scopedTransaction(ExecutionContext, IsolationLevel, TransactionCallback)
     */
    public <T> T scopedTransaction(ExecutionContext ctx, TransactionCallback<T> callback) throws SQLException {
        return scopedTransaction(ctx, null, callback);
    }

    /**
     * Opens a session, runs {@code callback}, and commits if it returns normally. If the
     * callback or the commit throws, the transaction is rolled back and the original
     * exception is rethrown; a failing rollback is attached to it as suppressed.
     * The session's connection goes back to the pool in every case.
     *
     * @param isolation applied to the connection before the callback runs; null keeps the default
     * @throws SQLException      thrown by the callback or by the commit
     * @throws ResourceException if no session can be opened
     */
    public <T> T scopedTransaction(ExecutionContext ctx, IsolationLevel isolation,
                                   TransactionCallback<T> callback) throws SQLException {
        Objects.requireNonNull(callback, "callback is required");
        SessionFactory factory = acquireSessionFactory(ctx);
        String isolationName = isolation != null ? isolation.getSqlName() : null;

        try (LogContext lc = LogContext.forTransaction(ctx.getId(), settings.getName(), isolationName)) {
            GraphSession session = openSession(factory);
            long start = System.nanoTime();
            TransactionOutcome outcome = TransactionOutcome.ROLLED_BACK;
            try {
                if (isolation != null) {
                    session.getConnection().setTransactionIsolation(isolation.getJdbcLevel());
                }
                T result = callback.doInTransaction(session);
                session.commit();
                outcome = TransactionOutcome.COMMITTED;
                log.debug("transaction.committed durationMs={}", elapsedMillis(start));
                return result;
            } catch (Throwable t) {
                rollback(session, t);
                log.debug("transaction.rolled_back durationMs={} cause={}", elapsedMillis(start), t.toString());
                throw t;
            } finally {
                release(session);
                metrics.recordTransactionDuration(settings.getName(), outcome, Duration.ofNanos(System.nanoTime() - start));
            }
        }
    }

    /**
     * Runs {@link #scopedTransaction(ExecutionContext, IsolationLevel, TransactionCallback)}
     * on {@code executor}.
     *
     * <p>Cancelling the returned future before the callback has returned makes the transaction
     * roll back instead of committing; the session is released either way. A future cancelled
     * before the task starts never opens a session.</p>
     */
    public <T> CompletableFuture<T> scopedTransactionAsync(ExecutionContext ctx, IsolationLevel isolation,
                                                           TransactionCallback<T> callback, Executor executor) {
        Objects.requireNonNull(callback, "callback is required");
        CompletableFuture<T> future = new CompletableFuture<>();
        Runnable task = () -> {
            if (future.isCancelled()) {
                return;
            }
            try {
                T result = scopedTransaction(ctx, isolation, session -> {
                    T value = callback.doInTransaction(session);
                    if (future.isCancelled()) {
                        throw new CancellationException("Transaction cancelled before commit");
                    }
                    return value;
                });
                future.complete(result);
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        };
        try {
            executor.execute(task);
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Closes the engine of {@code ctx} and forgets it and its session factory.
     * Other contexts are not affected. Does nothing when {@code ctx} has no engine.
     *
     * @throws ResourceException if closing the engine fails; the context is forgotten anyway
     */
    public void dispose(ExecutionContext ctx) {
        Objects.requireNonNull(ctx, "ctx is required");
        CachedEngineHandle handle;
        lock.lock();
        try {
            handle = registry.peek(ctx);
            if (handle != null) {
                registry.clear((key, value) -> key.equals(ctx));
            }
        } finally {
            lock.unlock();
        }
        if (handle == null) {
            log.debug("engine.dispose_skipped context={} connection={}", ctx, settings.getName());
            return;
        }
        closeEngine(ctx, handle, REASON_DISPOSE);
    }

    /**
     * Disposes every context. Closing continues past failures; the first failure is thrown
     * with the others suppressed.
     *
     * @throws ResourceException if any engine failed to close
     */
    public void disposeAll() {
        Map<ExecutionContext, CachedEngineHandle> handles = new LinkedHashMap<>();
        lock.lock();
        try {
            for (ExecutionContext ctx : registry.keys()) {
                handles.put(ctx, registry.peek(ctx));
            }
            registry.clear();
        } finally {
            lock.unlock();
        }

        ResourceException failure = null;
        for (Map.Entry<ExecutionContext, CachedEngineHandle> entry : handles.entrySet()) {
            try {
                closeEngine(entry.getKey(), entry.getValue(), REASON_SHUTDOWN);
            } catch (ResourceException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Current lifecycle state of {@code ctx}. Does not affect eviction order.
     */
    public LifecycleState state(ExecutionContext ctx) {
        lock.lock();
        try {
            CachedEngineHandle handle = registry.peek(ctx);
            return handle != null ? handle.state() : LifecycleState.UNINITIALIZED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pool statistics of the engine of {@code ctx}, or empty when it has none.
     */
    public Optional<PoolStats> poolStats(ExecutionContext ctx) {
        CachedEngineHandle handle;
        lock.lock();
        try {
            handle = registry.peek(ctx);
        } finally {
            lock.unlock();
        }
        return handle != null ? Optional.of(handle.engine().getStats()) : Optional.empty();
    }

    /**
     * Contexts that currently own an engine, least recently used first.
     */
    public List<ExecutionContext> activeContexts() {
        lock.lock();
        try {
            return registry.keys();
        } finally {
            lock.unlock();
        }
    }

    public ConnectionSettings getSettings() {
        return settings;
    }

    public int getMaxContexts() {
        return registry.maxSize();
    }

    @Override
    public void close() {
        disposeAll();
    }

    // must hold lock
    private CachedEngineHandle handleFor(ExecutionContext ctx) {
        CachedEngineHandle handle = registry.get(ctx);
        if (handle != null && !handle.engine().isClosed()) {
            return handle;
        }
        if (handle != null) {
            log.warn("engine.closed_externally context={} connection={}", ctx, settings.getName());
        }
        handle = CachedEngineHandle.of(createEngine(ctx));
        registry.put(ctx, handle);
        return handle;
    }

    private GraphEngine createEngine(ExecutionContext ctx) {
        GraphEngine engine;
        try {
            engine = engineFactory.create(settings);
        } catch (ValidationException | ResourceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResourceException("Failed to create engine for connection '" + settings.getName() + "'", e);
        }
        try (LogContext lc = LogContext.forContext(ctx.getId(), settings.getName())) {
            log.info("engine.created context={} dsn={}", ctx, settings.getDsn().toSafeString());
        }
        metrics.incrementEngineCreated(settings.getName());
        return engine;
    }

    // must hold lock
    private Map<ExecutionContext, CachedEngineHandle> drainEvictions() {
        if (pendingEvictions.isEmpty()) {
            return Map.of();
        }
        Map<ExecutionContext, CachedEngineHandle> drained = new LinkedHashMap<>(pendingEvictions);
        pendingEvictions.clear();
        return drained;
    }

    private void closeEvicted(Map<ExecutionContext, CachedEngineHandle> evicted) {
        evicted.forEach((ctx, handle) -> {
            try {
                closeEngine(ctx, handle, REASON_EVICTED);
            } catch (ResourceException e) {
                log.warn("engine.evict_close_failed context={} connection={}: {}",
                        ctx, settings.getName(), e.getMessage(), e);
            }
        });
    }

    private void closeEngine(ExecutionContext ctx, CachedEngineHandle handle, String reason) {
        try (LogContext lc = LogContext.forContext(ctx.getId(), settings.getName()).with(LogContext.REASON, reason)) {
            try {
                handle.engine().close();
            } catch (RuntimeException e) {
                throw new ResourceException("Failed to close engine of context '" + ctx + "'", e);
            }
            log.info("engine.disposed context={} reason={}", ctx, reason);
            metrics.incrementEngineDisposed(settings.getName(), reason);
        }
    }

    private GraphSession openSession(SessionFactory factory) {
        try {
            return factory.openSession();
        } catch (SQLException | RuntimeException e) {
            throw new ResourceException("Failed to open session for connection '" + settings.getName() + "'", e);
        }
    }

    private static void rollback(GraphSession session, Throwable cause) {
        try {
            session.rollback();
        } catch (SQLException | RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private static void release(GraphSession session) {
        try {
            session.close();
        } catch (SQLException e) {
            log.warn("session.close_failed: {}", e.getMessage(), e);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @Override
    public String toString() {
        return "ConnectionLifecycleManager{connection='" + settings.getName() + "', contexts=" + activeContexts().size() + '}';
    }
}
