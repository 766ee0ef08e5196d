package com.age.mcp.cache;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;

/**
 * Fixed-capacity key/value store with least-recently-used eviction.
 *
 * <p>Both {@link #get(Object)} and {@link #put(Object, Object)} mark an entry as
 * most recently used. Inserting a new key into a full cache evicts exactly one entry,
 * the least recently touched one, before the insert. The cache never holds more than
 * {@code maxSize} entries.</p>
 *
 * <p>This class is not synchronized. Callers sharing an instance between threads
 * must guard every call with their own lock:</p>
 * <pre>
 * lock.lock();
 * try {
 *     cache.put(key, value);
 * } finally {
 *     lock.unlock();
 * }
 * </pre>
 *
 * @param <K> key type, must implement {@code equals}/{@code hashCode}
 * @param <V> value type
 */
public class LruCache<K, V> {

    /** Capacity used by the no-arg constructor. */
    public static final int DEFAULT_MAX_SIZE = 100;

    private final int maxSize;
    private final BiConsumer<K, V> evictionListener;
    // insertion-ordered; a hit is moved to the tail by re-inserting it
    private final LinkedHashMap<K, V> entries = new LinkedHashMap<>();

    public LruCache() {
        this(DEFAULT_MAX_SIZE);
    }

    public LruCache(int maxSize) {
        this(maxSize, null);
    }

    /**
     * Creates a cache that reports capacity evictions.
     *
     * @param maxSize          maximum number of entries, must be &gt; 0
     * @param evictionListener called with each entry dropped to make room for a new key;
     *                         not called for replacements or {@link #clear} removals. May be null.
     */
    public LruCache(int maxSize, BiConsumer<K, V> evictionListener) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.maxSize = maxSize;
        this.evictionListener = evictionListener;
    }

    /**
     * Returns the value for {@code key} and marks it most recently used.
     *
     * @return the cached value, or null on a miss
     */
    public V get(K key) {
        if (!entries.containsKey(key)) {
            return null;
        }
        V value = entries.remove(key);
        entries.put(key, value);
        return value;
    }

    /**
     * Returns the value for {@code key} without changing its recency.
     */
    public V peek(K key) {
        return entries.get(key);
    }

    /**
     * Inserts or replaces the value for {@code key}.
     * A replaced key starts over as the most recently used entry.
     */
    public void put(K key, V value) {
        if (entries.containsKey(key)) {
            entries.remove(key);
        } else if (entries.size() >= maxSize) {
            evictEldest();
        }
        entries.put(key, value);
    }

    /**
     * Removes every entry.
     */
    public void clear() {
        clear(null);
    }

    /**
     * Removes the entries matching {@code filter}, or every entry when it is null.
     * Surviving entries keep their relative recency order.
     */
    public void clear(BiPredicate<? super K, ? super V> filter) {
        if (filter == null) {
            entries.clear();
            return;
        }
        entries.entrySet().removeIf(e -> filter.test(e.getKey(), e.getValue()));
    }

    public int size() {
        return entries.size();
    }

    public int maxSize() {
        return maxSize;
    }

    /**
     * Snapshot of the keys from least to most recently used.
     */
    public List<K> keys() {
        return new ArrayList<>(entries.keySet());
    }

    private void evictEldest() {
        Iterator<Map.Entry<K, V>> it = entries.entrySet().iterator();
        if (!it.hasNext()) {
            return;
        }
        Map.Entry<K, V> eldest = it.next();
        it.remove();
        if (evictionListener != null) {
            evictionListener.accept(eldest.getKey(), eldest.getValue());
        }
    }
}
