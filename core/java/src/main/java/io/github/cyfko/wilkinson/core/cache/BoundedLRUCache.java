package io.github.cyfko.wilkinson.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Thread-safe bounded cache evicting the least recently used entry once full.
 * <p>
 * Entries live in an access-ordered {@link LinkedHashMap}. Because a lookup reorders the map,
 * lookups take the write lock; pure queries ({@link #size()}, {@link #containsKey(Object)})
 * share the read lock. Hit and miss counters are kept for {@code getCacheStats()}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BoundedLRUCache<String, FormulaMetaData> cache = new BoundedLRUCache<>(1000);
 * FormulaMetaData meta = cache.computeIfAbsent("y ~ x", builder::build);
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> entries;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Creates a bounded LRU cache.
     *
     * @param maxSize the maximum number of entries to store
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLRUCache.this.maxSize;
            }
        };
    }

    /**
     * Looks up a value and marks it most recently used.
     *
     * @param key the key to look up
     * @return the cached value, or null if not present
     */
    public V get(K key) {
        lock.writeLock().lock();
        try {
            V value = entries.get(key);
            (value == null ? misses : hits).incrementAndGet();
            return value;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores a value, evicting the least recently used entry when over capacity.
     *
     * @param key   the key to store
     * @param value the value to store
     */
    public void put(K key, V value) {
        lock.writeLock().lock();
        try {
            entries.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the cached value or computes, stores and returns it.
     * <p>
     * The mapping function runs outside the lock: two threads missing on the same key may both
     * compute it, and the last one stored wins. Exceptions from the function propagate and
     * nothing is cached. Null results are not cached.
     * </p>
     *
     * @param key             the key to compute for
     * @param mappingFunction the function to compute the value
     * @return the cached or newly computed value
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        V value = get(key);
        if (value != null) {
            return value;
        }
        value = mappingFunction.apply(key);
        if (value != null) {
            put(key, value);
        }
        return value;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsKey(K key) {
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes all entries and resets the hit and miss counters.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            hits.set(0);
            misses.set(0);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int maxSize() {
        return maxSize;
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }
}
