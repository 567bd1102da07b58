package minis.db;

import minis.utils.Time;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * String key-value store with per-key expiry. Keys are compared as Java strings;
 * the command layer builds them one char per byte so binary keys stay distinct.
 * <p>
 * A single read/write lock guards the whole map: reads share the read lock,
 * writes and evictions take the write lock. Expired entries are removed lazily
 * by {@link #get(String)}; there is no background sweep.
 */
public class MinisDatabase {
    private final Map<String, ValueEntry> store = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Time.Clock clock;

    public MinisDatabase() {
        this(Time.SYSTEM_CLOCK);
    }

    public MinisDatabase(Time.Clock clock) {
        this.clock = clock;
    }

    /** Stores a value that never expires. */
    public void set(String key, byte[] value) {
        set(key, value, -1);
    }

    /**
     * Stores a value, replacing any previous entry and its expiry.
     *
     * @param ttlMillis relative time to live; negative means no expiry, 0 expires immediately
     */
    public void set(String key, byte[] value, long ttlMillis) {
        long expireAt = ValueEntry.NO_EXPIRY;
        if (ttlMillis >= 0) {
            long now = clock.currentTimeMillis();
            expireAt = ttlMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis;
        }
        ValueEntry entry = new ValueEntry(value, expireAt);

        lock.writeLock().lock();
        try {
            store.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the live entry for the key, or {@code null} if it is absent or expired.
     * An expired entry is removed as a side effect.
     */
    public ValueEntry get(String key) {
        ValueEntry entry;
        lock.readLock().lock();
        try {
            entry = store.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (entry == null) return null;
        if (!entry.isExpired(clock.currentTimeMillis())) return entry;

        lock.writeLock().lock();
        try {
            // Only drop the entry we saw; a concurrent SET may have replaced it
            store.remove(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
        return null;
    }

    /** Convenience for {@link #get(String)} returning just the value bytes. */
    public byte[] getValue(String key) {
        ValueEntry entry = get(key);
        return entry == null ? null : entry.getValue();
    }

    /** Raw entry count, including expired entries that have not been read yet. */
    public int size() {
        lock.readLock().lock();
        try {
            return store.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            store.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
