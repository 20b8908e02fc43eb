package com.meteocache.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process key/value cache whose TTL is supplied on each read rather than bound to the entry.
 *
 * <p>
 * The same stored entry can therefore be read under different effective TTLs. Stale entries
 * are evicted lazily on read or by {@link #sweep(Duration)}. There is no size bound.
 *
 * <p>
 * A single lock guards the whole map.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class TtlCache<K, V> {

    private final Map<K, Entry<V>> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public TtlCache() {
        this(Clock.systemUTC());
    }

    public TtlCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * Gets a value if it was stored less than {@code ttl} ago.
     * A stale entry is removed and empty is returned.
     *
     * @param key the cache key
     * @param ttl maximum age accepted by this read
     * @return the value if present and fresh
     */
    public Optional<V> get(K key, Duration ttl) {
        lock.lock();
        try {
            Entry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isFresh(clock.instant(), ttl)) {
                return Optional.of(entry.value);
            }
            entries.remove(key);
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a value stamped with the current time, replacing any previous entry.
     *
     * @throws NullPointerException if {@code value} is null
     */
    public void set(K key, V value) {
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            entries.put(key, new Entry<>(value, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of stored entries, including expired ones not yet swept.
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry older than {@code ttl}.
     *
     * @return number of entries evicted
     */
    public int sweep(Duration ttl) {
        lock.lock();
        try {
            Instant now = clock.instant();
            int evicted = 0;
            Iterator<Entry<V>> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                if (!iterator.next().isFresh(now, ttl)) {
                    iterator.remove();
                    evicted++;
                }
            }
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    private static final class Entry<V> {
        private final V value;
        private final Instant storedAt;

        private Entry(V value, Instant storedAt) {
            this.value = value;
            this.storedAt = storedAt;
        }

        private boolean isFresh(Instant now, Duration ttl) {
            return Duration.between(storedAt, now).compareTo(ttl) < 0;
        }
    }
}
