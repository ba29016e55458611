package com.phillippitts.truthtell.service.cache;

import com.phillippitts.truthtell.exception.CacheException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide namespaced key/value store with per-entry TTL.
 *
 * <p><b>Expiry:</b> reads are lazily expiring: a {@link #get} that finds an entry older than
 * its TTL removes it and reports a miss, so stale values are never returned even between
 * sweeps. {@link #sweep()} removes every expired entry in every namespace and is run on a
 * fixed schedule by {@link CacheSweeper}, which bounds memory for keys that are never read again.
 *
 * <p><b>Namespaces</b> are fixed at construction; operations on any other namespace throw
 * {@link CacheException}.
 *
 * <p><b>Thread Safety:</b> all operations are thread-safe. Each namespace is backed by a
 * {@link ConcurrentHashMap}; expiry removal uses {@code remove(key, entry)} so a concurrent
 * re-write of the same key is never removed by a stale read.
 */
public final class ExpiringCache {

    private static final Logger LOG = LogManager.getLogger(ExpiringCache.class);

    private final Map<CacheNamespace, ConcurrentMap<String, CacheEntry>> stores;
    private final Clock clock;

    public ExpiringCache(Clock clock) {
        this(clock, EnumSet.allOf(CacheNamespace.class));
    }

    public ExpiringCache(Clock clock, Set<CacheNamespace> namespaces) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(namespaces, "namespaces must not be null");
        if (namespaces.isEmpty()) {
            throw new IllegalArgumentException("at least one namespace is required");
        }
        Map<CacheNamespace, ConcurrentMap<String, CacheEntry>> map = new EnumMap<>(CacheNamespace.class);
        for (CacheNamespace namespace : namespaces) {
            map.put(namespace, new ConcurrentHashMap<>());
        }
        this.stores = Collections.unmodifiableMap(map);
    }

    /**
     * Returns the live value for a key, or empty on miss. An expired entry is removed as
     * a side effect and reported as a miss.
     *
     * @param namespace cache namespace
     * @param key entry key
     * @param type expected value type
     * @return cached value, or empty if absent or expired
     * @throws CacheException if the namespace is unknown, the key is null,
     *         or the stored value is not of {@code type}
     */
    public <T> Optional<T> get(CacheNamespace namespace, String key, Class<T> type) {
        ConcurrentMap<String, CacheEntry> store = store(namespace);
        CacheEntry entry = store.get(requireKey(namespace, key));
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            store.remove(key, entry);
            LOG.debug("Expired entry removed on read (namespace={}, ttl={})", namespace, entry.ttl());
            return Optional.empty();
        }
        if (!type.isInstance(entry.value())) {
            throw new CacheException("Cached value is not a " + type.getSimpleName(), namespace);
        }
        return Optional.of(type.cast(entry.value()));
    }

    /**
     * Stores a value, replacing any previous entry for the key.
     *
     * @param ttl time-to-live, must be positive
     */
    public void set(CacheNamespace namespace, String key, Object value, Duration ttl) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        store(namespace).put(requireKey(namespace, key), new CacheEntry(value, clock.instant(), ttl));
    }

    /**
     * Removes an entry.
     *
     * @return {@code true} if an entry was present
     */
    public boolean delete(CacheNamespace namespace, String key) {
        return store(namespace).remove(requireKey(namespace, key)) != null;
    }

    /**
     * Removes every expired entry across all namespaces.
     *
     * @return number of entries removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (ConcurrentMap<String, CacheEntry> store : stores.values()) {
            for (Map.Entry<String, CacheEntry> entry : store.entrySet()) {
                if (entry.getValue().isExpired(now) && store.remove(entry.getKey(), entry.getValue())) {
                    removed++;
                }
            }
        }
        return removed;
    }

    /**
     * Number of stored entries in a namespace, including expired entries not yet swept.
     */
    public int size(CacheNamespace namespace) {
        return store(namespace).size();
    }

    /**
     * Entry counts per namespace, in namespace declaration order.
     */
    public Map<CacheNamespace, Integer> sizes() {
        Map<CacheNamespace, Integer> sizes = new EnumMap<>(CacheNamespace.class);
        stores.forEach((namespace, store) -> sizes.put(namespace, store.size()));
        return sizes;
    }

    /**
     * Removes all entries from all namespaces.
     */
    public void clear() {
        stores.values().forEach(Map::clear);
    }

    public Set<CacheNamespace> namespaces() {
        return stores.keySet();
    }

    private ConcurrentMap<String, CacheEntry> store(CacheNamespace namespace) {
        ConcurrentMap<String, CacheEntry> store = namespace == null ? null : stores.get(namespace);
        if (store == null) {
            throw new CacheException("Unknown cache namespace", namespace);
        }
        return store;
    }

    private static String requireKey(CacheNamespace namespace, String key) {
        if (key == null) {
            throw new CacheException("Cache key must not be null", namespace);
        }
        return key;
    }
}
