package com.dcec.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded map that evicts its least recently used entry when full. Both
 * {@link #get} and {@link #put} count as a use. An optional time-to-live
 * turns entries older than it into misses. All operations synchronize on the
 * cache instance. An unordered index beside the access-ordered map serves
 * reads that must not count as a use.
 */
public class LruCache<K, V> {

    private static final Logger LOGGER = LoggerFactory.getLogger(LruCache.class);

    private final String name;
    private final int maxSize;
    private final Duration ttl;
    private final Clock clock;
    private final LinkedHashMap<K, CacheEntry<K, V>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final Map<K, CacheEntry<K, V>> index = new HashMap<>();

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public LruCache(String name, int maxSize) {
        this(name, maxSize, null, Clock.systemUTC());
    }

    public LruCache(String name, int maxSize, Duration ttl) {
        this(name, maxSize, ttl, Clock.systemUTC());
    }

    /**
     * @param ttl entry lifetime; null or zero disables expiry
     */
    public LruCache(String name, int maxSize, Duration ttl, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
        }
        this.name = name;
        this.maxSize = maxSize;
        this.ttl = ttl == null || ttl.isZero() || ttl.isNegative() ? null : ttl;
        this.clock = clock;
    }

    public synchronized Optional<V> get(K key) {
        CacheEntry<K, V> entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (isExpired(entry, now)) {
            entries.remove(key);
            index.remove(key);
            expirations++;
            misses++;
            LOGGER.debug("Cache {} entry expired: {}", name, key);
            return Optional.empty();
        }
        entry.recordAccess(now);
        hits++;
        return Optional.of(entry.getValue());
    }

    public synchronized void put(K key, V value) {
        if (!index.containsKey(key) && entries.size() >= maxSize) {
            evictEldest();
        }
        CacheEntry<K, V> entry = new CacheEntry<>(key, value, clock.instant());
        entries.put(key, entry);
        index.put(key, entry);
    }

    private void evictEldest() {
        Iterator<Map.Entry<K, CacheEntry<K, V>>> iterator = entries.entrySet().iterator();
        if (iterator.hasNext()) {
            K evicted = iterator.next().getKey();
            iterator.remove();
            index.remove(evicted);
            evictions++;
            LOGGER.debug("Cache {} evicted least recently used entry {}", name, evicted);
        }
    }

    private boolean isExpired(CacheEntry<K, V> entry, Instant now) {
        return ttl != null && entry.getCreatedAt().plus(ttl).compareTo(now) <= 0;
    }

    /**
     * Presence check that leaves recency and counters untouched.
     */
    public synchronized boolean containsKey(K key) {
        CacheEntry<K, V> entry = index.get(key);
        return entry != null && !isExpired(entry, clock.instant());
    }

    /**
     * A copy of the entry for {@code key}, read without counting a use.
     */
    public synchronized Optional<CacheEntry<K, V>> getEntry(K key) {
        CacheEntry<K, V> entry = index.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.copy());
    }

    public synchronized boolean remove(K key) {
        index.remove(key);
        return entries.remove(key) != null;
    }

    public synchronized void clear() {
        entries.clear();
        index.clear();
    }

    public synchronized void resetStats() {
        hits = 0;
        misses = 0;
        evictions = 0;
        expirations = 0;
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Keys from least to most recently used.
     */
    public synchronized List<K> keys() {
        return new ArrayList<>(entries.keySet());
    }

    /**
     * Copies of the entries from least to most recently used.
     */
    public synchronized List<CacheEntry<K, V>> snapshot() {
        List<CacheEntry<K, V>> copies = new ArrayList<>(entries.size());
        for (CacheEntry<K, V> entry : entries.values()) {
            copies.add(entry.copy());
        }
        return copies;
    }

    public String getName() { return name; }
    public int getMaxSize() { return maxSize; }

    public synchronized CacheStats getStats() {
        return new CacheStats(name, hits, misses, evictions, expirations, entries.size(), maxSize);
    }
}
