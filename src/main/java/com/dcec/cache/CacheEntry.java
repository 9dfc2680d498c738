package com.dcec.cache;

import java.time.Instant;

/**
 * A cached value with its bookkeeping. Mutated only under the owning cache's lock.
 */
public class CacheEntry<K, V> {
    private final K key;
    private final V value;
    private final Instant createdAt;
    private Instant lastAccessedAt;
    private long accessCount;

    CacheEntry(K key, V value, Instant createdAt) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.lastAccessedAt = createdAt;
    }

    private CacheEntry(CacheEntry<K, V> other) {
        this.key = other.key;
        this.value = other.value;
        this.createdAt = other.createdAt;
        this.lastAccessedAt = other.lastAccessedAt;
        this.accessCount = other.accessCount;
    }

    void recordAccess(Instant now) {
        lastAccessedAt = now;
        accessCount++;
    }

    CacheEntry<K, V> copy() {
        return new CacheEntry<>(this);
    }

    public K getKey() { return key; }
    public V getValue() { return value; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastAccessedAt() { return lastAccessedAt; }
    public long getAccessCount() { return accessCount; }

    @Override
    public String toString() {
        return "CacheEntry{" +
                "key=" + key +
                ", createdAt=" + createdAt +
                ", lastAccessedAt=" + lastAccessedAt +
                ", accessCount=" + accessCount +
                '}';
    }
}
