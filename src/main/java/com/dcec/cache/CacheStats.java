package com.dcec.cache;

/**
 * Point-in-time counters of one cache.
 */
public class CacheStats {
    private final String name;
    private final long hits;
    private final long misses;
    private final long evictions;
    private final long expirations;
    private final int size;
    private final int maxSize;

    public CacheStats(String name, long hits, long misses, long evictions, long expirations, int size, int maxSize) {
        this.name = name;
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.expirations = expirations;
        this.size = size;
        this.maxSize = maxSize;
    }

    public String getName() { return name; }
    public long getHits() { return hits; }
    public long getMisses() { return misses; }
    public long getEvictions() { return evictions; }
    public long getExpirations() { return expirations; }
    public int getSize() { return size; }

    /**
     * Capacity, or -1 for unbounded caches.
     */
    public int getMaxSize() { return maxSize; }

    public long getRequests() {
        return hits + misses;
    }

    public double getHitRate() {
        long requests = getRequests();
        return requests == 0 ? 0.0 : (double) hits / requests;
    }

    @Override
    public String toString() {
        return String.format("CacheStats{name=%s, hits=%d, misses=%d, hitRate=%.2f, evictions=%d, expirations=%d, size=%d/%d}",
                name, hits, misses, getHitRate(), evictions, expirations, size, maxSize);
    }
}
