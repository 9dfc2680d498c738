package com.dcec.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Caches the results of a loader function in an {@link LruCache}. Entries
 * older than the time-to-live count as misses and are recomputed. Loading
 * happens outside the cache lock, so two threads missing on the same key may
 * both compute it.
 */
public class Memoizer<K, V> {
    private final LruCache<K, V> cache;
    private final Function<? super K, ? extends V> loader;
    private final Predicate<? super V> cacheable;

    public Memoizer(String name, int maxSize, Duration ttl, Function<? super K, ? extends V> loader) {
        this(new LruCache<>(name, maxSize, ttl), loader, value -> true);
    }

    public Memoizer(String name, int maxSize, Duration ttl, Clock clock, Function<? super K, ? extends V> loader) {
        this(new LruCache<>(name, maxSize, ttl, clock), loader, value -> true);
    }

    /**
     * @param cacheable results failing this test are returned but not stored
     */
    public Memoizer(LruCache<K, V> cache, Function<? super K, ? extends V> loader, Predicate<? super V> cacheable) {
        this.cache = cache;
        this.loader = loader;
        this.cacheable = cacheable;
    }

    public V get(K key) {
        return get(key, loader);
    }

    /**
     * Look up {@code key}, computing it with {@code keyLoader} on a miss. A
     * null result is returned and not cached.
     */
    public V get(K key, Function<? super K, ? extends V> keyLoader) {
        return cache.get(key).orElseGet(() -> {
            V value = keyLoader.apply(key);
            if (value != null && cacheable.test(value)) {
                cache.put(key, value);
            }
            return value;
        });
    }

    public void invalidate(K key) {
        cache.remove(key);
    }

    public void clear() {
        cache.clear();
    }

    public LruCache<K, V> getCache() {
        return cache;
    }

    public CacheStats getStats() {
        return cache.getStats();
    }
}
