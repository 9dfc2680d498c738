package com.dcec.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns the caches of one engine instance. Created by the composition root
 * and passed to the components that use it.
 */
public class CacheManager implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(CacheManager.class);

    private final FormulaInterner interner;
    private final ProofCache proofCache;
    private final ParseCache parseCache;
    private volatile boolean closed;

    public CacheManager(int proofCacheSize, int parseCacheSize, Duration ttl) {
        this.interner = new FormulaInterner();
        this.proofCache = new ProofCache(proofCacheSize, ttl);
        this.parseCache = new ParseCache(parseCacheSize, ttl);
        LOGGER.info("CacheManager initialized: proofCacheSize={}, parseCacheSize={}, ttl={}",
                proofCacheSize, parseCacheSize, ttl);
    }

    public FormulaInterner getInterner() { return interner; }
    public ProofCache getProofCache() { return proofCache; }
    public ParseCache getParseCache() { return parseCache; }

    public Map<String, CacheStats> getStats() {
        Map<String, CacheStats> stats = new LinkedHashMap<>();
        stats.put("interner", interner.getStats());
        stats.put("proof", proofCache.getStats());
        stats.put("parse", parseCache.getStats());
        return stats;
    }

    public void clearAll() {
        interner.clear();
        proofCache.clear();
        parseCache.clear();
        LOGGER.info("All caches cleared");
    }

    public void logStats() {
        getStats().values().forEach(stats -> LOGGER.info("{}", stats));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logStats();
        clearAll();
    }
}
