package com.dcec.cache;

import com.dcec.formula.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps structurally equal formulas to one shared instance.
 */
public class FormulaInterner {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaInterner.class);

    private final ConcurrentMap<Formula, Formula> pool = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public Formula intern(Formula formula) {
        Formula canonical = pool.putIfAbsent(formula, formula);
        if (canonical == null) {
            misses.incrementAndGet();
            LOGGER.trace("Interned new formula {}", formula);
            return formula;
        }
        hits.incrementAndGet();
        return canonical;
    }

    public int size() {
        return pool.size();
    }

    public void clear() {
        pool.clear();
    }

    public CacheStats getStats() {
        return new CacheStats("formula-interner", hits.get(), misses.get(), 0, 0, pool.size(), -1);
    }
}
