package com.dcec.cache;

import com.dcec.parsing.ParsedFormula;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Parse results keyed by source text and input language. Failed parses are
 * not cached.
 */
public class ParseCache {
    private final Memoizer<String, ParsedFormula> memoizer;

    public ParseCache(int maxSize, Duration ttl) {
        this.memoizer = new Memoizer<>(new LruCache<>("parse-cache", maxSize, ttl), key -> null, value -> true);
    }

    public static String key(String text, String language) {
        return CacheKeys.sha256(Arrays.asList(language, text));
    }

    public Optional<ParsedFormula> getOrParse(String text, String language, Supplier<ParsedFormula> parser) {
        return Optional.ofNullable(memoizer.get(key(text, language), k -> parser.get()));
    }

    public void clear() {
        memoizer.clear();
    }

    public int size() {
        return memoizer.getCache().size();
    }

    public CacheStats getStats() {
        return memoizer.getStats();
    }
}
