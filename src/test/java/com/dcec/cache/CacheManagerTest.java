package com.dcec.cache;

import com.dcec.formula.AtomicFormula;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CacheManagerTest {

    @Test
    @DisplayName("should report stats for every cache it owns")
    void stats() {
        CacheManager manager = new CacheManager(10, 20, Duration.ofMinutes(1));

        assertThat(manager.getStats()).containsOnlyKeys("interner", "proof", "parse");
        assertThat(manager.getStats().get("proof").getMaxSize()).isEqualTo(10);
        assertThat(manager.getStats().get("parse").getMaxSize()).isEqualTo(20);
    }

    @Test
    @DisplayName("close should clear the caches once and be safe to repeat")
    void close() {
        CacheManager manager = new CacheManager(10, 10, Duration.ZERO);
        manager.getInterner().intern(AtomicFormula.proposition("P"));

        manager.close();
        manager.close();

        assertThat(manager.isClosed()).isTrue();
        assertThat(manager.getInterner().size()).isZero();
    }

    @Test
    @DisplayName("the parse cache key should depend on the language")
    void parseKeyIncludesLanguage() {
        assertThat(ParseCache.key("P", "dcec")).isNotEqualTo(ParseCache.key("P", "other"));
    }
}
