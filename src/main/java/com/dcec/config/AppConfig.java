package com.dcec.config;

import com.dcec.cache.CacheManager;
import com.dcec.namespace.Namespace;
import com.dcec.parsing.DcecParser;
import com.dcec.reasoning.ExternalProverAdapter;
import com.dcec.reasoning.ExternalProverStrategy;
import com.dcec.reasoning.ForwardChainingStrategy;
import com.dcec.reasoning.ProverStrategy;
import com.dcec.reasoning.TheoremProver;
import com.dcec.reasoning.rules.InferenceRuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Composition root: every shared engine object is created here once and
 * handed to its users.
 */
@Configuration
public class AppConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public Namespace namespace() {
        return Namespace.seeded();
    }

    @Bean(destroyMethod = "close")
    public CacheManager cacheManager(DcecProperties properties) {
        return new CacheManager(properties.getProofCacheSize(), properties.getParseCacheSize(),
                properties.getCacheTtl());
    }

    @Bean
    public InferenceRuleRegistry inferenceRuleRegistry(DcecProperties properties) {
        return InferenceRuleRegistry.create(properties.isModalRulesEnabled());
    }

    @Bean
    public ProverStrategy proverStrategy(DcecProperties properties, InferenceRuleRegistry registry,
                                         ObjectProvider<ExternalProverAdapter> adapters) {
        ForwardChainingStrategy forwardChaining = new ForwardChainingStrategy(registry, properties.getMaxPasses());
        String strategy = properties.getStrategy();
        if (DcecProperties.FORWARD_CHAINING.equals(strategy)) {
            return forwardChaining;
        }
        if (DcecProperties.EXTERNAL.equals(strategy)) {
            ExternalProverAdapter adapter = adapters.getIfAvailable();
            if (adapter == null) {
                LOGGER.warn("Strategy 'external' requested but no ExternalProverAdapter bean exists, " +
                        "using forward chaining");
                return forwardChaining;
            }
            return new ExternalProverStrategy(adapter, forwardChaining);
        }
        throw new IllegalArgumentException("Unknown prover strategy: " + strategy);
    }

    @Bean(destroyMethod = "close")
    public TheoremProver theoremProver(ProverStrategy strategy, CacheManager cacheManager,
                                       DcecProperties properties) {
        LOGGER.info("Theorem prover using strategy {} with default timeout {} ms",
                strategy.getName(), properties.getProverTimeoutMs());
        return new TheoremProver(strategy, cacheManager.getProofCache(), properties.getProverTimeout());
    }

    @Bean
    public DcecParser dcecParser(Namespace namespace, CacheManager cacheManager) {
        return new DcecParser(namespace, cacheManager);
    }
}
