package com.dcec.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for parsing, proving and batch runs
 */
@ConfigurationProperties(prefix = "dcec")
public class DcecProperties {

    public static final String FORWARD_CHAINING = "forward-chaining";
    public static final String EXTERNAL = "external";

    private long proverTimeoutMs = 5000;
    private int maxPasses = 100;
    private boolean modalRulesEnabled = false;
    private String strategy = FORWARD_CHAINING;
    private int proofCacheSize = 256;
    private int parseCacheSize = 512;
    private long cacheTtlSeconds = 0;
    private String problemsDirectory = "./problems";
    private String outputDirectory = "./output";
    private boolean enableDetailedLogging = false;

    // Getters and setters
    public long getProverTimeoutMs() { return proverTimeoutMs; }
    public void setProverTimeoutMs(long proverTimeoutMs) { this.proverTimeoutMs = proverTimeoutMs; }

    public int getMaxPasses() { return maxPasses; }
    public void setMaxPasses(int maxPasses) { this.maxPasses = maxPasses; }

    public boolean isModalRulesEnabled() { return modalRulesEnabled; }
    public void setModalRulesEnabled(boolean modalRulesEnabled) { this.modalRulesEnabled = modalRulesEnabled; }

    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    public int getProofCacheSize() { return proofCacheSize; }
    public void setProofCacheSize(int proofCacheSize) { this.proofCacheSize = proofCacheSize; }

    public int getParseCacheSize() { return parseCacheSize; }
    public void setParseCacheSize(int parseCacheSize) { this.parseCacheSize = parseCacheSize; }

    public long getCacheTtlSeconds() { return cacheTtlSeconds; }
    public void setCacheTtlSeconds(long cacheTtlSeconds) { this.cacheTtlSeconds = cacheTtlSeconds; }

    public String getProblemsDirectory() { return problemsDirectory; }
    public void setProblemsDirectory(String problemsDirectory) { this.problemsDirectory = problemsDirectory; }

    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }

    public boolean isEnableDetailedLogging() { return enableDetailedLogging; }
    public void setEnableDetailedLogging(boolean enableDetailedLogging) {
        this.enableDetailedLogging = enableDetailedLogging;
    }

    public Duration getProverTimeout() {
        return Duration.ofMillis(proverTimeoutMs);
    }

    /**
     * Zero means cache entries never expire
     */
    public Duration getCacheTtl() {
        return Duration.ofSeconds(cacheTtlSeconds);
    }

    @Override
    public String toString() {
        return "DcecProperties{" +
                "proverTimeoutMs=" + proverTimeoutMs +
                ", maxPasses=" + maxPasses +
                ", modalRulesEnabled=" + modalRulesEnabled +
                ", strategy='" + strategy + '\'' +
                ", proofCacheSize=" + proofCacheSize +
                ", parseCacheSize=" + parseCacheSize +
                ", cacheTtlSeconds=" + cacheTtlSeconds +
                ", problemsDirectory='" + problemsDirectory + '\'' +
                ", outputDirectory='" + outputDirectory + '\'' +
                ", enableDetailedLogging=" + enableDetailedLogging +
                '}';
    }
}
