package com.chunkforge.engine.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Prompt cache settings, bound from {@code chunkforge.cache.*}.
 *
 * <pre>
 * chunkforge:
 *   cache:
 *     enabled: true
 *     max-entries: 100
 *     max-tokens-per-entry: 8192
 *     max-total-tokens: 500000
 *     ttl: 30m
 *     min-reuse-threshold: 0.5
 *     sweep-interval: 5m
 *     hard-limit: 1000
 *     assumed-tokens-per-second: 30
 * </pre>
 *
 * @param maxEntries             entry count that triggers score-based eviction
 * @param maxTokensPerEntry      contexts above this estimate are never cached
 * @param maxTotalTokens         ceiling on the summed token estimate of all entries
 * @param ttl                    age after which an entry no longer produces hits
 * @param minReuseThreshold      fraction of a cached entry a prefix match must cover
 * @param sweepInterval          period of the background purge of expired entries
 * @param hardLimit              absolute entry cap; least recently used entries fall out first
 * @param assumedTokensPerSecond generation speed used to estimate time saved by a hit
 */
@Validated
@ConfigurationProperties(prefix = "chunkforge.cache")
public record PromptCacheProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("100") @Min(1) int maxEntries,
        @DefaultValue("8192") @Min(1) int maxTokensPerEntry,
        @DefaultValue("500000") @Min(1) long maxTotalTokens,
        @DefaultValue("30m") @NotNull Duration ttl,
        @DefaultValue("0.5") @DecimalMin("0.0") @DecimalMax("1.0") double minReuseThreshold,
        @DefaultValue("5m") @NotNull Duration sweepInterval,
        @DefaultValue("1000") @Min(1) int hardLimit,
        @DefaultValue("30") @DecimalMin("0.1") double assumedTokensPerSecond) {

    // Bean validation has no positive-Duration constraint; the sweep schedule rejects zero periods.
    public PromptCacheProperties {
        requirePositive("ttl", ttl);
        requirePositive("sweepInterval", sweepInterval);
    }

    public static PromptCacheProperties defaults() {
        return new PromptCacheProperties(true, 100, 8192, 500_000, Duration.ofMinutes(30),
                0.5, Duration.ofMinutes(5), 1000, 30);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException("chunkforge.cache." + name + " must be a positive duration, got " + value);
        }
    }
}
