package com.bastion.enrichment;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for IP reputation analysis and external feed lookups.
 *
 * Tracks:
 * - Verdict cache hit rate
 * - Feed calls, failures and rate-limit rejections per source
 * - Verdict latency
 */
@Component
public class EnrichmentMetrics {

    private final MeterRegistry registry;
    private final Counter verdictCacheHits;
    private final Counter verdictCacheMisses;
    private final Counter feedCacheHits;
    private final Timer verdictLatency;

    public EnrichmentMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.verdictCacheHits = Counter.builder("bastion.enrichment.verdict.cache.hits")
            .description("Reputation verdicts served from cache")
            .tag("component", "enrichment")
            .register(registry);

        this.verdictCacheMisses = Counter.builder("bastion.enrichment.verdict.cache.misses")
            .description("Reputation verdicts computed from indicators and feeds")
            .tag("component", "enrichment")
            .register(registry);

        this.feedCacheHits = Counter.builder("bastion.enrichment.feed.cache.hits")
            .description("Feed lookups answered from the feed cache")
            .tag("component", "enrichment")
            .register(registry);

        this.verdictLatency = Timer.builder("bastion.enrichment.verdict.latency")
            .description("Latency of uncached reputation verdicts")
            .tag("component", "enrichment")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    public void recordVerdictCacheHit() {
        verdictCacheHits.increment();
    }

    public void recordVerdictCacheMiss() {
        verdictCacheMisses.increment();
    }

    public void recordFeedCacheHit() {
        feedCacheHits.increment();
    }

    /**
     * Record a lookup sent to an external feed.
     */
    public void recordFeedCall(String source) {
        feedCounter("bastion.enrichment.feed.calls", "Lookups sent to an external feed", source).increment();
    }

    /**
     * Record a feed lookup that failed or timed out.
     */
    public void recordFeedError(String source) {
        feedCounter("bastion.enrichment.feed.errors", "Failed or timed-out feed lookups", source).increment();
    }

    /**
     * Record a lookup skipped because the feed's request budget was exhausted.
     */
    public void recordFeedRateLimited(String source) {
        feedCounter("bastion.enrichment.feed.rate_limited", "Feed lookups rejected by the rate limiter", source).increment();
    }

    public void recordVerdictLatency(long durationMs) {
        verdictLatency.record(durationMs, TimeUnit.MILLISECONDS);
    }

    private Counter feedCounter(String name, String description, String source) {
        return Counter.builder(name)
            .description(description)
            .tag("component", "enrichment")
            .tag("source", source)
            .register(registry);
    }

    /**
     * @return verdict cache hit rate as a percentage (0-100)
     */
    public double getVerdictCacheHitRate() {
        double hits = verdictCacheHits.count();
        double total = hits + verdictCacheMisses.count();
        if (total == 0) {
            return 0.0;
        }
        return (hits / total) * 100.0;
    }
}
