package com.bastion.enrichment;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Fans a single IP lookup out to every configured reputation source.
 *
 * Per source, a lookup is answered from the shared feed cache when possible,
 * otherwise it must obtain a permit from that source's rate limiter (no waiting)
 * and complete within the fixed timeout. Sources run in parallel on the bounded
 * elastic scheduler. A source that fails, times out or is out of budget simply
 * contributes no signal: {@link #query(String)} never throws.
 */
public class ReputationFeedClient {

    private static final Logger log = LoggerFactory.getLogger(ReputationFeedClient.class);

    private final Map<String, ReputationSource> sources = new LinkedHashMap<>();
    private final Map<String, RateLimiter> rateLimiters = new LinkedHashMap<>();
    private final Cache<String, FeedSignal> cache;
    private final Duration timeout;
    private final int concurrency;
    private final EnrichmentMetrics metrics;

    public ReputationFeedClient(List<ReputationSource> sources, Duration cacheTtl, Duration timeout,
                                int concurrency, EnrichmentMetrics metrics) {
        this.timeout = timeout;
        this.concurrency = Math.max(1, concurrency);
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
            .maximumSize(100_000)
            .expireAfterWrite(cacheTtl)
            .build();

        for (ReputationSource source : sources) {
            RequestBudget budget = source.budget();
            RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(budget.getRequests())
                .limitRefreshPeriod(budget.getWindow())
                .timeoutDuration(Duration.ZERO)
                .build();
            this.sources.put(source.name(), source);
            this.rateLimiters.put(source.name(), RateLimiter.of(source.name() + "Budget", config));
            log.info("Registered reputation source {} with budget {}", source.name(), budget);
        }
    }

    /**
     * Query every source for the IP.
     *
     * @return the signals of the sources that answered, in registration order
     */
    public List<FeedSignal> query(String ip) {
        if (sources.isEmpty() || ip == null || ip.isBlank()) {
            return List.of();
        }
        try {
            List<FeedSignal> signals = Flux.fromIterable(sources.values())
                .flatMapSequential(source -> lookup(source, ip), concurrency)
                .collectList()
                .block();
            return signals != null ? signals : List.of();
        } catch (RuntimeException e) {
            log.warn("Reputation feed fan-out failed for {}: {}", ip, e.getMessage());
            return List.of();
        }
    }

    private Mono<FeedSignal> lookup(ReputationSource source, String ip) {
        String cacheKey = source.name() + ":" + ip;
        FeedSignal cached = cache.getIfPresent(cacheKey);
        if (cached != null) {
            metrics.recordFeedCacheHit();
            return Mono.just(cached);
        }

        return Mono.defer(() -> {
                metrics.recordFeedCall(source.name());
                return source.lookup(ip);
            })
            .transformDeferred(RateLimiterOperator.of(rateLimiters.get(source.name())))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .doOnNext(signal -> cache.put(cacheKey, signal))
            .onErrorResume(e -> {
                if (e instanceof RequestNotPermitted) {
                    metrics.recordFeedRateLimited(source.name());
                    log.warn("{} request budget exhausted, skipping lookup for {}", source.name(), ip);
                } else if (e instanceof TimeoutException) {
                    metrics.recordFeedError(source.name());
                    log.warn("{} lookup for {} timed out after {}ms", source.name(), ip, timeout.toMillis());
                } else {
                    metrics.recordFeedError(source.name());
                    log.warn("{} lookup for {} failed: {}", source.name(), ip, e.getMessage());
                }
                return Mono.empty();
            });
    }

    public Optional<ReputationSource> source(String name) {
        return Optional.ofNullable(sources.get(name));
    }

    public List<String> sourceNames() {
        return List.copyOf(sources.keySet());
    }

    RateLimiter rateLimiter(String sourceName) {
        return rateLimiters.get(sourceName);
    }

    public void invalidate(String ip) {
        for (String name : sources.keySet()) {
            cache.invalidate(name + ":" + ip);
        }
    }
}
