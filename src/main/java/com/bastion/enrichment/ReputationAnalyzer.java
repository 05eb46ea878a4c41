package com.bastion.enrichment;

import com.bastion.domain.AuthAttempt;
import com.bastion.domain.IndicatorKind;
import com.bastion.domain.ReputationLevel;
import com.bastion.domain.ReputationVerdict;
import com.bastion.domain.ThreatContext;
import com.bastion.domain.ThreatIndicator;
import com.bastion.domain.ThreatSignal;
import com.bastion.storage.IndicatorStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * ReputationAnalyzer combines local threat indicators with external reputation
 * feeds into a verdict per IP address, and builds the full threat context of an
 * authentication attempt.
 *
 * Verdicts are cached for a short time. Local indicator matches seed the verdict
 * with the most severe match; each feed may then escalate it past its own cutoffs.
 * Escalation only ever raises the reputation level.
 */
@Component
public class ReputationAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ReputationAnalyzer.class);

    private final IndicatorStore indicatorStore;
    private final ReputationFeedClient feedClient;
    private final EnrichmentMetrics metrics;
    private final Cache<String, ReputationVerdict> verdictCache;

    public ReputationAnalyzer(IndicatorStore indicatorStore,
                              ReputationFeedClient feedClient,
                              EnrichmentMetrics metrics,
                              @Value("${bastion.enrichment.verdict-cache-ttl-seconds:3600}") long cacheTtlSeconds,
                              @Value("${bastion.enrichment.verdict-cache-max-size:50000}") long cacheMaxSize) {
        this.indicatorStore = indicatorStore;
        this.feedClient = feedClient;
        this.metrics = metrics;
        this.verdictCache = Caffeine.newBuilder()
            .maximumSize(cacheMaxSize)
            .expireAfterWrite(Duration.ofSeconds(cacheTtlSeconds))
            .recordStats()
            .build();
    }

    /**
     * Reputation verdict for an IP address.
     *
     * @param ip the address to analyze
     * @return the verdict; never null, a failing feed only removes its contribution
     */
    public ReputationVerdict analyzeIP(String ip) {
        ReputationVerdict cached = verdictCache.getIfPresent(ip);
        if (cached != null) {
            metrics.recordVerdictCacheHit();
            return cached;
        }
        metrics.recordVerdictCacheMiss();
        long startTime = System.currentTimeMillis();

        ReputationLevel level = ReputationLevel.CLEAN;
        double confidence = 0.0;
        Set<String> sources = new LinkedHashSet<>();
        Set<String> tags = new LinkedHashSet<>();
        Map<String, Object> additionalInfo = new LinkedHashMap<>();
        Instant firstSeen = null;
        Instant lastSeen = null;

        // Seed from the most severe local match
        List<ThreatIndicator> localMatches = indicatorStore.matchIP(ip);
        for (ThreatIndicator match : localMatches) {
            if (match.getReputationLevel().isMoreSevereThan(level)) {
                level = match.getReputationLevel();
            }
            confidence = Math.max(confidence, match.getConfidence());
            sources.add(match.getSource());
            tags.addAll(match.getTags());
            if (match.getFirstSeen() != null && (firstSeen == null || match.getFirstSeen().isBefore(firstSeen))) {
                firstSeen = match.getFirstSeen();
            }
            if (match.getLastSeen() != null && (lastSeen == null || match.getLastSeen().isAfter(lastSeen))) {
                lastSeen = match.getLastSeen();
            }
        }

        for (FeedSignal signal : feedClient.query(ip)) {
            Optional<ReputationSource> source = feedClient.source(signal.getSource());
            if (source.isEmpty()) {
                continue;
            }
            double feedConfidence = signal.getMaliciousConfidence();
            if (feedConfidence > source.get().maliciousCutoff()) {
                level = ReputationLevel.max(level, ReputationLevel.MALICIOUS);
                confidence = Math.max(confidence, feedConfidence);
            } else if (feedConfidence > source.get().suspiciousCutoff()) {
                level = ReputationLevel.max(level, ReputationLevel.SUSPICIOUS);
                confidence = Math.max(confidence, feedConfidence);
            }
            sources.add(signal.getSource());
            tags.addAll(signal.getTags());
            additionalInfo.put(signal.getSource(), signal.getRaw());
        }

        ReputationVerdict verdict = new ReputationVerdict(ip, level, confidence, sources, tags,
            firstSeen, lastSeen, additionalInfo);
        verdictCache.put(ip, verdict);
        metrics.recordVerdictLatency(System.currentTimeMillis() - startTime);

        log.debug("Reputation verdict for {}: {} ({}) from {}", ip, level.getValue(), confidence, sources);
        return verdict;
    }

    /**
     * Threat context of an authentication attempt: the IP verdict plus every IP,
     * user-agent, pattern and email indicator the attempt matches.
     */
    public ThreatContext assessAttempt(AuthAttempt attempt) {
        ReputationVerdict verdict = attempt.getClientIp() != null
            ? analyzeIP(attempt.getClientIp())
            : ReputationVerdict.clean(null);

        List<ThreatIndicator> matched = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        if (attempt.getClientIp() != null) {
            addMatches(matched, seen, indicatorStore.matchIP(attempt.getClientIp()));
        }
        if (attempt.getUserAgent() != null) {
            addMatches(matched, seen, indicatorStore.matchUserAgent(attempt.getUserAgent()));
        }
        if (attempt.getEmail() != null) {
            indicatorStore.get(IndicatorKind.EMAIL, attempt.getEmail())
                .ifPresent(indicator -> addMatches(matched, seen, List.of(indicator)));
        }

        double riskScore = riskScore(verdict, matched);

        Set<String> categories = new LinkedHashSet<>(verdict.getTags());
        matched.forEach(indicator -> categories.addAll(indicator.getTags()));

        return new ThreatContext(verdict, matched, riskScore, new ArrayList<>(categories), attribution(matched));
    }

    /**
     * Per-attempt threat signal for campaign detection, derived from a threat context.
     */
    public ThreatSignal toSignal(ThreatContext context) {
        Set<String> patterns = new LinkedHashSet<>();
        context.getMatchedIndicators().forEach(indicator -> patterns.addAll(indicator.getTags()));

        ThreatSignal signal = new ThreatSignal(context.getRiskScore(), new ArrayList<>(patterns), 0);
        if (context.getAttribution() != null) {
            signal.setThreatActorIndicators(List.of(context.getAttribution()));
        }
        return signal;
    }

    private static void addMatches(List<ThreatIndicator> matched, Set<String> seen, List<ThreatIndicator> found) {
        for (ThreatIndicator indicator : found) {
            if (seen.add(indicator.getKey())) {
                matched.add(indicator);
            }
        }
    }

    static double riskScore(ReputationVerdict verdict, List<ThreatIndicator> indicators) {
        double score = verdictWeight(verdict.getReputationLevel()) * verdict.getConfidence();
        for (ThreatIndicator indicator : indicators) {
            score += indicatorWeight(indicator.getReputationLevel()) * indicator.getConfidence();
        }
        return Math.min(score, 1.0);
    }

    private static double verdictWeight(ReputationLevel level) {
        switch (level) {
            case CRITICAL:
                return 0.8;
            case MALICIOUS:
                return 0.6;
            case SUSPICIOUS:
                return 0.3;
            default:
                return 0.0;
        }
    }

    private static double indicatorWeight(ReputationLevel level) {
        switch (level) {
            case CRITICAL:
                return 0.7;
            case MALICIOUS:
                return 0.5;
            case SUSPICIOUS:
                return 0.2;
            default:
                return 0.0;
        }
    }

    private static String attribution(List<ThreatIndicator> indicators) {
        for (ThreatIndicator indicator : indicators) {
            if (indicator.getTags().contains("apt")) {
                return "APT (based on " + indicator.getValue() + ")";
            } else if (indicator.getTags().contains("botnet")) {
                return "Botnet (based on " + indicator.getValue() + ")";
            } else if (indicator.getTags().contains("scanner")) {
                return "Automated Scanner (based on " + indicator.getValue() + ")";
            }
        }
        return null;
    }

    /**
     * Drop the cached verdict and feed answers for an IP.
     */
    public void invalidate(String ip) {
        verdictCache.invalidate(ip);
        feedClient.invalidate(ip);
    }

    public long cacheSize() {
        return verdictCache.estimatedSize();
    }
}
