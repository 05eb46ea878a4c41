package com.bastion.correlation;

import com.bastion.domain.AttackCampaign;
import com.bastion.domain.AttemptRecord;
import com.bastion.domain.CampaignAnalysisResult;
import com.bastion.domain.CampaignEvent;
import com.bastion.domain.CampaignStatistics;
import com.bastion.domain.CampaignType;
import com.bastion.domain.IndicatorKind;
import com.bastion.domain.ReputationLevel;
import com.bastion.domain.ThreatIndicator;
import com.bastion.enrichment.ReputationAnalyzer;
import com.bastion.storage.CampaignStore;
import com.bastion.storage.IndicatorStore;
import com.google.common.collect.Sets;
import com.google.common.hash.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * CampaignEngine runs detection passes over batches of scored authentication attempts.
 *
 * A pass featurizes the batch, groups it, classifies each large enough group and
 * creates campaigns for the confident ones, then plans which remaining events
 * extend existing campaigns. Nothing is written until that plan is complete, so a
 * pass interrupted before the commit leaves no trace. After the commit the pass
 * correlates the campaigns it touched, feeds indicators of significant campaigns
 * back into the indicator store and persists both stores.
 *
 * Passes are serialized. Every stage is guarded: a failing stage is logged and
 * replaced by its fallback, and no exception reaches the caller.
 */
@Service
public class CampaignEngine {

    private static final Logger log = LoggerFactory.getLogger(CampaignEngine.class);

    /**
     * Classification confidence (a signature match score) is compared against the
     * same correlationThreshold as event-to-campaign similarity. The two quantities
     * are coupled through that single setting.
     */
    public static final boolean ATTRIBUTION_THRESHOLD_COUPLING = true;

    static final int MIN_EVENTS_FOR_INDICATORS = 5;
    static final Duration IP_INDICATOR_TTL = Duration.ofDays(7);
    static final Duration USER_AGENT_INDICATOR_TTL = Duration.ofDays(30);
    static final List<String> SUSPICIOUS_USER_AGENT_MARKERS = List.of("bot", "crawler", "scanner", "tool");

    private final CampaignStore campaignStore;
    private final IndicatorStore indicatorStore;
    private final ReputationAnalyzer reputationAnalyzer;
    private final EventFeaturizer featurizer;
    private final CampaignGrouper grouper;
    private final SignatureClassifier classifier;
    private final CorrelationSettings settings;
    private final CampaignMetrics metrics;
    private final Clock clock;
    private final ReentrantLock passLock = new ReentrantLock();

    public CampaignEngine(CampaignStore campaignStore,
                          IndicatorStore indicatorStore,
                          ReputationAnalyzer reputationAnalyzer,
                          EventFeaturizer featurizer,
                          CampaignGrouper grouper,
                          SignatureClassifier classifier,
                          CorrelationSettings settings,
                          CampaignMetrics metrics,
                          Clock clock) {
        this.campaignStore = campaignStore;
        this.indicatorStore = indicatorStore;
        this.reputationAnalyzer = reputationAnalyzer;
        this.featurizer = featurizer;
        this.grouper = grouper;
        this.classifier = classifier;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
        log.info("Campaign engine initialized with {} and {} signatures", settings, classifier.getCatalog().size());
    }

    /**
     * Run one detection pass over a batch of attempts.
     *
     * @param records attempts paired with their threat signals
     * @return what the pass detected; an empty result if the batch was empty or the pass was abandoned
     */
    public CampaignAnalysisResult analyze(List<AttemptRecord> records) {
        Instant started = clock.instant();
        if (records == null || records.isEmpty()) {
            return CampaignAnalysisResult.empty(started);
        }

        passLock.lock();
        try {
            return runPass(records, started);
        } catch (RuntimeException e) {
            log.error("Campaign detection pass over {} attempts failed", records.size(), e);
            return CampaignAnalysisResult.empty(started);
        } finally {
            passLock.unlock();
        }
    }

    private CampaignAnalysisResult runPass(List<AttemptRecord> records, Instant started) {
        long startNanos = System.nanoTime();

        List<CampaignEvent> events = guarded("featurize", () -> toEvents(records), List::of);
        Map<String, List<CampaignEvent>> groups = guarded("group",
            () -> grouper.group(events), () -> grouper.groupHeuristically(events));

        Set<String> absorbed = new HashSet<>();
        List<AttackCampaign> newCampaigns = guarded("classify",
            () -> createCampaigns(groups, absorbed), ArrayList::new);

        Set<String> alreadyHolding = new LinkedHashSet<>();
        List<PlannedEvent> plan = guarded("match",
            () -> planUpdates(events, absorbed, alreadyHolding), ArrayList::new);

        if (Thread.currentThread().isInterrupted()) {
            log.warn("Campaign detection pass interrupted before commit, abandoning {} attempts", records.size());
            metrics.recordAbandonedPass();
            return CampaignAnalysisResult.empty(started);
        }

        // Commit
        for (AttackCampaign campaign : newCampaigns) {
            campaignStore.add(campaign);
            metrics.recordCampaignCreated(campaign.getCampaignType().getValue());
            log.info("Detected new campaign {} ({}, actor={}, confidence={}, events={})",
                campaign.getCampaignId(), campaign.getCampaignType().getValue(), campaign.getThreatActor(),
                campaign.getAttributionConfidence(), campaign.getEvents().size());
        }
        Map<String, AttackCampaign> updated = new LinkedHashMap<>();
        for (PlannedEvent planned : plan) {
            if (campaignStore.addEvent(planned.campaignId, planned.event)) {
                campaignStore.get(planned.campaignId).ifPresent(c -> updated.putIfAbsent(c.getCampaignId(), c));
            } else {
                alreadyHolding.add(planned.campaignId);
            }
        }
        updated.values().forEach(c -> metrics.recordCampaignUpdated());
        List<AttackCampaign> updatedCampaigns = new ArrayList<>(updated.values());

        List<AttackCampaign> touched = new ArrayList<>(newCampaigns);
        touched.addAll(updatedCampaigns);

        Map<String, List<String>> correlations = guarded("correlate",
            () -> correlate(touched), LinkedHashMap::new);
        List<ThreatIndicator> emitted = guarded("emit",
            () -> emitIndicators(touched), ArrayList::new);

        // Persist
        campaignStore.saveToFile();
        if (!emitted.isEmpty()) {
            indicatorStore.saveToFile();
        }

        Map<String, AttackCampaign> detected = new LinkedHashMap<>();
        touched.forEach(c -> detected.put(c.getCampaignId(), c));
        for (String campaignId : alreadyHolding) {
            campaignStore.get(campaignId).ifPresent(c -> detected.putIfAbsent(campaignId, c));
        }

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordPass(records.size(), elapsedMs);
        log.info("Campaign pass over {} attempts: {} detected, {} new, {} updated, {} correlated, {} indicators in {}ms",
            records.size(), detected.size(), newCampaigns.size(), updatedCampaigns.size(),
            correlations.size(), emitted.size(), elapsedMs);

        return new CampaignAnalysisResult(new ArrayList<>(detected.values()), newCampaigns, updatedCampaigns,
            correlations, emitted, started, elapsedMs);
    }

    private List<CampaignEvent> toEvents(List<AttemptRecord> records) {
        Map<String, CampaignEvent> events = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            AttemptRecord record = records.get(i);
            CampaignEvent event = featurizer.toEvent(record.getAttempt(), record.getSignal(), i);
            if (events.putIfAbsent(event.getEventId(), event) != null) {
                log.debug("Ignoring duplicate attempt {} within batch", event.getEventId());
            }
        }
        return new ArrayList<>(events.values());
    }

    private List<AttackCampaign> createCampaigns(Map<String, List<CampaignEvent>> groups, Set<String> absorbed) {
        // See ATTRIBUTION_THRESHOLD_COUPLING
        double attributionThreshold = settings.getCorrelationThreshold();
        List<AttackCampaign> created = new ArrayList<>();
        Set<String> createdIds = new HashSet<>();

        for (Map.Entry<String, List<CampaignEvent>> group : groups.entrySet()) {
            List<CampaignEvent> groupEvents = group.getValue();
            if (groupEvents.size() < settings.getMinEventsForCampaign()) {
                continue;
            }

            Classification classification = guarded("classify " + group.getKey(),
                () -> classifier.classify(groupEvents), () -> classifier.fallback(groupEvents));
            if (classification.getConfidence() < attributionThreshold) {
                log.debug("Group {} classified as {} below threshold {}", group.getKey(), classification, attributionThreshold);
                continue;
            }

            String campaignId = campaignId(groupEvents);
            if (campaignStore.contains(campaignId) || !createdIds.add(campaignId)) {
                log.debug("Campaign {} already exists, not recreating", campaignId);
                continue;
            }

            AttackCampaign campaign = new AttackCampaign(campaignId, classification.getCampaignType(),
                classification.getThreatActor(), classification.getConfidence());
            groupEvents.stream()
                .sorted(Comparator.comparing(CampaignEvent::getTimestamp))
                .forEach(campaign::addEvent);
            groupEvents.forEach(e -> absorbed.add(e.getEventId()));
            created.add(campaign);
        }
        return created;
    }

    private List<PlannedEvent> planUpdates(List<CampaignEvent> events, Set<String> absorbed, Set<String> alreadyHolding) {
        Set<String> recent = campaignStore.findRecent(settings.getCampaignTimeoutHours()).stream()
            .map(AttackCampaign::getCampaignId)
            .collect(Collectors.toSet());
        List<PlannedEvent> plan = new ArrayList<>();
        if (recent.isEmpty()) {
            return plan;
        }

        for (CampaignEvent event : events) {
            if (absorbed.contains(event.getEventId())) {
                continue;
            }

            Map<String, AttackCampaign> candidates = new LinkedHashMap<>();
            if (event.clientIp() != null) {
                campaignStore.findByIp(event.clientIp()).forEach(c -> candidates.putIfAbsent(c.getCampaignId(), c));
            }
            if (event.email() != null) {
                campaignStore.findByUser(event.email()).forEach(c -> candidates.putIfAbsent(c.getCampaignId(), c));
            }

            AttackCampaign best = null;
            double bestScore = 0.0;
            for (AttackCampaign candidate : candidates.values()) {
                if (!recent.contains(candidate.getCampaignId())) {
                    continue;
                }
                double score = eventSimilarity(event, candidate);
                if (score > bestScore && score >= settings.getCorrelationThreshold()) {
                    best = candidate;
                    bestScore = score;
                }
            }

            if (best == null) {
                continue;
            }
            if (best.containsEvent(event.getEventId())) {
                alreadyHolding.add(best.getCampaignId());
            } else {
                plan.add(new PlannedEvent(best.getCampaignId(), event));
            }
        }
        return plan;
    }

    /**
     * How well an event fits an existing campaign: shared IP 0.4, shared user 0.3,
     * shared user agent 0.2, plus up to 0.1 for closeness to the campaign's last activity.
     */
    public double eventSimilarity(CampaignEvent event, AttackCampaign campaign) {
        double score = 0.0;
        if (event.clientIp() != null && campaign.getSourceIps().contains(event.clientIp())) {
            score += 0.4;
        }
        if (event.email() != null && campaign.getTargetUsers().contains(event.email())) {
            score += 0.3;
        }
        if (event.userAgent() != null && campaign.getUserAgents().contains(event.userAgent())) {
            score += 0.2;
        }
        if (campaign.getLastSeen() != null) {
            double timeout = settings.getCampaignTimeout().getSeconds();
            double diff = Math.abs(Duration.between(campaign.getLastSeen(), event.getTimestamp()).getSeconds());
            score += Math.max(0.0, 1.0 - diff / timeout) * 0.1;
        }
        return score;
    }

    private Map<String, List<String>> correlate(List<AttackCampaign> campaigns) {
        Map<String, List<String>> correlations = new LinkedHashMap<>();
        for (int i = 0; i < campaigns.size(); i++) {
            for (int j = i + 1; j < campaigns.size(); j++) {
                AttackCampaign a = campaigns.get(i);
                AttackCampaign b = campaigns.get(j);
                if (campaignSimilarity(a, b) < settings.getCorrelationThreshold()) {
                    continue;
                }
                correlations.computeIfAbsent(a.getCampaignId(), k -> new ArrayList<>()).add(b.getCampaignId());
                correlations.computeIfAbsent(b.getCampaignId(), k -> new ArrayList<>()).add(a.getCampaignId());
                campaignStore.mutate(a.getCampaignId(), c -> c.addRelatedCampaign(b.getCampaignId()));
                campaignStore.mutate(b.getCampaignId(), c -> c.addRelatedCampaign(a.getCampaignId()));
                metrics.recordCorrelation();
                log.info("Correlated campaigns {} and {}", a.getCampaignId(), b.getCampaignId());
            }
        }
        return correlations;
    }

    /**
     * Symmetric similarity of two campaigns: IP Jaccard 0.4, user Jaccard 0.3,
     * same type 0.2, same known actor 0.1.
     */
    public static double campaignSimilarity(AttackCampaign a, AttackCampaign b) {
        double score = jaccard(a.getSourceIps(), b.getSourceIps()) * 0.4
            + jaccard(a.getTargetUsers(), b.getTargetUsers()) * 0.3;
        if (a.getCampaignType() == b.getCampaignType()) {
            score += 0.2;
        }
        if (a.getThreatActor() != null && a.getThreatActor() == b.getThreatActor()) {
            score += 0.1;
        }
        return score;
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        int union = Sets.union(a, b).size();
        if (union == 0) {
            return 0.0;
        }
        return (double) Sets.intersection(a, b).size() / union;
    }

    private List<ThreatIndicator> emitIndicators(List<AttackCampaign> campaigns) {
        List<ThreatIndicator> emitted = new ArrayList<>();
        Instant now = clock.instant();

        for (AttackCampaign campaign : campaigns) {
            for (ThreatIndicator indicator : deriveIndicators(campaign)) {
                Optional<ThreatIndicator> existing = indicatorStore.get(indicator.getKind(), indicator.getValue());
                if (existing.isPresent() && !existing.get().isExpired(now)
                        && existing.get().getReputationLevel().isMoreSevereThan(indicator.getReputationLevel())) {
                    log.debug("Keeping more severe indicator {}", existing.get());
                    continue;
                }
                indicatorStore.add(indicator);
                campaignStore.mutate(campaign.getCampaignId(), c -> c.addIoc(indicator.getKey()));
                if (indicator.getKind() == IndicatorKind.IP) {
                    reputationAnalyzer.invalidate(indicator.getValue());
                }
                emitted.add(indicator);
            }
        }
        if (!emitted.isEmpty()) {
            metrics.recordIndicatorsEmitted(emitted.size());
            log.info("Emitted {} threat indicators from {} campaigns", emitted.size(), campaigns.size());
        }
        return emitted;
    }

    /**
     * Indicators a campaign surfaces: its source IPs and its tool-like user agents.
     * Campaigns with fewer than five events surface nothing.
     */
    public List<ThreatIndicator> deriveIndicators(AttackCampaign campaign) {
        List<ThreatIndicator> indicators = new ArrayList<>();
        if (campaign.getEvents().size() < MIN_EVENTS_FOR_INDICATORS) {
            return indicators;
        }

        CampaignType type = campaign.getCampaignType();
        ReputationLevel ipLevel = type == CampaignType.APT_CAMPAIGN || type == CampaignType.BOTNET_ACTIVITY
            ? ReputationLevel.MALICIOUS
            : ReputationLevel.SUSPICIOUS;

        for (String ip : campaign.getSourceIps()) {
            indicators.add(ThreatIndicator.builder()
                .kind(IndicatorKind.IP)
                .value(ip)
                .reputationLevel(ipLevel)
                .source(ThreatIndicator.SOURCE_INTERNAL)
                .firstSeen(campaign.getFirstSeen())
                .lastSeen(campaign.getLastSeen())
                .confidence(campaign.getAttributionConfidence())
                .tags(List.of(type.getValue(), "campaign_detected"))
                .description("IP involved in " + type.getValue() + " campaign " + campaign.getCampaignId())
                .ttlSeconds(IP_INDICATOR_TTL.getSeconds())
                .build());
        }

        for (String userAgent : campaign.getUserAgents()) {
            String lower = userAgent.toLowerCase(Locale.ROOT);
            if (SUSPICIOUS_USER_AGENT_MARKERS.stream().noneMatch(lower::contains)) {
                continue;
            }
            indicators.add(ThreatIndicator.builder()
                .kind(IndicatorKind.USER_AGENT)
                .value(userAgent)
                .reputationLevel(ReputationLevel.SUSPICIOUS)
                .source(ThreatIndicator.SOURCE_INTERNAL)
                .firstSeen(campaign.getFirstSeen())
                .lastSeen(campaign.getLastSeen())
                .confidence(campaign.getAttributionConfidence())
                .tags(List.of(type.getValue(), "suspicious_ua"))
                .description("Suspicious user agent from campaign " + campaign.getCampaignId())
                .ttlSeconds(USER_AGENT_INDICATOR_TTL.getSeconds())
                .build());
        }
        return indicators;
    }

    /**
     * Deterministic campaign id from the group's sorted IPs, sorted users and earliest timestamp.
     */
    public static String campaignId(List<CampaignEvent> events) {
        Set<String> ips = new TreeSet<>();
        Set<String> users = new TreeSet<>();
        Instant earliest = null;
        for (CampaignEvent event : events) {
            if (event.clientIp() != null) {
                ips.add(event.clientIp());
            }
            if (event.email() != null) {
                users.add(event.email());
            }
            if (earliest == null || event.getTimestamp().isBefore(earliest)) {
                earliest = event.getTimestamp();
            }
        }
        String input = String.join(":", ips) + "|" + String.join(":", users) + "|" + Objects.toString(earliest);
        String hash = Hashing.sha256().hashString(input, StandardCharsets.UTF_8).toString();
        return "campaign_" + hash.substring(0, 12);
    }

    public CampaignStatistics statistics() {
        return campaignStore.statistics(settings.getActiveWindowHours());
    }

    public CorrelationSettings getSettings() {
        return settings;
    }

    private <T> T guarded(String stage, Supplier<T> body, Supplier<T> fallback) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.warn("Campaign detection stage '{}' failed, using fallback: {}", stage, e.getMessage(), e);
            metrics.recordStageFailure();
            return fallback.get();
        }
    }

    private static final class PlannedEvent {
        private final String campaignId;
        private final CampaignEvent event;

        private PlannedEvent(String campaignId, CampaignEvent event) {
            this.campaignId = campaignId;
            this.event = event;
        }
    }
}
