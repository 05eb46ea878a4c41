package com.bastion.config;

import com.bastion.correlation.CampaignGrouper;
import com.bastion.correlation.CampaignMetrics;
import com.bastion.correlation.CorrelationSettings;
import com.bastion.correlation.DensityClusterer;
import com.bastion.correlation.EventFeaturizer;
import com.bastion.correlation.SignatureCatalog;
import com.bastion.correlation.SignatureClassifier;
import com.bastion.domain.AttackCampaign;
import com.bastion.domain.ThreatIndicator;
import com.bastion.enrichment.AbuseIpDbSource;
import com.bastion.enrichment.EnrichmentMetrics;
import com.bastion.enrichment.ReputationFeedClient;
import com.bastion.enrichment.ReputationSource;
import com.bastion.enrichment.RequestBudget;
import com.bastion.enrichment.ShodanSource;
import com.bastion.enrichment.VirusTotalSource;
import com.bastion.storage.CampaignStore;
import com.bastion.storage.IndicatorStore;
import com.bastion.storage.SnapshotFile;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Wiring for the stores, reputation feeds and campaign detection components.
 */
@Configuration
public class BastionConfig {
    private static final Logger logger = LoggerFactory.getLogger(BastionConfig.class);

    @Value("${bastion.storage.indicators-file:data/threat_indicators.json}")
    private String indicatorsFile;

    @Value("${bastion.storage.campaigns-file:data/attack_campaigns.json}")
    private String campaignsFile;

    @Value("${bastion.correlation.correlation-threshold:0.7}")
    private double correlationThreshold;

    @Value("${bastion.correlation.min-events-for-campaign:5}")
    private int minEventsForCampaign;

    @Value("${bastion.correlation.campaign-timeout-hours:72}")
    private long campaignTimeoutHours;

    @Value("${bastion.correlation.clustering-eps:0.5}")
    private double clusteringEps;

    @Value("${bastion.correlation.clustering-min-samples:3}")
    private int clusteringMinSamples;

    @Value("${bastion.correlation.active-window-hours:24}")
    private long activeWindowHours;

    @Value("${bastion.correlation.signatures-file:}")
    private String signaturesFile;

    @Value("${bastion.enrichment.feed-cache-ttl-seconds:3600}")
    private long feedCacheTtlSeconds;

    @Value("${bastion.enrichment.feed-timeout-ms:2000}")
    private long feedTimeoutMs;

    @Value("${bastion.enrichment.feed-concurrency:4}")
    private int feedConcurrency;

    @Value("${bastion.feeds.abuseipdb.api-key:}")
    private String abuseIpDbApiKey;

    @Value("${bastion.feeds.abuseipdb.base-url:https://api.abuseipdb.com}")
    private String abuseIpDbBaseUrl;

    @Value("${bastion.feeds.abuseipdb.requests-per-window:1000}")
    private int abuseIpDbRequests;

    @Value("${bastion.feeds.abuseipdb.window-seconds:86400}")
    private long abuseIpDbWindowSeconds;

    @Value("${bastion.feeds.virustotal.api-key:}")
    private String virusTotalApiKey;

    @Value("${bastion.feeds.virustotal.base-url:https://www.virustotal.com}")
    private String virusTotalBaseUrl;

    @Value("${bastion.feeds.virustotal.requests-per-window:4}")
    private int virusTotalRequests;

    @Value("${bastion.feeds.virustotal.window-seconds:60}")
    private long virusTotalWindowSeconds;

    @Value("${bastion.feeds.shodan.api-key:}")
    private String shodanApiKey;

    @Value("${bastion.feeds.shodan.base-url:https://api.shodan.io}")
    private String shodanBaseUrl;

    @Value("${bastion.feeds.shodan.requests-per-window:100}")
    private int shodanRequests;

    @Value("${bastion.feeds.shodan.window-seconds:2592000}")
    private long shodanWindowSeconds;

    private final ObjectMapper snapshotMapper = SnapshotFile.defaultMapper();

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IndicatorStore indicatorStore(Clock clock) {
        IndicatorStore store = new IndicatorStore(snapshot(indicatorsFile, ThreatIndicator.class), clock);
        store.seedDefaults();
        return store;
    }

    @Bean
    public CampaignStore campaignStore(Clock clock) {
        return new CampaignStore(snapshot(campaignsFile, AttackCampaign.class), clock);
    }

    private <T> SnapshotFile<T> snapshot(String file, Class<T> type) {
        if (file == null || file.isBlank()) {
            logger.warn("No persistence file configured for {}, keeping it in memory only", type.getSimpleName());
            return null;
        }
        return new SnapshotFile<>(Paths.get(file), type, snapshotMapper);
    }

    /**
     * Feed client over every reputation source that has an API key configured.
     */
    @Bean
    public ReputationFeedClient reputationFeedClient(WebClient.Builder webClientBuilder, EnrichmentMetrics metrics) {
        List<ReputationSource> sources = new ArrayList<>();
        if (!abuseIpDbApiKey.isBlank()) {
            sources.add(new AbuseIpDbSource(webClientBuilder.clone().baseUrl(abuseIpDbBaseUrl).build(),
                abuseIpDbApiKey, RequestBudget.of(abuseIpDbRequests, Duration.ofSeconds(abuseIpDbWindowSeconds))));
        }
        if (!virusTotalApiKey.isBlank()) {
            sources.add(new VirusTotalSource(webClientBuilder.clone().baseUrl(virusTotalBaseUrl).build(),
                virusTotalApiKey, RequestBudget.of(virusTotalRequests, Duration.ofSeconds(virusTotalWindowSeconds))));
        }
        if (!shodanApiKey.isBlank()) {
            sources.add(new ShodanSource(webClientBuilder.clone().baseUrl(shodanBaseUrl).build(),
                shodanApiKey, RequestBudget.of(shodanRequests, Duration.ofSeconds(shodanWindowSeconds))));
        }
        if (sources.isEmpty()) {
            logger.info("No reputation feed API keys configured, verdicts use local indicators only");
        }
        return new ReputationFeedClient(sources, Duration.ofSeconds(feedCacheTtlSeconds),
            Duration.ofMillis(feedTimeoutMs), feedConcurrency, metrics);
    }

    @Bean
    public CorrelationSettings correlationSettings() {
        return new CorrelationSettings(correlationThreshold, minEventsForCampaign, campaignTimeoutHours,
            clusteringEps, clusteringMinSamples, activeWindowHours);
    }

    @Bean
    public SignatureCatalog signatureCatalog() {
        if (signaturesFile == null || signaturesFile.isBlank()) {
            return SignatureCatalog.defaults();
        }
        Path path = Paths.get(signaturesFile);
        return SignatureCatalog.fromFile(path, snapshotMapper);
    }

    @Bean
    public SignatureClassifier signatureClassifier(SignatureCatalog catalog) {
        return new SignatureClassifier(catalog);
    }

    @Bean
    public CampaignGrouper campaignGrouper(EventFeaturizer featurizer, CorrelationSettings settings,
                                           CampaignMetrics metrics) {
        DensityClusterer clusterer = new DensityClusterer(settings.getClusteringEps(), settings.getClusteringMinSamples());
        return new CampaignGrouper(featurizer, clusterer, metrics);
    }
}
