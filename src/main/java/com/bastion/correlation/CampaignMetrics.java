package com.bastion.correlation;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for campaign detection passes.
 */
@Component
public class CampaignMetrics {

    private final MeterRegistry registry;
    private final Counter passes;
    private final Counter eventsAnalyzed;
    private final Counter campaignsUpdated;
    private final Counter correlations;
    private final Counter indicatorsEmitted;
    private final Counter clusteringFallbacks;
    private final Counter stageFailures;
    private final Counter abandonedPasses;
    private final Timer passLatency;

    public CampaignMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.passes = Counter.builder("bastion.campaign.passes")
            .description("Completed detection passes")
            .tag("component", "campaign")
            .register(registry);

        this.eventsAnalyzed = Counter.builder("bastion.campaign.events.analyzed")
            .description("Authentication attempts analyzed by detection passes")
            .tag("component", "campaign")
            .register(registry);

        this.campaignsUpdated = Counter.builder("bastion.campaign.updated")
            .description("Existing campaigns that received new events")
            .tag("component", "campaign")
            .register(registry);

        this.correlations = Counter.builder("bastion.campaign.correlations")
            .description("Campaign pairs recorded as related")
            .tag("component", "campaign")
            .register(registry);

        this.indicatorsEmitted = Counter.builder("bastion.campaign.indicators.emitted")
            .description("Threat indicators minted from detected campaigns")
            .tag("component", "campaign")
            .register(registry);

        this.clusteringFallbacks = Counter.builder("bastion.campaign.clustering.fallbacks")
            .description("Batches grouped heuristically because clustering failed")
            .tag("component", "campaign")
            .register(registry);

        this.stageFailures = Counter.builder("bastion.campaign.stage.failures")
            .description("Detection stages that failed and were skipped")
            .tag("component", "campaign")
            .register(registry);

        this.abandonedPasses = Counter.builder("bastion.campaign.passes.abandoned")
            .description("Detection passes abandoned before commit")
            .tag("component", "campaign")
            .register(registry);

        this.passLatency = Timer.builder("bastion.campaign.pass.latency")
            .description("Duration of a detection pass")
            .tag("component", "campaign")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    public void recordPass(int events, long durationMs) {
        passes.increment();
        eventsAnalyzed.increment(events);
        passLatency.record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a newly created campaign, tagged by campaign type.
     */
    public void recordCampaignCreated(String campaignType) {
        Counter.builder("bastion.campaign.created")
            .description("Campaigns created by detection passes")
            .tag("component", "campaign")
            .tag("type", campaignType)
            .register(registry)
            .increment();
    }

    public void recordCampaignUpdated() {
        campaignsUpdated.increment();
    }

    public void recordCorrelation() {
        correlations.increment();
    }

    public void recordIndicatorsEmitted(int count) {
        indicatorsEmitted.increment(count);
    }

    public void recordClusteringFallback() {
        clusteringFallbacks.increment();
    }

    public void recordStageFailure() {
        stageFailures.increment();
    }

    public void recordAbandonedPass() {
        abandonedPasses.increment();
    }
}
