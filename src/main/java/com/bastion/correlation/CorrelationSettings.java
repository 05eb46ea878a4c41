package com.bastion.correlation;

import java.time.Duration;

/**
 * Validated tuning parameters of the campaign engine.
 */
public final class CorrelationSettings {

    public static final double DEFAULT_CORRELATION_THRESHOLD = 0.7;
    public static final int DEFAULT_MIN_EVENTS_FOR_CAMPAIGN = 5;
    public static final long DEFAULT_CAMPAIGN_TIMEOUT_HOURS = 72;
    public static final double DEFAULT_CLUSTERING_EPS = 0.5;
    public static final int DEFAULT_CLUSTERING_MIN_SAMPLES = 3;
    public static final long DEFAULT_ACTIVE_WINDOW_HOURS = 24;

    private final double correlationThreshold;
    private final int minEventsForCampaign;
    private final long campaignTimeoutHours;
    private final double clusteringEps;
    private final int clusteringMinSamples;
    private final long activeWindowHours;

    public CorrelationSettings(double correlationThreshold, int minEventsForCampaign, long campaignTimeoutHours,
                               double clusteringEps, int clusteringMinSamples, long activeWindowHours) {
        if (Double.isNaN(correlationThreshold) || correlationThreshold < 0.0 || correlationThreshold > 1.0) {
            throw new InvalidConfigurationException("correlationThreshold must be within [0,1]: " + correlationThreshold);
        }
        if (minEventsForCampaign < 1) {
            throw new InvalidConfigurationException("minEventsForCampaign must be at least 1: " + minEventsForCampaign);
        }
        if (campaignTimeoutHours <= 0) {
            throw new InvalidConfigurationException("campaignTimeoutHours must be positive: " + campaignTimeoutHours);
        }
        if (Double.isNaN(clusteringEps) || clusteringEps <= 0.0) {
            throw new InvalidConfigurationException("clusteringEps must be positive: " + clusteringEps);
        }
        if (clusteringMinSamples < 1) {
            throw new InvalidConfigurationException("clusteringMinSamples must be at least 1: " + clusteringMinSamples);
        }
        if (activeWindowHours <= 0) {
            throw new InvalidConfigurationException("activeWindowHours must be positive: " + activeWindowHours);
        }
        this.correlationThreshold = correlationThreshold;
        this.minEventsForCampaign = minEventsForCampaign;
        this.campaignTimeoutHours = campaignTimeoutHours;
        this.clusteringEps = clusteringEps;
        this.clusteringMinSamples = clusteringMinSamples;
        this.activeWindowHours = activeWindowHours;
    }

    public static CorrelationSettings defaults() {
        return new CorrelationSettings(DEFAULT_CORRELATION_THRESHOLD, DEFAULT_MIN_EVENTS_FOR_CAMPAIGN,
            DEFAULT_CAMPAIGN_TIMEOUT_HOURS, DEFAULT_CLUSTERING_EPS, DEFAULT_CLUSTERING_MIN_SAMPLES,
            DEFAULT_ACTIVE_WINDOW_HOURS);
    }

    public double getCorrelationThreshold() {
        return correlationThreshold;
    }

    public int getMinEventsForCampaign() {
        return minEventsForCampaign;
    }

    public long getCampaignTimeoutHours() {
        return campaignTimeoutHours;
    }

    public Duration getCampaignTimeout() {
        return Duration.ofHours(campaignTimeoutHours);
    }

    public double getClusteringEps() {
        return clusteringEps;
    }

    public int getClusteringMinSamples() {
        return clusteringMinSamples;
    }

    public long getActiveWindowHours() {
        return activeWindowHours;
    }

    @Override
    public String toString() {
        return "CorrelationSettings{threshold=" + correlationThreshold + ", minEvents=" + minEventsForCampaign
            + ", timeoutHours=" + campaignTimeoutHours + ", eps=" + clusteringEps
            + ", minSamples=" + clusteringMinSamples + ", activeWindowHours=" + activeWindowHours + "}";
    }
}
