package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregate view of the campaign store for observability collaborators.
 */
public class CampaignStatistics {

    @JsonProperty("totalCampaigns")
    private final int totalCampaigns;

    @JsonProperty("activeCampaigns")
    private final int activeCampaigns;

    @JsonProperty("campaignTypes")
    private final Map<String, Long> campaignTypes;

    @JsonProperty("threatActors")
    private final Map<String, Long> threatActors;

    @JsonProperty("averageCampaignDurationSeconds")
    private final double averageCampaignDurationSeconds;

    @JsonProperty("totalEvents")
    private final long totalEvents;

    public CampaignStatistics(int totalCampaigns, int activeCampaigns,
                              Map<String, Long> campaignTypes, Map<String, Long> threatActors,
                              double averageCampaignDurationSeconds, long totalEvents) {
        this.totalCampaigns = totalCampaigns;
        this.activeCampaigns = activeCampaigns;
        this.campaignTypes = Map.copyOf(campaignTypes);
        this.threatActors = Map.copyOf(threatActors);
        this.averageCampaignDurationSeconds = averageCampaignDurationSeconds;
        this.totalEvents = totalEvents;
    }

    public int getTotalCampaigns() {
        return totalCampaigns;
    }

    public int getActiveCampaigns() {
        return activeCampaigns;
    }

    public Map<String, Long> getCampaignTypes() {
        return campaignTypes;
    }

    public Map<String, Long> getThreatActors() {
        return threatActors;
    }

    public double getAverageCampaignDurationSeconds() {
        return averageCampaignDurationSeconds;
    }

    public long getTotalEvents() {
        return totalEvents;
    }
}
