package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one detection pass.
 *
 * detectedCampaigns holds every campaign the batch touched: newly created ones,
 * existing ones that received events, and existing ones that already held
 * re-submitted events.
 */
public class CampaignAnalysisResult {

    @JsonProperty("detectedCampaigns")
    private final List<AttackCampaign> detectedCampaigns;

    @JsonProperty("newCampaigns")
    private final List<AttackCampaign> newCampaigns;

    @JsonProperty("updatedCampaigns")
    private final List<AttackCampaign> updatedCampaigns;

    @JsonProperty("campaignCorrelations")
    private final Map<String, List<String>> campaignCorrelations;

    @JsonProperty("emittedIndicators")
    private final List<ThreatIndicator> emittedIndicators;

    @JsonProperty("analysisTimestamp")
    private final Instant analysisTimestamp;

    @JsonProperty("processingTimeMs")
    private final long processingTimeMs;

    public CampaignAnalysisResult(List<AttackCampaign> detectedCampaigns,
                                  List<AttackCampaign> newCampaigns,
                                  List<AttackCampaign> updatedCampaigns,
                                  Map<String, List<String>> campaignCorrelations,
                                  List<ThreatIndicator> emittedIndicators,
                                  Instant analysisTimestamp,
                                  long processingTimeMs) {
        this.detectedCampaigns = List.copyOf(detectedCampaigns);
        this.newCampaigns = List.copyOf(newCampaigns);
        this.updatedCampaigns = List.copyOf(updatedCampaigns);
        this.campaignCorrelations = Collections.unmodifiableMap(campaignCorrelations);
        this.emittedIndicators = List.copyOf(emittedIndicators);
        this.analysisTimestamp = analysisTimestamp;
        this.processingTimeMs = processingTimeMs;
    }

    public static CampaignAnalysisResult empty(Instant now) {
        return new CampaignAnalysisResult(List.of(), List.of(), List.of(), Map.of(), List.of(), now, 0L);
    }

    public List<AttackCampaign> getDetectedCampaigns() {
        return detectedCampaigns;
    }

    public List<AttackCampaign> getNewCampaigns() {
        return newCampaigns;
    }

    public List<AttackCampaign> getUpdatedCampaigns() {
        return updatedCampaigns;
    }

    public Map<String, List<String>> getCampaignCorrelations() {
        return campaignCorrelations;
    }

    public List<ThreatIndicator> getEmittedIndicators() {
        return emittedIndicators;
    }

    public Instant getAnalysisTimestamp() {
        return analysisTimestamp;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }
}
