package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Threat picture for a single authentication attempt: the IP verdict, every
 * indicator the attempt matched, and the combined risk score.
 */
public class ThreatContext {

    @JsonProperty("verdict")
    private final ReputationVerdict verdict;

    @JsonProperty("matchedIndicators")
    private final List<ThreatIndicator> matchedIndicators;

    @JsonProperty("riskScore")
    private final double riskScore;

    @JsonProperty("threatCategories")
    private final List<String> threatCategories;

    @JsonProperty("attribution")
    private final String attribution;

    public ThreatContext(ReputationVerdict verdict, List<ThreatIndicator> matchedIndicators,
                         double riskScore, List<String> threatCategories, String attribution) {
        this.verdict = verdict;
        this.matchedIndicators = List.copyOf(matchedIndicators);
        this.riskScore = riskScore;
        this.threatCategories = List.copyOf(threatCategories);
        this.attribution = attribution;
    }

    public ReputationVerdict getVerdict() {
        return verdict;
    }

    public List<ThreatIndicator> getMatchedIndicators() {
        return matchedIndicators;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public List<String> getThreatCategories() {
        return threatCategories;
    }

    public String getAttribution() {
        return attribution;
    }
}
