package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Counts of live indicators by kind, reputation level and source.
 */
public class IndicatorStatistics {

    @JsonProperty("totalIndicators")
    private final int totalIndicators;

    @JsonProperty("byKind")
    private final Map<String, Long> byKind;

    @JsonProperty("byReputation")
    private final Map<String, Long> byReputation;

    @JsonProperty("bySource")
    private final Map<String, Long> bySource;

    public IndicatorStatistics(int totalIndicators, Map<String, Long> byKind,
                               Map<String, Long> byReputation, Map<String, Long> bySource) {
        this.totalIndicators = totalIndicators;
        this.byKind = Map.copyOf(byKind);
        this.byReputation = Map.copyOf(byReputation);
        this.bySource = Map.copyOf(bySource);
    }

    public int getTotalIndicators() {
        return totalIndicators;
    }

    public Map<String, Long> getByKind() {
        return byKind;
    }

    public Map<String, Long> getByReputation() {
        return byReputation;
    }

    public Map<String, Long> getBySource() {
        return bySource;
    }
}
