package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Aggregated reputation judgment for one IP address, combining local indicator
 * matches with external feed signals. Ephemeral: cached briefly, never persisted.
 */
public class ReputationVerdict {

    @JsonProperty("ip")
    private final String ip;

    @JsonProperty("reputationLevel")
    private final ReputationLevel reputationLevel;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("sources")
    private final Set<String> sources;

    @JsonProperty("tags")
    private final Set<String> tags;

    @JsonProperty("firstSeen")
    private final Instant firstSeen;

    @JsonProperty("lastSeen")
    private final Instant lastSeen;

    /**
     * Raw per-source payloads, keyed by source name
     */
    @JsonProperty("additionalInfo")
    private final Map<String, Object> additionalInfo;

    public ReputationVerdict(String ip, ReputationLevel reputationLevel, double confidence,
                             Set<String> sources, Set<String> tags,
                             Instant firstSeen, Instant lastSeen,
                             Map<String, Object> additionalInfo) {
        this.ip = ip;
        this.reputationLevel = reputationLevel != null ? reputationLevel : ReputationLevel.CLEAN;
        this.confidence = confidence;
        this.sources = sources != null ? new LinkedHashSet<>(sources) : new LinkedHashSet<>();
        this.tags = tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>();
        this.firstSeen = firstSeen;
        this.lastSeen = lastSeen;
        this.additionalInfo = additionalInfo != null ? new LinkedHashMap<>(additionalInfo) : new LinkedHashMap<>();
    }

    public static ReputationVerdict clean(String ip) {
        return new ReputationVerdict(ip, ReputationLevel.CLEAN, 0.0, null, null, null, null, null);
    }

    public String getIp() {
        return ip;
    }

    public ReputationLevel getReputationLevel() {
        return reputationLevel;
    }

    public double getConfidence() {
        return confidence;
    }

    public Set<String> getSources() {
        return sources;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public Map<String, Object> getAdditionalInfo() {
        return additionalInfo;
    }

    @Override
    public String toString() {
        return "ReputationVerdict{ip=" + ip + ", level=" + reputationLevel
            + ", confidence=" + confidence + ", sources=" + sources + "}";
    }
}
