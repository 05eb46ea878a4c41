package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A reusable threat signal (IP, network block, user agent, pattern, ...) with a
 * reputation level, confidence and optional time to live.
 *
 * Indicators are owned by the indicator store. They are created by feed ingestion
 * or by the campaign engine and removed once {@link #isExpired(Instant)} holds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThreatIndicator {

    /**
     * Source name used for indicators minted from detected campaigns
     */
    public static final String SOURCE_INTERNAL = "internal";

    @JsonProperty("value")
    private String value;

    @JsonProperty("kind")
    private IndicatorKind kind;

    @JsonProperty("reputationLevel")
    private ReputationLevel reputationLevel = ReputationLevel.SUSPICIOUS;

    @JsonProperty("source")
    private String source = SOURCE_INTERNAL;

    @JsonProperty("firstSeen")
    private Instant firstSeen;

    @JsonProperty("lastSeen")
    private Instant lastSeen;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("tags")
    private Set<String> tags = new LinkedHashSet<>();

    @JsonProperty("description")
    private String description;

    /**
     * Time to live in seconds, measured from lastSeen. Null means the indicator never expires.
     */
    @JsonProperty("ttlSeconds")
    private Long ttlSeconds;

    public ThreatIndicator() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Storage key, unique per kind and value.
     */
    @JsonIgnore
    public String getKey() {
        return key(kind, value);
    }

    public static String key(IndicatorKind kind, String value) {
        return (kind != null ? kind.getValue() : "unknown") + ":" + value;
    }

    @JsonIgnore
    public boolean isExpired() {
        return isExpired(Instant.now());
    }

    public boolean isExpired(Instant now) {
        if (ttlSeconds == null) {
            return false;
        }
        if (lastSeen == null) {
            return true;
        }
        return Duration.between(lastSeen, now).getSeconds() > ttlSeconds;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public IndicatorKind getKind() {
        return kind;
    }

    public void setKind(IndicatorKind kind) {
        this.kind = kind;
    }

    public ReputationLevel getReputationLevel() {
        return reputationLevel;
    }

    public void setReputationLevel(ReputationLevel reputationLevel) {
        this.reputationLevel = reputationLevel;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public void setFirstSeen(Instant firstSeen) {
        this.firstSeen = firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public void setLastSeen(Instant lastSeen) {
        this.lastSeen = lastSeen;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public Set<String> getTags() {
        return tags;
    }

    public void setTags(Set<String> tags) {
        this.tags = tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>();
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(Long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    @Override
    public String toString() {
        return "ThreatIndicator{" + getKey() + ", level=" + reputationLevel
            + ", source=" + source + ", confidence=" + confidence + "}";
    }

    public static class Builder {
        private final ThreatIndicator indicator;

        public Builder() {
            this.indicator = new ThreatIndicator();
        }

        public Builder value(String value) {
            indicator.value = value;
            return this;
        }

        public Builder kind(IndicatorKind kind) {
            indicator.kind = kind;
            return this;
        }

        public Builder reputationLevel(ReputationLevel reputationLevel) {
            indicator.reputationLevel = reputationLevel;
            return this;
        }

        public Builder source(String source) {
            indicator.source = source;
            return this;
        }

        public Builder firstSeen(Instant firstSeen) {
            indicator.firstSeen = firstSeen;
            return this;
        }

        public Builder lastSeen(Instant lastSeen) {
            indicator.lastSeen = lastSeen;
            return this;
        }

        public Builder confidence(double confidence) {
            indicator.confidence = confidence;
            return this;
        }

        public Builder tags(Collection<String> tags) {
            indicator.tags = new LinkedHashSet<>(tags);
            return this;
        }

        public Builder tag(String tag) {
            indicator.tags.add(tag);
            return this;
        }

        public Builder description(String description) {
            indicator.description = description;
            return this;
        }

        public Builder ttlSeconds(Long ttlSeconds) {
            indicator.ttlSeconds = ttlSeconds;
            return this;
        }

        public ThreatIndicator build() {
            Instant now = Instant.now();
            if (indicator.firstSeen == null) {
                indicator.firstSeen = indicator.lastSeen != null ? indicator.lastSeen : now;
            }
            if (indicator.lastSeen == null) {
                indicator.lastSeen = indicator.firstSeen;
            }
            return indicator;
        }
    }
}
