package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one attempt inside a campaign. Once assigned, an event is
 * owned by exactly one campaign.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CampaignEvent {

    @JsonProperty("eventId")
    private final String eventId;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("attempt")
    private final AuthAttempt attempt;

    @JsonProperty("signal")
    private final ThreatSignal signal;

    @JsonProperty("confidenceScore")
    private final double confidenceScore;

    @JsonCreator
    public CampaignEvent(@JsonProperty("eventId") String eventId,
                         @JsonProperty("timestamp") Instant timestamp,
                         @JsonProperty("attempt") AuthAttempt attempt,
                         @JsonProperty("signal") ThreatSignal signal,
                         @JsonProperty("confidenceScore") double confidenceScore) {
        this.eventId = Objects.requireNonNull(eventId, "eventId");
        this.attempt = attempt != null ? attempt : new AuthAttempt();
        this.signal = signal != null ? signal : ThreatSignal.empty();
        Instant ts = timestamp != null ? timestamp : this.attempt.getTimestamp();
        this.timestamp = ts != null ? ts : Instant.EPOCH;
        this.confidenceScore = confidenceScore;
    }

    public String getEventId() {
        return eventId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public AuthAttempt getAttempt() {
        return attempt;
    }

    public ThreatSignal getSignal() {
        return signal;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public String clientIp() {
        return attempt.getClientIp();
    }

    public String email() {
        return attempt.getEmail();
    }

    public String userAgent() {
        return attempt.getUserAgent();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CampaignEvent)) return false;
        return eventId.equals(((CampaignEvent) o).eventId);
    }

    @Override
    public int hashCode() {
        return eventId.hashCode();
    }

    @Override
    public String toString() {
        return "CampaignEvent{" + eventId + ", ip=" + clientIp() + ", user=" + email() + ", at=" + timestamp + "}";
    }
}
