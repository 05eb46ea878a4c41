package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A coordinated attack campaign: the ordered events attributed to it plus the
 * sets and distributions derived from those events.
 *
 * Invariants maintained by {@link #addEvent(CampaignEvent)}:
 * lastSeen is the latest event timestamp, totalAttempts equals the number of events,
 * and sourceIPs, targetUsers and userAgents are exactly the values carried by the events.
 *
 * Instances are owned by the campaign store and mutated only under its write lock.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AttackCampaign {

    @JsonProperty("campaignId")
    private String campaignId;

    @JsonProperty("campaignType")
    private CampaignType campaignType = CampaignType.UNKNOWN;

    @JsonProperty("threatActor")
    private ThreatActor threatActor;

    @JsonProperty("firstSeen")
    private Instant firstSeen;

    @JsonProperty("lastSeen")
    private Instant lastSeen;

    @JsonProperty("events")
    private List<CampaignEvent> events = new ArrayList<>();

    @JsonProperty("targetUsers")
    private Set<String> targetUsers = new LinkedHashSet<>();

    @JsonProperty("sourceIPs")
    private Set<String> sourceIps = new LinkedHashSet<>();

    @JsonProperty("userAgents")
    private Set<String> userAgents = new LinkedHashSet<>();

    /**
     * Attempts per country
     */
    @JsonProperty("geoDistribution")
    private Map<String, Integer> geoDistribution = new LinkedHashMap<>();

    /**
     * Attempts per UTC hour bucket, keyed "hour_HH"
     */
    @JsonProperty("temporalDistribution")
    private Map<String, Integer> temporalDistribution = new LinkedHashMap<>();

    @JsonProperty("totalAttempts")
    private int totalAttempts;

    @JsonProperty("attributionConfidence")
    private double attributionConfidence;

    @JsonProperty("relatedCampaignIds")
    private List<String> relatedCampaignIds = new ArrayList<>();

    @JsonProperty("iocs")
    private List<String> iocs = new ArrayList<>();

    @JsonIgnore
    private final Set<String> eventIds = new HashSet<>();

    public AttackCampaign() {
    }

    public AttackCampaign(String campaignId, CampaignType campaignType, ThreatActor threatActor,
                          double attributionConfidence) {
        this.campaignId = campaignId;
        this.campaignType = campaignType != null ? campaignType : CampaignType.UNKNOWN;
        this.threatActor = threatActor;
        this.attributionConfidence = attributionConfidence;
    }

    /**
     * Append an event and fold it into the derived fields.
     *
     * @return false if an event with the same id is already part of this campaign
     */
    public boolean addEvent(CampaignEvent event) {
        if (!eventIds.add(event.getEventId())) {
            return false;
        }
        events.add(event);
        absorb(event);
        totalAttempts = events.size();
        return true;
    }

    private void absorb(CampaignEvent event) {
        Instant ts = event.getTimestamp();
        if (lastSeen == null || ts.isAfter(lastSeen)) {
            lastSeen = ts;
        }
        if (firstSeen == null || ts.isBefore(firstSeen)) {
            firstSeen = ts;
        }

        AuthAttempt attempt = event.getAttempt();
        if (attempt.getEmail() != null) {
            targetUsers.add(attempt.getEmail());
        }
        if (attempt.getClientIp() != null) {
            sourceIps.add(attempt.getClientIp());
        }
        if (attempt.getUserAgent() != null) {
            userAgents.add(attempt.getUserAgent());
        }

        GeoLocation geo = attempt.getGeolocation();
        if (geo != null && geo.getCountry() != null) {
            geoDistribution.merge(geo.getCountry(), 1, Integer::sum);
        }

        int hour = ts.atZone(ZoneOffset.UTC).getHour();
        temporalDistribution.merge(String.format("hour_%02d", hour), 1, Integer::sum);
    }

    /**
     * Recompute every derived field from the event list. Used after loading a
     * snapshot so that persisted aggregates cannot drift from their events.
     */
    public void rebuildDerivedState() {
        if (events.isEmpty()) {
            totalAttempts = 0;
            return;
        }
        List<CampaignEvent> snapshot = new ArrayList<>(events);
        events.clear();
        eventIds.clear();
        targetUsers.clear();
        sourceIps.clear();
        userAgents.clear();
        geoDistribution.clear();
        temporalDistribution.clear();
        firstSeen = null;
        lastSeen = null;
        for (CampaignEvent event : snapshot) {
            addEvent(event);
        }
    }

    public boolean containsEvent(String eventId) {
        return eventIds.contains(eventId);
    }

    public void addRelatedCampaign(String otherCampaignId) {
        if (!campaignId.equals(otherCampaignId) && !relatedCampaignIds.contains(otherCampaignId)) {
            relatedCampaignIds.add(otherCampaignId);
        }
    }

    public void addIoc(String ioc) {
        if (!iocs.contains(ioc)) {
            iocs.add(ioc);
        }
    }

    @JsonIgnore
    public Duration getDuration() {
        if (firstSeen == null || lastSeen == null) {
            return Duration.ZERO;
        }
        return Duration.between(firstSeen, lastSeen);
    }

    /**
     * Overall threat score combining volume, source spread, target spread and attribution.
     */
    public double campaignScore() {
        double score = 0.0;
        score += Math.min(events.size() / 100.0, 1.0) * 0.3;
        score += Math.min(sourceIps.size() / 50.0, 1.0) * 0.2;
        score += Math.min(targetUsers.size() / 20.0, 1.0) * 0.2;
        score += attributionConfidence * 0.3;
        return Math.min(score, 1.0);
    }

    public String getCampaignId() {
        return campaignId;
    }

    public void setCampaignId(String campaignId) {
        this.campaignId = campaignId;
    }

    public CampaignType getCampaignType() {
        return campaignType;
    }

    public void setCampaignType(CampaignType campaignType) {
        this.campaignType = campaignType != null ? campaignType : CampaignType.UNKNOWN;
    }

    public ThreatActor getThreatActor() {
        return threatActor;
    }

    public void setThreatActor(ThreatActor threatActor) {
        this.threatActor = threatActor;
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

    public List<CampaignEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public void setEvents(List<CampaignEvent> events) {
        this.events = events != null ? new ArrayList<>(events) : new ArrayList<>();
    }

    public Set<String> getTargetUsers() {
        return Collections.unmodifiableSet(targetUsers);
    }

    public void setTargetUsers(Set<String> targetUsers) {
        this.targetUsers = targetUsers != null ? new LinkedHashSet<>(targetUsers) : new LinkedHashSet<>();
    }

    public Set<String> getSourceIps() {
        return Collections.unmodifiableSet(sourceIps);
    }

    public void setSourceIps(Set<String> sourceIps) {
        this.sourceIps = sourceIps != null ? new LinkedHashSet<>(sourceIps) : new LinkedHashSet<>();
    }

    public Set<String> getUserAgents() {
        return Collections.unmodifiableSet(userAgents);
    }

    public void setUserAgents(Set<String> userAgents) {
        this.userAgents = userAgents != null ? new LinkedHashSet<>(userAgents) : new LinkedHashSet<>();
    }

    public Map<String, Integer> getGeoDistribution() {
        return Collections.unmodifiableMap(geoDistribution);
    }

    public void setGeoDistribution(Map<String, Integer> geoDistribution) {
        this.geoDistribution = geoDistribution != null ? new LinkedHashMap<>(geoDistribution) : new LinkedHashMap<>();
    }

    public Map<String, Integer> getTemporalDistribution() {
        return Collections.unmodifiableMap(temporalDistribution);
    }

    public void setTemporalDistribution(Map<String, Integer> temporalDistribution) {
        this.temporalDistribution = temporalDistribution != null ? new LinkedHashMap<>(temporalDistribution) : new LinkedHashMap<>();
    }

    public int getTotalAttempts() {
        return totalAttempts;
    }

    public void setTotalAttempts(int totalAttempts) {
        this.totalAttempts = totalAttempts;
    }

    public double getAttributionConfidence() {
        return attributionConfidence;
    }

    public void setAttributionConfidence(double attributionConfidence) {
        this.attributionConfidence = attributionConfidence;
    }

    public List<String> getRelatedCampaignIds() {
        return Collections.unmodifiableList(relatedCampaignIds);
    }

    public void setRelatedCampaignIds(List<String> relatedCampaignIds) {
        this.relatedCampaignIds = relatedCampaignIds != null ? new ArrayList<>(relatedCampaignIds) : new ArrayList<>();
    }

    public List<String> getIocs() {
        return Collections.unmodifiableList(iocs);
    }

    public void setIocs(List<String> iocs) {
        this.iocs = iocs != null ? new ArrayList<>(iocs) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "AttackCampaign{" + campaignId + ", type=" + campaignType + ", actor=" + threatActor
            + ", events=" + events.size() + ", ips=" + sourceIps.size() + ", users=" + targetUsers.size() + "}";
    }
}
