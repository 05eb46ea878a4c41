package com.bastion.correlation;

import com.bastion.domain.CampaignType;
import com.bastion.domain.ThreatActor;

import java.util.List;

/**
 * A named pattern of indicator predicates. A group of events matches the signature
 * to the degree that it satisfies the predicates; the signature applies once that
 * degree reaches its confidence threshold.
 */
public final class AttackSignature {

    private final String signatureId;
    private final String name;
    private final String description;
    private final List<IndicatorPredicate> indicators;
    private final double confidenceThreshold;
    private final CampaignType campaignType;
    private final ThreatActor threatActor;

    public AttackSignature(String signatureId, String name, String description,
                           List<IndicatorPredicate> indicators, double confidenceThreshold,
                           CampaignType campaignType, ThreatActor threatActor) {
        if (signatureId == null || signatureId.isBlank()) {
            throw new InvalidConfigurationException("Signature id must not be empty");
        }
        if (indicators == null || indicators.isEmpty()) {
            throw new InvalidConfigurationException("Signature " + signatureId + " has no indicators");
        }
        if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new InvalidConfigurationException(
                "Signature " + signatureId + " threshold must be within [0,1]: " + confidenceThreshold);
        }
        if (campaignType == null) {
            throw new InvalidConfigurationException("Signature " + signatureId + " has no campaign type");
        }
        this.signatureId = signatureId;
        this.name = name != null ? name : signatureId;
        this.description = description;
        this.indicators = List.copyOf(indicators);
        this.confidenceThreshold = confidenceThreshold;
        this.campaignType = campaignType;
        this.threatActor = threatActor;
    }

    public String getSignatureId() {
        return signatureId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<IndicatorPredicate> getIndicators() {
        return indicators;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public CampaignType getCampaignType() {
        return campaignType;
    }

    public ThreatActor getThreatActor() {
        return threatActor;
    }

    @Override
    public String toString() {
        return "AttackSignature{" + signatureId + ", type=" + campaignType.getValue() + ", indicators=" + indicators + "}";
    }
}
