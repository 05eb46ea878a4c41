package com.bastion.correlation;

import com.bastion.domain.CampaignType;
import com.bastion.domain.ThreatActor;

/**
 * Result of classifying a group of events: campaign type, likely actor and the
 * confidence of the attribution. {@code signatureId} is null when the coarse
 * fallback heuristic produced the result.
 */
public final class Classification {

    private final CampaignType campaignType;
    private final ThreatActor threatActor;
    private final double confidence;
    private final String signatureId;

    public Classification(CampaignType campaignType, ThreatActor threatActor, double confidence, String signatureId) {
        this.campaignType = campaignType;
        this.threatActor = threatActor;
        this.confidence = confidence;
        this.signatureId = signatureId;
    }

    public CampaignType getCampaignType() {
        return campaignType;
    }

    public ThreatActor getThreatActor() {
        return threatActor;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getSignatureId() {
        return signatureId;
    }

    public boolean isFromSignature() {
        return signatureId != null;
    }

    @Override
    public String toString() {
        return "Classification{" + campaignType.getValue() + ", actor=" + threatActor
            + ", confidence=" + confidence + ", signature=" + signatureId + "}";
    }
}
