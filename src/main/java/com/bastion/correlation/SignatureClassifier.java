package com.bastion.correlation;

import com.bastion.domain.CampaignEvent;
import com.bastion.domain.CampaignType;
import com.bastion.domain.ThreatActor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Assigns a campaign type and threat actor to a group of events by scoring it
 * against the signature catalogue.
 *
 * A signature's score is the fraction of its predicates the group satisfies. The
 * highest-scoring signature wins, earlier catalogue entries winning ties, but only
 * if its score reaches the signature's own threshold. Otherwise the group is
 * classified from its source/target spread alone.
 */
public class SignatureClassifier {

    private static final Logger log = LoggerFactory.getLogger(SignatureClassifier.class);

    private final SignatureCatalog catalog;

    public SignatureClassifier(SignatureCatalog catalog) {
        this.catalog = catalog;
    }

    public Classification classify(List<CampaignEvent> events) {
        AttackSignature best = null;
        double bestScore = 0.0;

        for (AttackSignature signature : catalog.getSignatures()) {
            double score = score(events, signature);
            if (score > bestScore) {
                best = signature;
                bestScore = score;
            }
        }

        if (best != null && bestScore >= best.getConfidenceThreshold()) {
            log.debug("Signature {} matched {} events with score {}", best.getSignatureId(), events.size(), bestScore);
            return new Classification(best.getCampaignType(), best.getThreatActor(), bestScore, best.getSignatureId());
        }
        return fallback(events);
    }

    /**
     * Fraction of the signature's predicates satisfied by the events. A predicate
     * that throws counts as not satisfied.
     */
    public double score(List<CampaignEvent> events, AttackSignature signature) {
        List<IndicatorPredicate> predicates = signature.getIndicators();
        int matched = 0;
        for (IndicatorPredicate predicate : predicates) {
            try {
                if (predicate.test(events)) {
                    matched++;
                }
            } catch (RuntimeException e) {
                log.warn("Predicate {} failed for signature {}: {}", predicate.getName(),
                    signature.getSignatureId(), e.getMessage());
            }
        }
        return (double) matched / predicates.size();
    }

    /**
     * Coarse classification from the number of distinct source IPs and target users.
     */
    Classification fallback(List<CampaignEvent> events) {
        int ips = IndicatorPredicate.distinct(events, CampaignEvent::clientIp);
        int users = IndicatorPredicate.distinct(events, CampaignEvent::email);

        if (ips > 5 && users < 5) {
            return new Classification(CampaignType.CREDENTIAL_STUFFING, ThreatActor.CYBERCRIMINAL, 0.6, null);
        } else if (ips == 1 && users > 3) {
            return new Classification(CampaignType.BRUTE_FORCE, ThreatActor.AUTOMATED_TOOL, 0.7, null);
        } else if (ips > 3 && users > 3) {
            return new Classification(CampaignType.DISTRIBUTED_ATTACK, ThreatActor.CYBERCRIMINAL, 0.5, null);
        }
        return new Classification(CampaignType.UNKNOWN, null, 0.3, null);
    }

    public SignatureCatalog getCatalog() {
        return catalog;
    }
}
