package com.bastion.correlation;

import com.bastion.domain.CampaignType;
import com.bastion.domain.ThreatActor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered list of attack signatures. Declaration order matters: it breaks score
 * ties during classification.
 */
public final class SignatureCatalog {

    private static final Logger log = LoggerFactory.getLogger(SignatureCatalog.class);

    private final List<AttackSignature> signatures;

    public SignatureCatalog(List<AttackSignature> signatures) {
        if (signatures == null || signatures.isEmpty()) {
            throw new InvalidConfigurationException("Signature catalogue must not be empty");
        }
        Set<String> ids = new HashSet<>();
        for (AttackSignature signature : signatures) {
            if (!ids.add(signature.getSignatureId())) {
                throw new InvalidConfigurationException("Duplicate signature id: " + signature.getSignatureId());
            }
        }
        this.signatures = List.copyOf(signatures);
    }

    /**
     * Built-in catalogue covering brute force, credential stuffing, account
     * takeover, APT and botnet activity.
     */
    public static SignatureCatalog defaults() {
        List<AttackSignature> signatures = new ArrayList<>();
        signatures.add(new AttackSignature("bf_rapid_attempts", "Rapid Brute Force Attempts",
            "Multiple failed login attempts in rapid succession from the same source",
            List.of(IndicatorPredicate.RAPID_ATTEMPTS, IndicatorPredicate.MULTIPLE_FAILURES, IndicatorPredicate.SAME_IP),
            0.8, CampaignType.BRUTE_FORCE, ThreatActor.AUTOMATED_TOOL));
        signatures.add(new AttackSignature("cs_distributed", "Distributed Credential Stuffing",
            "Credential stuffing spread over many source addresses",
            List.of(IndicatorPredicate.MULTIPLE_IPS, IndicatorPredicate.COMMON_PASSWORDS, IndicatorPredicate.LOW_SUCCESS_RATE),
            0.7, CampaignType.CREDENTIAL_STUFFING, ThreatActor.CYBERCRIMINAL));
        signatures.add(new AttackSignature("ato_location_anomaly", "Account Takeover via Location Anomaly",
            "Successful logins from unusual locations and devices",
            List.of(IndicatorPredicate.LOCATION_ANOMALY, IndicatorPredicate.DEVICE_CHANGE, IndicatorPredicate.SUCCESSFUL_LOGIN),
            0.6, CampaignType.ACCOUNT_TAKEOVER, ThreatActor.CYBERCRIMINAL));
        signatures.add(new AttackSignature("apt_persistent", "Persistent APT Activity",
            "Long-running, targeted attempts using evasion techniques",
            List.of(IndicatorPredicate.PERSISTENT_ATTEMPTS, IndicatorPredicate.SPECIFIC_TARGETS, IndicatorPredicate.ADVANCED_EVASION),
            0.9, CampaignType.APT_CAMPAIGN, ThreatActor.NATION_STATE));
        signatures.add(new AttackSignature("botnet_distributed", "Botnet Distributed Attack",
            "Coordinated attempts from many sources with uniform timing and tooling",
            List.of(IndicatorPredicate.DISTRIBUTED_SOURCES, IndicatorPredicate.COORDINATED_TIMING, IndicatorPredicate.SIMILAR_PATTERNS),
            0.8, CampaignType.BOTNET_ACTIVITY, ThreatActor.CYBERCRIMINAL));
        return new SignatureCatalog(signatures);
    }

    /**
     * Read a catalogue from a JSON array of signature objects.
     *
     * @throws InvalidConfigurationException if the file cannot be read or describes an invalid signature
     */
    public static SignatureCatalog fromFile(Path path, ObjectMapper objectMapper) {
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new InvalidConfigurationException("Cannot read signature catalogue " + path, e);
        }
        if (root == null || !root.isArray()) {
            throw new InvalidConfigurationException("Signature catalogue " + path + " must be a JSON array");
        }

        List<AttackSignature> signatures = new ArrayList<>();
        for (JsonNode node : root) {
            signatures.add(parseSignature(node));
        }
        log.info("Loaded {} attack signatures from {}", signatures.size(), path);
        return new SignatureCatalog(signatures);
    }

    private static AttackSignature parseSignature(JsonNode node) {
        String id = node.path("signatureId").asText(null);
        List<IndicatorPredicate> indicators = new ArrayList<>();
        for (JsonNode indicator : node.path("indicators")) {
            indicators.add(IndicatorPredicate.fromName(indicator.asText()));
        }
        if (!node.path("confidenceThreshold").isNumber()) {
            throw new InvalidConfigurationException("Signature " + id + " needs a numeric confidenceThreshold");
        }

        if (!node.path("campaignType").isTextual()) {
            throw new InvalidConfigurationException("Signature " + id + " needs a campaignType");
        }
        CampaignType type = CampaignType.fromValue(node.path("campaignType").asText());
        JsonNode actorNode = node.path("threatActor");
        ThreatActor actor = actorNode.isTextual() ? ThreatActor.fromValue(actorNode.asText()) : null;

        return new AttackSignature(id,
            node.path("name").asText(id),
            node.path("description").asText(null),
            indicators,
            node.path("confidenceThreshold").asDouble(),
            type,
            actor);
    }

    public List<AttackSignature> getSignatures() {
        return signatures;
    }

    public int size() {
        return signatures.size();
    }
}
