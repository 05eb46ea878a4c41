package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-attempt threat scoring produced upstream of campaign detection.
 * The campaign engine only reads these fields; it never recomputes them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThreatSignal {

    @JsonProperty("ipReputationScore")
    private double ipReputationScore;

    @JsonProperty("knownAttackPatterns")
    private List<String> knownAttackPatterns = new ArrayList<>();

    @JsonProperty("threatActorIndicators")
    private List<String> threatActorIndicators = new ArrayList<>();

    @JsonProperty("similarAttacksDetected")
    private int similarAttacksDetected;

    @JsonProperty("bruteForce")
    private BruteForceIndicators bruteForce = new BruteForceIndicators();

    @JsonProperty("credentialStuffing")
    private CredentialStuffingIndicators credentialStuffing = new CredentialStuffingIndicators();

    @JsonProperty("accountTakeover")
    private AccountTakeoverIndicators accountTakeover = new AccountTakeoverIndicators();

    public ThreatSignal() {
    }

    public ThreatSignal(double ipReputationScore, List<String> knownAttackPatterns, int similarAttacksDetected) {
        this.ipReputationScore = ipReputationScore;
        setKnownAttackPatterns(knownAttackPatterns);
        this.similarAttacksDetected = similarAttacksDetected;
    }

    /**
     * Signal with no threat information, used when the upstream scorer supplied none.
     */
    public static ThreatSignal empty() {
        return new ThreatSignal();
    }

    public double getIpReputationScore() {
        return ipReputationScore;
    }

    public void setIpReputationScore(double ipReputationScore) {
        this.ipReputationScore = ipReputationScore;
    }

    public List<String> getKnownAttackPatterns() {
        return knownAttackPatterns;
    }

    public void setKnownAttackPatterns(List<String> knownAttackPatterns) {
        this.knownAttackPatterns = knownAttackPatterns != null ? new ArrayList<>(knownAttackPatterns) : new ArrayList<>();
    }

    public List<String> getThreatActorIndicators() {
        return threatActorIndicators;
    }

    public void setThreatActorIndicators(List<String> threatActorIndicators) {
        this.threatActorIndicators = threatActorIndicators != null ? new ArrayList<>(threatActorIndicators) : new ArrayList<>();
    }

    public int getSimilarAttacksDetected() {
        return similarAttacksDetected;
    }

    public void setSimilarAttacksDetected(int similarAttacksDetected) {
        this.similarAttacksDetected = similarAttacksDetected;
    }

    public BruteForceIndicators getBruteForce() {
        return bruteForce;
    }

    public void setBruteForce(BruteForceIndicators bruteForce) {
        this.bruteForce = bruteForce != null ? bruteForce : new BruteForceIndicators();
    }

    public CredentialStuffingIndicators getCredentialStuffing() {
        return credentialStuffing;
    }

    public void setCredentialStuffing(CredentialStuffingIndicators credentialStuffing) {
        this.credentialStuffing = credentialStuffing != null ? credentialStuffing : new CredentialStuffingIndicators();
    }

    public AccountTakeoverIndicators getAccountTakeover() {
        return accountTakeover;
    }

    public void setAccountTakeover(AccountTakeoverIndicators accountTakeover) {
        this.accountTakeover = accountTakeover != null ? accountTakeover : new AccountTakeoverIndicators();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BruteForceIndicators {
        @JsonProperty("rapidAttempts")
        private boolean rapidAttempts;

        @JsonProperty("multipleIps")
        private boolean multipleIps;

        @JsonProperty("passwordVariations")
        private boolean passwordVariations;

        public boolean isRapidAttempts() {
            return rapidAttempts;
        }

        public void setRapidAttempts(boolean rapidAttempts) {
            this.rapidAttempts = rapidAttempts;
        }

        public boolean isMultipleIps() {
            return multipleIps;
        }

        public void setMultipleIps(boolean multipleIps) {
            this.multipleIps = multipleIps;
        }

        public boolean isPasswordVariations() {
            return passwordVariations;
        }

        public void setPasswordVariations(boolean passwordVariations) {
            this.passwordVariations = passwordVariations;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CredentialStuffingIndicators {
        @JsonProperty("multipleAccounts")
        private boolean multipleAccounts;

        @JsonProperty("commonPasswords")
        private boolean commonPasswords;

        @JsonProperty("distributedSources")
        private boolean distributedSources;

        public boolean isMultipleAccounts() {
            return multipleAccounts;
        }

        public void setMultipleAccounts(boolean multipleAccounts) {
            this.multipleAccounts = multipleAccounts;
        }

        public boolean isCommonPasswords() {
            return commonPasswords;
        }

        public void setCommonPasswords(boolean commonPasswords) {
            this.commonPasswords = commonPasswords;
        }

        public boolean isDistributedSources() {
            return distributedSources;
        }

        public void setDistributedSources(boolean distributedSources) {
            this.distributedSources = distributedSources;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AccountTakeoverIndicators {
        @JsonProperty("locationAnomaly")
        private boolean locationAnomaly;

        @JsonProperty("deviceChange")
        private boolean deviceChange;

        @JsonProperty("behaviorChange")
        private boolean behaviorChange;

        @JsonProperty("privilegeEscalation")
        private boolean privilegeEscalation;

        public boolean isLocationAnomaly() {
            return locationAnomaly;
        }

        public void setLocationAnomaly(boolean locationAnomaly) {
            this.locationAnomaly = locationAnomaly;
        }

        public boolean isDeviceChange() {
            return deviceChange;
        }

        public void setDeviceChange(boolean deviceChange) {
            this.deviceChange = deviceChange;
        }

        public boolean isBehaviorChange() {
            return behaviorChange;
        }

        public void setBehaviorChange(boolean behaviorChange) {
            this.behaviorChange = behaviorChange;
        }

        public boolean isPrivilegeEscalation() {
            return privilegeEscalation;
        }

        public void setPrivilegeEscalation(boolean privilegeEscalation) {
            this.privilegeEscalation = privilegeEscalation;
        }
    }
}
