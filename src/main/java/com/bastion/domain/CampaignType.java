package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of attack campaigns the correlation engine attributes.
 */
public enum CampaignType {
    BRUTE_FORCE("brute_force"),
    CREDENTIAL_STUFFING("credential_stuffing"),
    ACCOUNT_TAKEOVER("account_takeover"),
    DISTRIBUTED_ATTACK("distributed_attack"),
    APT_CAMPAIGN("apt_campaign"),
    BOTNET_ACTIVITY("botnet_activity"),
    UNKNOWN("unknown");

    private final String value;

    CampaignType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CampaignType fromValue(String value) {
        for (CampaignType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
