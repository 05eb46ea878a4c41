package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Threat actor categories used for campaign attribution.
 */
public enum ThreatActor {
    SCRIPT_KIDDIE("script_kiddie"),
    CYBERCRIMINAL("cybercriminal"),
    NATION_STATE("nation_state"),
    INSIDER_THREAT("insider_threat"),
    HACKTIVIST("hacktivist"),
    AUTOMATED_TOOL("automated_tool"),
    UNKNOWN("unknown");

    private final String value;

    ThreatActor(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ThreatActor fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ThreatActor actor : values()) {
            if (actor.value.equalsIgnoreCase(value) || actor.name().equalsIgnoreCase(value)) {
                return actor;
            }
        }
        return UNKNOWN;
    }
}
