package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reputation levels ordered by severity: critical > malicious > suspicious > clean.
 */
public enum ReputationLevel {
    CLEAN("clean", 0),
    SUSPICIOUS("suspicious", 1),
    MALICIOUS("malicious", 2),
    CRITICAL("critical", 3);

    private final String value;
    private final int severity;

    ReputationLevel(String value, int severity) {
        this.value = value;
        this.severity = severity;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int severity() {
        return severity;
    }

    public boolean isMoreSevereThan(ReputationLevel other) {
        return other == null || severity > other.severity;
    }

    /**
     * Returns the more severe of the two levels. Never downgrades.
     */
    public static ReputationLevel max(ReputationLevel a, ReputationLevel b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.severity > a.severity ? b : a;
    }

    @JsonCreator
    public static ReputationLevel fromValue(String value) {
        for (ReputationLevel level : values()) {
            if (level.value.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown reputation level: " + value);
    }
}
