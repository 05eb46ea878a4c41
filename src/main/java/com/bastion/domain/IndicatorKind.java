package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of threat indicators held by the indicator store.
 */
public enum IndicatorKind {
    IP("ip"),
    CIDR("cidr"),
    DOMAIN("domain"),
    URL("url"),
    EMAIL("email"),
    USER_AGENT("user_agent"),
    HASH("hash"),
    PATTERN("pattern");

    private final String value;

    IndicatorKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static IndicatorKind fromValue(String value) {
        for (IndicatorKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown indicator kind: " + value);
    }
}
