package com.geomonitor.gatewayservice.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Subscription level of an API key. The set is closed: quota ceilings are
 * looked up with an exhaustive switch over these constants.
 */
public enum PlanTier {
    FREE("free"),
    STARTER("starter"),
    PRO("pro"),
    ENTERPRISE("enterprise");

    private final String value;

    PlanTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<PlanTier> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(tier -> tier.value.equals(normalized))
                .findFirst();
    }

    /**
     * Strict parsing for API input, unknown tiers are rejected.
     */
    @JsonCreator
    public static PlanTier parse(String value) {
        return fromValue(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown plan tier: " + value));
    }
}
