package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How far a partially failed operation fell short, by share of sub-operations that succeeded.
 */
public enum DegradationLevel {
    MINOR("minor"),
    MODERATE("moderate"),
    SEVERE("severe");

    private final String code;

    DegradationLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * minor at 70% success or more, moderate at 40% or more, severe below.
     */
    public static DegradationLevel fromSuccessRate(double successRate) {
        if (successRate >= 0.7) return MINOR;
        if (successRate >= 0.4) return MODERATE;
        return SEVERE;
    }

    public static DegradationLevel fromCounts(int succeeded, int failed) {
        int total = succeeded + failed;
        if (total == 0) return MINOR;
        return fromSuccessRate((double) succeeded / total);
    }
}
