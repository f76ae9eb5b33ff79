package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Issue severity. The weight scales an issue's penalty in the compliance score.
 */
public enum Severity {
    CRITICAL("critical", 3.0),
    MAJOR("major", 2.0),
    MINOR("minor", 1.0);

    private final String code;
    private final double weight;

    Severity(String code, double weight) {
        this.code = code;
        this.weight = weight;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public double weight() {
        return weight;
    }

    @JsonCreator
    public static Severity fromCode(String code) {
        for (Severity s : values()) {
            if (s.code.equalsIgnoreCase(code)) return s;
        }
        throw new IllegalArgumentException("Unknown severity: " + code);
    }
}
