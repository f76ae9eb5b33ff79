package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Why an optimization session stopped. */
public enum TerminationReason {
    INITIAL_COMPLIANCE("initial_compliance"),
    COMPLIANCE_ACHIEVED("compliance_achieved"),
    MAX_ITERATIONS_REACHED("max_iterations_reached"),
    STAGNATION_DETECTED("stagnation_detected"),
    INSUFFICIENT_IMPROVEMENT("insufficient_improvement"),
    CYCLE_FAILED("cycle_failed"),
    CRITICAL_ERROR("critical_error");

    private final String code;

    TerminationReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isCompliant() {
        return this == INITIAL_COMPLIANCE || this == COMPLIANCE_ACHIEVED;
    }
}
