package com.irondust.seo.service.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * What to do next after a failure. {@code action} is one of
 * {@code retry}, {@code max_attempts_reached} or {@code fallback}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecoveryDecision {
    public boolean success;
    public String action;
    public ErrorCategory category;
    public String strategy;
    public String nextStep;
    public Double backoffDelaySeconds;
    public Integer attemptNumber;
    public Map<String, Object> fallback;
    public String message;
}
