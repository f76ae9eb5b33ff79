package com.irondust.seo.service.retry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** What an attempt knows about itself. */
public final class RetryContext {
    private final int attempt;
    private final int maxAttempts;
    private final String strategy;
    private final Map<String, Object> values;

    public RetryContext(int attempt, int maxAttempts, String strategy, Map<String, Object> values) {
        this.attempt = attempt;
        this.maxAttempts = maxAttempts;
        this.strategy = strategy;
        this.values = values != null ? Collections.unmodifiableMap(new LinkedHashMap<>(values)) : Map.of();
    }

    /** 1-based */
    public int getAttempt() { return attempt; }
    public int getMaxAttempts() { return maxAttempts; }
    /** Strategy applied to the content before this attempt, or "none" */
    public String getStrategy() { return strategy; }
    public Map<String, Object> getValues() { return values; }

    public Object get(String key) {
        return values.get(key);
    }
}
