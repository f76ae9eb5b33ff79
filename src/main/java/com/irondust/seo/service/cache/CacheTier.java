package com.irondust.seo.service.cache;

/**
 * Logical cache partitions. Each tier's TTL is a multiple of the configured default.
 */
public enum CacheTier {
    VALIDATION("validation", 1.0),
    METRICS("metrics", 1.0),
    KEYWORDS("keywords", 2.0),
    READABILITY("readability", 2.0),
    TITLE_UNIQUE("title_unique", 0.5),
    RETRY_STRATEGY("retry_strategy", 1.0);

    private final String code;
    private final double ttlFactor;

    CacheTier(String code, double ttlFactor) {
        this.code = code;
        this.ttlFactor = ttlFactor;
    }

    public String code() {
        return code;
    }

    public long ttlSeconds(long defaultTtlSeconds) {
        return Math.round(defaultTtlSeconds * ttlFactor);
    }
}
