package com.irondust.seo.service.cache;

import com.fasterxml.jackson.databind.JsonNode;

/** On-disk and in-memory representation of one store value. */
class StoredEntry {
    public JsonNode value;
    /** Epoch millis after which the entry is gone; 0 = never */
    public long expiresAt;

    StoredEntry() {}

    StoredEntry(JsonNode value, long expiresAt) {
        this.value = value;
        this.expiresAt = expiresAt;
    }

    boolean isExpired(long nowMillis) {
        return expiresAt > 0 && nowMillis >= expiresAt;
    }

    static long expiry(long nowMillis, long ttlSeconds) {
        return ttlSeconds > 0 ? nowMillis + ttlSeconds * 1000L : 0L;
    }
}
