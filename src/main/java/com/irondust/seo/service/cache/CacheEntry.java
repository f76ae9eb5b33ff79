package com.irondust.seo.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * A cached value with the moment it was stored and how long it stays valid.
 */
public final class CacheEntry {
    private final String key;
    private final JsonNode value;
    private final Instant insertedAt;
    private final long ttlSeconds;

    public CacheEntry(String key, JsonNode value, Instant insertedAt, long ttlSeconds) {
        this.key = key;
        this.value = value;
        this.insertedAt = insertedAt;
        this.ttlSeconds = ttlSeconds;
    }

    public boolean isExpiredAt(Instant now) {
        return ttlSeconds > 0 && !now.isBefore(insertedAt.plusSeconds(ttlSeconds));
    }

    /** Seconds left before expiry at {@code now}, at least 1 when still live. */
    long remainingSeconds(Instant now) {
        if (ttlSeconds <= 0) return 0;
        long left = insertedAt.plusSeconds(ttlSeconds).getEpochSecond() - now.getEpochSecond();
        return Math.max(1, left);
    }

    JsonNode toJson() {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.set("value", value);
        n.put("inserted_at", insertedAt.toEpochMilli());
        n.put("ttl_seconds", ttlSeconds);
        return n;
    }

    static CacheEntry fromJson(String key, JsonNode n) {
        if (n == null || !n.has("value")) return null;
        Instant inserted = Instant.ofEpochMilli(n.path("inserted_at").asLong(0));
        return new CacheEntry(key, n.get("value"), inserted, n.path("ttl_seconds").asLong(0));
    }

    public String getKey() { return key; }
    public JsonNode getValue() { return value; }
    public Instant getInsertedAt() { return insertedAt; }
    public long getTtlSeconds() { return ttlSeconds; }
}
