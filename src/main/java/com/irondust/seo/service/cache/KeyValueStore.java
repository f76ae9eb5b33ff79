package com.irondust.seo.service.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.Set;

/**
 * Durable key-value storage used for the persistent cache tier, learned retry
 * strategies and error statistics. Values are JSON trees; a TTL of zero or less
 * means the entry never expires.
 */
public interface KeyValueStore {

    Optional<JsonNode> get(String key);

    default JsonNode get(String key, JsonNode defaultValue) {
        return get(key).orElse(defaultValue);
    }

    default void set(String key, JsonNode value) {
        set(key, value, 0);
    }

    void set(String key, JsonNode value, long ttlSeconds);

    /** @return true when an entry was removed */
    boolean delete(String key);

    /** Live keys starting with {@code prefix}. */
    Set<String> keys(String prefix);
}
