package com.irondust.seo.service.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local store; contents are lost on restart. */
public class InMemoryKeyValueStore implements KeyValueStore {
    private final Clock clock;
    private final ConcurrentHashMap<String, StoredEntry> entries = new ConcurrentHashMap<>();

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<JsonNode> get(String key) {
        StoredEntry e = entries.get(key);
        if (e == null) return Optional.empty();
        if (e.isExpired(clock.millis())) {
            entries.remove(key, e);
            return Optional.empty();
        }
        return Optional.ofNullable(e.value != null ? e.value.deepCopy() : null);
    }

    @Override
    public void set(String key, JsonNode value, long ttlSeconds) {
        entries.put(key, new StoredEntry(value != null ? value.deepCopy() : null,
                StoredEntry.expiry(clock.millis(), ttlSeconds)));
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public Set<String> keys(String prefix) {
        long now = clock.millis();
        Set<String> out = new TreeSet<>();
        entries.forEach((k, e) -> {
            if (k.startsWith(prefix) && !e.isExpired(now)) out.add(k);
        });
        return out;
    }
}
