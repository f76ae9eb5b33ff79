package com.irondust.seo.service.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key-value store persisted as a single pretty-printed JSON file. The whole
 * map is held in memory and rewritten after every mutation.
 */
public class JsonFileKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileKeyValueStore.class);

    private final Path path;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, StoredEntry> cache = new ConcurrentHashMap<>();

    public JsonFileKeyValueStore(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
        tryLoad();
    }

    private synchronized void tryLoad() {
        try {
            if (Files.exists(path)) {
                Map<String, StoredEntry> m = objectMapper.readValue(path.toFile(), new TypeReference<>() {});
                cache.clear();
                long now = clock.millis();
                m.forEach((k, e) -> {
                    if (e != null && !e.isExpired(now)) cache.put(k, e);
                });
                log.info("Loaded {} store entries from {}", cache.size(), path);
            }
        } catch (Exception e) {
            log.warn("Failed to load key-value store {}: {}", path, e.toString());
        }
    }

    private synchronized void persist() {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Map<String, StoredEntry> ordered = new TreeMap<>(cache);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), ordered);
        } catch (Exception e) {
            throw new StoreException("Failed to persist key-value store " + path, e);
        }
    }

    @Override
    public Optional<JsonNode> get(String key) {
        StoredEntry e = cache.get(key);
        if (e == null) return Optional.empty();
        if (e.isExpired(clock.millis())) {
            if (cache.remove(key, e)) persist();
            return Optional.empty();
        }
        return Optional.ofNullable(e.value != null ? e.value.deepCopy() : null);
    }

    @Override
    public void set(String key, JsonNode value, long ttlSeconds) {
        cache.put(key, new StoredEntry(value != null ? value.deepCopy() : null,
                StoredEntry.expiry(clock.millis(), ttlSeconds)));
        persist();
    }

    @Override
    public boolean delete(String key) {
        boolean removed = cache.remove(key) != null;
        if (removed) persist();
        return removed;
    }

    @Override
    public Set<String> keys(String prefix) {
        long now = clock.millis();
        Set<String> out = new TreeSet<>();
        cache.forEach((k, e) -> {
            if (k.startsWith(prefix) && !e.isExpired(now)) out.add(k);
        });
        return out;
    }

    public Path getPath() {
        return path;
    }
}
