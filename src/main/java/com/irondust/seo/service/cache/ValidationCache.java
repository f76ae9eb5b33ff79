package com.irondust.seo.service.cache;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.DetectionReport;
import com.irondust.seo.model.ImagePrompt;
import com.irondust.seo.service.IssueDetector;
import com.irondust.seo.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Two-tier memoization of validation work.
 *
 * <p>The memory tier is a write-through front of the persistent {@link KeyValueStore}.
 * Lookups check memory first; a persistent hit is promoted into memory with its
 * original insertion time so both tiers expire together. Entries are never
 * returned once their TTL has elapsed.
 *
 * <p>Keys have the form {@code prefix + tier + "_" + parts.join("_")}, where parts
 * are usually a content hash, a config hash and a keyword hash.
 */
@Service
public class ValidationCache {
    private static final Logger log = LoggerFactory.getLogger(ValidationCache.class);

    private final OptimizerProperties properties;
    private final KeyValueStore store;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Map<String, CacheEntry> memory = new ConcurrentHashMap<>();
    private final Map<String, Object> keyLocks = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();

    public ValidationCache(OptimizerProperties properties, KeyValueStore store, Clock clock) {
        this.properties = properties;
        this.store = store;
        this.clock = clock;
    }

    public String key(CacheTier tier, String... parts) {
        return properties.getCache().getPrefix() + tier.code() + "_" + String.join("_", parts);
    }

    public <T> Optional<T> get(CacheTier tier, Class<T> type, String... parts) {
        if (!properties.getCache().isEnabled()) return Optional.empty();
        String key = key(tier, parts);
        CacheEntry entry = lookup(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        try {
            T value = objectMapper.treeToValue(entry.getValue(), type);
            hits.incrementAndGet();
            return Optional.ofNullable(value);
        } catch (Exception e) {
            log.warn("Dropping unreadable cache entry {}: {}", key, e.toString());
            evict(key);
            misses.incrementAndGet();
            return Optional.empty();
        }
    }

    public void set(CacheTier tier, Object value, String... parts) {
        set(tier, value, tier.ttlSeconds(properties.getCache().getDefaultTtlSeconds()), parts);
    }

    public void set(CacheTier tier, Object value, long ttlSeconds, String... parts) {
        if (!properties.getCache().isEnabled() || value == null) return;
        String key = key(tier, parts);
        CacheEntry entry = new CacheEntry(key, objectMapper.valueToTree(value), clock.instant(), ttlSeconds);
        memory.put(key, entry);
        sets.incrementAndGet();
        try {
            store.set(key, entry.toJson(), ttlSeconds);
        } catch (StoreException e) {
            log.warn("Persistent cache write failed for {}, keeping memory tier only: {}", key, e.toString());
        }
    }

    /**
     * Returns the cached value for the key or computes, stores and returns it.
     * At most one computation runs per key at a time.
     */
    public <T> T computeIfAbsent(CacheTier tier, Class<T> type, Supplier<T> supplier, String... parts) {
        if (!properties.getCache().isEnabled()) return supplier.get();
        String key = key(tier, parts);
        Object lock = keyLocks.computeIfAbsent(key, k -> new Object());
        synchronized (lock) {
            Optional<T> cached = get(tier, type, parts);
            if (cached.isPresent()) return cached.get();
            T value = supplier.get();
            set(tier, value, parts);
            return value;
        }
    }

    private CacheEntry lookup(String key) {
        Instant now = clock.instant();
        CacheEntry entry = memory.get(key);
        if (entry != null) {
            if (!entry.isExpiredAt(now)) return entry;
            memory.remove(key, entry);
        }
        Optional<JsonNode> persisted = store.get(key);
        if (persisted.isEmpty()) return null;
        CacheEntry fromStore = CacheEntry.fromJson(key, persisted.get());
        if (fromStore == null || fromStore.isExpiredAt(now)) {
            evict(key);
            return null;
        }
        memory.put(key, fromStore);
        return fromStore;
    }

    private void evict(String key) {
        memory.remove(key);
        try {
            store.delete(key);
        } catch (StoreException e) {
            log.warn("Failed to evict {} from persistent cache: {}", key, e.toString());
        }
    }

    /**
     * Removes every entry, in every tier and both storage levels, whose key
     * mentions the given content hash.
     *
     * @return number of distinct keys removed
     */
    public int invalidateContent(String contentHash) {
        List<String> doomed = new ArrayList<>();
        for (String k : memory.keySet()) {
            if (k.contains(contentHash)) doomed.add(k);
        }
        for (String k : store.keys(properties.getCache().getPrefix())) {
            if (k.contains(contentHash) && !doomed.contains(k)) doomed.add(k);
        }
        doomed.forEach(this::evict);
        log.debug("Invalidated {} cache entries for content {}", doomed.size(), contentHash);
        return doomed.size();
    }

    public void clearAll() {
        memory.clear();
        int removed = 0;
        for (String k : store.keys(properties.getCache().getPrefix())) {
            if (store.delete(k)) removed++;
        }
        hits.set(0);
        misses.set(0);
        sets.set(0);
        log.info("Cleared validation cache ({} persistent entries)", removed);
    }

    /** Detection report for the content, computed once per content/config/keyword combination. */
    public DetectionReport cachedDetection(Content content, String focusKeyword, List<String> secondaryKeywords,
                                           IssueDetector detector) {
        return computeIfAbsent(CacheTier.METRICS, DetectionReport.class,
                () -> detector.detectAllIssues(content, focusKeyword, secondaryKeywords),
                "detection", contentHash(content), configHash(), keywordHash(focusKeyword, secondaryKeywords));
    }

    /**
     * Pre-computes detection reports for a batch of content, e.g. a backlog about to be optimized.
     *
     * @return number of items processed
     */
    public int warmUp(List<Content> contents, IssueDetector detector) {
        int n = 0;
        for (Content c : contents) {
            if (c == null) continue;
            cachedDetection(c, c.getFocusKeyword(), c.getSecondaryKeywords(), detector);
            n++;
        }
        log.info("Cache warm-up processed {} content items", n);
        return n;
    }

    public CacheStats getStats() {
        return new CacheStats(hits.get(), misses.get(), sets.get(), memory.size(), properties.getCache().isEnabled());
    }

    /** md5 over the fields validation looks at. */
    public String contentHash(Content content) {
        StringBuilder sb = new StringBuilder();
        sb.append(TextUtils.nullToEmpty(content.getTitle())).append('\u0000')
                .append(TextUtils.nullToEmpty(content.getBody())).append('\u0000')
                .append(TextUtils.nullToEmpty(content.getMetaDescription()));
        if (content.getImagePrompts() != null) {
            for (ImagePrompt p : content.getImagePrompts()) {
                if (p == null) continue;
                sb.append('\u0000').append(TextUtils.nullToEmpty(p.getPrompt()))
                        .append('\u0001').append(TextUtils.nullToEmpty(p.getAlt()));
            }
        }
        return TextUtils.md5Hex(sb.toString());
    }

    /**
     * md5 over every field of the content. Keys for cached values that carry
     * content back to the caller must use this, not {@link #contentHash}.
     */
    public String contentStateHash(Content content) {
        try {
            return TextUtils.md5Hex(objectMapper.writeValueAsString(content));
        } catch (Exception e) {
            throw new IllegalStateException("Cannot serialize content", e);
        }
    }

    /** md5 over the validation thresholds, serialized with sorted keys. */
    public String configHash() {
        Map<String, Object> sorted = new TreeMap<>(properties.getThresholds().asMap());
        sorted.put("autoCorrection", properties.isAutoCorrection());
        try {
            return TextUtils.md5Hex(objectMapper.writeValueAsString(sorted));
        } catch (Exception e) {
            throw new IllegalStateException("Cannot serialize thresholds", e);
        }
    }

    public String keywordHash(String focusKeyword, List<String> secondaryKeywords) {
        List<String> secondary = new ArrayList<>();
        if (secondaryKeywords != null) {
            for (String s : secondaryKeywords) {
                if (s != null && !s.isBlank()) secondary.add(s.trim().toLowerCase(Locale.ROOT));
            }
        }
        Collections.sort(secondary);
        String focus = focusKeyword == null ? "" : focusKeyword.trim().toLowerCase(Locale.ROOT);
        return TextUtils.md5Hex(focus + "|" + String.join(",", secondary));
    }
}
