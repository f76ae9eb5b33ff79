package com.irondust.seo.service.correction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.irondust.seo.service.cache.CacheTier;
import com.irondust.seo.service.cache.KeyValueStore;
import com.irondust.seo.service.cache.ValidationCache;
import com.irondust.seo.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Remembers titles that have been published and reports when a new title
 * repeats or closely resembles one of them.
 */
@Service
public class TitleUniquenessChecker {
    private static final Logger log = LoggerFactory.getLogger(TitleUniquenessChecker.class);

    static final String REGISTRY_KEY = "seo_titles_registry";
    public static final double NEAR_DUPLICATE_SIMILARITY = 85.0;

    private final KeyValueStore store;
    private final ValidationCache cache;

    public TitleUniquenessChecker(KeyValueStore store, ValidationCache cache) {
        this.store = store;
        this.cache = cache;
    }

    public static class Result {
        public boolean unique = true;
        public boolean exactDuplicate;
        public List<String> similarTitles = new ArrayList<>();
        public double highestSimilarity;
    }

    public synchronized void registerTitle(String title) {
        String normalized = normalize(title);
        if (normalized.isEmpty()) return;
        Set<String> titles = registeredTitles();
        if (titles.add(normalized)) {
            ArrayNode arr = JsonNodeFactory.instance.arrayNode();
            titles.forEach(arr::add);
            store.set(REGISTRY_KEY, arr);
            log.info("Registered published title '{}' ({} known)", title, titles.size());
        }
    }

    public Set<String> registeredTitles() {
        Set<String> out = new LinkedHashSet<>();
        JsonNode n = store.get(REGISTRY_KEY, null);
        if (n != null && n.isArray()) n.forEach(t -> out.add(t.asText()));
        return out;
    }

    public Result check(String title) {
        String normalized = normalize(title);
        Set<String> titles = registeredTitles();
        if (normalized.isEmpty() || titles.isEmpty()) return new Result();
        return cache.computeIfAbsent(CacheTier.TITLE_UNIQUE, Result.class, () -> compare(normalized, titles),
                TextUtils.md5Hex(normalized), String.valueOf(titles.size()));
    }

    private Result compare(String normalized, Set<String> titles) {
        Result r = new Result();
        for (String known : titles) {
            double similarity = known.equals(normalized) ? 100.0 : TextUtils.similarityPercent(known, normalized);
            r.highestSimilarity = Math.max(r.highestSimilarity, TextUtils.round(similarity, 2));
            if (similarity >= NEAR_DUPLICATE_SIMILARITY) {
                r.similarTitles.add(known);
                r.unique = false;
                if (known.equals(normalized)) r.exactDuplicate = true;
            }
        }
        return r;
    }

    static String normalize(String title) {
        return TextUtils.nullToEmpty(title).toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
