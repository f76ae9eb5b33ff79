package com.irondust.seo.service.cache;

import com.irondust.seo.Fixtures;
import com.irondust.seo.MutableClock;
import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.DetectionReport;
import com.irondust.seo.model.ValidationMessage;
import com.irondust.seo.service.IssueDetector;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ValidationCacheTest {

    private final MutableClock clock = new MutableClock();
    private final OptimizerProperties props = new OptimizerProperties();
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);

    @Test
    public void set_thenGet_returnsEqualValue() {
        ValidationCache cache = new ValidationCache(props, store, clock);
        ValidationMessage value = new ValidationMessage("Title too long", "title", "2024-05-01T10:00:00Z");
        cache.set(CacheTier.VALIDATION, value, "abc", "def");

        Optional<ValidationMessage> hit = cache.get(CacheTier.VALIDATION, ValidationMessage.class, "abc", "def");
        assertTrue(hit.isPresent());
        assertEquals(value, hit.get());
        assertFalse(cache.get(CacheTier.VALIDATION, ValidationMessage.class, "abc", "other").isPresent());
    }

    @Test
    public void entries_expireAfterTtl() {
        ValidationCache cache = new ValidationCache(props, store, clock);
        cache.set(CacheTier.METRICS, new ValidationMessage("m", "c", "t"), 10, "k");

        clock.advance(Duration.ofSeconds(9));
        assertTrue(cache.get(CacheTier.METRICS, ValidationMessage.class, "k").isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertFalse(cache.get(CacheTier.METRICS, ValidationMessage.class, "k").isPresent());
        assertTrue(store.keys(props.getCache().getPrefix()).isEmpty());
    }

    @Test
    public void persistentTier_servesNewInstanceAndKeepsOriginalExpiry() {
        new ValidationCache(props, store, clock).set(CacheTier.METRICS, new ValidationMessage("m", "c", "t"), 60, "k");

        clock.advance(Duration.ofSeconds(30));
        ValidationCache fresh = new ValidationCache(props, store, clock);
        assertTrue(fresh.get(CacheTier.METRICS, ValidationMessage.class, "k").isPresent());

        clock.advance(Duration.ofSeconds(31));
        assertFalse(fresh.get(CacheTier.METRICS, ValidationMessage.class, "k").isPresent());
    }

    @Test
    public void key_hasPrefixTierAndParts() {
        ValidationCache cache = new ValidationCache(props, store, clock);
        assertEquals("seo_cache_readability_a_b_c", cache.key(CacheTier.READABILITY, "a", "b", "c"));
    }

    @Test
    public void computeIfAbsent_runsSupplierOnce() {
        ValidationCache cache = new ValidationCache(props, store, clock);
        AtomicInteger calls = new AtomicInteger();
        for (int i = 0; i < 3; i++) {
            ValidationMessage v = cache.computeIfAbsent(CacheTier.KEYWORDS, ValidationMessage.class, () -> {
                calls.incrementAndGet();
                return new ValidationMessage("m", "c", "t");
            }, "x");
            assertEquals("m", v.getMessage());
        }
        assertEquals(1, calls.get());
        CacheStats stats = cache.getStats();
        assertEquals(2, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(1, stats.getSets());
    }

    @Test
    public void disabledCache_neverStores() {
        props.getCache().setEnabled(false);
        ValidationCache cache = new ValidationCache(props, store, clock);
        cache.set(CacheTier.VALIDATION, new ValidationMessage("m", "c", "t"), "k");
        assertFalse(cache.get(CacheTier.VALIDATION, ValidationMessage.class, "k").isPresent());

        AtomicInteger calls = new AtomicInteger();
        cache.computeIfAbsent(CacheTier.VALIDATION, ValidationMessage.class,
                () -> new ValidationMessage("m" + calls.incrementAndGet(), "c", "t"), "k");
        cache.computeIfAbsent(CacheTier.VALIDATION, ValidationMessage.class,
                () -> new ValidationMessage("m" + calls.incrementAndGet(), "c", "t"), "k");
        assertEquals(2, calls.get());
    }

    @Test
    public void invalidateContent_removesEveryTierForThatHash() {
        ValidationCache cache = new ValidationCache(props, store, clock);
        Content content = Fixtures.compliantContent();
        String hash = cache.contentHash(content);
        cache.set(CacheTier.VALIDATION, new ValidationMessage("a", "c", "t"), "result", hash);
        cache.set(CacheTier.METRICS, new ValidationMessage("b", "c", "t"), "detection", hash);
        cache.set(CacheTier.METRICS, new ValidationMessage("c", "c", "t"), "detection", "otherhash");

        assertEquals(2, cache.invalidateContent(hash));
        assertFalse(cache.get(CacheTier.VALIDATION, ValidationMessage.class, "result", hash).isPresent());
        assertTrue(cache.get(CacheTier.METRICS, ValidationMessage.class, "detection", "otherhash").isPresent());
    }

    @Test
    public void clearAll_dropsBothLevelsAndResetsStats() {
        ValidationCache cache = new ValidationCache(props, store, clock);
        cache.set(CacheTier.VALIDATION, new ValidationMessage("a", "c", "t"), "k");
        cache.get(CacheTier.VALIDATION, ValidationMessage.class, "k");
        cache.clearAll();

        assertEquals(0, cache.getStats().getHits());
        assertEquals(0, cache.getStats().getMemoryCacheSize());
        assertTrue(store.keys(props.getCache().getPrefix()).isEmpty());
    }

    @Test
    public void hashes_trackWhatValidationDependsOn() {
        ValidationCache cache = new ValidationCache(props, store, clock);
        Content a = Fixtures.compliantContent();
        Content b = a.copy();
        assertEquals(cache.contentHash(a), cache.contentHash(b));
        b.getImagePrompts().get(0).setAlt("A different alt text");
        assertNotEquals(cache.contentHash(a), cache.contentHash(b));

        assertEquals(cache.keywordHash("Protein Powder", List.of("whey", "Casein")),
                cache.keywordHash("protein powder", List.of("casein", "WHEY")));

        String before = cache.configHash();
        props.getThresholds().setMaxTitleLength(60);
        assertNotEquals(before, cache.configHash());
    }

    @Test
    public void cachedDetection_reusesReportForSameInputs() {
        ValidationCache cache = new ValidationCache(props, store, clock);
        AtomicInteger runs = new AtomicInteger();
        IssueDetector detector = new IssueDetector(props) {
            @Override
            public DetectionReport detectAllIssues(Content content, String focusKeyword, List<String> secondaryKeywords) {
                runs.incrementAndGet();
                return super.detectAllIssues(content, focusKeyword, secondaryKeywords);
            }
        };
        Content content = Fixtures.compliantContent();
        DetectionReport first = cache.cachedDetection(content, Fixtures.KEYWORD, List.of(), detector);
        DetectionReport second = cache.cachedDetection(content.copy(), Fixtures.KEYWORD, List.of(), detector);

        assertEquals(1, runs.get());
        assertEquals(first.getComplianceScore(), second.getComplianceScore());
        assertEquals(first.getTotalIssues(), second.getTotalIssues());
    }

    @Test
    public void warmUp_countsNonNullItems() {
        ValidationCache cache = new ValidationCache(props, store, clock);
        List<Content> contents = new java.util.ArrayList<>();
        contents.add(Fixtures.compliantContent());
        contents.add(null);
        contents.add(Fixtures.lowDensityContent());
        assertEquals(2, cache.warmUp(contents, new IssueDetector(props)));
        assertEquals(2, cache.getStats().getSets());
    }
}
