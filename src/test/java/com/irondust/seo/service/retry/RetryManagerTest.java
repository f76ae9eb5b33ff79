package com.irondust.seo.service.retry;

import com.irondust.seo.Fixtures;
import com.irondust.seo.MutableClock;
import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.DegradationLevel;
import com.irondust.seo.service.cache.InMemoryKeyValueStore;
import com.irondust.seo.service.cache.ValidationCache;
import com.irondust.seo.service.error.SeoErrorHandler;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RetryManagerTest {

    private final MutableClock clock = new MutableClock();
    private final OptimizerProperties props = new OptimizerProperties();
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);
    private final RecordingSleeper sleeper = new RecordingSleeper();

    private RetryManager manager() {
        ValidationCache cache = new ValidationCache(props, store, clock);
        return new RetryManager(props, cache, store, new SeoErrorHandler(props, store, clock), sleeper, clock);
    }

    @Test
    public void calculateDelay_doublesUntilCap() {
        RetryManager m = manager();
        assertEquals(Duration.ofSeconds(1), m.calculateDelay(1));
        assertEquals(Duration.ofSeconds(2), m.calculateDelay(2));
        assertEquals(Duration.ofSeconds(4), m.calculateDelay(3));
        assertEquals(Duration.ofSeconds(8), m.calculateDelay(4));
        assertEquals(Duration.ofSeconds(30), m.calculateDelay(10));
    }

    @Test
    public void executeWithRetry_sleepsWithExponentialBackoffBetweenAttempts() {
        props.getRetry().setMaxRetryAttempts(5);
        props.getRetry().setMaxDelaySeconds(6);
        RetryOutcome<String> outcome = manager().executeWithRetry((c, ctx) -> {
            throw new IllegalStateException("Meta description too short (40 chars, minimum 120)");
        }, Fixtures.compliantContent(), Map.of());

        assertFalse(outcome.isSuccess());
        assertEquals(5, outcome.getAttempts());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(6)),
                sleeper.delays);
        assertEquals(5, outcome.getRetryHistory().size());
        assertTrue(outcome.getError().contains("too short"));
        assertEquals(DegradationLevel.SEVERE, outcome.getDegradationLevel());
    }

    @Test
    public void criticalFailure_isNotRetried() {
        int[] calls = {0};
        RetryOutcome<String> outcome = manager().executeWithRetry((c, ctx) -> {
            calls[0]++;
            throw new IllegalStateException("Fatal parser crash");
        }, Fixtures.compliantContent(), Map.of());

        assertFalse(outcome.isSuccess());
        assertEquals(1, calls[0]);
        assertEquals(1, outcome.getAttempts());
        assertTrue(sleeper.delays.isEmpty());
    }

    @Test
    public void succeedsAfterApplyingStrategyForFailure() {
        List<String> strategies = new ArrayList<>();
        List<Integer> keywordMentions = new ArrayList<>();
        RetryOutcome<String> outcome = manager().executeWithRetry((c, ctx) -> {
            strategies.add(ctx.getStrategy());
            keywordMentions.add(countKeyword(c));
            if (ctx.getAttempt() == 1) {
                throw new ValidationFailureException("Keyword density too low (0.40%, minimum 0.50%)", 4, 1);
            }
            return "ok";
        }, Fixtures.lowDensityContent(), Map.of("focus_keyword", Fixtures.KEYWORD));

        assertTrue(outcome.isSuccess());
        assertEquals("ok", outcome.getResult());
        assertEquals(2, outcome.getAttempts());
        assertEquals(List.of("none", "increase_keyword_density"), strategies);
        assertEquals(keywordMentions.get(0) + 2, keywordMentions.get(1));
        assertEquals(List.of(Duration.ofSeconds(1)), sleeper.delays);
    }

    @Test
    public void successfulStrategy_isReusedForSameContentAndContext() {
        RetryManager m = manager();
        Content content = Fixtures.lowDensityContent();
        Map<String, Object> context = Map.of("focus_keyword", Fixtures.KEYWORD);
        m.executeWithRetry((c, ctx) -> {
            if (ctx.getAttempt() == 1) throw new ValidationFailureException("Keyword density too low", 4, 1);
            return "ok";
        }, content, context);

        List<String> firstStrategy = new ArrayList<>();
        RetryOutcome<String> second = m.executeWithRetry((c, ctx) -> {
            firstStrategy.add(ctx.getStrategy());
            return "ok";
        }, content, context);

        assertTrue(second.isSuccess());
        assertEquals(1, second.getAttempts());
        assertEquals(List.of("increase_keyword_density"), firstStrategy);
    }

    @Test
    public void validationFailure_reportsDegradationFromCheckCounts() {
        props.getRetry().setMaxRetryAttempts(2);
        RetryOutcome<String> outcome = manager().executeWithRetry((c, ctx) -> {
            throw new ValidationFailureException("Title too long (80 chars, maximum 66)", 4, 1);
        }, Fixtures.compliantContent(), Map.of());

        assertFalse(outcome.isSuccess());
        assertEquals(DegradationLevel.MINOR, outcome.getDegradationLevel());
    }

    @Test
    public void interruptedBackoff_stopsAndRestoresFlag() {
        Sleeper interrupting = d -> {
            throw new InterruptedException("shutdown");
        };
        ValidationCache cache = new ValidationCache(props, store, clock);
        RetryManager m = new RetryManager(props, cache, store, new SeoErrorHandler(props, store, clock), interrupting, clock);
        int[] calls = {0};
        RetryOutcome<String> outcome = m.executeWithRetry((c, ctx) -> {
            calls[0]++;
            throw new IllegalStateException("Too much passive voice (30.0%, maximum 10.0%)");
        }, Fixtures.compliantContent(), Map.of());

        assertTrue(Thread.interrupted());
        assertFalse(outcome.isSuccess());
        assertEquals(1, calls[0]);
    }

    @Test
    public void operationReceivesCopyOfContent() {
        Content content = Fixtures.compliantContent();
        manager().executeWithRetry((c, ctx) -> {
            c.setTitle("changed");
            return "ok";
        }, content, Map.of());
        assertEquals(Fixtures.TITLE, content.getTitle());
    }

    @Test
    public void stats_countSuccessesAndFailures() {
        RetryManager m = manager();
        m.executeWithRetry((c, ctx) -> "ok", Fixtures.compliantContent(), Map.of());
        m.executeWithRetry((c, ctx) -> {
            throw new IllegalStateException("fatal");
        }, Fixtures.compliantContent(), Map.of());

        RetryStats stats = m.getRetryStats();
        assertEquals(2, stats.totalRetries);
        assertEquals(1, stats.successfulRetries);
        assertEquals(50.0, stats.successRate);
        assertEquals(1.0, stats.averageAttempts);
    }

    @Test
    public void classifyError_mapsMessagesToComponents() {
        assertEquals("meta_description", RetryManager.classifyError("Meta description too long"));
        assertEquals("keyword_density", RetryManager.classifyError("Keyword density too high (3.1%)"));
        assertEquals("readability", RetryManager.classifyError("Not enough transition words"));
        assertEquals("title", RetryManager.classifyError("Title should contain focus keyword"));
        assertEquals("images", RetryManager.classifyError("Content should include at least one image"));
        assertEquals("unknown", RetryManager.classifyError("boom"));
    }

    private static int countKeyword(Content c) {
        return com.irondust.seo.util.TextUtils.countKeyword(com.irondust.seo.util.TextUtils.stripTags(c.getBody()),
                Fixtures.KEYWORD);
    }
}
