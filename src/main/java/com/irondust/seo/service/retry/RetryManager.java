package com.irondust.seo.service.retry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.DegradationLevel;
import com.irondust.seo.service.cache.CacheTier;
import com.irondust.seo.service.cache.KeyValueStore;
import com.irondust.seo.service.cache.StoreException;
import com.irondust.seo.service.cache.ValidationCache;
import com.irondust.seo.service.error.ErrorCategory;
import com.irondust.seo.service.error.SeoErrorHandler;
import com.irondust.seo.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Retries an operation with exponential backoff, changing the content between
 * attempts according to what the last failure said.
 *
 * <p>Strategy choice, in order: a strategy learned for the same error type and
 * content shape, the first matching built-in {@link FailurePattern}, then a
 * per-error-type fallback. A strategy that led to success is cached for the
 * same content and context and remembered for similar content.
 */
@Service
public class RetryManager {
    private static final Logger log = LoggerFactory.getLogger(RetryManager.class);

    static final String PATTERN_STATS_KEY = "seo_retry_patterns";
    static final String GLOBAL_STATS_KEY = "seo_retry_global_stats";

    public static class PatternStats {
        public int failures;
        public int successes;
        public List<RetryStrategy> successfulStrategies = new ArrayList<>();
    }

    private final OptimizerProperties properties;
    private final ValidationCache cache;
    private final KeyValueStore store;
    private final SeoErrorHandler errorHandler;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Random random;
    private final RetryStrategyApplier applier;
    private final List<FailurePattern> failurePatterns = FailurePattern.defaults();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Map<String, PatternStats> patternStats = new ConcurrentHashMap<>();
    private final RetryStats globalStats = new RetryStats();

    public RetryManager(OptimizerProperties properties, ValidationCache cache, KeyValueStore store,
                        SeoErrorHandler errorHandler, Sleeper sleeper, Clock clock) {
        this.properties = properties;
        this.cache = cache;
        this.store = store;
        this.errorHandler = errorHandler;
        this.sleeper = sleeper;
        this.clock = clock;
        this.random = new Random(properties.getRandomSeed());
        this.applier = new RetryStrategyApplier(properties.getThresholds());
        tryLoad();
    }

    private synchronized void tryLoad() {
        try {
            JsonNode patterns = store.get(PATTERN_STATS_KEY, null);
            if (patterns != null) {
                patternStats.putAll(objectMapper.convertValue(patterns, new TypeReference<Map<String, PatternStats>>() {}));
            }
            JsonNode global = store.get(GLOBAL_STATS_KEY, null);
            if (global != null) {
                RetryStats g = objectMapper.treeToValue(global, RetryStats.class);
                globalStats.totalRetries = g.totalRetries;
                globalStats.successfulRetries = g.successfulRetries;
                globalStats.averageAttempts = g.averageAttempts;
                globalStats.averageTimeMillis = g.averageTimeMillis;
            }
        } catch (Exception e) {
            log.warn("Failed to load retry statistics: {}", e.toString());
        }
    }

    private void persist(String key, Object value) {
        try {
            store.set(key, objectMapper.valueToTree(value));
        } catch (StoreException e) {
            log.warn("Failed to persist {}: {}", key, e.toString());
        }
    }

    /**
     * Runs {@code operation} up to {@code maxRetryAttempts} times. Critical
     * failures and thread interruption end the run early.
     */
    public <T> RetryOutcome<T> executeWithRetry(RetryOperation<T> operation, Content content, Map<String, Object> context) {
        OptimizerProperties.Retry cfg = properties.getRetry();
        int maxAttempts = Math.max(1, cfg.getMaxRetryAttempts());
        long start = clock.millis();
        String retryKey = retryKey(content, context);
        String keyword = keyword(content, context);
        List<RetryAttempt> history = new ArrayList<>();

        Content current = content.copy();
        RetryStrategy strategy = cache.get(CacheTier.RETRY_STRATEGY, RetryStrategy.class, retryKey).orElse(null);
        if (strategy != null) {
            log.debug("Applying cached retry strategy {} for {}", strategy.getName(), retryKey);
            current = applier.apply(current, strategy, keyword, random);
        }

        Exception lastError = null;
        String lastErrorType = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            long attemptStart = clock.millis();
            String strategyName = strategy != null ? strategy.getName() : "none";
            try {
                T result = operation.execute(current.copy(), new RetryContext(attempt, maxAttempts, strategyName, context));
                history.add(new RetryAttempt(attempt, true, null, clock.millis() - attemptStart, strategyName));
                if (strategy != null && !strategy.isEmpty()) {
                    if (attempt > 1) cache.set(CacheTier.RETRY_STRATEGY, strategy, retryKey);
                    learnFromSuccess(current, lastErrorType, strategy);
                }
                long total = clock.millis() - start;
                updateRetryStats(true, attempt, total);
                log.debug("Retry operation succeeded on attempt {}/{}", attempt, maxAttempts);
                return RetryOutcome.succeeded(result, attempt, total, history, strategy);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastError = e;
                history.add(new RetryAttempt(attempt, false, "interrupted", clock.millis() - attemptStart, strategyName));
                break;
            } catch (Exception e) {
                lastError = e;
                String message = String.valueOf(e.getMessage());
                lastErrorType = classifyError(message);
                history.add(new RetryAttempt(attempt, false, message, clock.millis() - attemptStart, strategyName));
                learnFromFailure(current, lastErrorType);

                if (errorHandler.classifyError(message, lastErrorType) == ErrorCategory.CRITICAL) {
                    log.warn("Not retrying critical failure: {}", message);
                    break;
                }
                if (attempt >= maxAttempts) break;

                if (cfg.isEnableSmartCorrection()) {
                    RetryStrategy next = analyzeFailureAndGetStrategy(message, lastErrorType, current, attempt);
                    if (next != null) {
                        current = applier.apply(current, next, keyword, random);
                        strategy = next;
                    }
                }
                Duration delay = calculateDelay(attempt);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Retry backoff interrupted after attempt {}", attempt);
                    break;
                }
            }
        }

        long total = clock.millis() - start;
        updateRetryStats(false, attempt, total);
        DegradationLevel level = lastError instanceof ValidationFailureException
                ? DegradationLevel.fromCounts(((ValidationFailureException) lastError).getPassedChecks(),
                        ((ValidationFailureException) lastError).getFailedChecks())
                : DegradationLevel.SEVERE;
        String error = lastError != null ? String.valueOf(lastError.getMessage()) : "Unknown error";
        log.warn("Retry operation failed after {} attempt(s): {}", attempt, error);
        return RetryOutcome.failed(error, attempt, total, history, strategy, level);
    }

    /** {@code min(base * multiplier^(attempt-1), max)} */
    public Duration calculateDelay(int attempt) {
        OptimizerProperties.Retry cfg = properties.getRetry();
        double seconds = cfg.getBaseDelaySeconds() * Math.pow(cfg.getBackoffMultiplier(), Math.max(0, attempt - 1));
        seconds = Math.min(seconds, cfg.getMaxDelaySeconds());
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }

    RetryStrategy analyzeFailureAndGetStrategy(String message, String errorType, Content content, int attempt) {
        Optional<RetryStrategy> learned = learnedStrategy(errorType, content);
        if (learned.isPresent()) return learned.get();
        for (FailurePattern p : failurePatterns) {
            if (p.matches(message)) return p.getStrategy().adaptToAttempt(attempt);
        }
        RetryStrategy fallback = fallbackStrategy(errorType);
        return fallback != null ? fallback.adaptToAttempt(attempt) : null;
    }

    static RetryStrategy fallbackStrategy(String errorType) {
        switch (errorType) {
            case "meta_description":
                return RetryStrategy.of(RetryStrategy.ADJUST_META_LENGTH, Map.of("target_length", 140));
            case "keyword_density":
                return RetryStrategy.of(RetryStrategy.REDUCE_KEYWORD_DENSITY, Map.of("reduction_percentage", 0.2));
            case "readability":
                return RetryStrategy.of(RetryStrategy.IMPROVE_READABILITY,
                        Map.of("split_long_sentences", true, "add_transitions", true));
            case "title":
                return RetryStrategy.of(RetryStrategy.SHORTEN_TITLE, Map.of("max_length", 60));
            case "images":
                return RetryStrategy.of(RetryStrategy.ADD_IMAGES, Map.of("count", 1));
            default:
                return null;
        }
    }

    static String classifyError(String message) {
        String m = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (m.contains("meta description")) return "meta_description";
        if (m.contains("keyword density")) return "keyword_density";
        if (m.contains("readability") || m.contains("passive voice")
                || m.contains("long sentences") || m.contains("transition words")) return "readability";
        if (m.contains("title")) return "title";
        if (m.contains("image")) return "images";
        return "unknown";
    }

    private Optional<RetryStrategy> learnedStrategy(String errorType, Content content) {
        if (!properties.getRetry().isEnablePatternLearning()) return Optional.empty();
        PatternStats s = patternStats.get(successKey(errorType, content));
        if (s == null || s.successfulStrategies.isEmpty()) return Optional.empty();
        return Optional.of(s.successfulStrategies.get(s.successfulStrategies.size() - 1));
    }

    private void learnFromFailure(Content content, String errorType) {
        if (!properties.getRetry().isEnablePatternLearning()) return;
        patternStats.computeIfAbsent(errorType + "_" + contentSignature(content), k -> new PatternStats()).failures++;
        persist(PATTERN_STATS_KEY, new LinkedHashMap<>(patternStats));
    }

    private void learnFromSuccess(Content content, String errorType, RetryStrategy strategy) {
        if (!properties.getRetry().isEnablePatternLearning() || errorType == null) return;
        PatternStats s = patternStats.computeIfAbsent(successKey(errorType, content), k -> new PatternStats());
        synchronized (s) {
            s.successes++;
            s.successfulStrategies.add(strategy);
        }
        persist(PATTERN_STATS_KEY, new LinkedHashMap<>(patternStats));
    }

    private String successKey(String errorType, Content content) {
        return "success_" + errorType + "_" + contentSignature(content);
    }

    /** Coarse shape of the content: field lengths and whether images are present. */
    static String contentSignature(Content content) {
        boolean hasImages = content.getImagePrompts() != null && !content.getImagePrompts().isEmpty();
        return TextUtils.md5Hex(TextUtils.nullToEmpty(content.getTitle()).length() + "|"
                + TextUtils.nullToEmpty(content.getBody()).length() + "|"
                + TextUtils.nullToEmpty(content.getMetaDescription()).length() + "|" + hasImages);
    }

    private String retryKey(Content content, Map<String, Object> context) {
        String contextJson;
        try {
            contextJson = objectMapper.writeValueAsString(context != null ? new TreeMap<>(context) : Map.of());
        } catch (Exception e) {
            contextJson = String.valueOf(context);
        }
        return TextUtils.md5Hex(cache.contentHash(content) + "|" + TextUtils.md5Hex(contextJson));
    }

    private static String keyword(Content content, Map<String, Object> context) {
        Object k = context != null ? context.get("focus_keyword") : null;
        return k != null ? k.toString() : content.getFocusKeyword();
    }

    private synchronized void updateRetryStats(boolean success, int attempts, long totalMillis) {
        globalStats.totalRetries++;
        if (success) globalStats.successfulRetries++;
        long n = globalStats.totalRetries;
        globalStats.averageAttempts = (globalStats.averageAttempts * (n - 1) + attempts) / n;
        globalStats.averageTimeMillis = (globalStats.averageTimeMillis * (n - 1) + totalMillis) / n;
        persist(GLOBAL_STATS_KEY, globalStats);
    }

    public synchronized RetryStats getRetryStats() {
        RetryStats s = new RetryStats();
        s.totalRetries = globalStats.totalRetries;
        s.successfulRetries = globalStats.successfulRetries;
        s.averageAttempts = TextUtils.round(globalStats.averageAttempts, 2);
        s.averageTimeMillis = TextUtils.round(globalStats.averageTimeMillis, 2);
        s.successRate = s.totalRetries > 0 ? TextUtils.round(100.0 * s.successfulRetries / s.totalRetries, 2) : 0.0;
        s.patternCount = failurePatterns.size();
        s.learnedPatterns = patternStats.size();
        return s;
    }
}
