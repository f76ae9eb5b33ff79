package com.irondust.seo.service.error;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.DegradationLevel;
import com.irondust.seo.model.ValidationMessage;
import com.irondust.seo.service.cache.KeyValueStore;
import com.irondust.seo.service.cache.StoreException;
import com.irondust.seo.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Central sink for validation and correction failures.
 *
 * <p>Keeps a bounded in-memory failure log, per (component, error) statistics
 * that are flushed to the key-value store every few occurrences, manual
 * overrides for errors an operator has decided to accept, and adaptive
 * threshold suggestions for errors that keep coming back. It also decides how
 * to recover from a failure and how degraded a partially failed run is.
 */
@Service
public class SeoErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(SeoErrorHandler.class);

    static final String STATS_KEY = "seo_error_stats";
    static final String OVERRIDES_KEY = "seo_error_overrides";
    static final String RULES_KEY = "seo_adaptive_rules";
    private static final double MAX_BACKOFF_SECONDS = 30.0;

    private static final class RecoveryPlan {
        final String strategy;
        final List<String> steps;
        final int maxAttempts;
        final double backoffMultiplier;

        RecoveryPlan(String strategy, List<String> steps, int maxAttempts, double backoffMultiplier) {
            this.strategy = strategy;
            this.steps = steps;
            this.maxAttempts = maxAttempts;
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    private static final Map<String, RecoveryPlan> RECOVERY_PLANS = new LinkedHashMap<>();
    static {
        RECOVERY_PLANS.put("ai_provider_failure", new RecoveryPlan("provider_failover",
                List.of("switch_provider", "retry_request", "use_cached_result"), 3, 2.0));
        RECOVERY_PLANS.put("validation_timeout", new RecoveryPlan("simplified_validation",
                List.of("reduce_validation_scope", "use_cached_validation", "skip_non_critical"), 2, 1.5));
        RECOVERY_PLANS.put("correction_failure", new RecoveryPlan("alternative_correction",
                List.of("simplify_prompt", "use_template", "manual_fallback"), 3, 1.0));
        RECOVERY_PLANS.put("rate_limit_exceeded", new RecoveryPlan("exponential_backoff",
                List.of("wait_and_retry", "switch_provider", "queue_for_later"), 5, 2.0));
        RECOVERY_PLANS.put("network_error", new RecoveryPlan("retry_with_backoff",
                List.of("retry_immediately", "retry_with_delay", "use_cached_result"), 3, 2.0));
    }

    private static final Map<String, Map<String, Object>> FALLBACKS = new LinkedHashMap<>();
    static {
        FALLBACKS.put("ai_correction", fallback("use_ai_provider", "use_alternative_provider",
                "use_template_based_correction", "return_original_content", true));
        FALLBACKS.put("validation", fallback("full_validation", "critical_validation_only",
                "cached_validation", "skip_validation", true));
        FALLBACKS.put("optimization_loop", fallback("continue_optimization", "reduce_iteration_count",
                "return_best_result", "return_original_content", true));
    }

    private static final Map<Pattern, String> SIMPLIFICATIONS = new LinkedHashMap<>();
    static {
        SIMPLIFICATIONS.put(Pattern.compile("timeout", Pattern.CASE_INSENSITIVE), "The operation took too long to complete");
        SIMPLIFICATIONS.put(Pattern.compile("rate limit", Pattern.CASE_INSENSITIVE), "Too many requests - please wait a moment");
        SIMPLIFICATIONS.put(Pattern.compile("connection", Pattern.CASE_INSENSITIVE), "Unable to connect to the service");
        SIMPLIFICATIONS.put(Pattern.compile("authentication", Pattern.CASE_INSENSITIVE), "Authentication failed - please check your API keys");
        SIMPLIFICATIONS.put(Pattern.compile("not found", Pattern.CASE_INSENSITIVE), "The requested resource was not found");
        SIMPLIFICATIONS.put(Pattern.compile("permission", Pattern.CASE_INSENSITIVE), "You do not have permission to perform this action");
        SIMPLIFICATIONS.put(Pattern.compile("invalid", Pattern.CASE_INSENSITIVE), "The provided data is invalid");
        SIMPLIFICATIONS.put(Pattern.compile("exception", Pattern.CASE_INSENSITIVE), "An unexpected error occurred");
    }

    private final OptimizerProperties properties;
    private final KeyValueStore store;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Deque<ErrorLogEntry> recent = new ArrayDeque<>();
    private final Map<String, ErrorStat> errorStats = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> manualOverrides = new ConcurrentHashMap<>();
    private final Map<String, Object> adaptiveRules = new ConcurrentHashMap<>();

    public SeoErrorHandler(OptimizerProperties properties, KeyValueStore store, Clock clock) {
        this.properties = properties;
        this.store = store;
        this.clock = clock;
        adaptiveRules.putAll(defaultRules());
        tryLoad();
    }

    private static Map<String, Object> fallback(String primary, String f1, String f2, String f3, boolean graceful) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("primary", primary);
        m.put("fallback_1", f1);
        m.put("fallback_2", f2);
        m.put("fallback_3", f3);
        m.put("graceful_degradation", graceful);
        return Collections.unmodifiableMap(m);
    }

    private Map<String, Object> defaultRules() {
        OptimizerProperties.Thresholds t = properties.getThresholds();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("minMetaDescLength", t.getMinMetaDescLength());
        m.put("maxMetaDescLength", t.getMaxMetaDescLength());
        m.put("minKeywordDensity", t.getMinKeywordDensity());
        m.put("maxKeywordDensity", t.getMaxKeywordDensity());
        m.put("maxPassiveVoice", t.getMaxPassiveVoice());
        m.put("maxLongSentences", t.getMaxLongSentences());
        m.put("minTransitionWords", t.getMinTransitionWords());
        m.put("maxTitleLength", t.getMaxTitleLength());
        m.put("maxSubheadingKeywordUsage", t.getMaxSubheadingKeywordUsage());
        return m;
    }

    private synchronized void tryLoad() {
        try {
            JsonNode stats = store.get(STATS_KEY, null);
            if (stats != null) {
                Map<String, ErrorStat> m = objectMapper.convertValue(stats, new TypeReference<Map<String, ErrorStat>>() {});
                errorStats.putAll(m);
            }
            JsonNode overrides = store.get(OVERRIDES_KEY, null);
            if (overrides != null) {
                manualOverrides.putAll(objectMapper.convertValue(overrides,
                        new TypeReference<Map<String, Map<String, Object>>>() {}));
            }
            JsonNode rules = store.get(RULES_KEY, null);
            if (rules != null) {
                adaptiveRules.putAll(objectMapper.convertValue(rules, new TypeReference<Map<String, Object>>() {}));
            }
        } catch (Exception e) {
            log.warn("Failed to load error handler state: {}", e.toString());
        }
    }

    private void persist(String key, Object value) {
        try {
            store.set(key, objectMapper.valueToTree(value));
        } catch (StoreException e) {
            log.warn("Failed to persist {}: {}", key, e.toString());
        }
    }

    static String overrideKey(String component, String error) {
        return TextUtils.md5Hex(component + "|" + error);
    }

    /**
     * Records one failure: appends it to the failure log, updates the
     * statistics for its (component, error) pair and checks whether the error
     * has recurred often enough to suggest relaxing a threshold.
     *
     * @param severity error, warning or info
     */
    public ErrorLogEntry logValidationFailure(String component, String error, Map<String, Object> context, String severity) {
        ErrorLogEntry entry = newEntry(component, error, context, severity);
        Map<String, Object> override = manualOverrides.get(overrideKey(component, error));
        if (override != null && Boolean.TRUE.equals(override.get("active"))) {
            entry.manualOverride = override;
        }
        append(entry);
        int count = updateErrorStats(component, error, entry.severity);
        checkAdaptiveRuleUpdate(component, error, count);
        if ("error".equals(entry.severity)) {
            log.error("[SEO] {}: {}", component, error);
        } else if ("warning".equals(entry.severity)) {
            log.warn("[SEO] {}: {}", component, error);
        } else {
            log.debug("[SEO] {}: {}", component, error);
        }
        return entry;
    }

    public ErrorLogEntry logValidationFailure(String component, String error) {
        return logValidationFailure(component, error, Map.of(), "error");
    }

    private ErrorLogEntry newEntry(String component, String error, Map<String, Object> context, String severity) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.timestamp = clock.instant();
        entry.component = component;
        entry.error = error;
        entry.severity = severity != null ? severity : "error";
        entry.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        return entry;
    }

    private synchronized void append(ErrorLogEntry entry) {
        recent.addLast(entry);
        int max = Math.max(1, properties.getErrors().getMaxLogEntries());
        while (recent.size() > max) recent.removeFirst();
    }

    private int updateErrorStats(String component, String error, String severity) {
        String key = overrideKey(component, error);
        ErrorStat stat;
        int count;
        synchronized (errorStats) {
            stat = errorStats.computeIfAbsent(key, k -> {
                ErrorStat s = new ErrorStat();
                s.component = component;
                s.error = error;
                s.firstOccurrence = clock.instant();
                return s;
            });
            stat.count++;
            stat.lastOccurrence = clock.instant();
            stat.severityCounts.merge(severity, 1, Integer::sum);
            count = stat.count;
        }
        int every = Math.max(1, properties.getErrors().getPersistEvery());
        if (count % every == 0) {
            synchronized (errorStats) {
                persist(STATS_KEY, new LinkedHashMap<>(errorStats));
            }
        }
        return count;
    }

    private void checkAdaptiveRuleUpdate(String component, String error, int count) {
        int threshold = Math.max(1, properties.getErrors().getAdaptiveRuleThreshold());
        if (count < threshold || count % threshold != 0) return;
        Map<String, Object> suggestions = suggestRuleAdaptation(component, error);
        if (suggestions.isEmpty()) return;

        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("component", component);
        ctx.put("error", error);
        ctx.put("suggested_changes", suggestions);
        ctx.put("current_rules", getAdaptiveRules());
        append(newEntry("adaptive_suggestion", "Rule adaptation suggested", ctx, "info"));
        log.info("Error '{}' in {} seen {} times, suggested rule changes {}", error, component, count, suggestions);

        if (properties.getErrors().isAutoApplyAdaptiveRules()) {
            updateAdaptiveRules(suggestions);
        }
    }

    /**
     * Proposes a relaxed threshold for a frequently recurring error. Only
     * meta description, keyword density and readability errors have rules to relax.
     */
    Map<String, Object> suggestRuleAdaptation(String component, String error) {
        Map<String, Object> s = new LinkedHashMap<>();
        String e = error == null ? "" : error.toLowerCase(Locale.ROOT);
        switch (component == null ? "" : component) {
            case "meta_description" -> {
                if (e.contains("too short")) {
                    s.put("minMetaDescLength", Math.max(100, rule("minMetaDescLength").intValue() - 10));
                } else if (e.contains("too long")) {
                    s.put("maxMetaDescLength", Math.min(200, rule("maxMetaDescLength").intValue() + 10));
                }
            }
            case "keyword_density" -> {
                if (e.contains("too low")) {
                    s.put("minKeywordDensity", TextUtils.round(Math.max(0.1, rule("minKeywordDensity").doubleValue() - 0.1), 2));
                } else if (e.contains("too high")) {
                    s.put("maxKeywordDensity", Math.min(5.0, rule("maxKeywordDensity").doubleValue() + 0.5));
                }
            }
            case "readability" -> {
                if (e.contains("passive voice")) {
                    s.put("maxPassiveVoice", Math.min(20.0, rule("maxPassiveVoice").doubleValue() + 2.0));
                } else if (e.contains("long sentences")) {
                    s.put("maxLongSentences", Math.min(40.0, rule("maxLongSentences").doubleValue() + 5.0));
                } else if (e.contains("transition words")) {
                    s.put("minTransitionWords", Math.max(10.0, rule("minTransitionWords").doubleValue() - 5.0));
                }
            }
            default -> { }
        }
        return s;
    }

    private Number rule(String name) {
        Object v = adaptiveRules.get(name);
        if (v instanceof Number) return (Number) v;
        return (Number) defaultRules().get(name);
    }

    /**
     * Merges new rule values and pushes them into the live validation thresholds.
     */
    public synchronized Map<String, Object> updateAdaptiveRules(Map<String, Object> newRules) {
        Map<String, Object> old = getAdaptiveRules();
        adaptiveRules.putAll(newRules);
        applyToThresholds(newRules);
        persist(RULES_KEY, getAdaptiveRules());

        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("old_rules", old);
        ctx.put("new_rules", newRules);
        append(newEntry("adaptive_rules", "Rules updated", ctx, "info"));
        log.info("Adaptive rules updated: {}", newRules);
        return getAdaptiveRules();
    }

    private void applyToThresholds(Map<String, Object> rules) {
        OptimizerProperties.Thresholds t = properties.getThresholds();
        for (Map.Entry<String, Object> e : rules.entrySet()) {
            if (!(e.getValue() instanceof Number)) continue;
            Number n = (Number) e.getValue();
            switch (e.getKey()) {
                case "minMetaDescLength" -> t.setMinMetaDescLength(n.intValue());
                case "maxMetaDescLength" -> t.setMaxMetaDescLength(n.intValue());
                case "minKeywordDensity" -> t.setMinKeywordDensity(n.doubleValue());
                case "maxKeywordDensity" -> t.setMaxKeywordDensity(n.doubleValue());
                case "maxPassiveVoice" -> t.setMaxPassiveVoice(n.doubleValue());
                case "maxLongSentences" -> t.setMaxLongSentences(n.doubleValue());
                case "minTransitionWords" -> t.setMinTransitionWords(n.doubleValue());
                case "maxTitleLength" -> t.setMaxTitleLength(n.intValue());
                case "maxSubheadingKeywordUsage" -> t.setMaxSubheadingKeywordUsage(n.doubleValue());
                default -> log.warn("Ignoring unknown adaptive rule {}", e.getKey());
            }
        }
    }

    public Map<String, Object> getAdaptiveRules() {
        return new LinkedHashMap<>(adaptiveRules);
    }

    public void addManualOverride(String component, String error, Map<String, Object> override) {
        String key = overrideKey(component, error);
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("component", component);
        m.put("error", error);
        m.put("override", override);
        m.put("created_at", clock.instant().toString());
        m.put("active", true);
        manualOverrides.put(key, m);
        persist(OVERRIDES_KEY, new LinkedHashMap<>(manualOverrides));

        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("component", component);
        ctx.put("override_key", key);
        append(newEntry("manual_override", "Override created for: " + error, ctx, "info"));
    }

    /** @return the override configuration, or null when none is active */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getManualOverride(String component, String error) {
        Map<String, Object> m = manualOverrides.get(overrideKey(component, error));
        if (m == null || !Boolean.TRUE.equals(m.get("active"))) return null;
        return (Map<String, Object>) m.get("override");
    }

    /** Deactivates an override; it stays on record with its removal time. */
    public boolean removeManualOverride(String component, String error) {
        Map<String, Object> m = manualOverrides.get(overrideKey(component, error));
        if (m == null) return false;
        m.put("active", false);
        m.put("removed_at", clock.instant().toString());
        persist(OVERRIDES_KEY, new LinkedHashMap<>(manualOverrides));
        return true;
    }

    /**
     * Statistics for errors seen within the last {@code days}, most frequent first.
     */
    public List<ErrorStat> getErrorStats(String component, int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        List<ErrorStat> out = new ArrayList<>();
        synchronized (errorStats) {
            for (ErrorStat s : errorStats.values()) {
                if (s.lastOccurrence != null && s.lastOccurrence.isBefore(cutoff)) continue;
                if (component != null && !component.equals(s.component)) continue;
                out.add(s);
            }
        }
        out.sort((a, b) -> Integer.compare(b.count, a.count));
        return out;
    }

    /** Newest first. */
    public synchronized List<ErrorLogEntry> getRecentErrors(int limit, String component) {
        List<ErrorLogEntry> out = new ArrayList<>();
        Iterator<ErrorLogEntry> it = recent.descendingIterator();
        while (it.hasNext() && out.size() < limit) {
            ErrorLogEntry e = it.next();
            if (component == null || component.equals(e.component)) out.add(e);
        }
        return out;
    }

    /** Oldest first; entries logged at or after {@code since}. */
    public synchronized List<ErrorLogEntry> getErrorsSince(Instant since) {
        List<ErrorLogEntry> out = new ArrayList<>();
        for (ErrorLogEntry e : recent) {
            if (!e.timestamp.isBefore(since)) out.add(e);
        }
        return out;
    }

    /** @return number of entries dropped */
    public synchronized int clearOldLogs(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        int before = recent.size();
        recent.removeIf(e -> e.timestamp.isBefore(cutoff));
        return before - recent.size();
    }

    public ErrorCategory classifyError(String error, String component) {
        return ErrorCategory.classify(error);
    }

    /**
     * Logs the failure with its category and picks the next recovery step for
     * the error type. Unknown error types get the component's generic fallback.
     */
    public RecoveryDecision handleErrorWithRecovery(String errorType, String component, String error,
                                                    Map<String, Object> context, int attemptNumber) {
        ErrorCategory category = classifyError(error, component);
        Map<String, Object> ctx = new LinkedHashMap<>();
        if (context != null) ctx.putAll(context);
        ctx.put("error_type", errorType);
        ctx.put("category", category.code());
        ctx.put("attempt_number", attemptNumber);
        logValidationFailure(component, error, ctx, category == ErrorCategory.CRITICAL ? "error" : "warning");

        RecoveryDecision d = new RecoveryDecision();
        d.category = category;
        RecoveryPlan plan = RECOVERY_PLANS.get(errorType);
        if (plan == null) {
            d.success = false;
            d.action = "fallback";
            d.fallback = getFallbackStrategy(component);
            d.message = "Applied generic fallback for " + component + ": " + error;
            append(newEntry(component, "Applying generic fallback", Map.of("error", String.valueOf(error)), "warning"));
            return d;
        }
        if (attemptNumber >= plan.maxAttempts) {
            d.success = false;
            d.action = "max_attempts_reached";
            d.fallback = getFallbackStrategy(component);
            d.message = "Maximum recovery attempts (" + plan.maxAttempts + ") reached for " + errorType;
            return d;
        }
        String nextStep = plan.steps.get(Math.min(Math.max(attemptNumber, 1) - 1, plan.steps.size() - 1));
        d.success = true;
        d.action = "retry";
        d.strategy = plan.strategy;
        d.nextStep = nextStep;
        d.backoffDelaySeconds = calculateBackoffDelay(attemptNumber, plan.backoffMultiplier);
        d.attemptNumber = attemptNumber + 1;
        d.message = "Applying recovery strategy: " + plan.strategy + ", step: " + nextStep;
        return d;
    }

    /** {@code min(multiplier^(attempt-1), 30)} seconds. */
    static double calculateBackoffDelay(int attemptNumber, double multiplier) {
        double delay = Math.pow(multiplier, Math.max(0, attemptNumber - 1));
        return Math.min(delay, MAX_BACKOFF_SECONDS);
    }

    /**
     * Rates a partially failed operation. Returns null when the component has no
     * graceful degradation path and the failure should be reported as is.
     */
    public DegradationLevel applyGracefulDegradation(String component, int succeeded, int failed) {
        Map<String, Object> fb = FALLBACKS.get(component);
        if (fb == null || !Boolean.TRUE.equals(fb.get("graceful_degradation"))) {
            return null;
        }
        DegradationLevel level = DegradationLevel.fromCounts(succeeded, failed);
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("partial_results_count", succeeded);
        ctx.put("failures_count", failed);
        ctx.put("degradation_level", level.code());
        append(newEntry(component, "Applying graceful degradation", ctx, "warning"));
        log.warn("{} degraded ({}): {} succeeded, {} failed", component, level.code(), succeeded, failed);
        return level;
    }

    public Map<String, Object> getFallbackStrategy(String component) {
        Map<String, Object> fb = FALLBACKS.get(component);
        if (fb != null) return fb;
        return fallback("default_operation", "return_original", "skip_operation", "log_and_continue", false);
    }

    public ErrorReport generateUserFriendlyReport(List<ValidationMessage> errors) {
        ErrorReport report = new ErrorReport();
        if (errors == null || errors.isEmpty()) {
            report.summary = "No errors detected";
            return report;
        }
        Map<ErrorCategory, List<ValidationMessage>> classified = new LinkedHashMap<>();
        for (ValidationMessage m : errors) {
            classified.computeIfAbsent(classifyError(m.getMessage(), m.getComponent()), k -> new ArrayList<>()).add(m);
        }
        if (classified.containsKey(ErrorCategory.CRITICAL)) {
            report.severity = "critical";
            report.summary = classified.get(ErrorCategory.CRITICAL).size() + " critical error(s) detected";
        } else if (classified.containsKey(ErrorCategory.RECOVERABLE)) {
            report.severity = "warning";
            report.summary = classified.get(ErrorCategory.RECOVERABLE).size() + " recoverable error(s) detected";
        } else if (classified.containsKey(ErrorCategory.DEGRADED)) {
            report.severity = "warning";
            report.summary = "System operating in degraded mode";
        } else {
            report.severity = "info";
            report.summary = "Minor issues detected";
        }
        for (Map.Entry<ErrorCategory, List<ValidationMessage>> e : classified.entrySet()) {
            ErrorReport.CategoryDetails cd = new ErrorReport.CategoryDetails();
            cd.count = e.getValue().size();
            for (ValidationMessage m : e.getValue()) {
                ErrorReport.Detail d = new ErrorReport.Detail();
                d.component = m.getComponent() != null ? m.getComponent() : "unknown";
                d.message = simplifyErrorMessage(m.getMessage());
                d.timestamp = m.getTimestamp() != null ? m.getTimestamp() : clock.instant().toString();
                cd.errors.add(d);
            }
            report.details.put(e.getKey().code(), cd);
        }
        report.recommendations = generateRecommendations(classified);
        return report;
    }

    /** Report over the newest logged failures. */
    public ErrorReport generateUserFriendlyReport(int limit) {
        List<ValidationMessage> messages = new ArrayList<>();
        for (ErrorLogEntry e : getRecentErrors(limit, null)) {
            if ("info".equals(e.severity)) continue;
            messages.add(new ValidationMessage(e.error, e.component, e.timestamp.toString()));
        }
        return generateUserFriendlyReport(messages);
    }

    static String simplifyErrorMessage(String error) {
        if (error == null) return "";
        for (Map.Entry<Pattern, String> e : SIMPLIFICATIONS.entrySet()) {
            if (e.getKey().matcher(error).find()) return e.getValue();
        }
        return error;
    }

    private List<String> generateRecommendations(Map<ErrorCategory, List<ValidationMessage>> classified) {
        List<String> out = new ArrayList<>();
        if (classified.containsKey(ErrorCategory.CRITICAL)) {
            out.add("Critical errors detected - immediate action required");
            out.add("Check system logs for detailed error information");
            out.add("Verify API keys and service connectivity");
        }
        if (classified.containsKey(ErrorCategory.RECOVERABLE)) {
            out.add("Some operations failed but can be retried");
            out.add("Consider increasing timeout values if errors persist");
        }
        if (classified.containsKey(ErrorCategory.DEGRADED)) {
            out.add("System is operating with reduced functionality");
            out.add("Some features may not be available");
        }
        return out;
    }
}
