package com.irondust.seo.service.error;

import com.irondust.seo.MutableClock;
import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.DegradationLevel;
import com.irondust.seo.model.ValidationMessage;
import com.irondust.seo.service.cache.InMemoryKeyValueStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SeoErrorHandlerTest {

    private static final String SHORT_META = "Meta description too short (80 chars, minimum 120)";

    private final MutableClock clock = new MutableClock();
    private final OptimizerProperties props = new OptimizerProperties();
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);

    private SeoErrorHandler handler() {
        return new SeoErrorHandler(props, store, clock);
    }

    @Test
    public void classifyError_matchesCategoryPatterns() {
        SeoErrorHandler h = handler();
        assertEquals(ErrorCategory.CRITICAL, h.classifyError("Fatal parser crash", "pipeline"));
        assertEquals(ErrorCategory.RECOVERABLE, h.classifyError("Request timeout after 30s", "ai_correction"));
        assertEquals(ErrorCategory.DEGRADED, h.classifyError("Partial results returned", "validation"));
        assertEquals(ErrorCategory.INFORMATIONAL, h.classifyError("Notice: thin content", "readability"));
        assertEquals(ErrorCategory.RECOVERABLE, h.classifyError("Something odd happened", "title"));
    }

    @Test
    public void gracefulDegradation_ratesBySuccessShare() {
        SeoErrorHandler h = handler();
        assertEquals(DegradationLevel.MINOR, h.applyGracefulDegradation("validation", 4, 1));
        assertEquals(DegradationLevel.MODERATE, h.applyGracefulDegradation("validation", 2, 2));
        assertEquals(DegradationLevel.SEVERE, h.applyGracefulDegradation("validation", 1, 4));
        assertNull(h.applyGracefulDegradation("title", 1, 1));
        assertEquals("Applying graceful degradation", h.getRecentErrors(1, "validation").get(0).error);
    }

    @Test
    public void recurringError_suggestsRelaxedRule() {
        SeoErrorHandler h = handler();
        for (int i = 0; i < 10; i++) {
            h.logValidationFailure("meta_description", SHORT_META);
        }

        ErrorLogEntry suggestion = h.getRecentErrors(1, "adaptive_suggestion").get(0);
        assertEquals("info", suggestion.severity);
        assertEquals(Map.of("minMetaDescLength", 110), suggestion.context.get("suggested_changes"));
        assertEquals(120, props.getThresholds().getMinMetaDescLength());

        ErrorStat stat = h.getErrorStats("meta_description", 7).get(0);
        assertEquals(10, stat.count);
        assertEquals(10, stat.severityCounts.get("error").intValue());
        assertTrue(store.get(SeoErrorHandler.STATS_KEY).isPresent());
    }

    @Test
    public void recurringError_autoAppliesWhenEnabled() {
        props.getErrors().setAutoApplyAdaptiveRules(true);
        SeoErrorHandler h = handler();
        for (int i = 0; i < 10; i++) {
            h.logValidationFailure("keyword_density", "Keyword density too low (0.20%, minimum 0.50%)");
        }
        assertEquals(0.4, props.getThresholds().getMinKeywordDensity(), 1e-9);
        assertEquals(0.4, ((Number) h.getAdaptiveRules().get("minKeywordDensity")).doubleValue(), 1e-9);
        assertTrue(store.get(SeoErrorHandler.RULES_KEY).isPresent());
    }

    @Test
    public void suggestRuleAdaptation_onlyForKnownComponents() {
        SeoErrorHandler h = handler();
        assertEquals(Map.of("maxPassiveVoice", 12.0),
                h.suggestRuleAdaptation("readability", "Too much passive voice (14.0%, maximum 10.0%)"));
        assertEquals(Map.of("maxMetaDescLength", 166),
                h.suggestRuleAdaptation("meta_description", "Meta description too long (170 chars, maximum 156)"));
        assertTrue(h.suggestRuleAdaptation("title", "Title too long").isEmpty());
    }

    @Test
    public void recovery_walksPlanSteps() {
        SeoErrorHandler h = handler();
        RecoveryDecision first = h.handleErrorWithRecovery("rate_limit_exceeded", "ai_correction",
                "Rate limit hit", null, 1);
        assertTrue(first.success);
        assertEquals("retry", first.action);
        assertEquals("exponential_backoff", first.strategy);
        assertEquals("wait_and_retry", first.nextStep);
        assertEquals(1.0, first.backoffDelaySeconds.doubleValue());
        assertEquals(2, first.attemptNumber.intValue());
        assertEquals(ErrorCategory.RECOVERABLE, first.category);

        RecoveryDecision third = h.handleErrorWithRecovery("rate_limit_exceeded", "ai_correction",
                "Rate limit hit", Map.of(), 3);
        assertEquals("queue_for_later", third.nextStep);
        assertEquals(4.0, third.backoffDelaySeconds.doubleValue());

        RecoveryDecision exhausted = h.handleErrorWithRecovery("rate_limit_exceeded", "ai_correction",
                "Rate limit hit", Map.of(), 5);
        assertFalse(exhausted.success);
        assertEquals("max_attempts_reached", exhausted.action);
        assertEquals("use_ai_provider", exhausted.fallback.get("primary"));
    }

    @Test
    public void recovery_unknownTypeUsesGenericFallback() {
        RecoveryDecision d = handler().handleErrorWithRecovery("disk_full", "title", "No space left", null, 1);
        assertFalse(d.success);
        assertEquals("fallback", d.action);
        assertEquals("default_operation", d.fallback.get("primary"));
        assertEquals(false, d.fallback.get("graceful_degradation"));
    }

    @Test
    public void backoffDelay_isCapped() {
        assertEquals(1.0, SeoErrorHandler.calculateBackoffDelay(1, 2.0));
        assertEquals(8.0, SeoErrorHandler.calculateBackoffDelay(4, 2.0));
        assertEquals(30.0, SeoErrorHandler.calculateBackoffDelay(10, 2.0));
    }

    @Test
    public void simplifyErrorMessage_usesFirstMatchingPattern() {
        assertEquals("Unable to connect to the service", SeoErrorHandler.simplifyErrorMessage("Connection refused"));
        assertEquals("The operation took too long to complete",
                SeoErrorHandler.simplifyErrorMessage("Invalid response after timeout"));
        assertEquals("Title too long", SeoErrorHandler.simplifyErrorMessage("Title too long"));
        assertEquals("", SeoErrorHandler.simplifyErrorMessage(null));
    }

    @Test
    public void manualOverride_isAttachedUntilRemoved() {
        SeoErrorHandler h = handler();
        h.addManualOverride("meta_description", SHORT_META, Map.of("accept", true));

        assertEquals(Map.of("accept", true), h.getManualOverride("meta_description", SHORT_META));
        ErrorLogEntry logged = h.logValidationFailure("meta_description", SHORT_META);
        assertNotNull(logged.manualOverride);
        assertTrue(store.get(SeoErrorHandler.OVERRIDES_KEY).isPresent());

        assertTrue(h.removeManualOverride("meta_description", SHORT_META));
        assertNull(h.getManualOverride("meta_description", SHORT_META));
        assertNull(h.logValidationFailure("meta_description", SHORT_META).manualOverride);
        assertFalse(h.removeManualOverride("title", "never logged"));
    }

    @Test
    public void state_isReloadedFromStore() {
        SeoErrorHandler first = handler();
        for (int i = 0; i < 10; i++) {
            first.logValidationFailure("title", "Title too long");
        }
        first.addManualOverride("title", "Title too long", Map.of("accept", true));

        SeoErrorHandler second = handler();
        assertEquals(10, second.getErrorStats("title", 1).get(0).count);
        assertEquals(Map.of("accept", true), second.getManualOverride("title", "Title too long"));
    }

    @Test
    public void recentErrors_newestFirstAndPrunable() {
        SeoErrorHandler h = handler();
        h.logValidationFailure("title", "first");
        clock.advance(Duration.ofDays(2));
        h.logValidationFailure("images", "second");
        h.logValidationFailure("title", "third");

        assertEquals("third", h.getRecentErrors(10, null).get(0).error);
        assertEquals(List.of("third", "first"),
                h.getRecentErrors(10, "title").stream().map(e -> e.error).collect(Collectors.toList()));
        assertEquals(2, h.getErrorsSince(clock.instant()).size());
        assertEquals(1, h.clearOldLogs(1));
        assertEquals(2, h.getRecentErrors(10, null).size());
    }

    @Test
    public void userFriendlyReport_leadsWithMostSevereCategory() {
        SeoErrorHandler h = handler();
        assertEquals("No errors detected", h.generateUserFriendlyReport(List.of()).summary);

        ErrorReport r = h.generateUserFriendlyReport(List.of(
                new ValidationMessage("Fatal exception in parser", "pipeline", "2024-05-01T10:00:00Z"),
                new ValidationMessage("Provider timeout", "ai_correction", null)));

        assertEquals("critical", r.severity);
        assertEquals("1 critical error(s) detected", r.summary);
        assertEquals(1, r.details.get("critical").count);
        assertEquals("An unexpected error occurred", r.details.get("critical").errors.get(0).message);
        assertEquals("The operation took too long to complete", r.details.get("recoverable").errors.get(0).message);
        assertEquals(clock.instant().toString(), r.details.get("recoverable").errors.get(0).timestamp);
        assertTrue(r.recommendations.contains("Some operations failed but can be retried"));
    }

    @Test
    public void userFriendlyReport_fromLogSkipsInfoEntries() {
        SeoErrorHandler h = handler();
        h.logValidationFailure("images", "Partial image data");
        h.addManualOverride("images", "Partial image data", Map.of());

        ErrorReport r = h.generateUserFriendlyReport(10);
        assertEquals("System operating in degraded mode", r.summary);
        assertEquals(1, r.details.get("degraded").count);
    }
}
