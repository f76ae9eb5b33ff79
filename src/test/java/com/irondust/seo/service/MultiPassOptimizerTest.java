package com.irondust.seo.service;

import com.irondust.seo.Fixtures;
import com.irondust.seo.MutableClock;
import com.irondust.seo.admin.SessionRegistry;
import com.irondust.seo.config.AppProperties;
import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.TerminationReason;
import com.irondust.seo.model.ValidationResult;
import com.irondust.seo.service.cache.InMemoryKeyValueStore;
import com.irondust.seo.service.cache.ValidationCache;
import com.irondust.seo.service.correction.CorrectionPromptGenerator;
import com.irondust.seo.service.error.ErrorLogEntry;
import com.irondust.seo.service.error.SeoErrorHandler;
import com.irondust.seo.service.pipeline.ValidationPipeline;
import com.irondust.seo.service.retry.RecordingSleeper;
import com.irondust.seo.service.retry.RetryManager;
import com.irondust.seo.util.TextUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MultiPassOptimizerTest {

    private final MutableClock clock = new MutableClock();
    private final OptimizerProperties props = new OptimizerProperties();
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);
    private final ValidationCache cache = new ValidationCache(props, store, clock);
    private final SeoErrorHandler errorHandler = new SeoErrorHandler(props, store, clock);
    private final SessionRegistry registry = new SessionRegistry(new AppProperties());

    /**
     * Hands out scores from a script. Each corrected version gets a marker in its
     * meta description so the final re-validation can look its score back up.
     */
    class ScriptedPipeline extends ValidationPipeline {
        final Deque<Double> scores = new ArrayDeque<>();
        final Map<String, Double> scoreByMeta = new HashMap<>();
        double validAt = 100.0;
        int calls;

        ScriptedPipeline(double... script) {
            super(props, cache, errorHandler, List.of(), clock);
            for (double s : script) scores.add(s);
        }

        @Override
        public ValidationResult validateAndCorrect(Content content, String focusKeyword, List<String> secondaryKeywords) {
            double score = scores.size() > 1 ? scores.poll() : scores.peek();
            calls++;
            Content corrected = content.copy();
            corrected.setMetaDescription(Fixtures.META + " v" + calls);
            scoreByMeta.put(corrected.getMetaDescription(), score);
            return result(score, corrected);
        }

        @Override
        public ValidationResult validate(Content content, String focusKeyword, List<String> secondaryKeywords) {
            return result(scoreByMeta.getOrDefault(content.getMetaDescription(), 0.0), content.copy());
        }

        private ValidationResult result(double score, Content corrected) {
            ValidationResult r = new ValidationResult(true, clock);
            if (score < validAt) {
                r.addError("Keyword density too low (0.30%, minimum 0.50%)", "keyword_density");
            } else if (score < 100.0) {
                r.addWarning("Not enough transition words (20.0%, minimum 30.0%)", "readability");
            }
            r.setOverallScore(score);
            r.setCorrectedContent(corrected);
            r.setCorrectionsMade(List.of("keyword_density"));
            return r;
        }
    }

    private MultiPassOptimizer optimizer(ValidationPipeline pipeline) {
        RetryManager retryManager = new RetryManager(props, cache, store, errorHandler, new RecordingSleeper(), clock);
        return new MultiPassOptimizer(props, pipeline, new IssueDetector(props), cache, retryManager, errorHandler,
                new CorrectionPromptGenerator(props), registry, clock);
    }

    @Test
    public void compliantInput_stopsBeforeAnyPass() {
        ValidationPipeline pipeline = Fixtures.pipeline(props, store, clock);
        Content input = Fixtures.compliantContent();

        OptimizationReport r = optimizer(pipeline).optimizeContent(input, Fixtures.KEYWORD, List.of());

        assertTrue(r.success);
        assertEquals(TerminationReason.INITIAL_COMPLIANCE, r.optimizationSummary.terminationReason);
        assertEquals(0, r.optimizationSummary.iterationsUsed);
        assertEquals(100.0, r.optimizationSummary.finalScore);
        assertEquals(input, r.content);
        assertEquals(1, r.progressData.iterations.size());
        assertEquals("baseline", r.progressData.iterations.get(0).type);
        assertEquals(TerminationReason.INITIAL_COMPLIANCE, r.progressReport.summary.terminationReason);
        assertTrue(r.sessionId.startsWith("opt_"));
    }

    @Test
    public void lowDensityInput_isImprovedByBaselineCorrection() {
        ValidationPipeline pipeline = Fixtures.pipeline(props, store, clock);
        Content input = Fixtures.lowDensityContent();

        OptimizationReport r = optimizer(pipeline).optimizeContent(input, Fixtures.KEYWORD, List.of());

        int before = TextUtils.countKeyword(TextUtils.stripTags(input.getBody()), Fixtures.KEYWORD);
        int after = TextUtils.countKeyword(TextUtils.stripTags(r.content.getBody()), Fixtures.KEYWORD);
        assertTrue(after > before, "keyword mentions " + before + " -> " + after);
        assertTrue(r.optimizationSummary.bestScore >= r.optimizationSummary.initialScore);
        assertTrue(r.progressData.issuesResolved.contains("keyword_density"));
    }

    @Test
    public void flatScores_endInStagnation() {
        props.setEscalateOnStagnation(false);
        ScriptedPipeline pipeline = new ScriptedPipeline(60.0);

        OptimizationReport r = optimizer(pipeline).optimizeContent(Fixtures.compliantContent(), Fixtures.KEYWORD, List.of());

        assertEquals(TerminationReason.STAGNATION_DETECTED, r.optimizationSummary.terminationReason);
        assertEquals(2, r.optimizationSummary.iterationsUsed);
        assertEquals(60.0, r.optimizationSummary.bestScore);
        assertFalse(r.success);
        assertEquals(2, r.progressReport.passRecords.size());
        assertEquals(TerminationReason.STAGNATION_DETECTED, registry.get(r.sessionId).terminationReason);
    }

    @Test
    public void tinyGainsEachPass_endInStagnation() {
        props.setEscalateOnStagnation(false);
        ScriptedPipeline pipeline = new ScriptedPipeline(60.00, 60.01, 60.02, 60.03, 60.04, 60.05);

        OptimizationReport r = optimizer(pipeline).optimizeContent(Fixtures.compliantContent(), Fixtures.KEYWORD, List.of());

        assertEquals(TerminationReason.STAGNATION_DETECTED, r.optimizationSummary.terminationReason);
        assertTrue(r.optimizationSummary.iterationsUsed <= 3);
        assertEquals(2, r.optimizationSummary.iterationsUsed);
        assertEquals(60.02, r.optimizationSummary.bestScore, 1e-9);
        assertEquals(Fixtures.META + " v3", r.content.getMetaDescription());
    }

    @Test
    public void scoresBelowBest_countAsStagnation() {
        props.setEscalateOnStagnation(false);
        ScriptedPipeline pipeline = new ScriptedPipeline(50.0, 80.0, 60.0, 75.0, 70.0);

        OptimizationReport r = optimizer(pipeline).optimizeContent(Fixtures.compliantContent(), Fixtures.KEYWORD, List.of());

        assertEquals(TerminationReason.STAGNATION_DETECTED, r.optimizationSummary.terminationReason);
        assertEquals(3, r.optimizationSummary.iterationsUsed);
        assertEquals(80.0, r.optimizationSummary.bestScore);
        assertEquals(Fixtures.META + " v2", r.content.getMetaDescription());
    }

    @Test
    public void complianceOnLastAllowedPass_winsOverIterationLimit() {
        props.setMaxIterations(3);
        ScriptedPipeline pipeline = new ScriptedPipeline(60.0, 70.0, 80.0, 100.0);

        OptimizationReport r = optimizer(pipeline).optimizeContent(Fixtures.compliantContent(), Fixtures.KEYWORD, List.of());

        assertEquals(TerminationReason.COMPLIANCE_ACHIEVED, r.optimizationSummary.terminationReason);
        assertEquals(3, r.optimizationSummary.iterationsUsed);
        assertEquals(3, r.progressData.totalIterations);
        assertTrue(r.success);
        assertEquals(Fixtures.META + " v4", r.content.getMetaDescription());
    }

    @Test
    public void risingScores_reachCompliance() {
        ScriptedPipeline pipeline = new ScriptedPipeline(60.0, 80.0, 100.0);

        OptimizationReport r = optimizer(pipeline).optimizeContent(Fixtures.compliantContent(), Fixtures.KEYWORD, List.of());

        assertTrue(r.success);
        assertEquals(TerminationReason.COMPLIANCE_ACHIEVED, r.optimizationSummary.terminationReason);
        assertEquals(60.0, r.optimizationSummary.initialScore);
        assertEquals(100.0, r.optimizationSummary.finalScore);
        assertEquals(40.0, r.optimizationSummary.improvement);
        assertEquals(2, r.optimizationSummary.iterationsUsed);
        assertEquals(Fixtures.META + " v3", r.content.getMetaDescription());
        assertEquals(20.0, r.progressData.iterations.get(1).scoreImprovement.doubleValue());
        assertTrue(r.progressReport.strategyEffectiveness.containsKey("multi_pass_correction"));
        assertTrue(registry.get(r.sessionId).complianceAchieved);
    }

    @Test
    public void bestVersion_isReturnedWhenLaterPassesRegress() {
        props.setEscalateOnStagnation(false);
        ScriptedPipeline pipeline = new ScriptedPipeline(50.0, 70.0, 65.0, 65.0);

        OptimizationReport r = optimizer(pipeline).optimizeContent(Fixtures.compliantContent(), Fixtures.KEYWORD, List.of());

        assertEquals(TerminationReason.STAGNATION_DETECTED, r.optimizationSummary.terminationReason);
        assertEquals(3, r.optimizationSummary.iterationsUsed);
        assertEquals(Fixtures.META + " v2", r.content.getMetaDescription());
        assertEquals(70.0, r.optimizationSummary.bestScore);
        assertEquals(70.0, r.optimizationSummary.finalScore);
        assertTrue(r.optimizationSummary.bestScore >= r.optimizationSummary.initialScore);
    }

    @Test
    public void stalledPass_isEscalatedToSmartRetry() {
        ScriptedPipeline pipeline = new ScriptedPipeline(60.0, 60.0, 90.0, 100.0);
        pipeline.validAt = 90.0;

        OptimizationReport r = optimizer(pipeline).optimizeContent(Fixtures.compliantContent(), Fixtures.KEYWORD, List.of());

        assertEquals(TerminationReason.COMPLIANCE_ACHIEVED, r.optimizationSummary.terminationReason);
        assertEquals(2, r.optimizationSummary.iterationsUsed);
        assertEquals(90.0, r.progressReport.passRecords.get(0).getAfterScore());
        assertEquals("smart_retry", r.progressReport.passRecords.get(0).getStrategyUsed().getName());
        assertTrue(r.errorLog.stream().anyMatch(e -> e.message.startsWith("Smart retry raised score to 90.0%")));
    }

    @Test
    public void failingPass_endsCycleAndKeepsBaseline() {
        ScriptedPipeline pipeline = new ScriptedPipeline(70.0) {
            @Override
            public ValidationResult validateAndCorrect(Content content, String focusKeyword, List<String> secondaryKeywords) {
                if (calls > 0) throw new IllegalStateException("provider offline");
                return super.validateAndCorrect(content, focusKeyword, secondaryKeywords);
            }
        };

        OptimizationReport r = optimizer(pipeline).optimizeContent(Fixtures.compliantContent(), Fixtures.KEYWORD, List.of());

        assertEquals(TerminationReason.CYCLE_FAILED, r.optimizationSummary.terminationReason);
        assertEquals(0, r.optimizationSummary.iterationsUsed);
        assertEquals(Fixtures.META + " v1", r.content.getMetaDescription());
        assertEquals(70.0, r.optimizationSummary.finalScore);
        assertEquals(0, r.progressData.totalIterations);
        assertTrue(r.progressReport.passRecords.isEmpty());
        assertTrue(r.errorLog.stream().anyMatch(e -> e.message.equals("Optimization cycle failed: provider offline")));
    }

    @Test
    public void failureOnSecondPass_countsOnlyRecordedPasses() {
        props.setEscalateOnStagnation(false);
        ScriptedPipeline pipeline = new ScriptedPipeline(60.0, 75.0) {
            @Override
            public ValidationResult validateAndCorrect(Content content, String focusKeyword, List<String> secondaryKeywords) {
                if (calls > 1) throw new IllegalStateException("provider offline");
                return super.validateAndCorrect(content, focusKeyword, secondaryKeywords);
            }
        };

        OptimizationReport r = optimizer(pipeline).optimizeContent(Fixtures.compliantContent(), Fixtures.KEYWORD, List.of());

        assertEquals(TerminationReason.CYCLE_FAILED, r.optimizationSummary.terminationReason);
        assertEquals(1, r.progressReport.passRecords.size());
        assertEquals(1, r.progressData.totalIterations);
        assertEquals(1, r.optimizationSummary.iterationsUsed);
        assertEquals(75.0, r.optimizationSummary.bestScore);
        assertEquals(Fixtures.META + " v2", r.content.getMetaDescription());
    }

    @Test
    public void baselineFailure_fallsBackToInput() {
        ValidationPipeline pipeline = new ValidationPipeline(props, cache, errorHandler, List.of(), clock) {
            @Override
            public ValidationResult validateAndCorrect(Content content, String focusKeyword, List<String> secondaryKeywords) {
                throw new IllegalStateException("boom");
            }
        };
        Content input = Fixtures.compliantContent();

        OptimizationReport r = optimizer(pipeline).optimizeContent(input, Fixtures.KEYWORD, List.of());

        assertFalse(r.success);
        assertEquals(TerminationReason.CRITICAL_ERROR, r.optimizationSummary.terminationReason);
        assertEquals(input, r.content);
        assertEquals("Optimization failed: boom", r.validationResult.errorsFor("optimizer").get(0).getMessage());
        assertNull(r.sessionId);
        assertEquals(1, registry.recent(10).size());
        assertTrue(registry.recent(10).get(0).sessionId.startsWith("failed_"));
        ErrorLogEntry logged = errorHandler.getRecentErrors(1, "optimization_loop").get(0);
        assertEquals("critical", logged.severity);
        assertEquals("boom", logged.error);
    }

    @Test
    public void checkTermination_followsPriorityOrder() {
        MultiPassOptimizer o = optimizer(new ScriptedPipeline(0.0));
        assertEquals(TerminationReason.COMPLIANCE_ACHIEVED, o.checkTermination(100.0, 5, 3, 0.0, true));
        assertEquals(TerminationReason.MAX_ITERATIONS_REACHED, o.checkTermination(90.0, 5, 3, 0.0, true));
        assertEquals(TerminationReason.STAGNATION_DETECTED, o.checkTermination(90.0, 2, 2, 0.5, true));
        assertNull(o.checkTermination(90.0, 2, 1, 0.5, false));
        assertNull(o.checkTermination(90.0, 2, 0, 5.0, true));

        props.setEnableEarlyTermination(false);
        assertEquals(TerminationReason.INSUFFICIENT_IMPROVEMENT, o.checkTermination(90.0, 2, 2, 0.5, true));
    }
}
