package com.irondust.seo.service;

import com.irondust.seo.admin.SessionRegistry;
import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.CorrectionPrompt;
import com.irondust.seo.model.Issue;
import com.irondust.seo.model.StrategyDescriptor;
import com.irondust.seo.model.TerminationReason;
import com.irondust.seo.model.ValidationMessage;
import com.irondust.seo.model.ValidationResult;
import com.irondust.seo.service.cache.ValidationCache;
import com.irondust.seo.service.correction.CorrectionPromptGenerator;
import com.irondust.seo.service.error.SeoErrorHandler;
import com.irondust.seo.service.pipeline.ValidationPipeline;
import com.irondust.seo.service.retry.RetryManager;
import com.irondust.seo.service.retry.RetryOutcome;
import com.irondust.seo.service.retry.ValidationFailureException;
import com.irondust.seo.service.structure.HtmlStructurePreserver;
import com.irondust.seo.service.structure.IntegrityReport;
import com.irondust.seo.service.structure.PreservationResult;
import com.irondust.seo.service.structure.StructurePreserver;
import com.irondust.seo.service.tracking.ImprovementReport;
import com.irondust.seo.service.tracking.ImprovementTracker;
import com.irondust.seo.service.tracking.ProgressTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drives content through repeated validate-and-correct passes until it is
 * compliant or stops improving, and returns the best version seen.
 *
 * <p>Termination is checked after every pass in this order: compliance
 * reached, iteration budget spent, stagnation (consecutive passes gaining
 * less than the minimum improvement), then a low-gain pass while already
 * stagnating. The returned content is the best-scoring one, which need not
 * be the last pass's output.
 *
 * <p>Each call gets its own progress tracker, improvement tracker and
 * structure preserver, so sessions never share pass history.
 */
@Service
public class MultiPassOptimizer {
    private static final Logger log = LoggerFactory.getLogger(MultiPassOptimizer.class);

    static final String OPTIMIZER_COMPONENT = "optimizer";
    static final String LOOP_COMPONENT = "optimization_loop";
    static final String MULTI_PASS_STRATEGY = "multi_pass_correction";
    static final String SMART_RETRY_STRATEGY = "smart_retry";

    private final OptimizerProperties properties;
    private final ValidationPipeline pipeline;
    private final IssueDetector detector;
    private final ValidationCache cache;
    private final RetryManager retryManager;
    private final SeoErrorHandler errorHandler;
    private final CorrectionPromptGenerator promptGenerator;
    private final SessionRegistry sessionRegistry;
    private final Clock clock;

    public MultiPassOptimizer(OptimizerProperties properties, ValidationPipeline pipeline, IssueDetector detector,
                              ValidationCache cache, RetryManager retryManager, SeoErrorHandler errorHandler,
                              CorrectionPromptGenerator promptGenerator, SessionRegistry sessionRegistry, Clock clock) {
        this.properties = properties;
        this.pipeline = pipeline;
        this.detector = detector;
        this.cache = cache;
        this.retryManager = retryManager;
        this.errorHandler = errorHandler;
        this.promptGenerator = promptGenerator;
        this.sessionRegistry = sessionRegistry;
        this.clock = clock;
    }

    protected StructurePreserver createStructurePreserver() {
        return new HtmlStructurePreserver(properties.getStructure(), clock);
    }

    protected ProgressTracker createProgressTracker() {
        return new ProgressTracker(properties.getProgress(), clock);
    }

    protected ImprovementTracker createImprovementTracker() {
        return new ImprovementTracker(detector, cache, clock);
    }

    /** Mutable state of one optimization call. */
    private final class Session {
        final String keyword;
        final List<String> secondary;
        final ProgressTracker progress = createProgressTracker();
        final ImprovementTracker improvements = createImprovementTracker();
        final StructurePreserver preserver = createStructurePreserver();
        final OptimizationReport report = new OptimizationReport();
        final Instant startedAt = clock.instant();
        int iteration;

        Session(String keyword, List<String> secondary) {
            this.keyword = keyword;
            this.secondary = secondary;
        }

        void log(String level, String message) {
            report.errorLog.add(new OptimizationReport.LogEntry(level, message, iteration, clock.instant().toString()));
        }
    }

    public OptimizationReport optimizeContent(Content content, String focusKeyword, List<String> secondaryKeywords) {
        String keyword = focusKeyword != null ? focusKeyword : content.getFocusKeyword();
        List<String> secondary = secondaryKeywords != null ? secondaryKeywords : content.getSecondaryKeywords();
        Session s = new Session(keyword, secondary);
        log.info("Starting multi-pass optimization for '{}'", content.getTitle());

        Content current = content.copy();
        Content bestContent = content.copy();
        double bestScore = 0.0;
        try {
            ValidationResult baseline = pipeline.validateAndCorrect(current, keyword, secondary);
            double previousScore = baseline.getOverallScore();
            if (baseline.getCorrectedContent() != null) {
                current = baseline.getCorrectedContent().copy();
            }
            bestContent = current.copy();
            bestScore = previousScore;
            trackIteration(s, baseline, "baseline", null);
            s.log("info", "Initial SEO score: " + previousScore + "%");

            s.progress.startSession(content, previousScore, issuesOf(content, s));
            s.preserver.createSnapshot(content, "initial_content");

            if (previousScore >= properties.getTargetComplianceScore()) {
                log.info("Content '{}' compliant at baseline ({})", content.getTitle(), previousScore);
                s.progress.endSession(true, TerminationReason.INITIAL_COMPLIANCE);
                return finish(s, content, current, baseline, TerminationReason.INITIAL_COMPLIANCE, bestScore);
            }

            ValidationResult lastResult = baseline;
            TerminationReason reason = null;
            int stagnationCount = 0;
            for (s.iteration = 1; s.iteration <= properties.getMaxIterations(); s.iteration++) {
                int iteration = s.iteration;
                Content before = current;
                double beforeScore = previousScore;
                List<CorrectionPrompt> prompts = promptGenerator.generate(lastResult, keyword, properties.getPriorityOrder());

                ValidationResult result;
                Content optimized;
                ImprovementReport improvement;
                try {
                    result = pipeline.validateAndCorrect(before, keyword, secondary);
                    optimized = result.getCorrectedContent() != null ? result.getCorrectedContent().copy() : before.copy();
                    improvement = s.improvements.validateAndMeasureImprovement(before, optimized, keyword, secondary, iteration);
                } catch (RuntimeException e) {
                    log.error("Optimization cycle {} failed for '{}': {}", iteration, content.getTitle(), e.getMessage());
                    s.log("error", "Optimization cycle failed: " + e.getMessage());
                    reason = TerminationReason.CYCLE_FAILED;
                    s.iteration = iteration - 1;
                    break;
                }

                PreservationResult preserved = s.preserver.preserveContent(before, optimized);
                if (preserved.rolledBack) {
                    log.warn("Pass {} broke content structure, rolled back", iteration);
                    s.log("warning", "Content structure validation failed, rolled back to previous version");
                    current = preserved.content;
                    result = pipeline.validate(current, keyword, secondary);
                } else {
                    current = preserved.content;
                    s.preserver.createSnapshot(current, "iteration_" + iteration);
                }

                double score = result.getOverallScore();
                StrategyDescriptor strategy = strategy(MULTI_PASS_STRATEGY, "targeted_correction");
                if (score - previousScore < properties.getMinImprovementThreshold() && !result.isValid()
                        && properties.isEscalateOnStagnation()) {
                    ValidationResult retried = escalate(s, before, current, score);
                    if (retried != null) {
                        current = retried.getCorrectedContent().copy();
                        result = retried;
                        score = retried.getOverallScore();
                        strategy = strategy(SMART_RETRY_STRATEGY, "retry_correction");
                        s.preserver.createSnapshot(current, "retry_" + iteration);
                    }
                }
                double delta = score - previousScore;
                log.info("Iteration {} score: {} ({}{})", iteration, score, delta >= 0 ? "+" : "", delta);
                s.log("info", "Iteration " + iteration + " score: " + score + "%");

                trackIteration(s, result, "optimization", improvement.improvements);
                s.progress.recordPass(iteration, before, current, beforeScore, score,
                        issuesOf(before, s), issuesOf(current, s), prompts, strategy);

                boolean newBest = score > bestScore;
                if (newBest) {
                    bestContent = current.copy();
                    bestScore = score;
                }
                // Only a new best by a meaningful margin clears stagnation.
                boolean wasStagnating = stagnationCount > 0;
                if (newBest && delta >= properties.getMinImprovementThreshold()) {
                    stagnationCount = 0;
                } else {
                    stagnationCount++;
                }

                reason = checkTermination(score, iteration, stagnationCount, delta, wasStagnating);
                lastResult = result;
                previousScore = score;
                if (reason != null) {
                    log.info("Optimization of '{}' terminated: {}", content.getTitle(), reason.code());
                    break;
                }
            }
            if (reason == null) {
                reason = TerminationReason.MAX_ITERATIONS_REACHED;
                s.iteration = properties.getMaxIterations();
            }

            ValidationResult finalResult = pipeline.validate(bestContent, keyword, secondary);
            boolean compliant = finalResult.getOverallScore() >= properties.getTargetComplianceScore();
            s.progress.endSession(compliant, reason);
            return finish(s, content, bestContent, finalResult, reason, Math.max(bestScore, finalResult.getOverallScore()));
        } catch (RuntimeException e) {
            log.error("Critical optimization error for '{}': {}", content.getTitle(), e.getMessage(), e);
            s.log("error", "Critical optimization error: " + e.getMessage());
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("iteration", s.iteration);
            ctx.put("content_title", String.valueOf(content.getTitle()));
            errorHandler.logValidationFailure(LOOP_COMPONENT, String.valueOf(e.getMessage()), ctx, "critical");

            ValidationResult fallback = new ValidationResult(false, clock);
            fallback.addError("Optimization failed: " + e.getMessage(), OPTIMIZER_COMPONENT);
            fallback.setCorrectedContent(bestContent);
            fallback.calculateScore();
            if (s.progress.getSessionId() != null) {
                s.progress.endSession(false, TerminationReason.CRITICAL_ERROR);
            }
            return finish(s, content, bestContent, fallback, TerminationReason.CRITICAL_ERROR, bestScore);
        }
    }

    /**
     * Hands a stalled pass to the retry manager. The retried version is kept
     * only when it scores higher and keeps the structure of {@code before}.
     *
     * @return the accepted retry result, or null
     */
    private ValidationResult escalate(Session s, Content before, Content current, double score) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("focus_keyword", s.keyword);
        context.put("component", LOOP_COMPONENT);
        context.put("iteration", s.iteration);
        RetryOutcome<ValidationResult> outcome = retryManager.executeWithRetry((c, ctx) -> {
            ValidationResult r = pipeline.validateAndCorrect(c, s.keyword, s.secondary);
            if (!r.isValid()) {
                Set<String> failed = new LinkedHashSet<>();
                for (ValidationMessage m : r.getErrors()) failed.add(m.getComponent());
                String message = r.getErrors().isEmpty() ? "Validation failed" : r.getErrors().get(0).getMessage();
                int total = pipeline.getSteps().size();
                throw new ValidationFailureException(message, Math.max(0, total - failed.size()), failed.size());
            }
            return r;
        }, current, context);

        if (!outcome.isSuccess()) {
            s.log("warning", "Smart retry failed after " + outcome.getAttempts() + " attempt(s): " + outcome.getError());
            return null;
        }
        ValidationResult r = outcome.getResult();
        if (r.getCorrectedContent() == null || r.getOverallScore() <= score) {
            return null;
        }
        IntegrityReport integrity = s.preserver.validateIntegrity(before, r.getCorrectedContent());
        if (integrity.hasMajorViolation()) {
            log.warn("Discarding retry result for pass {}: structure changed", s.iteration);
            return null;
        }
        s.log("info", "Smart retry raised score to " + r.getOverallScore() + "% using "
                + (outcome.getLastStrategy() != null ? outcome.getLastStrategy().getName() : "none"));
        return r;
    }

    TerminationReason checkTermination(double score, int iteration, int stagnationCount, double delta,
                                       boolean wasStagnating) {
        if (score >= properties.getTargetComplianceScore()) {
            return TerminationReason.COMPLIANCE_ACHIEVED;
        }
        if (iteration >= properties.getMaxIterations()) {
            return TerminationReason.MAX_ITERATIONS_REACHED;
        }
        if (properties.isEnableEarlyTermination() && stagnationCount >= properties.getStagnationThreshold()) {
            return TerminationReason.STAGNATION_DETECTED;
        }
        if (delta < properties.getMinImprovementThreshold() && wasStagnating) {
            return TerminationReason.INSUFFICIENT_IMPROVEMENT;
        }
        return null;
    }

    private StrategyDescriptor strategy(String name, String type) {
        return new StrategyDescriptor(name, type, properties.getPriorityOrder());
    }

    private List<Issue> issuesOf(Content c, Session s) {
        return cache.cachedDetection(c, s.keyword, s.secondary, detector).getIssues();
    }

    private void trackIteration(Session s, ValidationResult result, String type,
                                ImprovementReport.Improvements details) {
        OptimizationReport.ProgressData pd = s.report.progressData;
        OptimizationReport.IterationData d = new OptimizationReport.IterationData();
        d.iteration = s.iteration;
        d.type = type;
        d.score = result.getOverallScore();
        d.valid = result.isValid();
        d.errorCount = result.getErrors().size();
        d.warningCount = result.getWarnings().size();
        d.timestamp = clock.instant().toString();
        d.improvementDetails = details;
        if (!pd.iterations.isEmpty()) {
            OptimizationReport.IterationData prev = pd.iterations.get(pd.iterations.size() - 1);
            d.scoreImprovement = d.score - prev.score;
            d.errorReduction = prev.errorCount - d.errorCount;
            d.warningReduction = prev.warningCount - d.warningCount;
        }
        pd.iterations.add(d);
        pd.totalIterations = s.iteration;
        if (s.iteration > 0) {
            pd.correctionsMade.addAll(result.getCorrectionsMade());
        }
        for (String c : result.getCorrectionsMade()) {
            if (!pd.issuesResolved.contains(c)) pd.issuesResolved.add(c);
        }
    }

    private OptimizationReport finish(Session s, Content input, Content content, ValidationResult result,
                                      TerminationReason reason, double bestScore) {
        OptimizationReport r = s.report;
        OptimizationReport.ProgressData pd = r.progressData;
        double target = properties.getTargetComplianceScore();
        long duration = clock.millis() - s.startedAt.toEpochMilli();
        // Passes that failed before being recorded do not count.
        pd.totalIterations = s.progress.getPassRecords().size();

        OptimizationReport.Performance perf = new OptimizationReport.Performance();
        perf.totalDurationMillis = duration;
        perf.averageIterationMillis = pd.totalIterations > 0 ? (double) duration / pd.totalIterations : 0.0;
        perf.finalComplianceScore = result.getOverallScore();
        perf.totalCorrections = pd.correctionsMade.size();
        perf.issuesResolved = pd.issuesResolved.size();
        pd.performance = perf;

        double initialScore = pd.iterations.isEmpty() ? 0.0 : pd.iterations.get(0).score;
        OptimizationReport.Summary sum = r.optimizationSummary;
        sum.initialScore = initialScore;
        sum.finalScore = result.getOverallScore();
        sum.bestScore = bestScore;
        sum.improvement = pd.iterations.isEmpty() ? 0.0 : result.getOverallScore() - initialScore;
        sum.iterationsUsed = s.progress.getPassRecords().size();
        sum.complianceAchieved = result.getOverallScore() >= target;
        sum.terminationReason = reason;

        r.success = sum.complianceAchieved;
        r.sessionId = s.progress.getSessionId();
        r.content = content;
        r.validationResult = result;
        r.progressReport = s.progress.generateComprehensiveReport();
        r.improvementTrends = s.improvements.getImprovementTrends();
        r.issueSummary = errorHandler.generateUserFriendlyReport(result.getErrors());

        SessionRegistry.SessionInfo info = new SessionRegistry.SessionInfo();
        info.sessionId = r.sessionId != null ? r.sessionId : "failed_" + s.startedAt.toEpochMilli();
        info.title = input.getTitle();
        info.focusKeyword = s.keyword;
        info.startedAt = s.startedAt;
        info.endedAt = clock.instant();
        info.initialScore = sum.initialScore;
        info.finalScore = sum.finalScore;
        info.bestScore = sum.bestScore;
        info.iterationsUsed = sum.iterationsUsed;
        info.complianceAchieved = sum.complianceAchieved;
        info.terminationReason = reason;
        sessionRegistry.put(info);
        return r;
    }
}
