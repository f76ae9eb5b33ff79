package com.irondust.seo.service.tracking;

import com.irondust.seo.Fixtures;
import com.irondust.seo.MutableClock;
import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.CorrectionPrompt;
import com.irondust.seo.model.Issue;
import com.irondust.seo.model.IssueType;
import com.irondust.seo.model.PassImprovements;
import com.irondust.seo.model.PassRecord;
import com.irondust.seo.model.StrategyDescriptor;
import com.irondust.seo.model.StrategyMetrics;
import com.irondust.seo.model.TerminationReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProgressTrackerTest {

    private final MutableClock clock = new MutableClock();
    private final OptimizerProperties.Progress config = new OptimizerProperties.Progress();
    private final StrategyDescriptor strategy = new StrategyDescriptor("multi_pass_correction", "targeted_correction",
            List.of("meta_description"));

    private static Issue issue(IssueType type) {
        return new Issue(type, 0, 1, List.of(), type.code());
    }

    private static Content version(int n) {
        Content c = Fixtures.compliantContent();
        c.setTitle(Fixtures.TITLE + " v" + n);
        return c;
    }

    @Test
    public void recordPass_withoutSession_throws() {
        ProgressTracker t = new ProgressTracker(config, clock);
        assertThrows(IllegalStateException.class,
                () -> t.recordPass(1, version(0), version(1), 40, 60, List.of(), List.of(), List.of(), strategy));
    }

    @Test
    public void recordPass_requiresConsecutivePassNumbers() {
        ProgressTracker t = new ProgressTracker(config, clock);
        t.startSession(version(0), 40, List.of());
        assertThrows(IllegalStateException.class,
                () -> t.recordPass(2, version(0), version(1), 40, 60, List.of(), List.of(), List.of(), strategy));
        t.recordPass(1, version(0), version(1), 40, 60, List.of(), List.of(), List.of(), strategy);
        assertThrows(IllegalStateException.class,
                () -> t.recordPass(1, version(1), version(2), 60, 70, List.of(), List.of(), List.of(), strategy));
        assertEquals(1, t.getPassRecords().size());
    }

    @Test
    public void startSession_resetsStateAndKeepsBaseline() {
        ProgressTracker t = new ProgressTracker(config, clock);
        String first = t.startSession(version(0), 40, List.of());
        t.recordPass(1, version(0), version(1), 40, 60, List.of(), List.of(), List.of(), strategy);

        String second = t.startSession(version(5), 55, List.of());
        assertTrue(second.startsWith("opt_"));
        assertNotEquals(first, second);
        assertTrue(t.getPassRecords().isEmpty());
        assertEquals(1, t.getContentHistory().size());
        assertEquals(0, t.getContentHistory().get(0).getPassNumber());
        assertEquals("initial", t.getContentHistory().get(0).getLabel());
    }

    @Test
    public void rollbackToPassZero_returnsCopyOfInput() {
        ProgressTracker t = new ProgressTracker(config, clock);
        t.startSession(version(0), 40, List.of());
        t.recordPass(1, version(0), version(1), 40, 60, List.of(), List.of(), List.of(), strategy);

        Content restored = t.rollbackToPass(0);
        assertEquals(Fixtures.TITLE + " v0", restored.getTitle());
        assertEquals(Fixtures.BODY, restored.getBody());
        restored.setTitle("mutated");
        assertEquals(Fixtures.TITLE + " v0", t.rollbackToPass(0).getTitle());
        assertEquals(Fixtures.TITLE + " v1", t.rollbackToPass(1).getTitle());
        assertNull(t.rollbackToPass(7));
    }

    @Test
    public void rollback_disabled_returnsNull() {
        config.setEnableRollback(false);
        ProgressTracker t = new ProgressTracker(config, clock);
        t.startSession(version(0), 40, List.of());
        assertNull(t.rollbackToPass(0));
    }

    @Test
    public void history_isBoundedButKeepsBaseline() {
        config.setMaxHistoryEntries(3);
        ProgressTracker t = new ProgressTracker(config, clock);
        t.startSession(version(0), 10, List.of());
        for (int i = 1; i <= 5; i++) {
            t.recordPass(i, version(i - 1), version(i), i * 10, i * 10 + 10, List.of(), List.of(), List.of(), strategy);
        }
        assertEquals(3, t.getContentHistory().size());
        assertEquals(0, t.getContentHistory().get(0).getPassNumber());
        assertEquals(4, t.getContentHistory().get(1).getPassNumber());
        assertEquals(5, t.getContentHistory().get(2).getPassNumber());
        assertNotNull(t.rollbackToPass(0));
        assertNull(t.rollbackToPass(2));
    }

    @Test
    public void recordPass_measuresDurationAndIssueChanges() {
        ProgressTracker t = new ProgressTracker(config, clock);
        t.startSession(version(0), 40, List.of());
        clock.advance(Duration.ofMillis(250));
        List<CorrectionPrompt> prompts = List.of(
                new CorrectionPrompt("meta_description_fix", "meta_description", "Expand the meta description", 10, "too short"),
                new CorrectionPrompt("title_fix", "title", "Shorten the title", 7, "too long"));
        PassRecord r = t.recordPass(1, version(0), version(1), 40, 70,
                List.of(issue(IssueType.META_DESCRIPTION_SHORT), issue(IssueType.TITLE_TOO_LONG)),
                List.of(issue(IssueType.TITLE_TOO_LONG)), prompts, strategy);

        assertEquals(250, r.getDurationMillis());
        assertEquals(30.0, r.getScoreImprovement());
        assertEquals(1, r.getIssuesResolved());
        assertEquals(List.of("meta_description_short"), r.getImprovements().getResolvedIssueTypes());
        assertEquals(List.of("title_too_long"), r.getImprovements().getPersistentIssueTypes());
        assertEquals(0.5, r.getImprovements().getEffectivenessRate());
        assertSame(r, t.getPassRecord(1));
        assertNull(t.getPassRecord(2));
    }

    @Test
    public void calculatePassImprovements_reportsNewIssueTypes() {
        PassImprovements p = ProgressTracker.calculatePassImprovements(
                List.of(issue(IssueType.NO_IMAGES)),
                List.of(issue(IssueType.NO_IMAGES), issue(IssueType.KEYWORD_DENSITY_HIGH)),
                List.of());
        assertEquals(List.of("keyword_density_high"), p.getNewIssueTypes());
        assertTrue(p.getResolvedIssueTypes().isEmpty());
        assertEquals(0.0, p.getEffectivenessRate());
    }

    @Test
    public void strategyEffectiveness_isAggregatedByName() {
        ProgressTracker t = new ProgressTracker(config, clock);
        t.startSession(version(0), 40, List.of());
        t.recordPass(1, version(0), version(1), 40, 60, List.of(), List.of(), List.of(), strategy);
        t.recordPass(2, version(1), version(2), 60, 60, List.of(), List.of(), List.of(), strategy);

        StrategyMetrics m = t.getStrategyMetrics().get("multi_pass_correction");
        assertEquals(2, m.getTimesUsed());
        assertEquals(20.0, m.getCumulativeScoreImprovement());
        assertEquals(1, m.getSuccessfulApplications());
        assertEquals(50.0, m.getSuccessRate());
    }

    @Test
    public void endSession_andReport_summarizeSession() {
        ProgressTracker t = new ProgressTracker(config, clock);
        t.startSession(version(0), 40, List.of(issue(IssueType.NO_IMAGES)));
        clock.advance(Duration.ofSeconds(1));
        t.recordPass(1, version(0), version(1), 40, 75, List.of(), List.of(), List.of(), strategy);
        clock.advance(Duration.ofSeconds(1));
        t.recordPass(2, version(1), version(2), 75, 70, List.of(), List.of(), List.of(), strategy);

        SessionSummary s = t.endSession(false, TerminationReason.STAGNATION_DETECTED);
        assertEquals(2, s.totalPasses);
        assertEquals(2000, s.durationMillis);
        assertEquals(30.0, s.totalImprovement);
        assertEquals(15.0, s.improvementRate);
        assertEquals(TerminationReason.STAGNATION_DETECTED, s.terminationReason);

        ProgressReport report = t.generateComprehensiveReport();
        assertEquals("available", report.progressAnalysis.status);
        assertEquals(List.of(75.0, 70.0), report.progressAnalysis.scoreProgression);
        assertEquals(1, report.progressAnalysis.bestPass.passNumber);
        assertEquals(2, report.progressAnalysis.worstPass.passNumber);
        assertFalse(report.progressAnalysis.consistentImprovement);
        assertEquals(3, report.contentHistory.totalEntries);
        assertEquals(15.0, report.detailedMetrics.efficiencyScore);
        assertEquals("available", report.beforeAfterComparison.status);
        assertEquals(30.0, report.beforeAfterComparison.improvement.doubleValue());
    }

    @Test
    public void report_withoutDetailedReporting_omitsDetails() {
        config.setDetailedReporting(false);
        ProgressTracker t = new ProgressTracker(config, clock);
        t.startSession(version(0), 40, List.of());
        ProgressReport report = t.generateComprehensiveReport();
        assertEquals("no_data", report.progressAnalysis.status);
        assertNull(report.detailedMetrics);
        assertNull(report.beforeAfterComparison);
    }
}
