package com.irondust.seo.service.tracking;

import com.irondust.seo.model.Content;
import com.irondust.seo.model.ContentMetrics;
import com.irondust.seo.model.DetectionReport;
import com.irondust.seo.service.IssueDetector;
import com.irondust.seo.service.cache.ValidationCache;
import com.irondust.seo.util.TextUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Measures what a pass changed by running the issue detector on the content
 * before and after it, and keeps the per-pass history trends are computed from.
 * One instance per optimization session.
 */
public class ImprovementTracker {
    static final double SIGNIFICANT_IMPROVEMENT = 10.0;

    private final IssueDetector detector;
    private final ValidationCache cache;
    private final Clock clock;
    private final List<PassProgress> passHistory = new ArrayList<>();

    public ImprovementTracker(IssueDetector detector, ValidationCache cache, Clock clock) {
        this.detector = detector;
        this.cache = cache;
        this.clock = clock;
    }

    public ImprovementReport validateAndMeasureImprovement(Content before, Content after, String focusKeyword,
                                                           List<String> secondaryKeywords, int passNumber) {
        DetectionReport original = cache.cachedDetection(before, focusKeyword, secondaryKeywords, detector);
        DetectionReport corrected = cache.cachedDetection(after, focusKeyword, secondaryKeywords, detector);
        ImprovementReport.Improvements improvements = calculateImprovements(original, corrected);

        ImprovementReport report = new ImprovementReport();
        report.passNumber = passNumber;
        report.original = ImprovementReport.DetectionSummary.of(original);
        report.corrected = ImprovementReport.DetectionSummary.of(corrected);
        report.improvements = improvements;

        ImprovementReport.Summary summary = new ImprovementReport.Summary();
        summary.improved = improvements.scoreImprovement > 0;
        summary.complianceAchieved = corrected.isCompliant();
        summary.significantImprovement = improvements.scoreImprovement >= SIGNIFICANT_IMPROVEMENT;
        summary.allIssuesResolved = corrected.getTotalIssues() == 0;
        report.summary = summary;

        trackPassProgress(passNumber, original, corrected, improvements);
        report.trends = analyzeTrends();
        return report;
    }

    static ImprovementReport.Improvements calculateImprovements(DetectionReport original, DetectionReport corrected) {
        ImprovementReport.Improvements i = new ImprovementReport.Improvements();
        i.scoreImprovement = corrected.getComplianceScore() - original.getComplianceScore();
        i.issuesResolved = original.getTotalIssues() - corrected.getTotalIssues();
        i.criticalIssuesResolved = original.getCriticalIssues() - corrected.getCriticalIssues();
        i.majorIssuesResolved = original.getMajorIssues() - corrected.getMajorIssues();
        i.minorIssuesResolved = original.getMinorIssues() - corrected.getMinorIssues();
        if (original.getComplianceScore() < 100.0) {
            i.percentageImprovement = TextUtils.round(i.scoreImprovement / (100.0 - original.getComplianceScore()) * 100.0, 2);
        }
        Set<String> before = new LinkedHashSet<>(original.issueTypeCodes());
        Set<String> after = new LinkedHashSet<>(corrected.issueTypeCodes());
        for (String t : before) {
            if (after.contains(t)) i.persistentIssues.add(t);
            else i.resolvedIssueTypes.add(t);
        }
        for (String t : after) {
            if (!before.contains(t)) i.newIssues.add(t);
        }
        i.metricImprovements = metricImprovements(original.getMetrics(), corrected.getMetrics());
        return i;
    }

    private static Map<String, ImprovementReport.MetricChange> metricImprovements(ContentMetrics o, ContentMetrics c) {
        Map<String, ImprovementReport.MetricChange> out = new LinkedHashMap<>();
        if (o == null || c == null) return out;
        out.put("keywordDensity", change(o.getKeywordDensity(), c.getKeywordDensity()));
        out.put("metaDescriptionLength", change(o.getMetaDescriptionLength(), c.getMetaDescriptionLength()));
        out.put("passiveVoicePercentage", change(o.getPassiveVoicePercentage(), c.getPassiveVoicePercentage()));
        out.put("longSentencePercentage", change(o.getLongSentencePercentage(), c.getLongSentencePercentage()));
        out.put("transitionWordPercentage", change(o.getTransitionWordPercentage(), c.getTransitionWordPercentage()));
        return out;
    }

    private static ImprovementReport.MetricChange change(double original, double corrected) {
        ImprovementReport.MetricChange m = new ImprovementReport.MetricChange();
        m.original = original;
        m.corrected = corrected;
        m.change = TextUtils.round(corrected - original, 2);
        m.percentChange = original != 0 ? TextUtils.round((corrected - original) / original * 100.0, 2) : 0.0;
        return m;
    }

    private void trackPassProgress(int passNumber, DetectionReport original, DetectionReport corrected,
                                   ImprovementReport.Improvements improvements) {
        PassProgress p = new PassProgress();
        p.passNumber = passNumber;
        p.timestamp = clock.instant().toString();
        p.originalScore = original.getComplianceScore();
        p.correctedScore = corrected.getComplianceScore();
        p.scoreImprovement = improvements.scoreImprovement;
        p.issuesResolved = improvements.issuesResolved;
        p.resolvedIssueTypes = List.copyOf(improvements.resolvedIssueTypes);
        p.newIssues = List.copyOf(improvements.newIssues);
        p.persistentIssues = List.copyOf(improvements.persistentIssues);
        passHistory.add(p);
    }

    /**
     * Direction comes from the mean of the last three score deltas: above 5 is
     * improving, below -2 declining, below 1 stagnating, otherwise stable.
     */
    ImprovementReport.Trends analyzeTrends() {
        ImprovementReport.Trends t = new ImprovementReport.Trends();
        if (passHistory.size() < 2) {
            t.status = "insufficient_data";
            t.message = "Need at least 2 passes for trend analysis";
            return t;
        }
        List<Double> scores = new ArrayList<>();
        List<Double> deltas = new ArrayList<>();
        for (PassProgress p : passHistory) {
            scores.add(p.correctedScore);
            deltas.add(p.scoreImprovement);
        }
        List<Double> recent = deltas.subList(Math.max(0, deltas.size() - 3), deltas.size());
        double recentMean = mean(recent);
        if (recentMean > 5) t.trendDirection = "improving";
        else if (recentMean < -2) t.trendDirection = "declining";
        else if (recentMean < 1) t.trendDirection = "stagnating";
        else t.trendDirection = "stable";

        double velocity = mean(deltas);
        double current = scores.get(scores.size() - 1);
        t.status = "available";
        t.averageImprovement = TextUtils.round(velocity, 2);
        t.velocity = TextUtils.round(velocity, 2);
        t.currentScore = current;
        if (current >= 100.0) {
            t.passesNeeded = 0;
        } else if (velocity > 0) {
            t.passesNeeded = (int) Math.ceil((100.0 - current) / velocity);
        } else {
            t.passesNeeded = null;
        }
        t.consistentImprovement = Collections.min(deltas) > 0;
        t.scoreProgression = scores;
        return t;
    }

    private static double mean(List<Double> values) {
        double sum = 0;
        for (double v : values) sum += v;
        return values.isEmpty() ? 0.0 : sum / values.size();
    }

    public List<PassProgress> getPassHistory() {
        return Collections.unmodifiableList(passHistory);
    }

    public ImprovementReport.Trends getImprovementTrends() {
        return analyzeTrends();
    }

    public void clearHistory() {
        passHistory.clear();
    }
}
