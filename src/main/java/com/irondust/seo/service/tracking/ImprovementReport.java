package com.irondust.seo.service.tracking;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.irondust.seo.model.ContentMetrics;
import com.irondust.seo.model.DetectionReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Before/after comparison of one pass, as produced by {@link ImprovementTracker}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImprovementReport {

    public static class DetectionSummary {
        public double complianceScore;
        public int totalIssues;
        public int criticalIssues;
        public int majorIssues;
        public int minorIssues;
        public boolean compliant;
        public ContentMetrics metrics;

        static DetectionSummary of(DetectionReport r) {
            DetectionSummary s = new DetectionSummary();
            s.complianceScore = r.getComplianceScore();
            s.totalIssues = r.getTotalIssues();
            s.criticalIssues = r.getCriticalIssues();
            s.majorIssues = r.getMajorIssues();
            s.minorIssues = r.getMinorIssues();
            s.compliant = r.isCompliant();
            s.metrics = r.getMetrics();
            return s;
        }
    }

    public static class MetricChange {
        public double original;
        public double corrected;
        public double change;
        public double percentChange;
    }

    public static class Improvements {
        public double scoreImprovement;
        public int issuesResolved;
        public int criticalIssuesResolved;
        public int majorIssuesResolved;
        public int minorIssuesResolved;
        /** Share of the remaining gap to 100 that this pass closed, in percent */
        public double percentageImprovement;
        public List<String> resolvedIssueTypes = new ArrayList<>();
        public List<String> newIssues = new ArrayList<>();
        public List<String> persistentIssues = new ArrayList<>();
        public Map<String, MetricChange> metricImprovements = new LinkedHashMap<>();
    }

    public static class Summary {
        public boolean improved;
        public boolean complianceAchieved;
        public boolean significantImprovement;
        public boolean allIssuesResolved;
    }

    public static class Trends {
        /** available | insufficient_data */
        public String status;
        public String message;
        /** improving | declining | stagnating | stable */
        public String trendDirection;
        public double averageImprovement;
        public double velocity;
        public double currentScore;
        /** Estimated passes to reach 100; null while scores are not rising */
        public Integer passesNeeded;
        public boolean consistentImprovement;
        public List<Double> scoreProgression;
    }

    public int passNumber;
    public DetectionSummary original;
    public DetectionSummary corrected;
    public Improvements improvements;
    public Summary summary;
    public Trends trends;
}
