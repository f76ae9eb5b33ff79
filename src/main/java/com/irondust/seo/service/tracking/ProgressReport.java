package com.irondust.seo.service.tracking;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.irondust.seo.model.PassRecord;
import com.irondust.seo.model.StrategyMetrics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full account of a session built by {@link ProgressTracker#generateComprehensiveReport()}.
 * {@code detailedMetrics} and {@code beforeAfterComparison} are only filled when
 * detailed reporting is enabled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressReport {
    public SessionSummary summary;
    public List<PassRecord> passRecords = new ArrayList<>();
    public Map<String, StrategyMetrics> strategyEffectiveness = new LinkedHashMap<>();
    public ProgressAnalysis progressAnalysis;
    public ContentHistory contentHistory;
    public DetailedMetrics detailedMetrics;
    public BeforeAfter beforeAfterComparison;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ProgressAnalysis {
        public String status; // available | no_data
        public List<Double> scoreProgression;
        public List<Double> improvementProgression;
        public List<Integer> issuesResolvedProgression;
        public Double averageImprovement;
        public Integer totalIssuesResolved;
        public Boolean consistentImprovement;
        public PassHighlight bestPass;
        public PassHighlight worstPass;
    }

    public static class PassHighlight {
        public int passNumber;
        public double scoreImprovement;
        public int issuesResolved;
        public int correctionsCount;

        static PassHighlight of(PassRecord r) {
            PassHighlight h = new PassHighlight();
            h.passNumber = r.getPassNumber();
            h.scoreImprovement = r.getScoreImprovement();
            h.issuesResolved = r.getIssuesResolved();
            h.correctionsCount = r.getCorrections().size();
            return h;
        }
    }

    public static class ContentHistory {
        public int totalEntries;
        public List<HistoryEntry> entries = new ArrayList<>();
    }

    public static class HistoryEntry {
        public int passNumber;
        public String stage;
        public String timestamp;
        public double score;
        public String contentHash;
    }

    public static class DetailedMetrics {
        public int totalPasses;
        public long totalDurationMillis;
        public double averagePassDurationMillis;
        public int totalCorrections;
        public double averageCorrectionsPerPass;
        public int totalIssuesResolved;
        public double averageIssuesResolvedPerPass;
        /** Score improvement per pass */
        public double efficiencyScore;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class BeforeAfter {
        public String status; // available | no_data
        public HistoryEntry before;
        public HistoryEntry after;
        public Double improvement;
        public Double improvementPercentage;
    }
}
