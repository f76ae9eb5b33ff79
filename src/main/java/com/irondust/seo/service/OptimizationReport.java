package com.irondust.seo.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.TerminationReason;
import com.irondust.seo.model.ValidationResult;
import com.irondust.seo.service.error.ErrorReport;
import com.irondust.seo.service.tracking.ImprovementReport;
import com.irondust.seo.service.tracking.ProgressReport;

import java.util.ArrayList;
import java.util.List;

/**
 * What {@link MultiPassOptimizer#optimizeContent} hands back: the best content
 * reached, its final validation and the session's audit trail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OptimizationReport {
    public boolean success;
    public String sessionId;
    public Content content;
    public ValidationResult validationResult;
    public ProgressData progressData = new ProgressData();
    public Summary optimizationSummary = new Summary();
    public ProgressReport progressReport;
    public ImprovementReport.Trends improvementTrends;
    public ErrorReport issueSummary;
    public List<LogEntry> errorLog = new ArrayList<>();

    public static class ProgressData {
        public List<IterationData> iterations = new ArrayList<>();
        public int totalIterations;
        /** Components corrected, once per pass that corrected them */
        public List<String> correctionsMade = new ArrayList<>();
        /** Distinct components corrected over the session */
        public List<String> issuesResolved = new ArrayList<>();
        public Performance performance;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class IterationData {
        public int iteration;
        public String type; // baseline | optimization
        public double score;
        public boolean valid;
        public int errorCount;
        public int warningCount;
        public String timestamp;
        public Double scoreImprovement;
        public Integer errorReduction;
        public Integer warningReduction;
        public ImprovementReport.Improvements improvementDetails;
    }

    public static class Performance {
        public long totalDurationMillis;
        public double averageIterationMillis;
        public double finalComplianceScore;
        public int totalCorrections;
        public int issuesResolved;
    }

    public static class Summary {
        public double initialScore;
        public double finalScore;
        public double bestScore;
        public double improvement;
        public int iterationsUsed;
        public boolean complianceAchieved;
        public TerminationReason terminationReason;
    }

    public static class LogEntry {
        public String level;
        public String message;
        public int iteration;
        public String timestamp;

        public LogEntry() {}

        public LogEntry(String level, String message, int iteration, String timestamp) {
            this.level = level;
            this.message = message;
            this.iteration = iteration;
            this.timestamp = timestamp;
        }
    }
}
