package com.irondust.seo.model;

import java.util.List;

/**
 * Audit entry for one optimization pass. Immutable once created; the
 * progress tracker only ever appends these.
 */
public final class PassRecord {
    private final int passNumber;
    private final String timestamp;
    private final double beforeScore;
    private final double afterScore;
    private final double scoreImprovement;
    private final List<Issue> issuesBefore;
    private final List<Issue> issuesAfter;
    private final int issuesResolved;
    private final List<CorrectionPrompt> corrections;
    private final StrategyDescriptor strategyUsed;
    private final PassImprovements improvements;
    private final long durationMillis;

    public PassRecord(int passNumber, String timestamp, double beforeScore, double afterScore,
                      List<Issue> issuesBefore, List<Issue> issuesAfter,
                      List<CorrectionPrompt> corrections, StrategyDescriptor strategyUsed,
                      PassImprovements improvements, long durationMillis) {
        this.passNumber = passNumber;
        this.timestamp = timestamp;
        this.beforeScore = beforeScore;
        this.afterScore = afterScore;
        this.scoreImprovement = afterScore - beforeScore;
        this.issuesBefore = issuesBefore != null ? List.copyOf(issuesBefore) : List.of();
        this.issuesAfter = issuesAfter != null ? List.copyOf(issuesAfter) : List.of();
        this.issuesResolved = this.issuesBefore.size() - this.issuesAfter.size();
        this.corrections = corrections != null ? List.copyOf(corrections) : List.of();
        this.strategyUsed = strategyUsed;
        this.improvements = improvements;
        this.durationMillis = durationMillis;
    }

    public int getPassNumber() { return passNumber; }
    public String getTimestamp() { return timestamp; }
    public double getBeforeScore() { return beforeScore; }
    public double getAfterScore() { return afterScore; }
    public double getScoreImprovement() { return scoreImprovement; }
    public List<Issue> getIssuesBefore() { return issuesBefore; }
    public List<Issue> getIssuesAfter() { return issuesAfter; }
    public int getIssuesResolved() { return issuesResolved; }
    public List<CorrectionPrompt> getCorrections() { return corrections; }
    public StrategyDescriptor getStrategyUsed() { return strategyUsed; }
    public PassImprovements getImprovements() { return improvements; }
    public long getDurationMillis() { return durationMillis; }
}
