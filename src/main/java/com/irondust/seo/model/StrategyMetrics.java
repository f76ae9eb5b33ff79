package com.irondust.seo.model;

/**
 * Running effectiveness figures for one named correction strategy.
 * Averages and success rate are kept incrementally, never recomputed from history.
 */
public class StrategyMetrics {
    private final String name;
    private int timesUsed;
    private double cumulativeScoreImprovement;
    private int cumulativeIssuesResolved;
    private double averageScoreImprovement;
    private double averageIssuesResolved;
    private int successfulApplications;
    /** Percentage 0-100 */
    private double successRate;

    public StrategyMetrics(String name) {
        this.name = name;
    }

    /**
     * Folds one application in. An application counts as successful when it
     * raised the score or resolved at least one issue.
     */
    public void record(double scoreImprovement, int issuesResolved) {
        timesUsed++;
        cumulativeScoreImprovement += scoreImprovement;
        cumulativeIssuesResolved += issuesResolved;
        averageScoreImprovement += (scoreImprovement - averageScoreImprovement) / timesUsed;
        averageIssuesResolved += (issuesResolved - averageIssuesResolved) / timesUsed;
        if (scoreImprovement > 0 || issuesResolved > 0) {
            successfulApplications++;
        }
        successRate = (double) successfulApplications / timesUsed * 100.0;
    }

    public String getName() { return name; }
    public int getTimesUsed() { return timesUsed; }
    public double getCumulativeScoreImprovement() { return cumulativeScoreImprovement; }
    public int getCumulativeIssuesResolved() { return cumulativeIssuesResolved; }
    public double getAverageScoreImprovement() { return averageScoreImprovement; }
    public double getAverageIssuesResolved() { return averageIssuesResolved; }
    public int getSuccessfulApplications() { return successfulApplications; }
    public double getSuccessRate() { return successRate; }
}
