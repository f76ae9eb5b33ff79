package com.irondust.seo.service.tracking;

import java.util.List;

/** History entry kept by {@link ImprovementTracker} for trend analysis. */
public class PassProgress {
    public int passNumber;
    public String timestamp;
    public double originalScore;
    public double correctedScore;
    public double scoreImprovement;
    public int issuesResolved;
    public List<String> resolvedIssueTypes;
    public List<String> newIssues;
    public List<String> persistentIssues;
}
