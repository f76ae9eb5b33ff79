package com.irondust.seo.service.tracking;

import com.irondust.seo.model.TerminationReason;

/** Closing figures for one optimization session. */
public class SessionSummary {
    public String sessionId;
    public String startTime;
    public String endTime;
    public long durationMillis;
    public int totalPasses;
    public double initialScore;
    public double finalScore;
    public double totalImprovement;
    public boolean complianceAchieved;
    public TerminationReason terminationReason;
    public int totalCorrections;
    public int totalIssuesResolved;
    public double averagePassDurationMillis;
    /** Score points gained per pass */
    public double improvementRate;
}
