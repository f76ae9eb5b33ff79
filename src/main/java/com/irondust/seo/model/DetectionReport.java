package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the issue detector found for one piece of content.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectionReport {
    private List<Issue> issues = new ArrayList<>();
    private int totalIssues;
    private int criticalIssues;
    private int majorIssues;
    private int minorIssues;
    private double complianceScore;
    private boolean compliant;
    private ContentMetrics metrics;

    public DetectionReport() {}

    public DetectionReport(List<Issue> issues, double complianceScore, ContentMetrics metrics) {
        this.issues = new ArrayList<>(issues);
        this.totalIssues = issues.size();
        for (Issue i : issues) {
            switch (i.getSeverity()) {
                case CRITICAL -> criticalIssues++;
                case MAJOR -> majorIssues++;
                case MINOR -> minorIssues++;
            }
        }
        this.complianceScore = complianceScore;
        this.compliant = complianceScore >= 100.0;
        this.metrics = metrics;
    }

    public List<String> issueTypeCodes() {
        List<String> out = new ArrayList<>();
        for (Issue i : issues) out.add(i.getType().code());
        return out;
    }

    public List<Issue> getIssues() { return issues; }
    public void setIssues(List<Issue> issues) { this.issues = issues; }
    public int getTotalIssues() { return totalIssues; }
    public void setTotalIssues(int totalIssues) { this.totalIssues = totalIssues; }
    public int getCriticalIssues() { return criticalIssues; }
    public void setCriticalIssues(int criticalIssues) { this.criticalIssues = criticalIssues; }
    public int getMajorIssues() { return majorIssues; }
    public void setMajorIssues(int majorIssues) { this.majorIssues = majorIssues; }
    public int getMinorIssues() { return minorIssues; }
    public void setMinorIssues(int minorIssues) { this.minorIssues = minorIssues; }
    public double getComplianceScore() { return complianceScore; }
    public void setComplianceScore(double complianceScore) { this.complianceScore = complianceScore; }
    public boolean isCompliant() { return compliant; }
    public void setCompliant(boolean compliant) { this.compliant = compliant; }
    public ContentMetrics getMetrics() { return metrics; }
    public void setMetrics(ContentMetrics metrics) { this.metrics = metrics; }
}
