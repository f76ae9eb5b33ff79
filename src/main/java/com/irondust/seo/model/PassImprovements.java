package com.irondust.seo.model;

import java.util.List;
import java.util.Map;

/**
 * Issue-level changes between the start and end of one pass.
 * {@code effectivenessRate} is resolved issues per correction, 0 when no corrections were made.
 */
public final class PassImprovements {
    private final List<String> resolvedIssueTypes;
    private final List<String> newIssueTypes;
    private final List<String> persistentIssueTypes;
    private final Map<String, Integer> correctionsByType;
    private final double effectivenessRate;

    public PassImprovements(List<String> resolvedIssueTypes, List<String> newIssueTypes,
                            List<String> persistentIssueTypes, Map<String, Integer> correctionsByType,
                            double effectivenessRate) {
        this.resolvedIssueTypes = List.copyOf(resolvedIssueTypes);
        this.newIssueTypes = List.copyOf(newIssueTypes);
        this.persistentIssueTypes = List.copyOf(persistentIssueTypes);
        this.correctionsByType = Map.copyOf(correctionsByType);
        this.effectivenessRate = effectivenessRate;
    }

    public List<String> getResolvedIssueTypes() { return resolvedIssueTypes; }
    public List<String> getNewIssueTypes() { return newIssueTypes; }
    public List<String> getPersistentIssueTypes() { return persistentIssueTypes; }
    public Map<String, Integer> getCorrectionsByType() { return correctionsByType; }
    public double getEffectivenessRate() { return effectivenessRate; }
}
