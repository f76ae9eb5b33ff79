package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A single detected SEO problem.
 *
 * <p>Issues are recomputed from scratch on every detection run and are never
 * modified afterwards. Severity, priority and weight come from the
 * {@link IssueType} table so two issues of the same type always score alike.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Issue {
    private final IssueType type;
    private final double currentValue;
    private final double targetValue;
    private final List<IssueLocation> locations;
    private final String description;

    public Issue(IssueType type, double currentValue, double targetValue,
                 List<IssueLocation> locations, String description) {
        this.type = type;
        this.currentValue = currentValue;
        this.targetValue = targetValue;
        this.locations = locations != null ? List.copyOf(locations) : List.of();
        this.description = description;
    }

    @JsonCreator
    static Issue fromJson(@JsonProperty("type") IssueType type,
                          @JsonProperty("currentValue") double currentValue,
                          @JsonProperty("targetValue") double targetValue,
                          @JsonProperty("locations") List<IssueLocation> locations,
                          @JsonProperty("description") String description) {
        return new Issue(type, currentValue, targetValue, locations, description);
    }

    public IssueType getType() { return type; }
    public Severity getSeverity() { return type.severity(); }
    public double getCurrentValue() { return currentValue; }
    public double getTargetValue() { return targetValue; }
    public List<IssueLocation> getLocations() { return locations; }
    public String getDescription() { return description; }
    public int getPriority() { return type.priority(); }
    public double getWeight() { return type.weight(); }

    /** Score penalty before the detector's global scaling factor */
    public double penalty() {
        return getWeight() * getSeverity().weight() * 10.0;
    }

    @Override
    public String toString() {
        return type.code() + ": " + description;
    }
}
