package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one validate-and-correct cycle.
 *
 * <p>Adding an error always marks the result invalid. The overall score is
 * derived from the number of errors and warnings (20 and 5 points each) and
 * is clamped to 0-100.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidationResult {
    public static final double ERROR_PENALTY = 20.0;
    public static final double WARNING_PENALTY = 5.0;

    private boolean valid;
    private List<ValidationMessage> errors = new ArrayList<>();
    private List<ValidationMessage> warnings = new ArrayList<>();
    private List<ValidationMessage> suggestions = new ArrayList<>();
    private double overallScore;
    private Content correctedContent;
    private List<String> correctionsMade = new ArrayList<>();
    /** Per-component metrics, e.g. keyword_density -> {density: 1.2, keywordCount: 6} */
    private Map<String, Map<String, Object>> metrics = new LinkedHashMap<>();
    private DegradationLevel degradationLevel;
    /** Stamps added messages */
    @JsonIgnore
    private Clock clock = Clock.systemUTC();

    public ValidationResult() {}

    public ValidationResult(boolean valid) {
        this.valid = valid;
    }

    public ValidationResult(boolean valid, Clock clock) {
        this.valid = valid;
        this.clock = clock;
    }

    public void addError(String message, String component) {
        errors.add(new ValidationMessage(message, component, clock.instant().toString()));
        valid = false;
    }

    public void addWarning(String message, String component) {
        warnings.add(new ValidationMessage(message, component, clock.instant().toString()));
    }

    public void addSuggestion(String message, String component) {
        suggestions.add(new ValidationMessage(message, component, clock.instant().toString()));
    }

    @JsonIgnore
    public boolean hasIssues() {
        return !errors.isEmpty() || !warnings.isEmpty();
    }

    @JsonIgnore
    public int getIssueCount() {
        return errors.size() + warnings.size();
    }

    public double calculateScore() {
        double score = 100.0 - errors.size() * ERROR_PENALTY - warnings.size() * WARNING_PENALTY;
        overallScore = Math.max(0.0, Math.min(100.0, score));
        return overallScore;
    }

    /**
     * Errors reported by one component, in insertion order.
     */
    public List<ValidationMessage> errorsFor(String component) {
        List<ValidationMessage> out = new ArrayList<>();
        for (ValidationMessage m : errors) {
            if (component.equals(m.getComponent())) out.add(m);
        }
        return out;
    }

    public boolean isValid() { return valid; }
    public void setValid(boolean valid) { this.valid = valid; }
    public List<ValidationMessage> getErrors() { return errors; }
    public void setErrors(List<ValidationMessage> errors) { this.errors = errors; }
    public List<ValidationMessage> getWarnings() { return warnings; }
    public void setWarnings(List<ValidationMessage> warnings) { this.warnings = warnings; }
    public List<ValidationMessage> getSuggestions() { return suggestions; }
    public void setSuggestions(List<ValidationMessage> suggestions) { this.suggestions = suggestions; }
    public double getOverallScore() { return overallScore; }
    public void setOverallScore(double overallScore) { this.overallScore = Math.max(0.0, Math.min(100.0, overallScore)); }
    public Content getCorrectedContent() { return correctedContent; }
    public void setCorrectedContent(Content correctedContent) { this.correctedContent = correctedContent; }
    public List<String> getCorrectionsMade() { return correctionsMade; }
    public void setCorrectionsMade(List<String> correctionsMade) { this.correctionsMade = correctionsMade; }
    public Map<String, Map<String, Object>> getMetrics() { return metrics; }
    public void setMetrics(Map<String, Map<String, Object>> metrics) { this.metrics = metrics; }
    public DegradationLevel getDegradationLevel() { return degradationLevel; }
    public void setDegradationLevel(DegradationLevel degradationLevel) { this.degradationLevel = degradationLevel; }
}
