package com.irondust.seo.service.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validation verdict of one pipeline step. Plain bean so it can be cached.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StepOutcome {
    private boolean valid = true;
    private List<String> errors = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();
    private List<String> suggestions = new ArrayList<>();
    private Map<String, Object> metrics = new LinkedHashMap<>();

    public StepOutcome error(String message) {
        errors.add(message);
        return this;
    }

    public StepOutcome warning(String message) {
        warnings.add(message);
        return this;
    }

    public StepOutcome suggestion(String message) {
        suggestions.add(message);
        return this;
    }

    public StepOutcome metric(String name, Object value) {
        metrics.put(name, value);
        return this;
    }

    public boolean isValid() { return valid; }
    public void setValid(boolean valid) { this.valid = valid; }
    public List<String> getErrors() { return errors; }
    public void setErrors(List<String> errors) { this.errors = errors; }
    public List<String> getWarnings() { return warnings; }
    public void setWarnings(List<String> warnings) { this.warnings = warnings; }
    public List<String> getSuggestions() { return suggestions; }
    public void setSuggestions(List<String> suggestions) { this.suggestions = suggestions; }
    public Map<String, Object> getMetrics() { return metrics; }
    public void setMetrics(Map<String, Object> metrics) { this.metrics = metrics; }
}
