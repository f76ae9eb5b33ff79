package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A targeted correction instruction generated from a validation error, e.g.
 * "Fix meta description to be 120-156 characters and include 'protein'".
 * Lower priority values are applied first.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CorrectionPrompt {
    private String type;
    private String component;
    private String instruction;
    private int priority;
    private String error;

    public CorrectionPrompt() {}

    public CorrectionPrompt(String type, String component, String instruction, int priority, String error) {
        this.type = type;
        this.component = component;
        this.instruction = instruction;
        this.priority = priority;
        this.error = error;
    }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getComponent() { return component; }
    public void setComponent(String component) { this.component = component; }
    public String getInstruction() { return instruction; }
    public void setInstruction(String instruction) { this.instruction = instruction; }
    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorrectionPrompt)) return false;
        CorrectionPrompt that = (CorrectionPrompt) o;
        return priority == that.priority
                && Objects.equals(type, that.type)
                && Objects.equals(component, that.component)
                && Objects.equals(instruction, that.instruction)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, component, instruction, priority, error);
    }
}
