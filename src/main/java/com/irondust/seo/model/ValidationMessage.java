package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * An error, warning or suggestion emitted by a pipeline component.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationMessage {
    /** Human-readable message */
    private String message;

    /** Pipeline component that produced the message (meta_description, readability, ...) */
    private String component;

    /** ISO-8601 instant */
    private String timestamp;

    public ValidationMessage() {}

    public ValidationMessage(String message, String component, String timestamp) {
        this.message = message;
        this.component = component;
        this.timestamp = timestamp;
    }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public String getComponent() { return component; }
    public void setComponent(String component) { this.component = component; }
    public String getTimestamp() { return timestamp; }
    public void setTimestamp(String timestamp) { this.timestamp = timestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationMessage)) return false;
        ValidationMessage that = (ValidationMessage) o;
        return Objects.equals(message, that.message)
                && Objects.equals(component, that.component)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, component, timestamp);
    }

    @Override
    public String toString() {
        return "[" + component + "] " + message;
    }
}
