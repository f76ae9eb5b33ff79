package com.irondust.seo.service.structure;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One way an optimized version departs from the original's structure.
 * Severity is {@code major}, {@code minor} or {@code warning} (intent checks).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructureViolation {
    public static final String MAJOR = "major";
    public static final String MINOR = "minor";
    public static final String WARNING = "warning";

    public String type;
    public String tag;
    public String original;
    public String modified;
    /** Relative change in percent, where one applies */
    public Double change;
    public String severity;

    public StructureViolation() {}

    StructureViolation(String type, String tag, Object original, Object modified, Double change, String severity) {
        this.type = type;
        this.tag = tag;
        this.original = String.valueOf(original);
        this.modified = String.valueOf(modified);
        this.change = change;
        this.severity = severity;
    }

    public boolean isMajor() {
        return MAJOR.equals(severity);
    }
}
