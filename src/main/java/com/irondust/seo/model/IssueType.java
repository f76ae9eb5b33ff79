package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every issue the detector can raise, with the severity, priority and weight it
 * always carries. Priority runs 1-10 (10 = fix first).
 */
public enum IssueType {
    KEYWORD_DENSITY_LOW("keyword_density_low", "keyword_density", Severity.MAJOR, 8, 2.0),
    KEYWORD_DENSITY_HIGH("keyword_density_high", "keyword_density", Severity.CRITICAL, 9, 3.0),
    META_DESCRIPTION_SHORT("meta_description_short", "meta_description", Severity.CRITICAL, 10, 3.0),
    META_DESCRIPTION_LONG("meta_description_long", "meta_description", Severity.MAJOR, 7, 2.0),
    META_DESCRIPTION_NO_KEYWORD("meta_description_no_keyword", "meta_description", Severity.MAJOR, 6, 2.0),
    PASSIVE_VOICE_HIGH("passive_voice_high", "readability", Severity.MAJOR, 5, 2.0),
    SENTENCE_LENGTH_HIGH("sentence_length_high", "readability", Severity.MINOR, 3, 1.0),
    TRANSITION_WORDS_LOW("transition_words_low", "readability", Severity.MINOR, 2, 1.0),
    TITLE_TOO_LONG("title_too_long", "title", Severity.MAJOR, 7, 2.0),
    TITLE_NO_KEYWORD("title_no_keyword", "title", Severity.CRITICAL, 9, 3.0),
    SUBHEADING_KEYWORD_OVERUSE("subheading_keyword_overuse", "keyword_density", Severity.MINOR, 4, 1.0),
    NO_IMAGES("no_images", "images", Severity.MAJOR, 6, 2.0),
    ALT_TEXT_NO_KEYWORD("alt_text_no_keyword", "images", Severity.MINOR, 3, 1.0);

    private final String code;
    private final String component;
    private final Severity severity;
    private final int priority;
    private final double weight;

    IssueType(String code, String component, Severity severity, int priority, double weight) {
        this.code = code;
        this.component = component;
        this.severity = severity;
        this.priority = priority;
        this.weight = weight;
    }

    @JsonValue
    public String code() { return code; }

    /** Pipeline component responsible for correcting this issue */
    public String component() { return component; }

    public Severity severity() { return severity; }

    public int priority() { return priority; }

    public double weight() { return weight; }

    @JsonCreator
    public static IssueType fromCode(String code) {
        for (IssueType t : values()) {
            if (t.code.equalsIgnoreCase(code)) return t;
        }
        throw new IllegalArgumentException("Unknown issue type: " + code);
    }
}
