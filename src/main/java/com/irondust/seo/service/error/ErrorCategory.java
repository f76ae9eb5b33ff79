package com.irondust.seo.service.error;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Coarse error taxonomy. Categories are matched in declaration order against
 * the lower-cased error text; the first pattern hit wins.
 */
public enum ErrorCategory {
    CRITICAL("critical", "Errors that prevent optimization from continuing",
            List.of("fatal", "exception", "crash", "cannot continue"), true, true),
    RECOVERABLE("recoverable", "Errors that can be recovered through retry or alternative approach",
            List.of("timeout", "rate limit", "temporary", "retry"), false, true),
    DEGRADED("degraded", "Errors that allow partial functionality",
            List.of("partial", "incomplete", "degraded"), false, true),
    INFORMATIONAL("informational", "Non-critical issues for monitoring",
            List.of("warning", "notice", "info"), false, false);

    private final String code;
    private final String description;
    private final List<String> patterns;
    private final boolean requiresImmediateAction;
    private final boolean enableFallback;

    ErrorCategory(String code, String description, List<String> patterns,
                  boolean requiresImmediateAction, boolean enableFallback) {
        this.code = code;
        this.description = description;
        this.patterns = patterns;
        this.requiresImmediateAction = requiresImmediateAction;
        this.enableFallback = enableFallback;
    }

    @JsonValue
    public String code() { return code; }
    public String description() { return description; }
    public List<String> patterns() { return patterns; }
    public boolean requiresImmediateAction() { return requiresImmediateAction; }
    public boolean enableFallback() { return enableFallback; }

    /** Unmatched text is treated as recoverable. */
    public static ErrorCategory classify(String error) {
        String lower = error == null ? "" : error.toLowerCase(Locale.ROOT);
        for (ErrorCategory c : values()) {
            for (String p : c.patterns) {
                if (lower.contains(p)) return c;
            }
        }
        return RECOVERABLE;
    }
}
