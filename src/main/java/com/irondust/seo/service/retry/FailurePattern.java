package com.irondust.seo.service.retry;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Maps an error message shape to the strategy that usually fixes it. */
public final class FailurePattern {
    private final Pattern pattern;
    private final RetryStrategy strategy;

    public FailurePattern(String regex, RetryStrategy strategy) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        this.strategy = strategy;
    }

    public boolean matches(String message) {
        return message != null && pattern.matcher(message).find();
    }

    public String getRegex() { return pattern.pattern(); }
    public RetryStrategy getStrategy() { return strategy; }

    /** Built-in patterns, tried in order. */
    public static List<FailurePattern> defaults() {
        return List.of(
                new FailurePattern("meta description.*too short", RetryStrategy.of(RetryStrategy.ADJUST_META_LENGTH,
                        Map.of("target_length", 140, "extension_text", " Learn more."))),
                new FailurePattern("meta description.*too long", RetryStrategy.of(RetryStrategy.ADJUST_META_LENGTH,
                        Map.of("target_length", 150))),
                new FailurePattern("keyword density.*too high", RetryStrategy.of(RetryStrategy.REDUCE_KEYWORD_DENSITY,
                        Map.of("reduction_percentage", 0.3))),
                new FailurePattern("keyword density.*too low", RetryStrategy.of(RetryStrategy.INCREASE_KEYWORD_DENSITY,
                        Map.of("increase_count", 2))),
                new FailurePattern("passive voice", RetryStrategy.of(RetryStrategy.IMPROVE_READABILITY,
                        Map.of("reduce_passive_voice", true))),
                new FailurePattern("long sentences", RetryStrategy.of(RetryStrategy.IMPROVE_READABILITY,
                        Map.of("split_long_sentences", true))),
                new FailurePattern("transition words", RetryStrategy.of(RetryStrategy.IMPROVE_READABILITY,
                        Map.of("add_transitions", true))),
                new FailurePattern("title.*too long", RetryStrategy.of(RetryStrategy.SHORTEN_TITLE,
                        Map.of("max_length", 60))),
                new FailurePattern("image", RetryStrategy.of(RetryStrategy.ADD_IMAGES,
                        Map.of("count", 1))));
    }
}
