package com.irondust.seo.service.retry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered set of content actions, each with its parameters, e.g.
 * {@code adjust_meta_length {target_length: 140}}. Strategies are cached and
 * learned, so they stay plain JSON-friendly maps.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetryStrategy {
    public static final String ADJUST_META_LENGTH = "adjust_meta_length";
    public static final String REDUCE_KEYWORD_DENSITY = "reduce_keyword_density";
    public static final String INCREASE_KEYWORD_DENSITY = "increase_keyword_density";
    public static final String IMPROVE_READABILITY = "improve_readability";
    public static final String SHORTEN_TITLE = "shorten_title";
    public static final String ADD_IMAGES = "add_images";

    private Map<String, Map<String, Object>> actions = new LinkedHashMap<>();

    public RetryStrategy() {}

    public static RetryStrategy of(String action, Map<String, Object> params) {
        RetryStrategy s = new RetryStrategy();
        s.actions.put(action, new LinkedHashMap<>(params));
        return s;
    }

    /**
     * A copy tuned for the given attempt: meta targets grow by 5 characters,
     * density reductions by 10 points (capped at 80%), and added keyword
     * mentions by one, per attempt after the first.
     */
    public RetryStrategy adaptToAttempt(int attempt) {
        int step = Math.max(0, attempt - 1);
        RetryStrategy out = new RetryStrategy();
        for (Map.Entry<String, Map<String, Object>> e : actions.entrySet()) {
            Map<String, Object> p = new LinkedHashMap<>(e.getValue());
            switch (e.getKey()) {
                case ADJUST_META_LENGTH -> {
                    if (p.get("target_length") instanceof Number) {
                        p.put("target_length", ((Number) p.get("target_length")).intValue() + 5 * step);
                    }
                }
                case REDUCE_KEYWORD_DENSITY -> {
                    if (p.get("reduction_percentage") instanceof Number) {
                        double r = ((Number) p.get("reduction_percentage")).doubleValue() + 0.1 * step;
                        p.put("reduction_percentage", Math.min(0.8, Math.round(r * 100.0) / 100.0));
                    }
                }
                case INCREASE_KEYWORD_DENSITY -> {
                    if (p.get("increase_count") instanceof Number) {
                        p.put("increase_count", ((Number) p.get("increase_count")).intValue() + step);
                    }
                }
                default -> { }
            }
            out.actions.put(e.getKey(), p);
        }
        return out;
    }

    @JsonIgnore
    public String getName() {
        return actions.isEmpty() ? "none" : String.join("+", actions.keySet());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return actions.isEmpty();
    }

    public Map<String, Map<String, Object>> getActions() { return actions; }
    public void setActions(Map<String, Map<String, Object>> actions) { this.actions = actions; }

    @Override
    public String toString() {
        return actions.toString();
    }
}
