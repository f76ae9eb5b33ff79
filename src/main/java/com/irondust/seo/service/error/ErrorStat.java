package com.irondust.seo.service.error;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Running occurrence count of one (component, error) pair. */
public class ErrorStat {
    public String component;
    public String error;
    public int count;
    public Instant firstOccurrence;
    public Instant lastOccurrence;
    public Map<String, Integer> severityCounts = new LinkedHashMap<>();
}
