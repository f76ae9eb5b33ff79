package com.irondust.seo.service.error;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Failure summary meant for people rather than logs. */
public class ErrorReport {
    public static class Detail {
        public String component;
        public String message;
        public String timestamp;
    }

    public static class CategoryDetails {
        public int count;
        public List<Detail> errors = new ArrayList<>();
    }

    public String summary;
    public String severity = "info"; // info | warning | critical
    public Map<String, CategoryDetails> details = new LinkedHashMap<>();
    public List<String> recommendations = new ArrayList<>();
}
