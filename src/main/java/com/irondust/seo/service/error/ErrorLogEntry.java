package com.irondust.seo.service.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/** One logged validation failure. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorLogEntry {
    public Instant timestamp;
    public String component;
    public String error;
    public String severity; // error | warning | info
    public Map<String, Object> context;
    /** Active manual override for this component/error pair, if one exists */
    public Map<String, Object> manualOverride;
}
