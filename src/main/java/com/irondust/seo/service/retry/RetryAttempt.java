package com.irondust.seo.service.retry;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetryAttempt {
    public int attempt;
    public boolean success;
    public String error;
    public long timeMillis;
    public String strategy;

    public RetryAttempt() {}

    public RetryAttempt(int attempt, boolean success, String error, long timeMillis, String strategy) {
        this.attempt = attempt;
        this.success = success;
        this.error = error;
        this.timeMillis = timeMillis;
        this.strategy = strategy;
    }
}
