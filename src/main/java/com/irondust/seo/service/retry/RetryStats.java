package com.irondust.seo.service.retry;

/** Global retry figures; {@code successRate} is a percentage. */
public class RetryStats {
    public long totalRetries;
    public long successfulRetries;
    public double averageAttempts;
    public double averageTimeMillis;
    public double successRate;
    public int patternCount;
    public int learnedPatterns;
}
