package com.irondust.seo.service.retry;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.irondust.seo.model.DegradationLevel;

import java.util.List;

/**
 * Result of {@link RetryManager#executeWithRetry}. Exactly one of
 * {@code result} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RetryOutcome<T> {
    private final boolean success;
    private final T result;
    private final String error;
    private final int attempts;
    private final long totalTimeMillis;
    private final List<RetryAttempt> retryHistory;
    private final RetryStrategy lastStrategy;
    private final DegradationLevel degradationLevel;

    private RetryOutcome(boolean success, T result, String error, int attempts, long totalTimeMillis,
                         List<RetryAttempt> retryHistory, RetryStrategy lastStrategy,
                         DegradationLevel degradationLevel) {
        this.success = success;
        this.result = result;
        this.error = error;
        this.attempts = attempts;
        this.totalTimeMillis = totalTimeMillis;
        this.retryHistory = List.copyOf(retryHistory);
        this.lastStrategy = lastStrategy;
        this.degradationLevel = degradationLevel;
    }

    static <T> RetryOutcome<T> succeeded(T result, int attempts, long totalTimeMillis,
                                         List<RetryAttempt> history, RetryStrategy strategy) {
        return new RetryOutcome<>(true, result, null, attempts, totalTimeMillis, history, strategy, null);
    }

    static <T> RetryOutcome<T> failed(String error, int attempts, long totalTimeMillis, List<RetryAttempt> history,
                                      RetryStrategy strategy, DegradationLevel degradationLevel) {
        return new RetryOutcome<>(false, null, error, attempts, totalTimeMillis, history, strategy, degradationLevel);
    }

    public boolean isSuccess() { return success; }
    public T getResult() { return result; }
    public String getError() { return error; }
    public int getAttempts() { return attempts; }
    public long getTotalTimeMillis() { return totalTimeMillis; }
    public List<RetryAttempt> getRetryHistory() { return retryHistory; }
    public RetryStrategy getLastStrategy() { return lastStrategy; }
    public DegradationLevel getDegradationLevel() { return degradationLevel; }
}
