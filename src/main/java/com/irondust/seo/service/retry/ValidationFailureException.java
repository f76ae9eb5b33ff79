package com.irondust.seo.service.retry;

/**
 * Thrown by a retry operation whose validation still fails. The check counts
 * let the retry manager rate how degraded the final outcome is.
 */
public class ValidationFailureException extends Exception {
    private final int passedChecks;
    private final int failedChecks;

    public ValidationFailureException(String message, int passedChecks, int failedChecks) {
        super(message);
        this.passedChecks = passedChecks;
        this.failedChecks = failedChecks;
    }

    public int getPassedChecks() {
        return passedChecks;
    }

    public int getFailedChecks() {
        return failedChecks;
    }
}
