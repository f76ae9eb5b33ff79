package com.irondust.seo.service.retry;

import com.irondust.seo.model.Content;

/**
 * Work the {@link RetryManager} may run several times. Throwing signals a failed
 * attempt; the message drives which correction strategy is tried next.
 */
@FunctionalInterface
public interface RetryOperation<T> {
    T execute(Content content, RetryContext context) throws Exception;
}
