package com.irondust.seo.service.retry;

import java.time.Duration;

/** Blocking pause between retry attempts. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
}
