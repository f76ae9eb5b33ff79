package com.irondust.seo.service.retry;

import java.time.Duration;

public class ThreadSleeper implements Sleeper {
    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) return;
        Thread.sleep(duration.toMillis());
    }
}
