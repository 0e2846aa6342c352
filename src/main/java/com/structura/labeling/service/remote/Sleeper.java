package com.structura.labeling.service.remote;

import java.time.Duration;

/**
 * Blocking pause between retry attempts. Replaced by a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        long millis = duration.toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
