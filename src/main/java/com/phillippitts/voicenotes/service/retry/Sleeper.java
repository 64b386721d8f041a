package com.phillippitts.voicenotes.service.retry;

import java.time.Duration;

/**
 * Waits between retry attempts. Swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
