package com.phillippitts.livescribe.service.stt.scribe;

import java.time.Duration;

/**
 * Pause between retry attempts. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
