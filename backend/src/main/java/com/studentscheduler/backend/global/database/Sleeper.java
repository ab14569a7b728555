package com.studentscheduler.backend.global.database;

import java.time.Duration;

/**
 * Blocking wait used between retry attempts; replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
