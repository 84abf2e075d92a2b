package com.example.compliance.gateway;

import java.time.Duration;

/**
 * Blocking pause between retry attempts.
 */
@FunctionalInterface
interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
