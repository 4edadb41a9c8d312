package com.gamewright.core.upload;

import java.time.Duration;

/**
 * Pause between readiness polls.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
